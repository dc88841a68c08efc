/*******************************************************************************
 * Copyright (c) 2024 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 *******************************************************************************/

package org.eclipse.hubsdk.client.amqp.connection;

/**
 * A listener to be notified when a session has re-established its connection
 * to the hub and has re-enabled all features.
 *
 */
@FunctionalInterface
public interface ReconnectListener {

    /**
     * Invoked after the session has been re-established.
     */
    void onReconnect();
}
