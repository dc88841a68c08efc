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
 * A listener to be notified when a session has lost its connection to the hub
 * and will not try to re-establish it.
 *
 */
@FunctionalInterface
public interface DisconnectListener {

    /**
     * Invoked when the session has been disconnected.
     *
     * @param cause The error that caused the disconnect.
     */
    void onDisconnect(Throwable cause);
}
