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
 * The states of a {@link ConnectionSession}.
 *
 */
public enum SessionState {

    /**
     * No connection to the hub exists.
     */
    DISCONNECTED(false),
    /**
     * The transport level connection is being established.
     */
    CONNECTING(true),
    /**
     * The connection is being authorized.
     */
    AUTHENTICATING(true),
    /**
     * The connection is established and authorized, links can be attached.
     */
    AUTHENTICATED(false),
    /**
     * Links are being detached and the connection is being closed.
     */
    DISCONNECTING(true);

    private final boolean transitional;

    SessionState(final boolean transitional) {
        this.transitional = transitional;
    }

    /**
     * Checks if this state is left without any further request.
     * <p>
     * Requests received while in a transitional state are deferred until
     * the session has reached a stable state.
     *
     * @return {@code true} if the state is transitional.
     */
    public boolean isTransitional() {
        return transitional;
    }
}
