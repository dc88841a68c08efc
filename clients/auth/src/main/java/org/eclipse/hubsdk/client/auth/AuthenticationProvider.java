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


package org.eclipse.hubsdk.client.auth;

import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * A source of credentials for authenticating a device or module to the hub.
 * <p>
 * Token based providers notify their listeners whenever a new signature has been
 * created, e.g. as part of proactive renewal, so that an established connection
 * can re-authenticate before the current signature expires.
 */
public interface AuthenticationProvider {

    /**
     * Gets the kind of credentials this provider supplies.
     *
     * @return The type.
     */
    AuthenticationType getType();

    /**
     * Gets the current credentials.
     * <p>
     * Token based providers create a new signature if the current one is about to expire.
     *
     * @return A future indicating the outcome. The future will be failed if
     *         a new signature is required but cannot be created.
     */
    Future<Credential> getCredential();

    /**
     * Stops any proactive renewal.
     * <p>
     * No listener is notified about a new credential after the returned future has completed.
     *
     * @return A succeeded future.
     */
    Future<Void> stop();

    /**
     * Registers a listener to be notified about new credentials.
     *
     * @param listener The listener.
     * @throws NullPointerException if listener is {@code null}.
     */
    void addNewCredentialListener(Handler<Credential> listener);

    /**
     * Registers a listener to be notified about failures to renew credentials
     * that happen outside of an invocation of {@link #getCredential()}.
     *
     * @param listener The listener.
     * @throws NullPointerException if listener is {@code null}.
     */
    void addErrorListener(Handler<Throwable> listener);

    /**
     * Checks if signatures are created by a remote service.
     *
     * @return {@code true} if the key never resides in this process.
     */
    default boolean isRemoteSigning() {
        return false;
    }
}
