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

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Handler;

/**
 * A base class for implementing authentication providers.
 * <p>
 * Provides support for managing listeners.
 */
public abstract class AbstractAuthenticationProvider implements AuthenticationProvider {

    /**
     * A logger to be shared with subclasses.
     */
    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final List<Handler<Credential>> newCredentialListeners = new CopyOnWriteArrayList<>();
    private final List<Handler<Throwable>> errorListeners = new CopyOnWriteArrayList<>();

    @Override
    public final void addNewCredentialListener(final Handler<Credential> listener) {
        newCredentialListeners.add(Objects.requireNonNull(listener));
    }

    @Override
    public final void addErrorListener(final Handler<Throwable> listener) {
        errorListeners.add(Objects.requireNonNull(listener));
    }

    /**
     * Notifies all registered listeners about a new credential.
     * <p>
     * A failing listener does not prevent other listeners from being notified.
     *
     * @param credential The new credential.
     */
    protected final void notifyNewCredential(final Credential credential) {
        for (final Handler<Credential> listener : newCredentialListeners) {
            try {
                listener.handle(credential);
            } catch (final Exception ex) {
                log.warn("error notifying listener about new credential", ex);
            }
        }
    }

    /**
     * Notifies all registered listeners about a renewal failure.
     *
     * @param error The error.
     */
    protected final void notifyError(final Throwable error) {
        if (errorListeners.isEmpty()) {
            log.warn("failed to renew credential and no error listener is registered", error);
            return;
        }
        for (final Handler<Throwable> listener : errorListeners) {
            try {
                listener.handle(error);
            } catch (final Exception ex) {
                log.warn("error notifying listener about renewal failure", ex);
            }
        }
    }
}
