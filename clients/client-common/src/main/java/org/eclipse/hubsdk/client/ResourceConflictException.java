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


package org.eclipse.hubsdk.client;

import java.net.HttpURLConnection;

/**
 * A request that the hub rejected with 409, e.g. a twin update based on an outdated version.
 */
public class ResourceConflictException extends ClientErrorException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception.
     *
     * @param msg The reason given by the hub or {@code null}.
     */
    public ResourceConflictException(final String msg) {
        this(msg, null);
    }

    /**
     * Creates an exception.
     *
     * @param msg The reason given by the hub or {@code null}.
     * @param cause The underlying cause or {@code null}.
     */
    public ResourceConflictException(final String msg, final Throwable cause) {
        super(HttpURLConnection.HTTP_CONFLICT, msg, cause);
    }
}
