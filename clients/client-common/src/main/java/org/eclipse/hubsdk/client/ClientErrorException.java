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

/**
 * A request that the hub rejected, e.g. because the credentials are invalid (401),
 * the device is not allowed to use a feature (403) or a resource does not exist (404).
 * <p>
 * Repeating the request unchanged will not help, apart from 408 and 429.
 */
public class ClientErrorException extends ServiceInvocationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message derived from the status.
     *
     * @param errorCode The status, 400 to 499.
     * @throws IllegalArgumentException if the status is out of range.
     */
    public ClientErrorException(final int errorCode) {
        this(errorCode, null, null);
    }

    /**
     * Creates an exception.
     *
     * @param errorCode The status, 400 to 499.
     * @param msg The reason given by the hub or {@code null}.
     * @throws IllegalArgumentException if the status is out of range.
     */
    public ClientErrorException(final int errorCode, final String msg) {
        this(errorCode, msg, null);
    }

    /**
     * Creates an exception.
     *
     * @param errorCode The status, 400 to 499.
     * @param msg The reason given by the hub or {@code null}.
     * @param cause The underlying cause or {@code null}.
     * @throws IllegalArgumentException if the status is out of range.
     */
    public ClientErrorException(final int errorCode, final String msg, final Throwable cause) {
        super(requireClientError(errorCode), msg, cause);
    }

    private static int requireClientError(final int status) {
        if (status / 100 != 4) {
            throw new IllegalArgumentException("not a client error status: " + status);
        }
        return status;
    }
}
