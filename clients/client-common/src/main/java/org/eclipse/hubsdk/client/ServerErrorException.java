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
 * A request that failed because the hub is unavailable or overloaded, or because
 * the connection to it broke down before an outcome was known.
 * <p>
 * The client raises 503 locally when there is no usable connection and 500 for
 * responses it cannot make sense of.
 */
public class ServerErrorException extends ServiceInvocationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message derived from the status.
     *
     * @param errorCode The status, 500 to 599.
     * @throws IllegalArgumentException if the status is out of range.
     */
    public ServerErrorException(final int errorCode) {
        this(errorCode, null, null);
    }

    /**
     * Creates an exception.
     *
     * @param errorCode The status, 500 to 599.
     * @param msg A description of the failure or {@code null}.
     * @throws IllegalArgumentException if the status is out of range.
     */
    public ServerErrorException(final int errorCode, final String msg) {
        this(errorCode, msg, null);
    }

    /**
     * Creates an exception wrapping the error that made the request fail.
     *
     * @param errorCode The status, 500 to 599.
     * @param cause The underlying cause.
     * @throws IllegalArgumentException if the status is out of range.
     */
    public ServerErrorException(final int errorCode, final Throwable cause) {
        this(errorCode, null, cause);
    }

    /**
     * Creates an exception.
     *
     * @param errorCode The status, 500 to 599.
     * @param msg A description of the failure or {@code null}.
     * @param cause The underlying cause or {@code null}.
     * @throws IllegalArgumentException if the status is out of range.
     */
    public ServerErrorException(final int errorCode, final String msg, final Throwable cause) {
        super(requireServerError(errorCode), msg, cause);
    }

    private static int requireServerError(final int status) {
        if (status / 100 != 5) {
            throw new IllegalArgumentException("not a server error status: " + status);
        }
        return status;
    }
}
