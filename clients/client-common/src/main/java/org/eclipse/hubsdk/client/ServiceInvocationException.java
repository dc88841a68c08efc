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
 * A request to the hub that did not succeed.
 * <p>
 * The failure is classified by the HTTP-style status code that the hub reported
 * or that the client derived locally, e.g. 503 for a lost connection or 504 for
 * a request that was not answered in time.
 */
public abstract class ServiceInvocationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int errorCode;

    /**
     * Creates a new exception.
     *
     * @param errorCode The status code classifying the failure, 400 to 599.
     * @param msg A description of the failure or {@code null} to derive one from the code.
     * @param cause The underlying cause or {@code null}.
     * @throws IllegalArgumentException if the code is not an error status.
     */
    protected ServiceInvocationException(final int errorCode, final String msg, final Throwable cause) {
        super(msg == null ? "Error Code: " + errorCode : msg, cause);
        if (errorCode / 100 != 4 && errorCode / 100 != 5) {
            throw new IllegalArgumentException("not an error status: " + errorCode);
        }
        this.errorCode = errorCode;
    }

    /**
     * Gets the status code classifying the failure.
     *
     * @return The code.
     */
    public final int getErrorCode() {
        return errorCode;
    }

    /**
     * Gets the status code carried by an error.
     *
     * @param t The error or {@code null}.
     * @return The error's code if it is a {@code ServiceInvocationException},
     *         {@link HttpURLConnection#HTTP_INTERNAL_ERROR} otherwise.
     */
    public static int extractStatusCode(final Throwable t) {
        if (t instanceof ServiceInvocationException) {
            return ((ServiceInvocationException) t).getErrorCode();
        }
        return HttpURLConnection.HTTP_INTERNAL_ERROR;
    }
}
