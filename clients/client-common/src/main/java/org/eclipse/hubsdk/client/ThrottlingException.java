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
 * Indicates that the service has rejected a request because the client has exceeded
 * its request quota.
 * <p>
 * Requests failing with this exception may be retried but should use a longer back off.
 */
public class ThrottlingException extends ClientErrorException {

    /**
     * The status code indicating that too many requests have been sent.
     */
    public static final int HTTP_TOO_MANY_REQUESTS = 429;

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception for a detail message.
     *
     * @param msg The detail message.
     */
    public ThrottlingException(final String msg) {
        this(msg, null);
    }

    /**
     * Creates a new exception for a detail message and a root cause.
     *
     * @param msg The detail message.
     * @param cause The root cause.
     */
    public ThrottlingException(final String msg, final Throwable cause) {
        super(HTTP_TOO_MANY_REQUESTS, msg, cause);
    }
}
