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
import java.util.Collection;
import java.util.Objects;

/**
 * Indicates that a connection could not be fully restored after it had been lost.
 * <p>
 * The individual failures (e.g. of features that could not be re-enabled) are
 * available as {@linkplain #getSuppressed() suppressed} exceptions.
 */
public class ReconnectFailedException extends ServerErrorException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception for a detail message and a root cause.
     *
     * @param msg The detail message.
     * @param cause The root cause.
     */
    public ReconnectFailedException(final String msg, final Throwable cause) {
        super(HttpURLConnection.HTTP_UNAVAILABLE, msg, cause);
    }

    /**
     * Creates a new exception aggregating several failures.
     * <p>
     * The first failure becomes the cause of the created exception, all
     * failures are added as suppressed exceptions.
     *
     * @param msg The detail message.
     * @param failures The failures to aggregate.
     * @return The exception.
     * @throws NullPointerException if failures is {@code null}.
     * @throws IllegalArgumentException if failures is empty.
     */
    public static ReconnectFailedException aggregate(final String msg, final Collection<? extends Throwable> failures) {
        Objects.requireNonNull(failures);
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("at least one failure is required");
        }
        final ReconnectFailedException result = new ReconnectFailedException(msg, failures.iterator().next());
        failures.forEach(result::addSuppressed);
        return result;
    }
}
