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

package org.eclipse.hubsdk.client.util;

import java.net.HttpURLConnection;

import org.eclipse.hubsdk.client.ClientErrorException;
import org.eclipse.hubsdk.client.ResourceConflictException;
import org.eclipse.hubsdk.client.ServerErrorException;
import org.eclipse.hubsdk.client.ServiceInvocationException;
import org.eclipse.hubsdk.client.ThrottlingException;

/**
 * Translates the status codes reported by the hub into exceptions.
 */
public abstract class StatusCodeMapper {

    private StatusCodeMapper() {
    }

    /**
     * Checks if a status code reported by the hub indicates success.
     *
     * @param statusCode The status code or {@code null} if the hub did not report one.
     * @return {@code true} if the code is in the 2xx range.
     */
    public static final boolean isSuccessful(final Integer statusCode) {
        return statusCode != null && statusCode / 100 == 2;
    }

    /**
     * Checks if a status code indicates a condition that may go away by itself.
     * <p>
     * Request timeouts (408, 504), throttling (429) and an overloaded or
     * unavailable hub (500, 503) are considered transient.
     *
     * @param statusCode The status code.
     * @return {@code true} if a request that failed with the code is worth repeating.
     */
    public static final boolean isTransient(final int statusCode) {
        switch (statusCode) {
        case HttpURLConnection.HTTP_CLIENT_TIMEOUT:
        case ThrottlingException.HTTP_TOO_MANY_REQUESTS:
        case HttpURLConnection.HTTP_INTERNAL_ERROR:
        case HttpURLConnection.HTTP_UNAVAILABLE:
        case HttpURLConnection.HTTP_GATEWAY_TIMEOUT:
            return true;
        default:
            return false;
        }
    }

    /**
     * Maps an error status to an exception.
     *
     * @param statusCode The error status, 400 to 599.
     * @param detailMessage A description of the problem or {@code null}.
     * @return The exception.
     * @throws IllegalArgumentException if the status is not an error status.
     */
    public static final ServiceInvocationException from(final int statusCode, final String detailMessage) {
        return from(statusCode, detailMessage, null);
    }

    /**
     * Maps an error status to an exception that wraps an underlying cause.
     * <p>
     * 409 yields a {@link ResourceConflictException}, 429 a {@link ThrottlingException},
     * remaining 4xx codes a {@link ClientErrorException} and 5xx codes a
     * {@link ServerErrorException}.
     *
     * @param statusCode The error status, 400 to 599.
     * @param detailMessage A description of the problem or {@code null}.
     * @param cause The underlying cause or {@code null}.
     * @return The exception.
     * @throws IllegalArgumentException if the status is not an error status.
     */
    public static final ServiceInvocationException from(
            final int statusCode,
            final String detailMessage,
            final Throwable cause) {

        switch (statusCode / 100) {
        case 4:
            if (statusCode == HttpURLConnection.HTTP_CONFLICT) {
                return new ResourceConflictException(detailMessage, cause);
            }
            if (statusCode == ThrottlingException.HTTP_TOO_MANY_REQUESTS) {
                return new ThrottlingException(detailMessage, cause);
            }
            return new ClientErrorException(statusCode, detailMessage, cause);
        case 5:
            return new ServerErrorException(statusCode, detailMessage, cause);
        default:
            throw new IllegalArgumentException("not an error status: " + statusCode);
        }
    }
}
