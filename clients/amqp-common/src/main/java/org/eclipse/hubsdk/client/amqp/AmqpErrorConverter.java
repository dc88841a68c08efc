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

package org.eclipse.hubsdk.client.amqp;

import java.net.HttpURLConnection;
import java.util.Map;
import java.util.Objects;

import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.messaging.Accepted;
import org.apache.qpid.proton.amqp.messaging.Modified;
import org.apache.qpid.proton.amqp.messaging.Rejected;
import org.apache.qpid.proton.amqp.messaging.Released;
import org.apache.qpid.proton.amqp.transport.AmqpError;
import org.apache.qpid.proton.amqp.transport.ConnectionError;
import org.apache.qpid.proton.amqp.transport.DeliveryState;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;
import org.apache.qpid.proton.amqp.transport.LinkError;
import org.eclipse.hubsdk.client.ClientErrorException;
import org.eclipse.hubsdk.client.ServerErrorException;
import org.eclipse.hubsdk.client.ServiceInvocationException;
import org.eclipse.hubsdk.client.util.StatusCodeMapper;

/**
 * Maps AMQP error conditions and delivery states to {@code ServiceInvocationException}s.
 *
 */
public final class AmqpErrorConverter {

    /**
     * The condition indicating that the hub throttles the device.
     */
    public static final Symbol CONDITION_THROTTLED = Symbol.valueOf("com.microsoft:device-container-throttled");
    /**
     * The condition indicating that the hub did not answer in time.
     */
    public static final Symbol CONDITION_TIMEOUT = Symbol.valueOf("com.microsoft:timeout");

    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private static final Map<Symbol, Integer> STATUS_CODES = Map.ofEntries(
            Map.entry(AmqpError.INTERNAL_ERROR, HttpURLConnection.HTTP_INTERNAL_ERROR),
            Map.entry(AmqpError.NOT_FOUND, HttpURLConnection.HTTP_NOT_FOUND),
            Map.entry(AmqpError.NOT_IMPLEMENTED, HttpURLConnection.HTTP_NOT_IMPLEMENTED),
            Map.entry(AmqpError.NOT_ALLOWED, HttpURLConnection.HTTP_BAD_REQUEST),
            Map.entry(AmqpError.DECODE_ERROR, HttpURLConnection.HTTP_BAD_REQUEST),
            Map.entry(AmqpError.INVALID_FIELD, HttpURLConnection.HTTP_BAD_REQUEST),
            Map.entry(AmqpError.RESOURCE_LIMIT_EXCEEDED, HttpURLConnection.HTTP_FORBIDDEN),
            Map.entry(AmqpError.UNAUTHORIZED_ACCESS, HttpURLConnection.HTTP_UNAUTHORIZED),
            Map.entry(LinkError.MESSAGE_SIZE_EXCEEDED, HttpURLConnection.HTTP_ENTITY_TOO_LARGE),
            Map.entry(LinkError.DETACH_FORCED, HttpURLConnection.HTTP_UNAVAILABLE),
            Map.entry(LinkError.STOLEN, HttpURLConnection.HTTP_CONFLICT),
            Map.entry(ConnectionError.CONNECTION_FORCED, HttpURLConnection.HTTP_UNAVAILABLE),
            Map.entry(ConnectionError.FRAMING_ERROR, HttpURLConnection.HTTP_UNAVAILABLE),
            Map.entry(Symbol.valueOf("com.microsoft:argument-error"), HttpURLConnection.HTTP_BAD_REQUEST),
            Map.entry(Symbol.valueOf("com.microsoft:argument-out-of-range"), HttpURLConnection.HTTP_BAD_REQUEST),
            Map.entry(Symbol.valueOf("com.microsoft:device-already-exists"), HttpURLConnection.HTTP_CONFLICT),
            Map.entry(CONDITION_THROTTLED, HTTP_TOO_MANY_REQUESTS),
            Map.entry(Symbol.valueOf("com.microsoft:iot-hub-suspended"), HttpURLConnection.HTTP_FORBIDDEN),
            Map.entry(Symbol.valueOf("com.microsoft:iot-hub-not-found-error"), HttpURLConnection.HTTP_NOT_FOUND),
            Map.entry(Symbol.valueOf("com.microsoft:message-lock-lost"), HttpURLConnection.HTTP_PRECON_FAILED),
            Map.entry(Symbol.valueOf("com.microsoft:precondition-failed"), HttpURLConnection.HTTP_PRECON_FAILED),
            Map.entry(Symbol.valueOf("com.microsoft:quota-exceeded"), HttpURLConnection.HTTP_FORBIDDEN),
            Map.entry(CONDITION_TIMEOUT, HttpURLConnection.HTTP_UNAVAILABLE));

    private AmqpErrorConverter() {
        // prevent instantiation
    }

    /**
     * Creates an exception for an error condition.
     *
     * @param condition The error condition.
     * @param description The error description or {@code null} if not available.
     * @param defaultStatusCode The status code to use for unknown conditions.
     * @return The exception.
     * @throws NullPointerException if condition is {@code null}.
     */
    public static ServiceInvocationException from(
            final Symbol condition,
            final String description,
            final int defaultStatusCode) {

        Objects.requireNonNull(condition);
        final int statusCode = STATUS_CODES.getOrDefault(condition, defaultStatusCode);
        final String detailMessage = description == null ? condition.toString() : description;
        return StatusCodeMapper.from(statusCode, detailMessage);
    }

    /**
     * Creates an exception for the error condition contained in a peer's <em>detach</em> frame
     * that has been sent in response to an <em>attach</em> frame.
     * <p>
     * Unknown conditions are mapped to a <em>404 Not Found</em> error.
     *
     * @param error The error condition.
     * @return The exception.
     * @throws NullPointerException if error is {@code null}.
     */
    public static ServiceInvocationException fromAttachError(final ErrorCondition error) {

        Objects.requireNonNull(error);
        if (error.getCondition() == null) {
            return new ClientErrorException(HttpURLConnection.HTTP_NOT_FOUND, error.getDescription());
        }
        return from(error.getCondition(), error.getDescription(), HttpURLConnection.HTTP_NOT_FOUND);
    }

    /**
     * Creates an exception for the error condition contained in a peer's <em>detach</em> or
     * <em>close</em> frame for an established link or connection.
     * <p>
     * A missing condition and unknown conditions are mapped to a <em>503 Service unavailable</em> error.
     *
     * @param error The error condition or {@code null} if the peer did not indicate an error.
     * @return The exception.
     */
    public static ServiceInvocationException fromDetachError(final ErrorCondition error) {

        if (error == null || error.getCondition() == null) {
            return new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "detached by peer");
        }
        return from(error.getCondition(), error.getDescription(), HttpURLConnection.HTTP_UNAVAILABLE);
    }

    /**
     * Creates an exception for the error condition contained in a <em>rejected</em> delivery state.
     * <p>
     * Unknown conditions are mapped to a <em>400 Bad Request</em> error.
     *
     * @param error The error condition.
     * @return The exception.
     * @throws NullPointerException if error is {@code null}.
     */
    public static ServiceInvocationException fromTransferError(final ErrorCondition error) {

        Objects.requireNonNull(error);
        if (error.getCondition() == null) {
            return new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, error.getDescription());
        }
        return from(error.getCondition(), error.getDescription(), HttpURLConnection.HTTP_BAD_REQUEST);
    }

    /**
     * Maps the outcome of a message transfer.
     *
     * @param remoteState The delivery state reported by the peer.
     * @return {@code null} if the message has been accepted or the exception
     *         representing the reason why the message has not been accepted.
     */
    public static ServiceInvocationException fromDeliveryState(final DeliveryState remoteState) {

        if (remoteState instanceof Accepted) {
            return null;
        } else if (remoteState instanceof Rejected) {
            final ErrorCondition error = ((Rejected) remoteState).getError();
            return error == null ? new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST) : fromTransferError(error);
        } else if (remoteState instanceof Released) {
            return new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "message released by peer");
        } else if (remoteState instanceof Modified) {
            return Boolean.TRUE.equals(((Modified) remoteState).getUndeliverableHere())
                    ? new ClientErrorException(HttpURLConnection.HTTP_NOT_FOUND, "message undeliverable")
                    : new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "message not delivered");
        } else {
            return new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "unknown delivery state");
        }
    }
}
