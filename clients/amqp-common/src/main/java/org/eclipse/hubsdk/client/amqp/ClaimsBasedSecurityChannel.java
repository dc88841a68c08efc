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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.apache.qpid.proton.amqp.messaging.AmqpValue;
import org.apache.qpid.proton.amqp.messaging.ApplicationProperties;
import org.apache.qpid.proton.message.Message;
import org.eclipse.hubsdk.client.ServerErrorException;
import org.eclipse.hubsdk.client.ServiceInvocationException;
import org.eclipse.hubsdk.client.util.StatusCodeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.proton.ProtonDelivery;
import io.vertx.proton.ProtonHelper;
import io.vertx.proton.ProtonReceiver;
import io.vertx.proton.ProtonSender;

/**
 * A request/response channel for putting security tokens to the hub's
 * claims based security node.
 * <p>
 * Responses are correlated to requests by means of the request's <em>message-id</em>.
 * Requests that are not answered within the configured timeout fail with a
 * <em>503 Service unavailable</em> error.
 *
 */
public final class ClaimsBasedSecurityChannel {

    /**
     * The address of the claims based security node.
     */
    public static final String NODE_ADDRESS = "$cbs";
    /**
     * The reply-to address used in put-token requests.
     */
    public static final String REPLY_TO_ADDRESS = "cbs";
    /**
     * The value of the <em>operation</em> property of put-token requests.
     */
    public static final String OPERATION_PUT_TOKEN = "put-token";
    /**
     * The type of token that is put.
     */
    public static final String TOKEN_TYPE_SAS = "servicebus.windows.net:sastoken";

    static final String PROPERTY_OPERATION = "operation";
    static final String PROPERTY_TYPE = "type";
    static final String PROPERTY_NAME = "name";
    static final String PROPERTY_STATUS_CODE = "status-code";
    static final String PROPERTY_STATUS_DESCRIPTION = "status-description";

    private static final Logger LOG = LoggerFactory.getLogger(ClaimsBasedSecurityChannel.class);

    private final Map<Object, Promise<Void>> replyMap = new HashMap<>();
    private final Vertx vertx;
    private final ProtonSender sender;
    private final ProtonReceiver receiver;
    private final long putTokenTimeoutMillis;

    /**
     * Creates a new channel for a pair of links.
     * <p>
     * Registers a handler for response messages on the receiver link.
     *
     * @param vertx The vert.x instance to run timers on.
     * @param sender The link for sending requests.
     * @param receiver The link for receiving responses.
     * @param putTokenTimeoutMillis The number of milliseconds to wait for a response.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the timeout is not positive.
     */
    public ClaimsBasedSecurityChannel(
            final Vertx vertx,
            final ProtonSender sender,
            final ProtonReceiver receiver,
            final long putTokenTimeoutMillis) {

        this.vertx = Objects.requireNonNull(vertx);
        this.sender = Objects.requireNonNull(sender);
        this.receiver = Objects.requireNonNull(receiver);
        if (putTokenTimeoutMillis <= 0) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.putTokenTimeoutMillis = putTokenTimeoutMillis;
        this.receiver.handler(this::handleResponse);
    }

    ProtonSender getSender() {
        return sender;
    }

    ProtonReceiver getReceiver() {
        return receiver;
    }

    /**
     * Puts a token for an audience.
     *
     * @param audience The resource that the token grants access to.
     * @param token The serialized shared access signature.
     * @return A future indicating the outcome. The future will be failed with a
     *         {@link ServiceInvocationException} if the hub rejects the token or
     *         does not respond in time.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public Future<Void> putToken(final String audience, final String token) {

        Objects.requireNonNull(audience);
        Objects.requireNonNull(token);

        if (sender.sendQueueFull()) {
            LOG.debug("cannot put token, no credit left on link to {}", NODE_ADDRESS);
            return Future.failedFuture(new ServerErrorException(
                    HttpURLConnection.HTTP_UNAVAILABLE, "no credit available for sending put-token request"));
        }

        final String messageId = UUID.randomUUID().toString();
        final Message request = createPutTokenRequest(messageId, audience, token);
        final Promise<Void> result = Promise.promise();
        replyMap.put(messageId, result);

        sender.send(request, delivery -> {
            final ServiceInvocationException error = AmqpErrorConverter.fromDeliveryState(delivery.getRemoteState());
            if (error != null) {
                LOG.debug("hub did not accept put-token request [audience: {}, message ID: {}]: {}",
                        audience, messageId, error.getMessage());
                cancelRequest(messageId, error);
            }
        });
        final long timerId = vertx.setTimer(putTokenTimeoutMillis, tid -> cancelRequest(
                messageId,
                new ServerErrorException(
                        HttpURLConnection.HTTP_UNAVAILABLE,
                        "put-token request timed out after " + putTokenTimeoutMillis + "ms")));
        LOG.debug("sent put-token request [audience: {}, message ID: {}]", audience, messageId);
        return result.future().onComplete(r -> vertx.cancelTimer(timerId));
    }

    private static Message createPutTokenRequest(final String messageId, final String audience, final String token) {

        final Map<String, Object> props = new HashMap<>();
        props.put(PROPERTY_OPERATION, OPERATION_PUT_TOKEN);
        props.put(PROPERTY_TYPE, TOKEN_TYPE_SAS);
        props.put(PROPERTY_NAME, audience);

        final Message request = ProtonHelper.message();
        request.setMessageId(messageId);
        request.setAddress(NODE_ADDRESS);
        request.setReplyTo(REPLY_TO_ADDRESS);
        request.setApplicationProperties(new ApplicationProperties(props));
        request.setBody(new AmqpValue(token));
        return request;
    }

    /**
     * Processes a response message received from the peer.
     *
     * @param delivery The handle for accessing the message's disposition.
     * @param message The response.
     */
    void handleResponse(final ProtonDelivery delivery, final Message message) {

        final Promise<Void> request = Optional.ofNullable(message.getCorrelationId())
                .map(replyMap::remove)
                .orElse(null);
        if (request == null) {
            LOG.debug("discarding unexpected put-token response [correlation ID: {}]", message.getCorrelationId());
            ProtonHelper.rejected(delivery, true);
            return;
        }

        final Integer status = getStatusCode(message);
        if (StatusCodeMapper.isSuccessful(status)) {
            LOG.debug("hub accepted token [correlation ID: {}]", message.getCorrelationId());
            request.tryComplete();
        } else {
            final String description = getStringProperty(message, PROPERTY_STATUS_DESCRIPTION);
            LOG.debug("hub rejected token [correlation ID: {}, status: {}, description: {}]",
                    message.getCorrelationId(), status, description);
            if (status != null && status >= 400 && status < 600) {
                request.tryFail(StatusCodeMapper.from(status, description));
            } else {
                request.tryFail(new ServerErrorException(
                        HttpURLConnection.HTTP_INTERNAL_ERROR,
                        "malformed put-token response [status: " + status + "]"));
            }
        }
        ProtonHelper.accepted(delivery, true);
    }

    private boolean cancelRequest(final Object correlationId, final Throwable error) {
        return Optional.ofNullable(replyMap.remove(correlationId))
                .map(request -> {
                    LOG.debug("canceling put-token request [correlation ID: {}]: {}", correlationId, error.getMessage());
                    request.tryFail(error);
                    return true;
                })
                .orElse(false);
    }

    /**
     * Fails all outstanding requests and closes the links.
     *
     * @param cause The error to fail outstanding requests with or {@code null}
     *              to use a <em>503 Service unavailable</em> error.
     */
    public void close(final Throwable cause) {

        final Throwable error = Optional.ofNullable(cause)
                .orElseGet(() -> new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "channel closed"));
        final List<Object> outstanding = new ArrayList<>(replyMap.keySet());
        outstanding.forEach(id -> cancelRequest(id, error));
        if (sender.isOpen()) {
            sender.close();
        }
        if (receiver.isOpen()) {
            receiver.close();
        }
    }

    /**
     * Gets the number of requests for which no response has been received yet.
     *
     * @return The number of requests.
     */
    int getOutstandingRequests() {
        return replyMap.size();
    }

    private static Integer getStatusCode(final Message message) {
        final Object value = getProperty(message, PROPERTY_STATUS_CODE);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return null;
    }

    private static String getStringProperty(final Message message, final String name) {
        final Object value = getProperty(message, name);
        return value instanceof String ? (String) value : null;
    }

    private static Object getProperty(final Message message, final String name) {
        return Optional.ofNullable(message.getApplicationProperties())
                .map(ApplicationProperties::getValue)
                .map(props -> props.get(name))
                .orElse(null);
    }
}
