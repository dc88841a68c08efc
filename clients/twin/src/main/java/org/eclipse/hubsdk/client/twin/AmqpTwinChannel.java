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

package org.eclipse.hubsdk.client.twin;

import java.net.HttpURLConnection;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.apache.qpid.proton.amqp.Binary;
import org.apache.qpid.proton.amqp.messaging.Data;
import org.apache.qpid.proton.message.Message;
import org.eclipse.hubsdk.client.ServerErrorException;
import org.eclipse.hubsdk.client.amqp.AmqpUtils;
import org.eclipse.hubsdk.client.amqp.LinkOptions;
import org.eclipse.hubsdk.client.amqp.connection.ConnectionSession;
import org.eclipse.hubsdk.client.util.StatusCodeMapper;
import org.eclipse.hubsdk.config.ClientConfigProperties;
import org.eclipse.hubsdk.util.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * A twin channel that exchanges requests with the hub over the session's duplex twin link.
 * <p>
 * Requests carry the <em>operation</em> and <em>resource</em> message annotations and a
 * random correlation ID. Responses are correlated by means of their correlation ID.
 * Messages without a correlation ID are patches of the desired properties.
 *
 */
public class AmqpTwinChannel implements TwinChannel {

    static final String OPERATION_GET = "GET";
    static final String OPERATION_PATCH = "PATCH";
    static final String OPERATION_PUT = "PUT";
    static final String OPERATION_DELETE = "DELETE";
    static final String RESOURCE_REPORTED_PROPERTIES = "/properties/reported";
    static final String RESOURCE_DESIRED_NOTIFICATIONS = "/notifications/twin/properties/desired";

    private static final Logger LOG = LoggerFactory.getLogger(AmqpTwinChannel.class);
    private static final String EMPTY_BODY = " ";

    private final Map<Object, Promise<JsonObject>> replyMap = new HashMap<>();
    private final Vertx vertx;
    private final Context context;
    private final ConnectionSession session;
    private final long requestTimeoutMillis;
    private Handler<JsonObject> desiredPropertyUpdateHandler;

    /**
     * Creates a new channel.
     * <p>
     * Registers the twin link with the session.
     *
     * @param vertx The vert.x instance to run timers on.
     * @param session The session to send requests on.
     * @param config The configuration properties to take the request timeout from.
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null}.
     * @throws NullPointerException if any of the parameters other than module ID is {@code null}.
     */
    public AmqpTwinChannel(
            final Vertx vertx,
            final ConnectionSession session,
            final ClientConfigProperties config,
            final String deviceId,
            final String moduleId) {

        this.vertx = Objects.requireNonNull(vertx);
        this.session = Objects.requireNonNull(session);
        Objects.requireNonNull(config);
        Objects.requireNonNull(deviceId);
        this.requestTimeoutMillis = config.getRequestTimeout();
        this.context = vertx.getOrCreateContext();

        session.registerLink(LinkOptions.duplex(
                Constants.FEATURE_TWIN,
                Constants.twinAddress(deviceId, moduleId),
                msg -> runOnContext(v -> handleMessage(msg))));
        session.addDisconnectListener(cause -> runOnContext(v -> failOutstandingRequests(cause)));
    }

    @Override
    public String getFeatureName() {
        return Constants.FEATURE_TWIN;
    }

    @Override
    public void desiredPropertyUpdateHandler(final Handler<JsonObject> handler) {
        this.desiredPropertyUpdateHandler = handler;
    }

    @Override
    public Future<JsonObject> getTwin() {
        return sendRequest(OPERATION_GET, null, null);
    }

    @Override
    public Future<Void> updateReportedProperties(final JsonObject patch) {
        Objects.requireNonNull(patch);
        return sendRequest(OPERATION_PATCH, RESOURCE_REPORTED_PROPERTIES, patch).mapEmpty();
    }

    @Override
    public Future<Void> enableDesiredPropertyUpdates() {
        return sendRequest(OPERATION_PUT, RESOURCE_DESIRED_NOTIFICATIONS, null).mapEmpty();
    }

    @Override
    public Future<Void> disableDesiredPropertyUpdates() {
        return sendRequest(OPERATION_DELETE, RESOURCE_DESIRED_NOTIFICATIONS, null).mapEmpty();
    }

    /**
     * Gets the number of requests for which no response has been received yet.
     *
     * @return The number of requests.
     */
    int getOutstandingRequests() {
        return replyMap.size();
    }

    private Future<JsonObject> sendRequest(final String operation, final String resource, final JsonObject body) {

        final Promise<JsonObject> result = Promise.promise();
        runOnContext(go -> {
            final String correlationId = UUID.randomUUID().toString();
            final Message request = createRequest(correlationId, operation, resource, body);
            replyMap.put(correlationId, result);

            final long timerId = vertx.setTimer(requestTimeoutMillis, tid -> cancelRequest(
                    correlationId,
                    new ServerErrorException(
                            HttpURLConnection.HTTP_UNAVAILABLE,
                            "twin request timed out after " + requestTimeoutMillis + "ms")));
            result.future().onComplete(r -> vertx.cancelTimer(timerId));

            session.send(Constants.FEATURE_TWIN, request)
                .onSuccess(ok -> LOG.debug("sent twin request [operation: {}, resource: {}, correlation ID: {}]",
                        operation, resource, correlationId))
                .onFailure(t -> cancelRequest(correlationId, t));
        });
        return result.future();
    }

    private static Message createRequest(
            final String correlationId,
            final String operation,
            final String resource,
            final JsonObject body) {

        final Message request = Message.Factory.create();
        request.setCorrelationId(correlationId);
        AmqpUtils.addAnnotation(request, Constants.ANNOTATION_OPERATION, operation);
        if (resource != null) {
            AmqpUtils.addAnnotation(request, Constants.ANNOTATION_RESOURCE, resource);
        }
        if (body == null) {
            request.setBody(new Data(new Binary(EMPTY_BODY.getBytes(StandardCharsets.UTF_8))));
        } else {
            AmqpUtils.setJsonPayload(request, body);
        }
        return request;
    }

    /**
     * Processes a message received on the twin link.
     *
     * @param message The message.
     */
    void handleMessage(final Message message) {

        final Object correlationId = message.getCorrelationId();
        if (correlationId == null) {
            handleDesiredPropertyUpdate(message);
            return;
        }
        final Promise<JsonObject> request = replyMap.remove(correlationId);
        if (request == null) {
            LOG.debug("discarding unexpected twin response [correlation ID: {}]", correlationId);
            return;
        }
        final Integer status = getStatus(message);
        if (status == null || StatusCodeMapper.isSuccessful(status)) {
            try {
                request.tryComplete(AmqpUtils.getJsonPayload(message));
            } catch (final DecodeException e) {
                LOG.debug("twin response contains malformed payload [correlation ID: {}]", correlationId);
                request.tryFail(new ServerErrorException(
                        HttpURLConnection.HTTP_INTERNAL_ERROR, "malformed twin response", e));
            }
        } else {
            LOG.debug("twin request failed [correlation ID: {}, status: {}]", correlationId, status);
            request.tryFail(StatusCodeMapper.from(status, AmqpUtils.getPayloadAsString(message)));
        }
    }

    private void handleDesiredPropertyUpdate(final Message message) {

        final JsonObject patch;
        try {
            patch = AmqpUtils.getJsonPayload(message);
        } catch (final DecodeException e) {
            LOG.debug("discarding desired properties patch with malformed payload: {}", e.getMessage());
            return;
        }
        if (patch == null) {
            LOG.debug("discarding message without correlation ID and payload");
        } else if (desiredPropertyUpdateHandler == null) {
            LOG.debug("no handler registered, discarding desired properties patch");
        } else {
            desiredPropertyUpdateHandler.handle(patch);
        }
    }

    private static Integer getStatus(final Message message) {
        final Object status = AmqpUtils.getAnnotation(message, Constants.ANNOTATION_STATUS, Object.class);
        if (status instanceof Number) {
            return ((Number) status).intValue();
        } else if (status instanceof String) {
            try {
                return Integer.valueOf((String) status);
            } catch (final NumberFormatException e) {
                LOG.debug("twin response contains malformed status [{}]", status);
                return HttpURLConnection.HTTP_INTERNAL_ERROR;
            }
        }
        return null;
    }

    private boolean cancelRequest(final Object correlationId, final Throwable error) {
        return Optional.ofNullable(replyMap.remove(correlationId))
                .map(request -> {
                    LOG.debug("canceling twin request [correlation ID: {}]: {}", correlationId, error.getMessage());
                    request.tryFail(error);
                    return true;
                })
                .orElse(false);
    }

    private void failOutstandingRequests(final Throwable cause) {
        final List<Object> outstanding = new ArrayList<>(replyMap.keySet());
        outstanding.forEach(id -> cancelRequest(id, cause));
    }

    private void runOnContext(final Handler<Void> codeToRun) {
        if (Vertx.currentContext() == context) {
            codeToRun.handle(null);
        } else {
            context.runOnContext(codeToRun);
        }
    }
}
