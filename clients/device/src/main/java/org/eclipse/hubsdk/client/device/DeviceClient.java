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

package org.eclipse.hubsdk.client.device;

import java.net.HttpURLConnection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.apache.qpid.proton.amqp.Binary;
import org.apache.qpid.proton.amqp.messaging.Data;
import org.apache.qpid.proton.message.Message;
import org.eclipse.hubsdk.client.amqp.AmqpUtils;
import org.eclipse.hubsdk.client.amqp.LinkOptions;
import org.eclipse.hubsdk.client.amqp.ProtonBasedSessionTransport;
import org.eclipse.hubsdk.client.amqp.connection.ConnectionSession;
import org.eclipse.hubsdk.client.amqp.connection.DisconnectListener;
import org.eclipse.hubsdk.client.auth.AuthenticationProvider;
import org.eclipse.hubsdk.client.auth.RenewingTokenAuthenticationProvider;
import org.eclipse.hubsdk.client.auth.SharedAccessKeyAuthenticationProvider;
import org.eclipse.hubsdk.client.auth.SharedAccessSignatureAuthenticationProvider;
import org.eclipse.hubsdk.client.auth.X509AuthenticationProvider;
import org.eclipse.hubsdk.client.auth.X509Certificate;
import org.eclipse.hubsdk.client.retry.ExponentialBackoffWithJitter;
import org.eclipse.hubsdk.client.retry.RetryOperation;
import org.eclipse.hubsdk.client.retry.RetryPolicy;
import org.eclipse.hubsdk.client.twin.AmqpTwinChannel;
import org.eclipse.hubsdk.client.twin.TwinDocument;
import org.eclipse.hubsdk.client.twin.TwinSynchronizer;
import org.eclipse.hubsdk.config.ClientConfigProperties;
import org.eclipse.hubsdk.tracing.TracingHelper;
import org.eclipse.hubsdk.util.ConnectionString;
import org.eclipse.hubsdk.util.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentracing.Span;
import io.opentracing.Tracer;
import io.opentracing.noop.NoopTracerFactory;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;

/**
 * A client for a device (or module) connected to the hub.
 * <p>
 * Every operation is executed in a retry loop governed by the current {@link RetryPolicy}
 * and the operation timeout configured in {@link ClientConfigProperties#getOperationTimeout()}.
 * The underlying session connects on demand and transparently reconnects after
 * transient connection losses.
 *
 */
public class DeviceClient {

    /**
     * The name of the link used for sending events.
     */
    public static final String LINK_EVENTS = "events";

    static final String APP_PROPERTY_METHOD_NAME = "IoThub-methodname";
    static final String APP_PROPERTY_STATUS = "IoThub-status";

    private static final String COMPONENT_NAME = "hubsdk-device-client";
    private static final Logger LOG = LoggerFactory.getLogger(DeviceClient.class);

    private final Map<String, DeviceMethodHandler> methodHandlers = new ConcurrentHashMap<>();
    private final Vertx vertx;
    private final ClientConfigProperties config;
    private final AuthenticationProvider authenticationProvider;
    private final ConnectionSession session;
    private final TwinSynchronizer twin;
    private final String deviceId;
    private final String moduleId;

    private volatile RetryPolicy retryPolicy = new ExponentialBackoffWithJitter();
    private volatile Tracer tracer = NoopTracerFactory.create();
    private volatile Handler<Message> messageHandler;

    /**
     * Creates a client that connects to the hub using AMQP 1.0.
     *
     * @param vertx The vert.x instance to use.
     * @param config The configuration properties containing the hub's host name and port.
     * @param authenticationProvider The provider of the credentials to authenticate with.
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null} for a device client.
     * @throws NullPointerException if any of the parameters other than module ID is {@code null}.
     */
    public DeviceClient(
            final Vertx vertx,
            final ClientConfigProperties config,
            final AuthenticationProvider authenticationProvider,
            final String deviceId,
            final String moduleId) {

        this(vertx,
                config,
                authenticationProvider,
                new ConnectionSession(
                        vertx,
                        config,
                        new ProtonBasedSessionTransport(vertx, config),
                        authenticationProvider),
                deviceId,
                moduleId);
    }

    /**
     * Creates a client for an existing session.
     *
     * @param vertx The vert.x instance to use.
     * @param config The configuration properties.
     * @param authenticationProvider The provider of the credentials that the session uses.
     * @param session The session to the hub.
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null} for a device client.
     * @throws NullPointerException if any of the parameters other than module ID is {@code null}.
     */
    DeviceClient(
            final Vertx vertx,
            final ClientConfigProperties config,
            final AuthenticationProvider authenticationProvider,
            final ConnectionSession session,
            final String deviceId,
            final String moduleId) {

        this.vertx = Objects.requireNonNull(vertx);
        this.config = Objects.requireNonNull(config);
        this.authenticationProvider = Objects.requireNonNull(authenticationProvider);
        this.session = Objects.requireNonNull(session);
        this.deviceId = Objects.requireNonNull(deviceId);
        this.moduleId = moduleId;

        session.setRetryPolicy(retryPolicy);
        session.registerLink(LinkOptions.sender(LINK_EVENTS, Constants.eventAddress(deviceId, moduleId)));
        session.registerLink(LinkOptions.receiver(
                Constants.FEATURE_C2D,
                Constants.cloudToDeviceAddress(deviceId, moduleId),
                this::handleCloudToDeviceMessage));
        session.registerLink(LinkOptions.duplex(
                Constants.FEATURE_METHODS,
                Constants.methodsAddress(deviceId, moduleId),
                this::handleMethodRequest));
        this.twin = new TwinSynchronizer(
                vertx,
                session,
                new AmqpTwinChannel(vertx, session, config, deviceId, moduleId));
    }

    /**
     * Creates a client for a device connection string.
     * <p>
     * The connection string must contain either a shared access key or a shared access signature.
     *
     * @param vertx The vert.x instance to use.
     * @param connectionString The connection string.
     * @return The client.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the connection string is invalid or requires an X.509 certificate.
     */
    public static DeviceClient fromConnectionString(final Vertx vertx, final String connectionString) {
        Objects.requireNonNull(vertx);
        Objects.requireNonNull(connectionString);

        final ConnectionString cs = ConnectionString.parseDeviceConnectionString(connectionString);
        final AuthenticationProvider provider;
        if (cs.getSharedAccessKey() != null) {
            provider = SharedAccessKeyAuthenticationProvider.fromConnectionString(vertx, connectionString);
        } else if (cs.getSharedAccessSignature() != null) {
            provider = new SharedAccessSignatureAuthenticationProvider(
                    cs.getHostName(),
                    cs.getGatewayHostName(),
                    cs.getDeviceId(),
                    cs.getModuleId(),
                    cs.getSharedAccessSignature());
        } else {
            throw new IllegalArgumentException("connection string requires an X.509 certificate");
        }
        return new DeviceClient(vertx, configFor(cs), provider, cs.getDeviceId(), cs.getModuleId());
    }

    /**
     * Creates a client for a device connection string that uses X.509 client certificate authentication.
     *
     * @param vertx The vert.x instance to use.
     * @param connectionString The connection string containing {@code x509=true}.
     * @param certificate The certificate and key to authenticate with.
     * @return The client.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the connection string is invalid.
     */
    public static DeviceClient fromConnectionString(
            final Vertx vertx,
            final String connectionString,
            final X509Certificate certificate) {

        Objects.requireNonNull(vertx);
        Objects.requireNonNull(connectionString);
        Objects.requireNonNull(certificate);

        final ConnectionString cs = ConnectionString.parseDeviceConnectionString(connectionString);
        final X509AuthenticationProvider provider = X509AuthenticationProvider.fromConnectionString(connectionString, certificate);
        return new DeviceClient(vertx, configFor(cs), provider, cs.getDeviceId(), cs.getModuleId());
    }

    private static ClientConfigProperties configFor(final ConnectionString cs) {
        final ClientConfigProperties props = new ClientConfigProperties();
        props.setHost(cs.getGatewayHostName() == null ? cs.getHostName() : cs.getGatewayHostName());
        props.setAmqpHostname(cs.getHostName());
        props.setName(cs.getModuleId() == null ? cs.getDeviceId() : cs.getDeviceId() + "/" + cs.getModuleId());
        return props;
    }

    /**
     * Sets the policy to use for retrying operations and reconnecting.
     *
     * @param policy The policy.
     * @throws NullPointerException if policy is {@code null}.
     */
    public void setRetryPolicy(final RetryPolicy policy) {
        this.retryPolicy = Objects.requireNonNull(policy);
        session.setRetryPolicy(policy);
    }

    /**
     * Sets the tracer to create spans for operations with.
     * <p>
     * Defaults to a no-op tracer.
     *
     * @param tracer The tracer.
     * @throws NullPointerException if tracer is {@code null}.
     */
    public void setTracer(final Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer);
    }

    /**
     * Registers a listener to be notified when the connection is lost for good.
     *
     * @param listener The listener.
     * @throws NullPointerException if listener is {@code null}.
     */
    public void addDisconnectListener(final DisconnectListener listener) {
        session.addDisconnectListener(listener);
    }

    /**
     * Registers a handler for errors that do not belong to any particular operation,
     * e.g. failures to renew credentials or to re-attach links.
     *
     * @param handler The handler.
     * @throws NullPointerException if handler is {@code null}.
     */
    public void addErrorListener(final Handler<Throwable> handler) {
        session.addErrorListener(handler);
    }

    /**
     * Connects to the hub.
     *
     * @return A future indicating the outcome.
     */
    public Future<Void> open() {
        return execute("open", session::connect);
    }

    /**
     * Disconnects from the hub and stops renewing credentials.
     * <p>
     * The client may be opened again afterwards.
     *
     * @return A future indicating the outcome of disconnecting.
     */
    public Future<Void> close() {
        LOG.debug("closing client [device-id: {}, module-id: {}]", deviceId, moduleId);
        return session.disconnect()
                .transform(disconnected -> authenticationProvider.stop()
                        .transform(stopped -> {
                            if (stopped.failed()) {
                                LOG.debug("failed to stop authentication provider", stopped.cause());
                            }
                            return disconnected.succeeded()
                                    ? Future.<Void>succeededFuture()
                                    : Future.<Void>failedFuture(disconnected.cause());
                        }));
    }

    /**
     * Sends an event to the hub.
     * <p>
     * A random message ID is set on the message if it has none.
     *
     * @param message The event.
     * @return A future indicating whether the hub has accepted the event.
     * @throws NullPointerException if message is {@code null}.
     */
    public Future<Void> sendEvent(final Message message) {
        Objects.requireNonNull(message);
        prepareEvent(message);
        return execute("send event", () -> session.send(LINK_EVENTS, message));
    }

    /**
     * Sends several events to the hub.
     * <p>
     * The events are sent in a single operation. If sending any of the events fails with
     * a retriable error, all events are sent again.
     *
     * @param messages The events.
     * @return A future indicating whether the hub has accepted all events.
     * @throws NullPointerException if messages is {@code null}.
     * @throws IllegalArgumentException if the list is empty.
     */
    public Future<Void> sendEventBatch(final List<Message> messages) {
        Objects.requireNonNull(messages);
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("batch must contain at least one event");
        }
        messages.forEach(this::prepareEvent);
        return execute("send event batch", () -> Future.all(messages.stream()
                    .map(msg -> session.send(LINK_EVENTS, msg))
                    .collect(Collectors.toList()))
                .mapEmpty());
    }

    private void prepareEvent(final Message message) {
        if (message.getMessageId() == null) {
            message.setMessageId(UUID.randomUUID().toString());
        }
    }

    /**
     * Sets the handler for cloud-to-device messages and starts receiving them.
     *
     * @param handler The handler.
     * @return A future indicating whether the client is receiving messages.
     * @throws NullPointerException if handler is {@code null}.
     */
    public Future<Void> onMessage(final Handler<Message> handler) {
        this.messageHandler = Objects.requireNonNull(handler);
        return execute("enable c2d", () -> session.enableFeature(Constants.FEATURE_C2D));
    }

    /**
     * Registers a handler for a direct method and starts receiving method invocations.
     *
     * @param methodName The name of the method.
     * @param handler The handler.
     * @return A future indicating whether the client is receiving method invocations.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the method name is empty.
     */
    public Future<Void> onDeviceMethod(final String methodName, final DeviceMethodHandler handler) {
        Objects.requireNonNull(methodName);
        Objects.requireNonNull(handler);
        if (methodName.isEmpty()) {
            throw new IllegalArgumentException("method name must not be empty");
        }
        methodHandlers.put(methodName, handler);
        return execute("enable methods", () -> session.enableFeature(Constants.FEATURE_METHODS));
    }

    /**
     * Fetches the device twin.
     *
     * @return A future completed with a copy of the twin.
     */
    public Future<TwinDocument> getTwin() {
        return execute("get twin", twin::getTwin);
    }

    /**
     * Sends a patch of the reported properties to the hub.
     *
     * @param patch The patch.
     * @return A future indicating the outcome.
     * @throws NullPointerException if patch is {@code null}.
     */
    public Future<Void> updateReportedProperties(final JsonObject patch) {
        Objects.requireNonNull(patch);
        return execute("update reported properties", () -> twin.updateReportedProperties(patch));
    }

    /**
     * Registers a handler to be notified about changes of a desired property.
     *
     * @param path The dot separated path of the property or the empty string for
     *             the whole tree of desired properties.
     * @param handler The handler.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @see TwinSynchronizer#onDesiredPropertyChange(String, Handler)
     */
    public void onDesiredPropertyChange(final String path, final Handler<Object> handler) {
        twin.onDesiredPropertyChange(path, handler);
    }

    /**
     * Replaces the shared access signature used for authenticating to the hub.
     * <p>
     * An established connection is re-authenticated with the new signature.
     *
     * @param sharedAccessSignature The serialized signature.
     * @throws NullPointerException if the signature is {@code null}.
     * @throws org.eclipse.hubsdk.util.MalformedSignatureException if the signature cannot be parsed.
     * @throws IllegalStateException if the client does not authenticate by means of signatures.
     */
    public void updateSharedAccessSignature(final String sharedAccessSignature) {
        Objects.requireNonNull(sharedAccessSignature);
        if (authenticationProvider instanceof SharedAccessSignatureAuthenticationProvider) {
            ((SharedAccessSignatureAuthenticationProvider) authenticationProvider)
                .updateSharedAccessSignature(sharedAccessSignature);
        } else if (authenticationProvider instanceof RenewingTokenAuthenticationProvider) {
            ((RenewingTokenAuthenticationProvider) authenticationProvider)
                .updateSharedAccessSignature(sharedAccessSignature);
        } else {
            throw new IllegalStateException("client does not use shared access signatures");
        }
    }

    private <T> Future<T> execute(final String operationName, final Supplier<Future<T>> work) {

        final Span span = TracingHelper.buildClientChildSpan(tracer, null, operationName, COMPONENT_NAME).start();
        TracingHelper.setDeviceTags(span, deviceId, moduleId);
        final RetryOperation operation = new RetryOperation(
                vertx,
                operationName,
                retryPolicy,
                config.getOperationTimeout());
        return operation.retry(work)
                .onComplete(ar -> {
                    TracingHelper.TAG_ATTEMPT.set(span, operation.getAttemptCount());
                    if (ar.failed()) {
                        TracingHelper.logError(span, ar.cause());
                    }
                    span.finish();
                });
    }

    private void handleCloudToDeviceMessage(final Message message) {
        final Handler<Message> handler = messageHandler;
        if (handler == null) {
            LOG.debug("no handler registered, discarding cloud-to-device message [message ID: {}]",
                    message.getMessageId());
            return;
        }
        try {
            handler.handle(message);
        } catch (final RuntimeException e) {
            LOG.warn("cloud-to-device message handler threw exception", e);
        }
    }

    private void handleMethodRequest(final Message message) {

        final String methodName = AmqpUtils.getProperty(message, APP_PROPERTY_METHOD_NAME, String.class);
        final Object requestId = message.getCorrelationId();
        if (methodName == null || requestId == null) {
            LOG.debug("discarding malformed method request [method: {}, request ID: {}]", methodName, requestId);
            return;
        }
        final DeviceMethodRequest request = new DeviceMethodRequest(methodName, requestId, AmqpUtils.getPayload(message));
        final DeviceMethodHandler handler = methodHandlers.get(methodName);

        final Future<DeviceMethodResponse> response;
        if (handler == null) {
            LOG.debug("no handler registered for method [{}]", methodName);
            response = Future.succeededFuture(DeviceMethodResponse.of(
                    HttpURLConnection.HTTP_NOT_FOUND,
                    new JsonObject().put("message", "method not implemented: " + methodName)));
        } else {
            response = invoke(handler, request);
        }
        response
            .recover(t -> {
                LOG.debug("handler for method [{}] failed", methodName, t);
                return Future.succeededFuture(DeviceMethodResponse.of(
                        HttpURLConnection.HTTP_INTERNAL_ERROR,
                        new JsonObject().put("message", String.valueOf(t.getMessage()))));
            })
            .compose(result -> session.send(Constants.FEATURE_METHODS, createMethodResponse(requestId, result)))
            .onSuccess(ok -> LOG.debug("sent response to {}", request))
            .onFailure(t -> LOG.info("failed to send response to {}: {}", request, t.getMessage()));
    }

    private static Future<DeviceMethodResponse> invoke(final DeviceMethodHandler handler, final DeviceMethodRequest request) {
        try {
            final Future<DeviceMethodResponse> result = handler.handle(request);
            return result == null ? Future.failedFuture(new IllegalStateException("handler returned no response")) : result;
        } catch (final RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    private static Message createMethodResponse(final Object requestId, final DeviceMethodResponse response) {
        final Message message = Message.Factory.create();
        message.setCorrelationId(requestId);
        AmqpUtils.addProperty(message, APP_PROPERTY_STATUS, response.getStatus());
        final Buffer payload = response.encodePayload();
        message.setContentType(AmqpUtils.CONTENT_TYPE_APPLICATION_JSON);
        message.setBody(new Data(new Binary(payload.getBytes())));
        return message;
    }
}
