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

package org.eclipse.hubsdk.client.amqp.connection;

import java.net.HttpURLConnection;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.qpid.proton.message.Message;
import org.eclipse.hubsdk.client.OperationCancelledException;
import org.eclipse.hubsdk.client.ReconnectFailedException;
import org.eclipse.hubsdk.client.ServerErrorException;
import org.eclipse.hubsdk.client.amqp.LinkOptions;
import org.eclipse.hubsdk.client.amqp.SessionTransport;
import org.eclipse.hubsdk.client.auth.AuthenticationProvider;
import org.eclipse.hubsdk.client.auth.AuthenticationType;
import org.eclipse.hubsdk.client.auth.Credential;
import org.eclipse.hubsdk.client.retry.ExponentialBackoffWithJitter;
import org.eclipse.hubsdk.client.retry.RetryOperation;
import org.eclipse.hubsdk.client.retry.RetryPolicy;
import org.eclipse.hubsdk.config.ClientConfigProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * A session with the hub that connects, authorizes and attaches links on demand.
 * <p>
 * The session is a state machine that runs on a single vert.x context. At most one
 * state transition is in flight at any time. Requests that arrive while a transition
 * is in flight are deferred and replayed in the order of their arrival once the
 * session has reached a stable state. A request other than {@link #disconnect()} that
 * arrives while the session is disconnected implicitly connects the session first.
 * <p>
 * Features are links that the session re-attaches automatically after it has
 * re-established a connection that has been lost.
 *
 */
public class ConnectionSession {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionSession.class);

    private final Vertx vertx;
    private final Context context;
    private final ClientConfigProperties config;
    private final SessionTransport transport;
    private final AuthenticationProvider authenticationProvider;
    private final Map<String, LinkOptions> linkDefinitions = new ConcurrentHashMap<>();
    private final Set<String> attachedLinks = new HashSet<>();
    private final Map<String, Future<Void>> pendingAttaches = new HashMap<>();
    private final Set<String> enabledFeatures = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Deque<Runnable> deferredRequests = new ArrayDeque<>();
    private final List<DisconnectListener> disconnectListeners = new CopyOnWriteArrayList<>();
    private final List<ReconnectListener> reconnectListeners = new CopyOnWriteArrayList<>();
    private final List<Handler<Throwable>> errorListeners = new CopyOnWriteArrayList<>();

    private volatile SessionState state = SessionState.DISCONNECTED;
    private volatile RetryPolicy retryPolicy = new ExponentialBackoffWithJitter();
    private RetryOperation reconnectOperation;
    private boolean reconnecting;
    private boolean reconnectAttemptInFlight;
    private boolean disconnectRequested;
    private boolean replaying;
    private long connectionGeneration;
    // token last put on the current connection
    private Credential authenticatedCredential;

    /**
     * Creates a new session.
     * <p>
     * The session runs on the vert.x context that is current when this constructor is invoked.
     *
     * @param vertx The vert.x instance to use.
     * @param config The configuration properties.
     * @param transport The transport to use for communicating with the hub.
     * @param authenticationProvider The provider of the credentials to authorize the connection with.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public ConnectionSession(
            final Vertx vertx,
            final ClientConfigProperties config,
            final SessionTransport transport,
            final AuthenticationProvider authenticationProvider) {

        this.vertx = Objects.requireNonNull(vertx);
        this.config = Objects.requireNonNull(config);
        this.transport = Objects.requireNonNull(transport);
        this.authenticationProvider = Objects.requireNonNull(authenticationProvider);
        this.context = vertx.getOrCreateContext();

        transport.disconnectHandler(cause -> runOnContext(v -> onTransportDisconnected(cause)));
        transport.linkErrorHandler((name, cause) -> runOnContext(v -> onLinkError(name, cause)));
        authenticationProvider.addNewCredentialListener(this::onNewCredential);
        authenticationProvider.addErrorListener(this::notifyErrorListeners);
    }

    /**
     * Gets the current state of this session.
     *
     * @return The state.
     */
    public SessionState getState() {
        return state;
    }

    /**
     * Sets the policy that decides whether and when a lost connection is re-established
     * and a link detached by the hub is re-attached.
     *
     * @param policy The policy.
     * @throws NullPointerException if policy is {@code null}.
     */
    public void setRetryPolicy(final RetryPolicy policy) {
        this.retryPolicy = Objects.requireNonNull(policy);
    }

    /**
     * Gets the policy used for re-establishing lost connections and links.
     *
     * @return The policy.
     */
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /**
     * Registers a link that can subsequently be used in {@link #send(String, Message)},
     * {@link #enableFeature(String)} and {@link #disableFeature(String)}.
     * <p>
     * A link that has already been registered under the same name is replaced.
     *
     * @param link The link.
     * @throws NullPointerException if link is {@code null}.
     */
    public void registerLink(final LinkOptions link) {
        Objects.requireNonNull(link);
        linkDefinitions.put(link.getName(), link);
    }

    /**
     * Adds a listener to be notified when the session has lost its connection and
     * either could not or must not re-establish it.
     * <p>
     * The listener is also notified if one or more features could not be re-enabled
     * after the connection has been re-established.
     *
     * @param listener The listener.
     * @throws NullPointerException if listener is {@code null}.
     */
    public void addDisconnectListener(final DisconnectListener listener) {
        disconnectListeners.add(Objects.requireNonNull(listener));
    }

    /**
     * Adds a listener to be notified when the session has re-established a lost
     * connection and has re-enabled all features.
     *
     * @param listener The listener.
     * @throws NullPointerException if listener is {@code null}.
     */
    public void addReconnectListener(final ReconnectListener listener) {
        reconnectListeners.add(Objects.requireNonNull(listener));
    }

    /**
     * Adds a listener to be notified about errors that are not related to any
     * particular request, e.g. links detached by the hub or failed token renewals.
     *
     * @param listener The listener.
     * @throws NullPointerException if listener is {@code null}.
     */
    public void addErrorListener(final Handler<Throwable> listener) {
        errorListeners.add(Objects.requireNonNull(listener));
    }

    /**
     * Connects to the hub and authorizes the connection.
     *
     * @return A future indicating the outcome. The future succeeds immediately if the
     *         session is already connected.
     */
    public Future<Void> connect() {
        return submit("connect", this::handleConnect);
    }

    /**
     * Detaches all links and closes the connection.
     * <p>
     * An automatic reconnect that is currently in progress is cancelled. All features
     * are disabled.
     *
     * @return A future indicating the outcome. The future succeeds immediately if the
     *         session is already disconnected.
     */
    public Future<Void> disconnect() {
        return executeOnContext(result -> {
            if (reconnecting) {
                disconnectRequested = true;
                if (reconnectOperation != null && !reconnectAttemptInFlight) {
                    reconnectOperation.cancel();
                }
            }
            dispatch("disconnect", () -> handleDisconnect(result));
        });
    }

    /**
     * Sends a message on a link.
     * <p>
     * The link is attached if necessary.
     *
     * @param linkName The name of the link to send the message on.
     * @param message The message to send.
     * @return A future indicating the outcome.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if no link with the given name has been registered.
     */
    public Future<Void> send(final String linkName, final Message message) {
        Objects.requireNonNull(message);
        checkRegistered(linkName);
        return submit("send", result -> handleSend(linkName, message, result));
    }

    /**
     * Enables a feature by attaching its link.
     * <p>
     * An enabled feature's link is re-attached automatically after a lost connection
     * has been re-established.
     *
     * @param name The name of the feature's link.
     * @return A future indicating the outcome.
     * @throws NullPointerException if name is {@code null}.
     * @throws IllegalArgumentException if no link with the given name has been registered.
     */
    public Future<Void> enableFeature(final String name) {
        checkRegistered(name);
        return submit("enable feature", result -> handleEnableFeature(name, result));
    }

    /**
     * Disables a feature by detaching its link.
     *
     * @param name The name of the feature's link.
     * @return A future indicating the outcome.
     * @throws NullPointerException if name is {@code null}.
     * @throws IllegalArgumentException if no link with the given name has been registered.
     */
    public Future<Void> disableFeature(final String name) {
        checkRegistered(name);
        return submit("disable feature", result -> handleDisableFeature(name, result));
    }

    /**
     * Checks if a feature is enabled.
     *
     * @param name The name of the feature's link.
     * @return {@code true} if the feature is enabled.
     */
    public boolean isFeatureEnabled(final String name) {
        return enabledFeatures.contains(name);
    }

    private void checkRegistered(final String linkName) {
        Objects.requireNonNull(linkName);
        if (!linkDefinitions.containsKey(linkName)) {
            throw new IllegalArgumentException("no such link: " + linkName);
        }
    }

    // ------------------------------------------------------------< request handling >---

    private <T> Future<T> submit(final String requestName, final Handler<Promise<T>> request) {
        return executeOnContext(result -> dispatch(requestName, () -> request.handle(result)));
    }

    private void dispatch(final String requestName, final Runnable request) {
        if (state.isTransitional() || replaying) {
            LOG.debug("deferring {} request [state: {}]", requestName, state);
            deferredRequests.add(request);
        } else {
            request.run();
        }
    }

    private void replayDeferredRequests() {
        if (replaying) {
            return;
        }
        replaying = true;
        try {
            while (!state.isTransitional() && !deferredRequests.isEmpty()) {
                deferredRequests.poll().run();
            }
        } finally {
            replaying = false;
        }
    }

    private void handleConnect(final Promise<Void> result) {
        if (state == SessionState.AUTHENTICATED) {
            result.complete();
        } else {
            open(result);
        }
    }

    private void handleDisconnect(final Promise<Void> result) {
        disconnectRequested = false;
        if (state == SessionState.DISCONNECTED) {
            result.complete();
        } else {
            enabledFeatures.clear();
            teardown(null).onComplete(ar -> {
                enterDisconnected();
                result.handle(ar);
                replayDeferredRequests();
            });
        }
    }

    private void handleSend(final String linkName, final Message message, final Promise<Void> result) {
        if (state == SessionState.DISCONNECTED) {
            connectAndReplay(result, () -> handleSend(linkName, message, result));
        } else {
            ensureAttached(linkName)
                .compose(v -> transport.send(linkName, message))
                .onComplete(result);
        }
    }

    private void handleEnableFeature(final String name, final Promise<Void> result) {
        if (state == SessionState.DISCONNECTED) {
            connectAndReplay(result, () -> handleEnableFeature(name, result));
        } else {
            ensureAttached(name)
                .onSuccess(v -> {
                    LOG.debug("enabled feature [{}]", name);
                    enabledFeatures.add(name);
                })
                .onComplete(result);
        }
    }

    private void handleDisableFeature(final String name, final Promise<Void> result) {
        enabledFeatures.remove(name);
        if (state == SessionState.DISCONNECTED || !attachedLinks.remove(name)) {
            result.complete();
        } else {
            LOG.debug("disabling feature [{}]", name);
            transport.detachLink(name, null).onComplete(result);
        }
    }

    private void connectAndReplay(final Promise<Void> result, final Runnable request) {
        open(connected -> {
            if (connected.succeeded()) {
                request.run();
            } else {
                result.fail(connected.cause());
            }
        });
    }

    // ------------------------------------------------------------< transitions >---

    private void open(final Handler<AsyncResult<Void>> completionHandler) {
        establish().onComplete(ar -> {
            if (ar.succeeded()) {
                setState(SessionState.AUTHENTICATED);
            } else {
                enterDisconnected();
            }
            completionHandler.handle(ar);
            replayDeferredRequests();
        });
    }

    private Future<Void> establish() {

        setState(SessionState.CONNECTING);
        return authenticationProvider.getCredential()
            .compose(credential -> transport.connect(credential).map(credential))
            .compose(credential -> {
                setState(SessionState.AUTHENTICATING);
                return authenticate(credential)
                    .recover(this::teardown);
            });
    }

    private Future<Void> authenticate(final Credential credential) {
        if (credential.getType() == AuthenticationType.X509) {
            LOG.debug("connection is authorized by client certificate");
            return Future.succeededFuture();
        }
        return transport.authenticate(credential)
            .onSuccess(ok -> authenticatedCredential = credential);
    }

    /**
     * Detaches all links and closes the transport.
     *
     * @param cause The error that led to tearing down the session or {@code null}
     *              if the session is closed gracefully.
     * @return A future failed with the given cause or, if the cause is {@code null},
     *         with the first error that occurred while detaching a link or closing the transport.
     */
    private Future<Void> teardown(final Throwable cause) {

        setState(SessionState.DISCONNECTING);
        final AtomicReference<Throwable> firstDetachError = new AtomicReference<>();
        final List<Future<Void>> detached = new ArrayList<>();
        for (final String name : attachedLinks) {
            detached.add(transport.detachLink(name, cause)
                    .recover(t -> {
                        LOG.debug("failed to detach link [{}]: {}", name, t.getMessage());
                        firstDetachError.compareAndSet(null, t);
                        return Future.succeededFuture();
                    }));
        }
        attachedLinks.clear();
        pendingAttaches.clear();
        authenticatedCredential = null;

        return Future.all(detached)
            .transform(v -> transport.disconnect())
            .transform(disconnected -> {
                if (cause != null) {
                    return Future.failedFuture(cause);
                } else if (firstDetachError.get() != null) {
                    return Future.failedFuture(firstDetachError.get());
                } else if (disconnected.failed()) {
                    return Future.failedFuture(disconnected.cause());
                } else {
                    return Future.succeededFuture();
                }
            });
    }

    private void enterDisconnected() {
        setState(SessionState.DISCONNECTED);
        connectionGeneration++;
        attachedLinks.clear();
        pendingAttaches.clear();
        enabledFeatures.clear();
        authenticatedCredential = null;
    }

    private void setState(final SessionState newState) {
        if (state != newState) {
            LOG.debug("session state change [{} -> {}]", state, newState);
            state = newState;
        }
    }

    private Future<Void> ensureAttached(final String name) {

        if (attachedLinks.contains(name)) {
            return Future.succeededFuture();
        }
        final Future<Void> pending = pendingAttaches.get(name);
        if (pending != null) {
            return pending;
        }

        final long generation = connectionGeneration;
        final Promise<Void> attached = Promise.promise();
        pendingAttaches.put(name, attached.future());
        transport.attachLink(linkDefinitions.get(name)).onComplete(ar -> {
            pendingAttaches.remove(name, attached.future());
            if (ar.succeeded() && generation == connectionGeneration) {
                attachedLinks.add(name);
            }
            attached.handle(ar);
        });
        return attached.future();
    }

    // ------------------------------------------------------------< events >---

    private void onNewCredential(final Credential credential) {
        submit("re-authenticate", (Promise<Void> result) -> {
            if (state != SessionState.AUTHENTICATED || credential.getType() != AuthenticationType.TOKEN) {
                result.complete();
                return;
            }
            if (credential.equals(authenticatedCredential)) {
                LOG.trace("token has already been put on current connection");
                result.complete();
                return;
            }
            LOG.debug("re-authenticating session using renewed token");
            final long generation = connectionGeneration;
            authenticate(credential)
                .onFailure(t -> {
                    if (generation == connectionGeneration && state == SessionState.AUTHENTICATED) {
                        LOG.info("re-authentication failed, closing connection: {}", t.getMessage());
                        notifyErrorListeners(t);
                        connectionGeneration++;
                        reconnecting = true;
                        teardown(t).onComplete(ar -> reconnectOrGiveUp(t));
                    }
                })
                .onComplete(result);
        });
    }

    private void onTransportDisconnected(final Throwable cause) {

        if (state != SessionState.AUTHENTICATED) {
            LOG.debug("ignoring loss of connection [state: {}]", state);
            return;
        }
        final Throwable error = cause != null ? cause
                : new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "connection closed by hub");
        LOG.info("lost connection to hub: {}", error.getMessage());
        connectionGeneration++;
        attachedLinks.clear();
        pendingAttaches.clear();
        reconnecting = true;
        reconnectOrGiveUp(error);
    }

    private void reconnectOrGiveUp(final Throwable cause) {

        final RetryPolicy policy = retryPolicy;
        if (disconnectRequested) {
            reconnecting = false;
            enterDisconnected();
            replayDeferredRequests();
            return;
        }
        if (!policy.shouldRetry(cause)) {
            LOG.info("not trying to reconnect: {}", cause.getMessage());
            reconnecting = false;
            enterDisconnected();
            notifyDisconnectListeners(cause);
            replayDeferredRequests();
            return;
        }

        setState(SessionState.CONNECTING);
        final Set<String> featuresToRestore = new LinkedHashSet<>(enabledFeatures);
        final RetryOperation operation = new RetryOperation(vertx, "reconnect", policy, config.getReconnectTimeout());
        reconnectOperation = operation;
        operation.retry(this::reconnectAttempt)
            .onComplete(ar -> {
                reconnectOperation = null;
                reconnecting = false;
                if (ar.succeeded()) {
                    LOG.info("re-established connection to hub after {} attempt(s)", operation.getAttemptCount());
                    setState(SessionState.AUTHENTICATED);
                    restoreFeatures(featuresToRestore);
                } else {
                    enterDisconnected();
                    if (disconnectRequested) {
                        LOG.debug("reconnect cancelled");
                    } else {
                        LOG.info("giving up on reconnecting to hub: {}", ar.cause().getMessage());
                        notifyDisconnectListeners(ar.cause());
                    }
                }
                replayDeferredRequests();
            });
    }

    private Future<Void> reconnectAttempt() {

        if (disconnectRequested) {
            return Future.failedFuture(new OperationCancelledException("reconnect cancelled"));
        }
        reconnectAttemptInFlight = true;
        return establish().transform(ar -> {
            reconnectAttemptInFlight = false;
            if (!disconnectRequested) {
                if (ar.failed()) {
                    setState(SessionState.CONNECTING);
                    return Future.failedFuture(ar.cause());
                }
                return Future.succeededFuture();
            }
            final Future<Void> cleanup = ar.succeeded() ? teardown(null) : Future.succeededFuture();
            return cleanup.transform(v -> {
                reconnectOperation.cancel();
                return Future.failedFuture(new OperationCancelledException("reconnect cancelled"));
            });
        });
    }

    private void restoreFeatures(final Set<String> features) {

        if (features.isEmpty()) {
            notifyReconnectListeners();
            return;
        }
        final Map<String, Throwable> failures = Collections.synchronizedMap(new LinkedHashMap<>());
        final List<Future<Void>> attempts = new ArrayList<>();
        for (final String feature : features) {
            attempts.add(ensureAttached(feature).recover(t -> {
                LOG.debug("failed to re-enable feature [{}]: {}", feature, t.getMessage());
                failures.put(feature, t);
                enabledFeatures.remove(feature);
                return Future.succeededFuture();
            }));
        }
        Future.all(attempts).onComplete(ar -> {
            if (failures.isEmpty()) {
                LOG.debug("re-enabled features {}", features);
                notifyReconnectListeners();
            } else {
                notifyDisconnectListeners(ReconnectFailedException.aggregate(
                        "failed to re-enable features " + failures.keySet(),
                        failures.values()));
            }
        });
    }

    private void onLinkError(final String name, final Throwable error) {

        LOG.debug("link [{}] detached by hub: {}", name, error.getMessage());
        attachedLinks.remove(name);
        notifyErrorListeners(error);

        if (state != SessionState.AUTHENTICATED || !enabledFeatures.contains(name)) {
            return;
        }
        final long generation = connectionGeneration;
        new RetryOperation(vertx, "re-attach " + name, retryPolicy, config.getReconnectTimeout())
            .retry(() -> generation == connectionGeneration
                    ? ensureAttached(name)
                    : Future.failedFuture(new OperationCancelledException("connection has been lost")))
            .onSuccess(v -> LOG.debug("re-attached link of feature [{}]", name))
            .onFailure(t -> {
                if (generation == connectionGeneration && enabledFeatures.remove(name)) {
                    LOG.info("failed to re-attach link of feature [{}]: {}", name, t.getMessage());
                    notifyErrorListeners(t);
                }
            });
    }

    // ------------------------------------------------------------< notifications >---

    private void notifyDisconnectListeners(final Throwable cause) {
        if (disconnectListeners.isEmpty()) {
            LOG.warn("session disconnected, no listener registered: {}", cause.getMessage());
        }
        for (final DisconnectListener listener : disconnectListeners) {
            try {
                listener.onDisconnect(cause);
            } catch (final RuntimeException e) {
                LOG.warn("disconnect listener threw exception", e);
            }
        }
    }

    private void notifyReconnectListeners() {
        for (final ReconnectListener listener : reconnectListeners) {
            try {
                listener.onReconnect();
            } catch (final RuntimeException e) {
                LOG.warn("reconnect listener threw exception", e);
            }
        }
    }

    private void notifyErrorListeners(final Throwable error) {
        for (final Handler<Throwable> listener : errorListeners) {
            try {
                listener.handle(error);
            } catch (final RuntimeException e) {
                LOG.warn("error listener threw exception", e);
            }
        }
    }

    // ------------------------------------------------------------< context >---

    private void runOnContext(final Handler<Void> codeToRun) {
        if (Vertx.currentContext() == context) {
            codeToRun.handle(null);
        } else {
            context.runOnContext(codeToRun);
        }
    }

    private <T> Future<T> executeOnContext(final Handler<Promise<T>> codeToRun) {
        final Promise<T> result = Promise.promise();
        runOnContext(go -> codeToRun.handle(result));
        return result.future();
    }
}
