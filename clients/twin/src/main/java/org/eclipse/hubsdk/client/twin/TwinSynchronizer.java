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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.eclipse.hubsdk.client.amqp.connection.ConnectionSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

/**
 * Keeps a local copy of a device's twin in sync with the hub.
 * <p>
 * Patches of the desired properties pushed by the hub are merged into the local
 * copy and reported to the handlers registered for the paths contained in the patch.
 * The twin is fetched again after the session has re-established a lost connection.
 *
 */
public class TwinSynchronizer {

    /**
     * The path denoting the whole tree of desired properties.
     */
    public static final String ROOT_PATH = "";

    private static final Logger LOG = LoggerFactory.getLogger(TwinSynchronizer.class);

    private final Map<String, List<Handler<Object>>> changeHandlers = new ConcurrentHashMap<>();
    private final Context context;
    private final ConnectionSession session;
    private final TwinChannel channel;

    private TwinDocument document;
    private boolean subscribed;

    /**
     * Creates a new synchronizer.
     *
     * @param vertx The vert.x instance to use.
     * @param session The session that the channel uses.
     * @param channel The channel to exchange twin messages with.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public TwinSynchronizer(final Vertx vertx, final ConnectionSession session, final TwinChannel channel) {
        this.context = Objects.requireNonNull(vertx).getOrCreateContext();
        this.session = Objects.requireNonNull(session);
        this.channel = Objects.requireNonNull(channel);
        channel.desiredPropertyUpdateHandler(patch -> runOnContext(v -> onDesiredPropertyUpdate(patch)));
        session.addReconnectListener(() -> runOnContext(v -> onReconnect()));
    }

    /**
     * Fetches the twin from the hub.
     * <p>
     * Subscribes to desired property updates first, if not done already. The fetched
     * document replaces the local copy and all registered change handlers are notified
     * about the values of the desired properties.
     *
     * @return A future completed with a copy of the fetched twin.
     */
    public Future<TwinDocument> getTwin() {
        return session.enableFeature(channel.getFeatureName())
            .compose(v -> subscribe())
            .compose(v -> channel.getTwin())
            .map(json -> {
                final TwinDocument fetched = TwinDocument.fromJson(json == null ? new JsonObject() : json);
                document = fetched;
                LOG.debug("fetched twin [desired version: {}]", fetched.getVersion());
                fireChangeEvents(fetched.getDesiredProperties());
                return fetched.copy();
            });
    }

    private Future<Void> subscribe() {
        if (subscribed) {
            return Future.succeededFuture();
        }
        return channel.enableDesiredPropertyUpdates()
            .onSuccess(v -> subscribed = true);
    }

    /**
     * Sends a patch of the reported properties to the hub.
     * <p>
     * The patch is merged into the local copy once the hub has accepted it.
     *
     * @param patch The patch.
     * @return A future indicating the outcome.
     * @throws NullPointerException if patch is {@code null}.
     */
    public Future<Void> updateReportedProperties(final JsonObject patch) {
        Objects.requireNonNull(patch);
        final JsonObject copy = patch.copy();
        return session.enableFeature(channel.getFeatureName())
            .compose(v -> channel.updateReportedProperties(copy))
            .onSuccess(v -> {
                if (document != null) {
                    document.mergeReportedProperties(copy);
                }
            });
    }

    /**
     * Registers a handler to be notified about changes of a desired property.
     * <p>
     * If the property already has a value, the handler is invoked with the current value
     * right away.
     *
     * @param path The dot separated path of the property or {@link #ROOT_PATH} for the
     *             whole tree of desired properties.
     * @param handler The handler to invoke with the property's new value. The value is
     *                {@code null} if the property has been removed.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public void onDesiredPropertyChange(final String path, final Handler<Object> handler) {
        Objects.requireNonNull(path);
        Objects.requireNonNull(handler);
        changeHandlers.computeIfAbsent(path, k -> new CopyOnWriteArrayList<>()).add(handler);
        runOnContext(v -> {
            if (document != null) {
                final Object current = document.getDesiredProperty(path);
                if (current != null) {
                    notifyHandler(path, handler, current);
                }
            }
        });
    }

    /**
     * Unsubscribes from desired property updates and disables the twin feature.
     *
     * @return A future indicating the outcome.
     */
    public Future<Void> stop() {
        if (!subscribed) {
            return session.disableFeature(channel.getFeatureName());
        }
        return channel.disableDesiredPropertyUpdates()
            .onComplete(ar -> subscribed = false)
            .transform(ar -> session.disableFeature(channel.getFeatureName()));
    }

    /**
     * Gets the local copy of the twin.
     *
     * @return The copy or {@code null} if the twin has not been fetched yet.
     */
    TwinDocument getDocument() {
        return document;
    }

    private void onDesiredPropertyUpdate(final JsonObject patch) {
        if (document == null) {
            LOG.debug("ignoring desired properties patch received before twin has been fetched");
            return;
        }
        document.mergeDesiredProperties(patch);
        LOG.debug("merged desired properties patch [desired version: {}]", document.getVersion());
        fireChangeEvents(patch);
    }

    private void onReconnect() {
        subscribed = false;
        if (document == null) {
            return;
        }
        LOG.debug("re-fetching twin after reconnect");
        getTwin().onFailure(t -> LOG.info("failed to re-fetch twin after reconnect: {}", t.getMessage()));
    }

    /**
     * Notifies the handlers registered for the root path and for all the paths
     * contained in a patch.
     * <p>
     * Properties that have been removed by the patch are reported with a {@code null} value.
     */
    private void fireChangeEvents(final JsonObject patch) {

        final List<String> paths = new ArrayList<>();
        paths.add(ROOT_PATH);
        paths.addAll(TwinDocument.paths(patch));
        for (final String path : paths) {
            final List<Handler<Object>> handlers = changeHandlers.get(path);
            if (handlers == null || handlers.isEmpty()) {
                continue;
            }
            final Object value = !ROOT_PATH.equals(path) && TwinDocument.valueAt(patch, path) == null
                    ? null
                    : document.getDesiredProperty(path);
            handlers.forEach(handler -> notifyHandler(path, handler, value));
        }
    }

    private static void notifyHandler(final String path, final Handler<Object> handler, final Object value) {
        try {
            handler.handle(value);
        } catch (final RuntimeException e) {
            LOG.warn("desired property change handler for path [{}] threw exception", path, e);
        }
    }

    private void runOnContext(final Handler<Void> codeToRun) {
        if (Vertx.currentContext() == context) {
            codeToRun.handle(null);
        } else {
            context.runOnContext(codeToRun);
        }
    }
}
