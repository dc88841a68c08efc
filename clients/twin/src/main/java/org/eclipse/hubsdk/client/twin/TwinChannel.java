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

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;

/**
 * A channel for exchanging twin requests and notifications with the hub.
 *
 */
public interface TwinChannel {

    /**
     * Gets the name of the session feature that needs to be enabled for
     * using this channel.
     *
     * @return The feature name.
     */
    String getFeatureName();

    /**
     * Retrieves the full twin document.
     *
     * @return A future completed with the document containing the <em>desired</em>
     *         and <em>reported</em> property trees.
     */
    Future<JsonObject> getTwin();

    /**
     * Sends a patch for the reported properties.
     *
     * @param patch The patch to send.
     * @return A future indicating the outcome.
     * @throws NullPointerException if patch is {@code null}.
     */
    Future<Void> updateReportedProperties(JsonObject patch);

    /**
     * Subscribes to notifications about changes of the desired properties.
     *
     * @return A future indicating the outcome.
     */
    Future<Void> enableDesiredPropertyUpdates();

    /**
     * Unsubscribes from notifications about changes of the desired properties.
     *
     * @return A future indicating the outcome.
     */
    Future<Void> disableDesiredPropertyUpdates();

    /**
     * Sets the handler to invoke with patches of the desired properties pushed by the hub.
     *
     * @param handler The handler.
     */
    void desiredPropertyUpdateHandler(Handler<JsonObject> handler);
}
