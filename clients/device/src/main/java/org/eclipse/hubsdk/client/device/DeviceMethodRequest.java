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

import java.util.Objects;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;

/**
 * A direct method invocation received from the hub.
 *
 */
public final class DeviceMethodRequest {

    private final String methodName;
    private final Object requestId;
    private final Buffer payload;

    /**
     * Creates a new request.
     *
     * @param methodName The name of the invoked method.
     * @param requestId The identifier that the response needs to be correlated with.
     * @param payload The request payload or {@code null} if the request has no payload.
     * @throws NullPointerException if method name or request ID are {@code null}.
     */
    public DeviceMethodRequest(final String methodName, final Object requestId, final Buffer payload) {
        this.methodName = Objects.requireNonNull(methodName);
        this.requestId = Objects.requireNonNull(requestId);
        this.payload = payload;
    }

    /**
     * Gets the name of the invoked method.
     *
     * @return The name.
     */
    public String getMethodName() {
        return methodName;
    }

    /**
     * Gets the identifier that correlates the response with this request.
     *
     * @return The identifier.
     */
    public Object getRequestId() {
        return requestId;
    }

    /**
     * @return The payload or {@code null} if the request has no payload.
     */
    public Buffer getPayload() {
        return payload;
    }

    /**
     * Gets the payload as a JSON object.
     *
     * @return The object or {@code null} if the request has no payload.
     * @throws io.vertx.core.json.DecodeException if the payload is not a JSON object.
     */
    public JsonObject getPayloadAsJson() {
        if (payload == null || payload.length() == 0) {
            return null;
        }
        return payload.toJsonObject();
    }

    @Override
    public String toString() {
        return "DeviceMethodRequest [method: " + methodName + ", request ID: " + requestId + "]";
    }
}
