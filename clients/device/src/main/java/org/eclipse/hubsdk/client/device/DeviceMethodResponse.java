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

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.Json;

/**
 * The outcome of a direct method invocation.
 *
 */
public final class DeviceMethodResponse {

    private final int status;
    private final Object payload;

    private DeviceMethodResponse(final int status, final Object payload) {
        this.status = status;
        this.payload = payload;
    }

    /**
     * Creates a response.
     *
     * @param status The status code to report to the invoker.
     * @param payload The value to return to the invoker (may be {@code null}).
     *                The value is encoded as JSON.
     * @return The response.
     */
    public static DeviceMethodResponse of(final int status, final Object payload) {
        return new DeviceMethodResponse(status, payload);
    }

    /**
     * Gets the status code to report to the invoker.
     *
     * @return The status code.
     */
    public int getStatus() {
        return status;
    }

    /**
     * Gets the value sent back to the invoker.
     *
     * @return The payload or {@code null}.
     */
    public Object getPayload() {
        return payload;
    }

    /**
     * Gets the JSON encoding of the payload.
     *
     * @return The encoded payload. A {@code null} payload is encoded as JSON {@code null}.
     * @throws io.vertx.core.json.EncodeException if the payload cannot be encoded.
     */
    Buffer encodePayload() {
        return Json.encodeToBuffer(payload);
    }
}
