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

import io.vertx.core.Future;

/**
 * Handles invocations of a direct method.
 *
 */
@FunctionalInterface
public interface DeviceMethodHandler {

    /**
     * Processes a method invocation.
     *
     * @param request The invocation.
     * @return A future completed with the response to send back to the invoker.
     *         A failed future results in a response with status 500.
     */
    Future<DeviceMethodResponse> handle(DeviceMethodRequest request);
}
