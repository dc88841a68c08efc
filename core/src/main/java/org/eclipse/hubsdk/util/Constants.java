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

package org.eclipse.hubsdk.util;

/**
 * Constants used throughout the SDK.
 *
 */
public final class Constants {

    /**
     * The default separator character for target addresses.
     */
    public static final String DEFAULT_PATH_SEPARATOR = "/";

    /**
     * The default port for AMQPS connections to the hub.
     */
    public static final int PORT_AMQPS = 5671;
    /**
     * The port for AMQP over secure web sockets.
     */
    public static final int PORT_AMQPS_WS = 443;

    /**
     * The API version that is indicated to the hub in link properties and requests.
     */
    public static final String API_VERSION = "2020-09-30";

    /**
     * The prefix of a serialized shared access signature.
     */
    public static final String SHARED_ACCESS_SIGNATURE_PREFIX = "SharedAccessSignature";

    /**
     * The name of the feature for receiving cloud-to-device messages.
     */
    public static final String FEATURE_C2D = "c2d";
    /**
     * The name of the feature for receiving direct method invocations.
     */
    public static final String FEATURE_METHODS = "methods";
    /**
     * The name of the feature for synchronizing the device twin.
     */
    public static final String FEATURE_TWIN = "twin";

    /**
     * The name of the AMQP message annotation carrying a twin request's operation.
     */
    public static final String ANNOTATION_OPERATION = "operation";
    /**
     * The name of the AMQP message annotation carrying a twin request's resource.
     */
    public static final String ANNOTATION_RESOURCE = "resource";
    /**
     * The name of the AMQP message annotation carrying a response's status code.
     */
    public static final String ANNOTATION_STATUS = "status";
    /**
     * The name of the AMQP message annotation carrying the twin's version.
     */
    public static final String ANNOTATION_VERSION = "version";

    /**
     * The name of the AMQP link property carrying the correlation identifier of a request/response channel.
     */
    public static final String LINK_PROPERTY_CHANNEL_CORRELATION_ID = "com.microsoft:channel-correlation-id";
    /**
     * The name of the AMQP link property carrying the API version.
     */
    public static final String LINK_PROPERTY_API_VERSION = "com.microsoft:api-version";

    private Constants() {
        // prevent instantiation
    }

    /**
     * Gets the resource path of a device or module identity.
     *
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null} if the identity is a device.
     * @return The path.
     */
    public static String identityPath(final String deviceId, final String moduleId) {
        final StringBuilder path = new StringBuilder("/devices/").append(deviceId);
        if (moduleId != null) {
            path.append("/modules/").append(moduleId);
        }
        return path.toString();
    }

    /**
     * Gets the address that telemetry messages are sent to.
     *
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null}.
     * @return The address.
     */
    public static String eventAddress(final String deviceId, final String moduleId) {
        return identityPath(deviceId, moduleId) + "/messages/events";
    }

    /**
     * Gets the address that cloud-to-device messages are received from.
     *
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null}.
     * @return The address.
     */
    public static String cloudToDeviceAddress(final String deviceId, final String moduleId) {
        return identityPath(deviceId, moduleId) + "/messages/devicebound";
    }

    /**
     * Gets the address that direct method requests are received from.
     *
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null}.
     * @return The address.
     */
    public static String methodsAddress(final String deviceId, final String moduleId) {
        return identityPath(deviceId, moduleId) + "/methods/devicebound";
    }

    /**
     * Gets the address of the twin request/response channel.
     *
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null}.
     * @return The address.
     */
    public static String twinAddress(final String deviceId, final String moduleId) {
        return identityPath(deviceId, moduleId) + "/twin";
    }
}
