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


package org.eclipse.hubsdk.client.auth;

import java.util.Map;
import java.util.Objects;

/**
 * Configuration for obtaining signatures from the workload API of an edge runtime.
 *
 */
public final class WorkloadApiConfig {

    /**
     * The environment variable containing the URI of the workload API.
     */
    public static final String ENV_WORKLOAD_URI = "IOTEDGE_WORKLOADURI";
    /**
     * The environment variable containing the device identifier.
     */
    public static final String ENV_DEVICE_ID = "IOTEDGE_DEVICEID";
    /**
     * The environment variable containing the module identifier.
     */
    public static final String ENV_MODULE_ID = "IOTEDGE_MODULEID";
    /**
     * The environment variable containing the host name of the hub.
     */
    public static final String ENV_HUB_HOST_NAME = "IOTEDGE_IOTHUBHOSTNAME";
    /**
     * The environment variable containing the authentication scheme.
     */
    public static final String ENV_AUTH_SCHEME = "IOTEDGE_AUTHSCHEME";
    /**
     * The environment variable containing the module's generation identifier.
     */
    public static final String ENV_GENERATION_ID = "IOTEDGE_MODULEGENERATIONID";
    /**
     * The environment variable containing the host name of the edge gateway.
     */
    public static final String ENV_GATEWAY_HOST_NAME = "IOTEDGE_GATEWAYHOSTNAME";
    /**
     * The only supported authentication scheme.
     */
    public static final String AUTH_SCHEME_SAS_TOKEN = "sasToken";

    private final String workloadUri;
    private final String deviceId;
    private final String moduleId;
    private final String hubHostName;
    private final String generationId;
    private final String gatewayHostName;

    /**
     * Creates a new configuration.
     *
     * @param workloadUri The URI of the workload API, either {@code unix://<socket path>}
     *                    or {@code http://<host>:<port>}.
     * @param deviceId The identifier of the edge device.
     * @param moduleId The module identifier.
     * @param hubHostName The host name of the hub.
     * @param generationId The module's generation identifier.
     * @param gatewayHostName The host name of the edge gateway or {@code null}.
     * @throws NullPointerException if any of the parameters except the gateway host name is {@code null}.
     */
    public WorkloadApiConfig(
            final String workloadUri,
            final String deviceId,
            final String moduleId,
            final String hubHostName,
            final String generationId,
            final String gatewayHostName) {
        this.workloadUri = Objects.requireNonNull(workloadUri, "workload URI must not be null");
        this.deviceId = Objects.requireNonNull(deviceId, "device ID must not be null");
        this.moduleId = Objects.requireNonNull(moduleId, "module ID must not be null");
        this.hubHostName = Objects.requireNonNull(hubHostName, "hub host name must not be null");
        this.generationId = Objects.requireNonNull(generationId, "generation ID must not be null");
        this.gatewayHostName = gatewayHostName;
    }

    /**
     * Creates a configuration from the environment variables set by the edge runtime.
     *
     * @param env The environment variables.
     * @return The configuration.
     * @throws NullPointerException if env is {@code null}.
     * @throws IllegalArgumentException if any of the required variables is missing or if the
     *                                  authentication scheme is not supported.
     */
    public static WorkloadApiConfig fromEnvironment(final Map<String, String> env) {
        Objects.requireNonNull(env);
        final String authScheme = env.get(ENV_AUTH_SCHEME);
        if (!AUTH_SCHEME_SAS_TOKEN.equals(authScheme)) {
            throw new IllegalArgumentException(String.format("authentication scheme [%s] is not supported", authScheme));
        }
        return new WorkloadApiConfig(
                required(env, ENV_WORKLOAD_URI),
                required(env, ENV_DEVICE_ID),
                required(env, ENV_MODULE_ID),
                required(env, ENV_HUB_HOST_NAME),
                required(env, ENV_GENERATION_ID),
                env.get(ENV_GATEWAY_HOST_NAME));
    }

    private static String required(final Map<String, String> env, final String name) {
        final String value = env.get(name);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(String.format("environment variable %s is not set", name));
        }
        return value;
    }

    /**
     * Gets the URI of the workload API.
     *
     * @return The URI.
     */
    public String getWorkloadUri() {
        return workloadUri;
    }

    /**
     * Gets the device identifier.
     *
     * @return The identifier.
     */
    public String getDeviceId() {
        return deviceId;
    }

    /**
     * Gets the module identifier.
     *
     * @return The identifier or {@code null} for a device identity.
     */
    public String getModuleId() {
        return moduleId;
    }

    /**
     * Gets the host name of the hub that the module belongs to.
     *
     * @return The host name.
     */
    public String getHubHostName() {
        return hubHostName;
    }

    /**
     * Gets the generation of the module identity.
     *
     * @return The generation ID.
     */
    public String getGenerationId() {
        return generationId;
    }

    /**
     * Gets the host name of the gateway that the device connects through.
     *
     * @return The host name or {@code null} if the device connects to the hub directly.
     */
    public String getGatewayHostName() {
        return gatewayHostName;
    }
}
