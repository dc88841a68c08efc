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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The parameters a device or module needs for connecting to a hub.
 * <p>
 * A connection string consists of {@code name=value} pairs separated by {@code ;}, e.g.
 * {@code HostName=hub.example.com;DeviceId=sensor-1;SharedAccessKey=c2VjcmV0}.
 */
public final class ConnectionString {

    /**
     * The name of the hub's host name property.
     */
    public static final String HOST_NAME = "HostName";
    /**
     * The name of the device identifier property.
     */
    public static final String DEVICE_ID = "DeviceId";
    /**
     * The name of the module identifier property.
     */
    public static final String MODULE_ID = "ModuleId";
    /**
     * The name of the symmetric key property.
     */
    public static final String SHARED_ACCESS_KEY = "SharedAccessKey";
    /**
     * The name of the key name property.
     */
    public static final String SHARED_ACCESS_KEY_NAME = "SharedAccessKeyName";
    /**
     * The name of the pre-signed token property.
     */
    public static final String SHARED_ACCESS_SIGNATURE = "SharedAccessSignature";
    /**
     * The name of the gateway host name property.
     */
    public static final String GATEWAY_HOST_NAME = "GatewayHostName";
    /**
     * The name of the property indicating X.509 client certificate authentication.
     */
    public static final String X509 = "x509";

    private final Map<String, String> properties;

    private ConnectionString(final Map<String, String> properties) {
        this.properties = Collections.unmodifiableMap(properties);
    }

    /**
     * Parses a connection string.
     *
     * @param source The connection string.
     * @param requiredProperties The names of the properties that must be present.
     * @return The parsed connection string.
     * @throws NullPointerException if source is {@code null}.
     * @throws IllegalArgumentException if a pair is malformed or a required property is missing.
     */
    public static ConnectionString parse(final String source, final String... requiredProperties) {
        Objects.requireNonNull(source);

        final Map<String, String> props = new LinkedHashMap<>();
        for (final String pair : source.split(";")) {
            if (pair.isBlank()) {
                continue;
            }
            // values (e.g. Base64 keys or signatures) may contain '='
            final int idx = pair.indexOf('=');
            if (idx <= 0) {
                throw new IllegalArgumentException("malformed connection string property: " + pair);
            }
            props.put(pair.substring(0, idx).trim(), pair.substring(idx + 1));
        }
        for (final String required : requiredProperties) {
            if (Strings.isNullOrEmpty(props.get(required))) {
                throw new IllegalArgumentException("connection string is missing property: " + required);
            }
        }
        return new ConnectionString(props);
    }

    /**
     * Parses a device (or module) connection string.
     * <p>
     * The connection string must contain the host name and device identifier and
     * exactly one of a shared access key, a shared access signature or {@code x509=true}.
     *
     * @param source The connection string.
     * @return The parsed connection string.
     * @throws NullPointerException if source is {@code null}.
     * @throws IllegalArgumentException if the connection string is not a valid device connection string.
     */
    public static ConnectionString parseDeviceConnectionString(final String source) {
        final ConnectionString cs = parse(source, HOST_NAME, DEVICE_ID);
        int credentialTypes = 0;
        if (cs.getSharedAccessKey() != null) {
            credentialTypes++;
        }
        if (cs.getSharedAccessSignature() != null) {
            credentialTypes++;
        }
        if (cs.isX509()) {
            credentialTypes++;
        }
        if (credentialTypes != 1) {
            throw new IllegalArgumentException(
                    "connection string must contain exactly one of SharedAccessKey, SharedAccessSignature or x509=true");
        }
        return cs;
    }

    /**
     * Creates a connection string for a device using a symmetric key.
     *
     * @param hostName The hub's host name.
     * @param deviceId The device identifier.
     * @param sharedAccessKey The Base64 encoded key.
     * @return The connection string.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static String createWithSharedAccessKey(final String hostName, final String deviceId, final String sharedAccessKey) {
        Objects.requireNonNull(hostName);
        Objects.requireNonNull(deviceId);
        Objects.requireNonNull(sharedAccessKey);
        return HOST_NAME + "=" + hostName + ";" + DEVICE_ID + "=" + deviceId + ";" + SHARED_ACCESS_KEY + "=" + sharedAccessKey;
    }

    /**
     * Gets a property value.
     *
     * @param name The property name.
     * @return The value or {@code null} if not set.
     */
    public String get(final String name) {
        return properties.get(name);
    }

    /**
     * Gets the host name of the hub.
     *
     * @return The host name.
     */
    public String getHostName() {
        return properties.get(HOST_NAME);
    }

    /**
     * Gets the device identifier.
     *
     * @return The identifier.
     */
    public String getDeviceId() {
        return properties.get(DEVICE_ID);
    }

    /**
     * Gets the module identifier.
     *
     * @return The identifier or {@code null} for a device identity.
     */
    public String getModuleId() {
        return properties.get(MODULE_ID);
    }

    /**
     * Gets the Base64 encoded shared access key.
     *
     * @return The key or {@code null} if not present.
     */
    public String getSharedAccessKey() {
        return properties.get(SHARED_ACCESS_KEY);
    }

    /**
     * Gets the name of the shared access policy whose key is used.
     *
     * @return The name or {@code null} if the identity's own key is used.
     */
    public String getSharedAccessKeyName() {
        return properties.get(SHARED_ACCESS_KEY_NAME);
    }

    /**
     * Gets the pre-created shared access signature.
     *
     * @return The signature or {@code null} if not present.
     */
    public String getSharedAccessSignature() {
        return properties.get(SHARED_ACCESS_SIGNATURE);
    }

    /**
     * Gets the host name of the gateway that the device connects through.
     *
     * @return The host name or {@code null} if the device connects to the hub directly.
     */
    public String getGatewayHostName() {
        return properties.get(GATEWAY_HOST_NAME);
    }

    /**
     * Checks if the connection string indicates X.509 client certificate authentication.
     *
     * @return {@code true} if the <em>x509</em> property is set to {@code true} (ignoring case).
     */
    public boolean isX509() {
        return Boolean.parseBoolean(properties.get(X509));
    }

    @Override
    public String toString() {
        // never include secrets
        return String.format("ConnectionString [host: %s, device: %s, module: %s]",
                getHostName(), getDeviceId(), getModuleId());
    }
}
