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

import java.time.Clock;
import java.util.Objects;

import org.eclipse.hubsdk.util.ConnectionString;
import org.eclipse.hubsdk.util.SharedAccessSignature;

import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * A provider that creates shared access signatures from a shared access key.
 *
 */
public class SharedAccessKeyAuthenticationProvider extends RenewingTokenAuthenticationProvider {

    private final String sharedAccessKeyName;
    private final String sharedAccessKey;

    /**
     * Creates a new provider using default validity and renewal margin.
     *
     * @param vertx The vert.x instance to use for setting timers.
     * @param hostName The host name of the hub.
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null}.
     * @param sharedAccessKeyName The name of the key or {@code null} if the key is the identity's own key.
     * @param sharedAccessKey The Base64 encoded key.
     * @throws NullPointerException if any of the non-optional parameters is {@code null}.
     */
    public SharedAccessKeyAuthenticationProvider(
            final Vertx vertx,
            final String hostName,
            final String deviceId,
            final String moduleId,
            final String sharedAccessKeyName,
            final String sharedAccessKey) {
        this(vertx, Clock.systemUTC(), hostName, null, deviceId, moduleId, sharedAccessKeyName, sharedAccessKey,
                DEFAULT_TOKEN_VALIDITY_SECONDS, DEFAULT_TOKEN_RENEWAL_MARGIN_SECONDS);
    }

    /**
     * Creates a new provider.
     *
     * @param vertx The vert.x instance to use for setting timers.
     * @param clock The clock to determine expiry with.
     * @param hostName The host name of the hub.
     * @param gatewayHostName The host name of the gateway or {@code null}.
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null}.
     * @param sharedAccessKeyName The name of the key or {@code null} if the key is the identity's own key.
     * @param sharedAccessKey The Base64 encoded key.
     * @param tokenValiditySeconds The number of seconds that a signature is valid for.
     * @param tokenRenewalMarginSeconds The number of seconds before expiry that a signature is renewed.
     * @throws NullPointerException if any of the non-optional parameters is {@code null}.
     * @throws IllegalArgumentException if the validity is not greater than the margin.
     */
    public SharedAccessKeyAuthenticationProvider(
            final Vertx vertx,
            final Clock clock,
            final String hostName,
            final String gatewayHostName,
            final String deviceId,
            final String moduleId,
            final String sharedAccessKeyName,
            final String sharedAccessKey,
            final long tokenValiditySeconds,
            final long tokenRenewalMarginSeconds) {
        super(vertx, clock, hostName, gatewayHostName, deviceId, moduleId, tokenValiditySeconds, tokenRenewalMarginSeconds);
        this.sharedAccessKeyName = sharedAccessKeyName;
        this.sharedAccessKey = Objects.requireNonNull(sharedAccessKey);
    }

    /**
     * Creates a provider for a device connection string.
     *
     * @param vertx The vert.x instance to use for setting timers.
     * @param connectionString The connection string.
     * @return The provider.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the connection string does not contain a shared access key.
     */
    public static SharedAccessKeyAuthenticationProvider fromConnectionString(
            final Vertx vertx,
            final String connectionString) {
        return fromConnectionString(vertx, connectionString, DEFAULT_TOKEN_VALIDITY_SECONDS, DEFAULT_TOKEN_RENEWAL_MARGIN_SECONDS);
    }

    /**
     * Creates a provider for a device connection string.
     *
     * @param vertx The vert.x instance to use for setting timers.
     * @param connectionString The connection string.
     * @param tokenValiditySeconds The number of seconds that a signature is valid for.
     * @param tokenRenewalMarginSeconds The number of seconds before expiry that a signature is renewed.
     * @return The provider.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the connection string does not contain a shared access key
     *                                  or if the validity is not greater than the margin.
     */
    public static SharedAccessKeyAuthenticationProvider fromConnectionString(
            final Vertx vertx,
            final String connectionString,
            final long tokenValiditySeconds,
            final long tokenRenewalMarginSeconds) {

        Objects.requireNonNull(vertx);
        Objects.requireNonNull(connectionString);
        final ConnectionString cs = ConnectionString.parseDeviceConnectionString(connectionString);
        if (cs.getSharedAccessKey() == null) {
            throw new IllegalArgumentException("connection string is missing a shared access key");
        }
        return new SharedAccessKeyAuthenticationProvider(
                vertx,
                Clock.systemUTC(),
                cs.getHostName(),
                cs.getGatewayHostName(),
                cs.getDeviceId(),
                cs.getModuleId(),
                cs.getSharedAccessKeyName(),
                cs.getSharedAccessKey(),
                tokenValiditySeconds,
                tokenRenewalMarginSeconds);
    }

    @Override
    protected Future<SharedAccessSignature> sign(final String resourceUri, final long expiryEpochSeconds) {
        return Future.succeededFuture(SharedAccessSignature.create(
                resourceUri,
                sharedAccessKeyName,
                sharedAccessKey,
                expiryEpochSeconds));
    }
}
