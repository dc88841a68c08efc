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
import java.util.Map;
import java.util.Objects;

import org.eclipse.hubsdk.util.SharedAccessSignature;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.ext.web.client.WebClient;

/**
 * A provider that obtains shared access signatures for a module from the workload API
 * of an edge runtime.
 * <p>
 * Renewal follows the same schedule as for {@link SharedAccessKeyAuthenticationProvider},
 * but the digest is created by the workload API instead of locally.
 */
public class WorkloadApiAuthenticationProvider extends RenewingTokenAuthenticationProvider {

    private final WorkloadApiConfig config;
    private final WorkloadApiClient workloadApiClient;

    /**
     * Creates a new provider.
     *
     * @param vertx The vert.x instance to use for setting timers.
     * @param clock The clock to determine expiry with.
     * @param config The workload API configuration.
     * @param workloadApiClient The client for the workload API.
     * @param tokenValiditySeconds The number of seconds that a signature is valid for.
     * @param tokenRenewalMarginSeconds The number of seconds before expiry that a signature is renewed.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the validity is not greater than the margin.
     */
    public WorkloadApiAuthenticationProvider(
            final Vertx vertx,
            final Clock clock,
            final WorkloadApiConfig config,
            final WorkloadApiClient workloadApiClient,
            final long tokenValiditySeconds,
            final long tokenRenewalMarginSeconds) {
        super(vertx, clock,
                Objects.requireNonNull(config).getHubHostName(),
                config.getGatewayHostName(),
                config.getDeviceId(),
                config.getModuleId(),
                tokenValiditySeconds,
                tokenRenewalMarginSeconds);
        this.config = config;
        this.workloadApiClient = Objects.requireNonNull(workloadApiClient);
    }

    /**
     * Creates a provider from the environment variables set by the edge runtime.
     *
     * @param vertx The vert.x instance to use.
     * @param env The environment variables.
     * @return The provider.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the environment does not contain a valid configuration.
     */
    public static WorkloadApiAuthenticationProvider fromEnvironment(final Vertx vertx, final Map<String, String> env) {
        final WorkloadApiConfig config = WorkloadApiConfig.fromEnvironment(env);
        return new WorkloadApiAuthenticationProvider(
                vertx,
                Clock.systemUTC(),
                config,
                new WorkloadApiClient(WebClient.create(vertx), config.getWorkloadUri()),
                DEFAULT_TOKEN_VALIDITY_SECONDS,
                DEFAULT_TOKEN_RENEWAL_MARGIN_SECONDS);
    }

    /**
     * {@inheritDoc}
     *
     * @return {@code true}.
     */
    @Override
    public boolean isRemoteSigning() {
        return true;
    }

    @Override
    protected Future<SharedAccessSignature> sign(final String resourceUri, final long expiryEpochSeconds) {
        return SharedAccessSignature.createWithSigningFunction(
                resourceUri,
                null,
                expiryEpochSeconds,
                data -> workloadApiClient.sign(config.getModuleId(), config.getGenerationId(), data));
    }
}
