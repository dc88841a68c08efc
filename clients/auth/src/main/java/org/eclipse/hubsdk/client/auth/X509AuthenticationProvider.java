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

import java.util.Objects;

import org.eclipse.hubsdk.util.ConnectionString;

import io.vertx.core.Future;

/**
 * A provider for an X.509 client certificate.
 *
 */
public class X509AuthenticationProvider extends AbstractAuthenticationProvider {

    private final String hostName;
    private final String gatewayHostName;
    private final String deviceId;
    private final String moduleId;
    private X509Certificate certificate;

    /**
     * Creates a new provider.
     *
     * @param hostName The host name of the hub.
     * @param gatewayHostName The host name of the gateway or {@code null}.
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null}.
     * @param certificate The certificate.
     * @throws NullPointerException if any of the non-optional parameters is {@code null}.
     */
    public X509AuthenticationProvider(
            final String hostName,
            final String gatewayHostName,
            final String deviceId,
            final String moduleId,
            final X509Certificate certificate) {
        this.hostName = Objects.requireNonNull(hostName);
        this.deviceId = Objects.requireNonNull(deviceId);
        this.gatewayHostName = gatewayHostName;
        this.moduleId = moduleId;
        this.certificate = Objects.requireNonNull(certificate);
    }

    /**
     * Creates a provider for a connection string with the {@code x509=true} flag.
     *
     * @param connectionString The connection string.
     * @param certificate The certificate.
     * @return The provider.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the connection string is not an X.509 connection string.
     */
    public static X509AuthenticationProvider fromConnectionString(final String connectionString, final X509Certificate certificate) {
        final ConnectionString cs = ConnectionString.parseDeviceConnectionString(Objects.requireNonNull(connectionString));
        if (!cs.isX509()) {
            throw new IllegalArgumentException("connection string does not enable X.509 authentication");
        }
        return new X509AuthenticationProvider(cs.getHostName(), cs.getGatewayHostName(), cs.getDeviceId(), cs.getModuleId(), certificate);
    }

    @Override
    public AuthenticationType getType() {
        return AuthenticationType.X509;
    }

    @Override
    public Future<Credential> getCredential() {
        return Future.succeededFuture(Credential.forCertificate(hostName, gatewayHostName, deviceId, moduleId, certificate));
    }

    /**
     * Replaces the certificate.
     * <p>
     * The new certificate is used when the next connection is established.
     *
     * @param certificate The new certificate.
     * @throws NullPointerException if certificate is {@code null}.
     */
    public void setX509Certificate(final X509Certificate certificate) {
        this.certificate = Objects.requireNonNull(certificate);
    }

    @Override
    public Future<Void> stop() {
        return Future.succeededFuture();
    }
}
