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

import org.eclipse.hubsdk.util.Constants;
import org.eclipse.hubsdk.util.SharedAccessSignature;

/**
 * An immutable snapshot of the credentials that a device or module uses to authenticate
 * to the hub.
 * <p>
 * A snapshot contains either a shared access signature or an X.509 certificate,
 * never both. The shared access key that a signature has been created with never
 * leaves the provider.
 */
public final class Credential {

    private final String hostName;
    private final String gatewayHostName;
    private final String deviceId;
    private final String moduleId;
    private final String sharedAccessKeyName;
    private final String sharedAccessSignature;
    private final Long expiryEpochSeconds;
    private final X509Certificate certificate;

    private Credential(
            final String hostName,
            final String gatewayHostName,
            final String deviceId,
            final String moduleId,
            final String sharedAccessKeyName,
            final String sharedAccessSignature,
            final Long expiryEpochSeconds,
            final X509Certificate certificate) {
        this.hostName = Objects.requireNonNull(hostName);
        this.deviceId = Objects.requireNonNull(deviceId);
        this.gatewayHostName = gatewayHostName;
        this.moduleId = moduleId;
        this.sharedAccessKeyName = sharedAccessKeyName;
        this.sharedAccessSignature = sharedAccessSignature;
        this.expiryEpochSeconds = expiryEpochSeconds;
        this.certificate = certificate;
    }

    /**
     * Creates a snapshot for a shared access signature.
     *
     * @param hostName The host name of the hub.
     * @param gatewayHostName The host name of the gateway to connect to or {@code null}.
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null}.
     * @param signature The signature.
     * @return The snapshot.
     * @throws NullPointerException if host name, device ID or signature are {@code null}.
     */
    public static Credential forSignature(
            final String hostName,
            final String gatewayHostName,
            final String deviceId,
            final String moduleId,
            final SharedAccessSignature signature) {
        Objects.requireNonNull(signature);
        return new Credential(
                hostName,
                gatewayHostName,
                deviceId,
                moduleId,
                signature.getKeyName(),
                signature.toString(),
                signature.getExpiry(),
                null);
    }

    /**
     * Creates a snapshot for an X.509 certificate.
     *
     * @param hostName The host name of the hub.
     * @param gatewayHostName The host name of the gateway to connect to or {@code null}.
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null}.
     * @param certificate The certificate.
     * @return The snapshot.
     * @throws NullPointerException if host name, device ID or certificate are {@code null}.
     */
    public static Credential forCertificate(
            final String hostName,
            final String gatewayHostName,
            final String deviceId,
            final String moduleId,
            final X509Certificate certificate) {
        Objects.requireNonNull(certificate);
        return new Credential(hostName, gatewayHostName, deviceId, moduleId, null, null, null, certificate);
    }

    /**
     * Gets the host name of the hub.
     *
     * @return The host name.
     */
    public String getHostName() {
        return hostName;
    }

    /**
     * Gets the host to open the connection to.
     *
     * @return The gateway host name if set, otherwise the hub's host name.
     */
    public String getConnectHostName() {
        return gatewayHostName != null ? gatewayHostName : hostName;
    }

    /**
     * Gets the host name of the gateway that the device connects through.
     *
     * @return The host name or {@code null} if the device connects to the hub directly.
     */
    public String getGatewayHostName() {
        return gatewayHostName;
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
     * Gets the name of the shared access policy whose key is used.
     *
     * @return The name or {@code null} if the identity's own key is used.
     */
    public String getSharedAccessKeyName() {
        return sharedAccessKeyName;
    }

    /**
     * @return The serialized signature or {@code null} if this is a certificate credential.
     */
    public String getSharedAccessSignature() {
        return sharedAccessSignature;
    }

    /**
     * @return The point in time (seconds since the epoch) at which the signature expires
     *         or {@code null} if this is a certificate credential.
     */
    public Long getExpiryEpochSeconds() {
        return expiryEpochSeconds;
    }

    /**
     * Gets the client certificate.
     *
     * @return The certificate or {@code null} for a token credential.
     */
    public X509Certificate getCertificate() {
        return certificate;
    }

    /**
     * Gets the type of credentials contained in this snapshot.
     *
     * @return The type.
     */
    public AuthenticationType getType() {
        return certificate != null ? AuthenticationType.X509 : AuthenticationType.TOKEN;
    }

    /**
     * Gets the audience that a signature grants access to.
     *
     * @return The hub's host name followed by the identity's path.
     */
    public String getAudience() {
        return hostName + Constants.identityPath(deviceId, moduleId);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Credential)) {
            return false;
        }
        final Credential other = (Credential) obj;
        return hostName.equals(other.hostName)
                && deviceId.equals(other.deviceId)
                && Objects.equals(gatewayHostName, other.gatewayHostName)
                && Objects.equals(moduleId, other.moduleId)
                && Objects.equals(sharedAccessSignature, other.sharedAccessSignature)
                && Objects.equals(certificate, other.certificate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hostName, deviceId, gatewayHostName, moduleId, sharedAccessSignature, certificate);
    }

    @Override
    public String toString() {
        return "Credential [type: " + getType() + ", audience: " + getAudience() + ", expiry: " + expiryEpochSeconds + "]";
    }
}
