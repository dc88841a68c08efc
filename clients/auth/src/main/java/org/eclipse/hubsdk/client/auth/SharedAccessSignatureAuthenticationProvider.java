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

import org.eclipse.hubsdk.util.SharedAccessSignature;

import io.vertx.core.Future;

/**
 * A provider for shared access signatures that have been created by the application.
 * <p>
 * Signatures are never renewed automatically. The application is responsible for supplying a
 * new signature by means of {@link #updateSharedAccessSignature(String)} before the current one expires.
 */
public class SharedAccessSignatureAuthenticationProvider extends AbstractAuthenticationProvider {

    private final String hostName;
    private final String deviceId;
    private final String moduleId;
    private final String gatewayHostName;
    private SharedAccessSignature currentSignature;

    /**
     * Creates a new provider.
     *
     * @param hostName The host name of the hub.
     * @param gatewayHostName The host name of the gateway or {@code null}.
     * @param deviceId The device identifier.
     * @param moduleId The module identifier or {@code null}.
     * @param sharedAccessSignature The serialized signature.
     * @throws NullPointerException if any of the non-optional parameters is {@code null}.
     * @throws org.eclipse.hubsdk.util.MalformedSignatureException if the signature cannot be parsed.
     */
    public SharedAccessSignatureAuthenticationProvider(
            final String hostName,
            final String gatewayHostName,
            final String deviceId,
            final String moduleId,
            final String sharedAccessSignature) {
        this.hostName = Objects.requireNonNull(hostName);
        this.deviceId = Objects.requireNonNull(deviceId);
        this.gatewayHostName = gatewayHostName;
        this.moduleId = moduleId;
        this.currentSignature = SharedAccessSignature.parse(Objects.requireNonNull(sharedAccessSignature));
    }

    /**
     * Creates a provider for a signature.
     * <p>
     * The host name and the device and module identifiers are taken from the
     * signature's resource URI.
     *
     * @param sharedAccessSignature The serialized signature.
     * @return The provider.
     * @throws NullPointerException if signature is {@code null}.
     * @throws IllegalArgumentException if the signature cannot be parsed or if its resource URI
     *                                  does not identify a device or module.
     */
    public static SharedAccessSignatureAuthenticationProvider fromSharedAccessSignature(final String sharedAccessSignature) {
        Objects.requireNonNull(sharedAccessSignature);
        final SharedAccessSignature sas = SharedAccessSignature.parse(sharedAccessSignature);
        // <host>/devices/<deviceId>[/modules/<moduleId>]
        final String[] segments = sas.getDecodedResourceUri().split("/");
        if (segments.length < 3 || !"devices".equals(segments[1])) {
            throw new IllegalArgumentException("signature's resource URI does not identify a device");
        }
        final String moduleId = segments.length >= 5 && "modules".equals(segments[3]) ? segments[4] : null;
        return new SharedAccessSignatureAuthenticationProvider(segments[0], null, segments[2], moduleId, sharedAccessSignature);
    }

    @Override
    public AuthenticationType getType() {
        return AuthenticationType.TOKEN;
    }

    @Override
    public Future<Credential> getCredential() {
        return Future.succeededFuture(Credential.forSignature(hostName, gatewayHostName, deviceId, moduleId, currentSignature));
    }

    /**
     * Replaces the current signature and notifies listeners.
     *
     * @param sharedAccessSignature The serialized signature.
     * @throws NullPointerException if signature is {@code null}.
     * @throws org.eclipse.hubsdk.util.MalformedSignatureException if the signature cannot be parsed.
     */
    public void updateSharedAccessSignature(final String sharedAccessSignature) {
        currentSignature = SharedAccessSignature.parse(Objects.requireNonNull(sharedAccessSignature));
        log.debug("signature for {} has been updated [expiry: {}]", deviceId, currentSignature.getExpiry());
        notifyNewCredential(Credential.forSignature(hostName, gatewayHostName, deviceId, moduleId, currentSignature));
    }

    /**
     * {@inheritDoc}
     * <p>
     * This provider never renews signatures, so there is nothing to stop.
     */
    @Override
    public Future<Void> stop() {
        return Future.succeededFuture();
    }
}
