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

/**
 * An X.509 client certificate along with its private key.
 *
 */
public final class X509Certificate {

    private final String certificate;
    private final String key;
    private final String passphrase;

    /**
     * Creates a new certificate.
     *
     * @param certificate The PEM encoded certificate (chain).
     * @param key The PEM encoded private key.
     * @param passphrase The passphrase protecting the key or {@code null} if not protected.
     * @throws NullPointerException if certificate or key are {@code null}.
     */
    public X509Certificate(final String certificate, final String key, final String passphrase) {
        this.certificate = Objects.requireNonNull(certificate);
        this.key = Objects.requireNonNull(key);
        this.passphrase = passphrase;
    }

    /**
     * @return The PEM encoded certificate (chain).
     */
    public String getCertificate() {
        return certificate;
    }

    /**
     * @return The PEM encoded private key.
     */
    public String getKey() {
        return key;
    }

    /**
     * @return The passphrase or {@code null}.
     */
    public String getPassphrase() {
        return passphrase;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof X509Certificate)) {
            return false;
        }
        final X509Certificate other = (X509Certificate) obj;
        return certificate.equals(other.certificate)
                && key.equals(other.key)
                && Objects.equals(passphrase, other.passphrase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(certificate, key, passphrase);
    }

    @Override
    public String toString() {
        // never expose the key material
        return "X509Certificate [certificate length: " + certificate.length() + "]";
    }
}
