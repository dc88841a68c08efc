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

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import io.vertx.core.Future;

/**
 * A time limited token that authorizes access to a hub resource.
 * <p>
 * A signature's serialized form is
 * <pre>
 * SharedAccessSignature sr=&lt;resource URI&gt;&amp;sig=&lt;signature&gt;&amp;se=&lt;expiry&gt;[&amp;skn=&lt;key name&gt;]
 * </pre>
 * where the signature is the Base64 encoded HMAC-SHA256 digest of
 * {@code <resource URI> + "\n" + <expiry>}. All values are percent-encoded.
 * <p>
 * Instances are immutable.
 */
public final class SharedAccessSignature {

    /**
     * The name of the field containing the (encoded) resource URI.
     */
    public static final String FIELD_RESOURCE_URI = "sr";
    /**
     * The name of the field containing the (encoded) signature.
     */
    public static final String FIELD_SIGNATURE = "sig";
    /**
     * The name of the field containing the expiration time in seconds since the epoch.
     */
    public static final String FIELD_EXPIRY = "se";
    /**
     * The name of the field containing the (encoded) name of the signing key.
     */
    public static final String FIELD_KEY_NAME = "skn";

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final String resourceUri;
    private final String signature;
    private final long expiry;
    private final String keyName;

    private SharedAccessSignature(
            final String resourceUri,
            final String signature,
            final long expiry,
            final String keyName) {
        this.resourceUri = resourceUri;
        this.signature = signature;
        this.expiry = expiry;
        this.keyName = keyName;
    }

    /**
     * Creates a new signature using a (shared) symmetric key.
     *
     * @param resourceUri The (unencoded) URI of the resource to grant access to.
     * @param keyName The name of the key or {@code null} if the key is the identity's own key.
     * @param base64Key The Base64 encoded key to sign with.
     * @param expiryEpochSeconds The point in time (seconds since the epoch) at which the signature expires.
     * @return The signature.
     * @throws NullPointerException if resource URI or key are {@code null}.
     * @throws IllegalArgumentException if resource URI or key are empty, if the key is not
     *         valid Base64 or if expiry is not a positive number.
     */
    public static SharedAccessSignature create(
            final String resourceUri,
            final String keyName,
            final String base64Key,
            final long expiryEpochSeconds) {

        Objects.requireNonNull(resourceUri);
        Objects.requireNonNull(base64Key);
        if (resourceUri.isEmpty()) {
            throw new IllegalArgumentException("resource URI must not be empty");
        }
        if (base64Key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        if (expiryEpochSeconds <= 0) {
            throw new IllegalArgumentException("expiry must be > 0");
        }

        final String encodedUri = Strings.encodeUriComponentStrict(resourceUri);
        final byte[] digest = hmacSha256(Base64.getDecoder().decode(base64Key), stringToSign(encodedUri, expiryEpochSeconds));
        return new SharedAccessSignature(
                encodedUri,
                Strings.encodeUriComponentStrict(Base64.getEncoder().encodeToString(digest)),
                expiryEpochSeconds,
                keyName == null ? null : Strings.encodeUriComponentStrict(keyName));
    }

    /**
     * Creates a new signature using an external signing function.
     * <p>
     * The signing function is invoked with the UTF-8 bytes of the string to sign
     * and is expected to return the raw (not Base64 encoded) HMAC-SHA256 digest.
     *
     * @param resourceUri The (unencoded) URI of the resource to grant access to.
     * @param keyName The name of the key or {@code null} if the key is the identity's own key.
     * @param expiryEpochSeconds The point in time (seconds since the epoch) at which the signature expires.
     * @param signingFunction The function to create the digest with.
     * @return A future indicating the outcome. The future will be failed with the error
     *         reported by the signing function if signing fails.
     * @throws NullPointerException if resource URI or signing function are {@code null}.
     * @throws IllegalArgumentException if resource URI is empty or expiry is not a positive number.
     */
    public static Future<SharedAccessSignature> createWithSigningFunction(
            final String resourceUri,
            final String keyName,
            final long expiryEpochSeconds,
            final Function<byte[], Future<byte[]>> signingFunction) {

        Objects.requireNonNull(resourceUri);
        Objects.requireNonNull(signingFunction);
        if (resourceUri.isEmpty()) {
            throw new IllegalArgumentException("resource URI must not be empty");
        }
        if (expiryEpochSeconds <= 0) {
            throw new IllegalArgumentException("expiry must be > 0");
        }

        final String encodedUri = Strings.encodeUriComponentStrict(resourceUri);
        final Future<byte[]> digest;
        try {
            digest = signingFunction.apply(stringToSign(encodedUri, expiryEpochSeconds));
        } catch (final RuntimeException e) {
            return Future.failedFuture(e);
        }
        return digest.map(signed -> new SharedAccessSignature(
                encodedUri,
                Strings.encodeUriComponentStrict(Base64.getEncoder().encodeToString(signed)),
                expiryEpochSeconds,
                keyName == null ? null : Strings.encodeUriComponentStrict(keyName)));
    }

    /**
     * Parses a serialized signature.
     *
     * @param source The serialized signature.
     * @param requiredFields The names of the fields that the signature must contain.
     * @return The signature.
     * @throws NullPointerException if source is {@code null}.
     * @throws MalformedSignatureException if the source does not start with the
     *         <em>SharedAccessSignature</em> prefix, if any of the required fields is missing
     *         or if the expiry is not a number.
     */
    public static SharedAccessSignature parse(final String source, final String... requiredFields) {

        Objects.requireNonNull(source);
        final String prefix = Constants.SHARED_ACCESS_SIGNATURE_PREFIX + " ";
        if (!source.startsWith(prefix)) {
            throw new MalformedSignatureException("signature must start with " + prefix);
        }

        final Map<String, String> fields = new LinkedHashMap<>();
        for (final String pair : source.substring(prefix.length()).trim().split("&")) {
            final int idx = pair.indexOf('=');
            if (idx > 0) {
                fields.put(pair.substring(0, idx), pair.substring(idx + 1));
            } else if (!pair.isEmpty()) {
                throw new MalformedSignatureException("malformed field: " + pair);
            }
        }

        for (final String field : requiredFields) {
            if (!fields.containsKey(field)) {
                throw new MalformedSignatureException("signature is missing field: " + field);
            }
        }

        final String se = fields.get(FIELD_EXPIRY);
        long expiry = 0;
        if (se != null) {
            try {
                expiry = Long.parseLong(se);
            } catch (final NumberFormatException e) {
                throw new MalformedSignatureException("expiry is not a number: " + se);
            }
        }
        return new SharedAccessSignature(
                fields.get(FIELD_RESOURCE_URI),
                fields.get(FIELD_SIGNATURE),
                expiry,
                fields.get(FIELD_KEY_NAME));
    }

    /**
     * Parses a serialized signature that contains at least the resource URI,
     * the signature and the expiry.
     *
     * @param source The serialized signature.
     * @return The signature.
     * @throws NullPointerException if source is {@code null}.
     * @throws MalformedSignatureException if the source is not a valid signature.
     */
    public static SharedAccessSignature parse(final String source) {
        return parse(source, FIELD_RESOURCE_URI, FIELD_SIGNATURE, FIELD_EXPIRY);
    }

    private static byte[] stringToSign(final String encodedResourceUri, final long expiry) {
        return (encodedResourceUri + "\n" + expiry).getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] hmacSha256(final byte[] key, final byte[] data) {
        try {
            final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            return mac.doFinal(data);
        } catch (final GeneralSecurityException e) {
            throw new IllegalStateException("cannot compute " + HMAC_ALGORITHM + " digest", e);
        }
    }

    /**
     * Gets the percent-encoded URI of the resource that this signature grants access to.
     *
     * @return The URI or {@code null} if not set.
     */
    public String getResourceUri() {
        return resourceUri;
    }

    /**
     * Gets the decoded URI of the resource that this signature grants access to.
     *
     * @return The URI or {@code null} if not set.
     */
    public String getDecodedResourceUri() {
        return resourceUri == null ? null : Strings.decodeUriComponent(resourceUri);
    }

    /**
     * Gets the percent-encoded signature.
     *
     * @return The signature or {@code null} if not set.
     */
    public String getSignature() {
        return signature;
    }

    /**
     * Gets the point in time at which this signature expires.
     *
     * @return The number of seconds since the epoch or 0 if not set.
     */
    public long getExpiry() {
        return expiry;
    }

    /**
     * Gets the percent-encoded name of the key used for signing.
     *
     * @return The name or {@code null} if not set.
     */
    public String getKeyName() {
        return keyName;
    }

    /**
     * Serializes this signature.
     *
     * @return The serialized form.
     */
    @Override
    public String toString() {
        final StringBuilder b = new StringBuilder(Constants.SHARED_ACCESS_SIGNATURE_PREFIX).append(' ');
        appendField(b, FIELD_RESOURCE_URI, resourceUri);
        appendField(b, FIELD_SIGNATURE, signature);
        appendField(b, FIELD_EXPIRY, expiry > 0 ? String.valueOf(expiry) : null);
        appendField(b, FIELD_KEY_NAME, keyName);
        return b.toString();
    }

    private static void appendField(final StringBuilder b, final String name, final String value) {
        if (value != null) {
            if (b.charAt(b.length() - 1) != ' ') {
                b.append('&');
            }
            b.append(name).append('=').append(value);
        }
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final SharedAccessSignature other = (SharedAccessSignature) obj;
        return expiry == other.expiry
                && Objects.equals(resourceUri, other.resourceUri)
                && Objects.equals(signature, other.signature)
                && Objects.equals(keyName, other.keyName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceUri, signature, expiry, keyName);
    }
}
