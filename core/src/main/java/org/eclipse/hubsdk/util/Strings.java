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

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * String checks and the URI component encoding used in connection strings and signatures.
 */
public final class Strings {

    private Strings() {
    }

    /**
     * Checks if a value has no textual content.
     *
     * @param value The value or {@code null}.
     * @return {@code true} if the value is {@code null} or its string form is empty.
     */
    public static boolean isNullOrEmpty(final Object value) {
        return value == null || String.valueOf(value).isEmpty();
    }

    /**
     * Percent-encodes a string so that it can be used as a URI component.
     * <p>
     * All characters except the RFC 3986 <em>unreserved</em> characters
     * ({@code A-Z a-z 0-9 - _ . ~}) are encoded using their UTF-8 representation.
     * In particular, the characters {@code ! ' ( ) *} are encoded as well.
     *
     * @param value The string to encode.
     * @return The encoded string.
     * @throws NullPointerException if value is {@code null}.
     */
    public static String encodeUriComponentStrict(final String value) {
        Objects.requireNonNull(value);

        final String formEncoded = URLEncoder.encode(value, StandardCharsets.UTF_8);
        final StringBuilder result = new StringBuilder(formEncoded.length());
        for (int i = 0; i < formEncoded.length(); i++) {
            final char c = formEncoded.charAt(i);
            switch (c) {
            case '+':
                result.append("%20");
                break;
            case '*':
                result.append("%2A");
                break;
            case '%':
                // keep already encoded octets, except for the encoded tilde
                if (formEncoded.startsWith("%7E", i)) {
                    result.append('~');
                    i += 2;
                } else {
                    result.append(c);
                }
                break;
            default:
                result.append(c);
            }
        }
        return result.toString();
    }

    /**
     * Decodes a percent-encoded URI component.
     *
     * @param value The string to decode.
     * @return The decoded string.
     * @throws NullPointerException if value is {@code null}.
     * @throws IllegalArgumentException if the value contains illegal escape sequences.
     */
    public static String decodeUriComponent(final String value) {
        Objects.requireNonNull(value);
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }
}
