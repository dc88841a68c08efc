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

package org.eclipse.hubsdk.client.amqp;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.apache.qpid.proton.amqp.Binary;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.messaging.AmqpValue;
import org.apache.qpid.proton.amqp.messaging.ApplicationProperties;
import org.apache.qpid.proton.amqp.messaging.Data;
import org.apache.qpid.proton.amqp.messaging.MessageAnnotations;
import org.apache.qpid.proton.amqp.messaging.Section;
import org.apache.qpid.proton.message.Message;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * Utility methods for working with AMQP 1.0 messages exchanged with the hub.
 *
 */
public final class AmqpUtils {

    /**
     * The content type indicating a JSON payload.
     */
    public static final String CONTENT_TYPE_APPLICATION_JSON = "application/json";

    private AmqpUtils() {
        // prevent instantiation
    }

    /**
     * Gets a message's body as a buffer.
     * <p>
     * Supported are <em>Data</em> sections and <em>AmqpValue</em> sections containing
     * a string, a byte array or binary data.
     *
     * @param msg The message.
     * @return The payload or {@code null} if the message has no body of a supported type.
     * @throws NullPointerException if msg is {@code null}.
     */
    public static Buffer getPayload(final Message msg) {

        Objects.requireNonNull(msg);
        final Section body = msg.getBody();
        if (body instanceof Data) {
            return toBuffer(((Data) body).getValue());
        } else if (body instanceof AmqpValue) {
            final Object value = ((AmqpValue) body).getValue();
            if (value instanceof String) {
                return Buffer.buffer((String) value);
            } else if (value instanceof byte[]) {
                return Buffer.buffer((byte[]) value);
            } else if (value instanceof Binary) {
                return toBuffer((Binary) value);
            }
        }
        return null;
    }

    private static Buffer toBuffer(final Binary binary) {
        if (binary == null) {
            return null;
        }
        final byte[] bytes = new byte[binary.getLength()];
        System.arraycopy(binary.getArray(), binary.getArrayOffset(), bytes, 0, binary.getLength());
        return Buffer.buffer(bytes);
    }

    /**
     * Gets a message's body as a UTF-8 string.
     *
     * @param msg The message.
     * @return The payload or {@code null} if the message has no body of a supported type.
     * @throws NullPointerException if msg is {@code null}.
     */
    public static String getPayloadAsString(final Message msg) {
        return Optional.ofNullable(getPayload(msg))
                .map(buffer -> buffer.toString(StandardCharsets.UTF_8))
                .orElse(null);
    }

    /**
     * Gets a message's body as a JSON object.
     *
     * @param msg The message.
     * @return The JSON object or {@code null} if the message has no body or a blank body.
     * @throws NullPointerException if msg is {@code null}.
     * @throws DecodeException if the payload is not a JSON object.
     */
    public static JsonObject getJsonPayload(final Message msg) {
        final String payload = getPayloadAsString(msg);
        if (payload == null || payload.isBlank()) {
            return null;
        }
        return new JsonObject(payload);
    }

    /**
     * Sets a message's body to a <em>Data</em> section containing a JSON object.
     *
     * @param msg The message.
     * @param payload The payload.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static void setJsonPayload(final Message msg, final JsonObject payload) {
        Objects.requireNonNull(msg);
        Objects.requireNonNull(payload);
        msg.setContentType(CONTENT_TYPE_APPLICATION_JSON);
        msg.setBody(new Data(new Binary(payload.toBuffer().getBytes())));
    }

    /**
     * Adds a message annotation.
     *
     * @param msg The message.
     * @param key The annotation's key.
     * @param value The annotation's value.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static void addAnnotation(final Message msg, final String key, final Object value) {
        Objects.requireNonNull(msg);
        Objects.requireNonNull(key);
        Objects.requireNonNull(value);
        MessageAnnotations annotations = msg.getMessageAnnotations();
        if (annotations == null) {
            annotations = new MessageAnnotations(new HashMap<>());
            msg.setMessageAnnotations(annotations);
        }
        annotations.getValue().put(Symbol.valueOf(key), value);
    }

    /**
     * Gets the value of a message annotation.
     *
     * @param <T> The expected type of the value.
     * @param msg The message.
     * @param key The annotation's key.
     * @param type The expected type of the value.
     * @return The value or {@code null} if the message has no such annotation or
     *         if the value is not of the expected type.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static <T> T getAnnotation(final Message msg, final String key, final Class<T> type) {
        Objects.requireNonNull(msg);
        Objects.requireNonNull(key);
        Objects.requireNonNull(type);
        return Optional.ofNullable(msg.getMessageAnnotations())
                .map(MessageAnnotations::getValue)
                .map(annotations -> annotations.get(Symbol.valueOf(key)))
                .filter(type::isInstance)
                .map(type::cast)
                .orElse(null);
    }

    /**
     * Adds an application property.
     *
     * @param msg The message.
     * @param key The property's key.
     * @param value The property's value.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static void addProperty(final Message msg, final String key, final Object value) {
        Objects.requireNonNull(msg);
        Objects.requireNonNull(key);
        Objects.requireNonNull(value);
        final ApplicationProperties props = msg.getApplicationProperties();
        if (props == null) {
            final Map<String, Object> values = new HashMap<>();
            values.put(key, value);
            msg.setApplicationProperties(new ApplicationProperties(values));
        } else {
            props.getValue().put(key, value);
        }
    }

    /**
     * Gets the value of an application property.
     *
     * @param <T> The expected type of the value.
     * @param msg The message.
     * @param key The property's key.
     * @param type The expected type of the value.
     * @return The value or {@code null} if the message has no such property or
     *         if the value is not of the expected type.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static <T> T getProperty(final Message msg, final String key, final Class<T> type) {
        Objects.requireNonNull(msg);
        Objects.requireNonNull(key);
        Objects.requireNonNull(type);
        return Optional.ofNullable(msg.getApplicationProperties())
                .map(ApplicationProperties::getValue)
                .map(props -> props.get(key))
                .filter(type::isInstance)
                .map(type::cast)
                .orElse(null);
    }
}
