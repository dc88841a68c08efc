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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.apache.qpid.proton.message.Message;
import org.eclipse.hubsdk.util.Constants;

import io.vertx.core.Handler;

/**
 * Describes a named link that can be attached to a session.
 * <p>
 * A link either sends messages to the hub, receives messages from the hub
 * or does both by means of a pair of links sharing the same address.
 *
 */
public final class LinkOptions {

    /**
     * The direction(s) in which messages flow on a link.
     */
    public enum Direction {
        /**
         * Messages are sent to the hub only.
         */
        SENDER,
        /**
         * Messages are received from the hub only.
         */
        RECEIVER,
        /**
         * A sender and a receiver link sharing the same address.
         */
        DUPLEX;

        /**
         * Checks if this direction includes sending messages.
         *
         * @return {@code true} for sender and duplex links.
         */
        public boolean canSend() {
            return this != RECEIVER;
        }

        /**
         * Checks if this direction includes receiving messages.
         *
         * @return {@code true} for receiver and duplex links.
         */
        public boolean canReceive() {
            return this != SENDER;
        }
    }

    private final String name;
    private final String address;
    private final Direction direction;
    private final Handler<Message> messageHandler;
    private final Map<String, Object> properties;

    private LinkOptions(
            final String name,
            final String address,
            final Direction direction,
            final Handler<Message> messageHandler,
            final Map<String, Object> properties) {
        this.name = Objects.requireNonNull(name);
        this.address = Objects.requireNonNull(address);
        this.direction = Objects.requireNonNull(direction);
        if (direction.canReceive()) {
            Objects.requireNonNull(messageHandler, "receiving links require a message handler");
        }
        this.messageHandler = messageHandler;
        this.properties = Collections.unmodifiableMap(new HashMap<>(properties));
    }

    /**
     * Creates options for a link that sends messages only.
     *
     * @param name The name that the link is referred to by.
     * @param address The target address.
     * @return The options.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static LinkOptions sender(final String name, final String address) {
        return new LinkOptions(name, address, Direction.SENDER, null, Map.of());
    }

    /**
     * Creates options for a link that receives messages only.
     *
     * @param name The name that the link is referred to by.
     * @param address The source address.
     * @param messageHandler The handler to invoke for received messages.
     * @return The options.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static LinkOptions receiver(final String name, final String address, final Handler<Message> messageHandler) {
        return new LinkOptions(name, address, Direction.RECEIVER, messageHandler, Map.of());
    }

    /**
     * Creates options for a request/response channel consisting of a sender and a receiver link.
     * <p>
     * Both links carry the same channel correlation identifier and API version in their
     * attach properties.
     *
     * @param name The name that the link is referred to by.
     * @param address The address of both links.
     * @param messageHandler The handler to invoke for received messages.
     * @return The options.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static LinkOptions duplex(final String name, final String address, final Handler<Message> messageHandler) {
        final Map<String, Object> props = new HashMap<>();
        props.put(Constants.LINK_PROPERTY_CHANNEL_CORRELATION_ID, name + ":" + UUID.randomUUID());
        props.put(Constants.LINK_PROPERTY_API_VERSION, Constants.API_VERSION);
        return new LinkOptions(name, address, Direction.DUPLEX, messageHandler, props);
    }

    /**
     * Gets the name that the link is registered under.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets the target or source address of the link.
     *
     * @return The address.
     */
    public String getAddress() {
        return address;
    }

    /**
     * Gets the direction of the link.
     *
     * @return The direction.
     */
    public Direction getDirection() {
        return direction;
    }

    /**
     * Gets the handler for messages received on this link.
     *
     * @return The handler or {@code null} for sender links.
     */
    public Handler<Message> getMessageHandler() {
        return messageHandler;
    }

    /**
     * Gets the properties to include in the link's attach frame.
     *
     * @return The (unmodifiable) properties.
     */
    public Map<String, Object> getProperties() {
        return properties;
    }

    @Override
    public String toString() {
        return "LinkOptions [name=" + name + ", address=" + address + ", direction=" + direction + "]";
    }
}
