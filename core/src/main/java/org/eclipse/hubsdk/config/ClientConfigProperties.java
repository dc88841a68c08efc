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

package org.eclipse.hubsdk.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

import org.eclipse.hubsdk.util.Constants;
import org.eclipse.hubsdk.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.net.JksOptions;
import io.vertx.core.net.PemTrustOptions;
import io.vertx.core.net.PfxOptions;
import io.vertx.core.net.TrustOptions;

/**
 * Settings for the AMQP connection between a device client and a hub.
 * <p>
 * All durations are given in milliseconds. The defaults fit a hub reachable via
 * the public internet on the standard AMQPS port.
 */
public class ClientConfigProperties {

    /**
     * Time to wait for the hub's <em>open</em> frame.
     */
    public static final int DEFAULT_CONNECT_TIMEOUT = 5000;
    /**
     * Time without any frame from the hub after which the connection is considered dead.
     */
    public static final int DEFAULT_IDLE_TIMEOUT = 16000;
    /**
     * Credits granted on receiver links.
     */
    public static final int DEFAULT_INITIAL_CREDITS = 200;
    /**
     * Time to wait for the hub's <em>attach</em> frame when opening a link.
     */
    public static final long DEFAULT_LINK_ESTABLISHMENT_TIMEOUT = 1000L;
    /**
     * Time to wait for the outcome of a CBS <em>put-token</em> request.
     */
    public static final long DEFAULT_PUT_TOKEN_TIMEOUT = 120_000L;
    /**
     * Upper bound for the time spent on re-establishing a lost connection.
     */
    public static final long DEFAULT_RECONNECT_TIMEOUT = 240_000L;
    /**
     * Time to wait for the response to a twin request.
     */
    public static final long DEFAULT_REQUEST_TIMEOUT = 10_000L;
    /**
     * Upper bound for the time an operation may take including all of its retries.
     */
    public static final long DEFAULT_OPERATION_TIMEOUT = 240_000L;
    /**
     * Time to wait for the hub to settle a sent message.
     */
    public static final long DEFAULT_SEND_MESSAGE_TIMEOUT = 10_000L;

    private static final Logger LOG = LoggerFactory.getLogger(ClientConfigProperties.class);

    private String name;
    private String host;
    private int port = Constants.PORT_AMQPS;
    private String amqpHostname;
    private boolean tlsEnabled = true;
    private boolean hostnameVerificationRequired = true;
    private String trustStorePath;
    private String trustStorePassword;
    private int connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT;
    private int idleTimeoutMillis = DEFAULT_IDLE_TIMEOUT;
    private int initialCredits = DEFAULT_INITIAL_CREDITS;
    private long linkEstablishmentTimeoutMillis = DEFAULT_LINK_ESTABLISHMENT_TIMEOUT;
    private long putTokenTimeoutMillis = DEFAULT_PUT_TOKEN_TIMEOUT;
    private long reconnectTimeoutMillis = DEFAULT_RECONNECT_TIMEOUT;
    private long requestTimeoutMillis = DEFAULT_REQUEST_TIMEOUT;
    private long operationTimeoutMillis = DEFAULT_OPERATION_TIMEOUT;
    private long sendMessageTimeoutMillis = DEFAULT_SEND_MESSAGE_TIMEOUT;

    /**
     * Creates settings with default values.
     */
    public ClientConfigProperties() {
        super();
    }

    /**
     * Creates a copy of other settings.
     *
     * @param other The settings to copy.
     * @throws NullPointerException if other is {@code null}.
     */
    public ClientConfigProperties(final ClientConfigProperties other) {
        Objects.requireNonNull(other);
        this.name = other.name;
        this.host = other.host;
        this.port = other.port;
        this.amqpHostname = other.amqpHostname;
        this.tlsEnabled = other.tlsEnabled;
        this.hostnameVerificationRequired = other.hostnameVerificationRequired;
        this.trustStorePath = other.trustStorePath;
        this.trustStorePassword = other.trustStorePassword;
        this.connectTimeoutMillis = other.connectTimeoutMillis;
        this.idleTimeoutMillis = other.idleTimeoutMillis;
        this.initialCredits = other.initialCredits;
        this.linkEstablishmentTimeoutMillis = other.linkEstablishmentTimeoutMillis;
        this.putTokenTimeoutMillis = other.putTokenTimeoutMillis;
        this.reconnectTimeoutMillis = other.reconnectTimeoutMillis;
        this.requestTimeoutMillis = other.requestTimeoutMillis;
        this.operationTimeoutMillis = other.operationTimeoutMillis;
        this.sendMessageTimeoutMillis = other.sendMessageTimeoutMillis;
    }

    private static long nonNegative(final long value, final String property) {
        if (value < 0) {
            throw new IllegalArgumentException(property + " must not be negative");
        }
        return value;
    }

    /**
     * Gets the container ID that the client announces to the hub.
     *
     * @return The ID or {@code null} to let the AMQP library generate one.
     */
    public final String getName() {
        return name;
    }

    /**
     * Sets the container ID that the client announces to the hub.
     *
     * @param name The ID or {@code null} to let the AMQP library generate one.
     */
    public final void setName(final String name) {
        this.name = name;
    }

    /**
     * Gets the host name or address of the hub or of the gateway in front of it.
     *
     * @return The host or {@code null} if not set.
     */
    public final String getHost() {
        return host;
    }

    /**
     * Sets the host name or address of the hub or of the gateway in front of it.
     *
     * @param host The host.
     * @throws NullPointerException if host is {@code null}.
     */
    public final void setHost(final String host) {
        this.host = Objects.requireNonNull(host);
    }

    /**
     * Gets the port to connect to.
     *
     * @return The port, 5671 unless set otherwise.
     */
    public final int getPort() {
        return port;
    }

    /**
     * Sets the port to connect to.
     *
     * @param port The port.
     * @throws IllegalArgumentException if the port is not in the range 1 to 65535.
     */
    public final void setPort(final int port) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be in range [1, 65535]");
        }
        this.port = port;
    }

    /**
     * Gets the virtual host name put into the <em>open</em> frame.
     * <p>
     * A gateway uses this name to route the connection to the hub.
     *
     * @return The name or {@code null} to use the host.
     */
    public final String getAmqpHostname() {
        return amqpHostname;
    }

    /**
     * Sets the virtual host name put into the <em>open</em> frame.
     *
     * @param amqpHostname The name or {@code null} to use the host.
     */
    public final void setAmqpHostname(final String amqpHostname) {
        this.amqpHostname = amqpHostname;
    }

    /**
     * Checks if the connection is secured with TLS.
     *
     * @return {@code true} unless disabled explicitly.
     */
    public final boolean isTlsEnabled() {
        return tlsEnabled;
    }

    /**
     * Sets whether the connection is secured with TLS.
     *
     * @param enabled {@code false} to connect in plain text, e.g. to a local test broker.
     */
    public final void setTlsEnabled(final boolean enabled) {
        this.tlsEnabled = enabled;
    }

    /**
     * Checks if the hub's certificate must match the host name.
     *
     * @return {@code true} unless disabled explicitly.
     */
    public final boolean isHostnameVerificationRequired() {
        return hostnameVerificationRequired;
    }

    /**
     * Sets whether the hub's certificate must match the host name.
     *
     * @param hostnameVerificationRequired {@code false} to accept any certificate signed by a trusted CA.
     */
    public final void setHostnameVerificationRequired(final boolean hostnameVerificationRequired) {
        this.hostnameVerificationRequired = hostnameVerificationRequired;
    }

    /**
     * Gets the file containing the certificates to trust.
     *
     * @return The path or {@code null} to trust the JVM's default CAs.
     */
    public final String getTrustStorePath() {
        return trustStorePath;
    }

    /**
     * Sets the file containing the certificates to trust.
     * <p>
     * Files ending in <em>.jks</em> are read as Java key stores, files ending in
     * <em>.p12</em> or <em>.pfx</em> as PKCS#12 stores and any other file as PEM.
     *
     * @param trustStorePath The path or {@code null} to trust the JVM's default CAs.
     */
    public final void setTrustStorePath(final String trustStorePath) {
        this.trustStorePath = trustStorePath;
    }

    /**
     * Gets the password protecting the trust store.
     *
     * @return The password or {@code null}.
     */
    public final String getTrustStorePassword() {
        return trustStorePassword;
    }

    /**
     * Sets the password protecting the trust store.
     *
     * @param trustStorePassword The password or {@code null} for PEM files.
     */
    public final void setTrustStorePassword(final String trustStorePassword) {
        this.trustStorePassword = trustStorePassword;
    }

    /**
     * Gets the trust anchors to validate the hub's certificate with.
     *
     * @return The options or {@code null} if no trust store is configured.
     * @throws IllegalArgumentException if the configured trust store does not exist.
     */
    public final TrustOptions getTrustOptions() {

        if (Strings.isNullOrEmpty(trustStorePath)) {
            return null;
        }
        if (!Files.exists(Path.of(trustStorePath))) {
            throw new IllegalArgumentException("trust store not found: " + trustStorePath);
        }

        final String path = trustStorePath.toLowerCase(Locale.ROOT);
        final TrustOptions options;
        if (path.endsWith(".jks")) {
            options = new JksOptions().setPath(trustStorePath).setPassword(trustStorePassword);
        } else if (path.endsWith(".p12") || path.endsWith(".pfx")) {
            options = new PfxOptions().setPath(trustStorePath).setPassword(trustStorePassword);
        } else {
            options = new PemTrustOptions().addCertPath(trustStorePath);
        }
        LOG.debug("trusting certificates from {} [type: {}]", trustStorePath, options.getClass().getSimpleName());
        return options;
    }

    /**
     * Gets the time to wait for the hub's <em>open</em> frame.
     *
     * @return The milliseconds.
     */
    public final int getConnectTimeout() {
        return connectTimeoutMillis;
    }

    /**
     * Sets the time to wait for the hub's <em>open</em> frame.
     *
     * @param connectTimeoutMillis The milliseconds.
     * @throws IllegalArgumentException if the value is negative.
     */
    public final void setConnectTimeout(final int connectTimeoutMillis) {
        this.connectTimeoutMillis = (int) nonNegative(connectTimeoutMillis, "connect timeout");
    }

    /**
     * Gets the time without any frame from the hub after which the connection is dropped.
     *
     * @return The milliseconds, 0 meaning no idle timeout.
     */
    public final int getIdleTimeout() {
        return idleTimeoutMillis;
    }

    /**
     * Sets the time without any frame from the hub after which the connection is dropped.
     *
     * @param idleTimeoutMillis The milliseconds, 0 meaning no idle timeout.
     * @throws IllegalArgumentException if the value is negative.
     */
    public final void setIdleTimeout(final int idleTimeoutMillis) {
        this.idleTimeoutMillis = (int) nonNegative(idleTimeoutMillis, "idle timeout");
    }

    /**
     * Gets the credits granted on receiver links.
     *
     * @return The credits.
     */
    public final int getInitialCredits() {
        return initialCredits;
    }

    /**
     * Sets the credits granted on receiver links.
     *
     * @param initialCredits The credits.
     * @throws IllegalArgumentException if the value is negative.
     */
    public final void setInitialCredits(final int initialCredits) {
        this.initialCredits = (int) nonNegative(initialCredits, "initial credits");
    }

    /**
     * Gets the time to wait for the hub's <em>attach</em> frame.
     *
     * @return The milliseconds.
     */
    public final long getLinkEstablishmentTimeout() {
        return linkEstablishmentTimeoutMillis;
    }

    /**
     * Sets the time to wait for the hub's <em>attach</em> frame.
     *
     * @param linkEstablishmentTimeoutMillis The milliseconds.
     * @throws IllegalArgumentException if the value is negative.
     */
    public final void setLinkEstablishmentTimeout(final long linkEstablishmentTimeoutMillis) {
        this.linkEstablishmentTimeoutMillis = nonNegative(linkEstablishmentTimeoutMillis, "link establishment timeout");
    }

    /**
     * Gets the time to wait for the outcome of a <em>put-token</em> request.
     *
     * @return The milliseconds.
     */
    public final long getPutTokenTimeout() {
        return putTokenTimeoutMillis;
    }

    /**
     * Sets the time to wait for the outcome of a <em>put-token</em> request.
     *
     * @param putTokenTimeoutMillis The milliseconds.
     * @throws IllegalArgumentException if the value is not positive.
     */
    public final void setPutTokenTimeout(final long putTokenTimeoutMillis) {
        if (putTokenTimeoutMillis <= 0) {
            throw new IllegalArgumentException("put-token timeout must be positive");
        }
        this.putTokenTimeoutMillis = putTokenTimeoutMillis;
    }

    /**
     * Gets the upper bound for re-establishing a lost connection.
     * <p>
     * The session gives up and disconnects once the bound is exceeded.
     *
     * @return The milliseconds.
     */
    public final long getReconnectTimeout() {
        return reconnectTimeoutMillis;
    }

    /**
     * Sets the upper bound for re-establishing a lost connection.
     *
     * @param reconnectTimeoutMillis The milliseconds.
     * @throws IllegalArgumentException if the value is negative.
     */
    public final void setReconnectTimeout(final long reconnectTimeoutMillis) {
        this.reconnectTimeoutMillis = nonNegative(reconnectTimeoutMillis, "reconnect timeout");
    }

    /**
     * Gets the time to wait for the response to a twin request.
     *
     * @return The milliseconds.
     */
    public final long getRequestTimeout() {
        return requestTimeoutMillis;
    }

    /**
     * Sets the time to wait for the response to a twin request.
     *
     * @param requestTimeoutMillis The milliseconds.
     * @throws IllegalArgumentException if the value is negative.
     */
    public final void setRequestTimeout(final long requestTimeoutMillis) {
        this.requestTimeoutMillis = nonNegative(requestTimeoutMillis, "request timeout");
    }

    /**
     * Gets the upper bound for an operation including its retries.
     *
     * @return The milliseconds.
     */
    public final long getOperationTimeout() {
        return operationTimeoutMillis;
    }

    /**
     * Sets the upper bound for an operation including its retries.
     *
     * @param operationTimeoutMillis The milliseconds.
     * @throws IllegalArgumentException if the value is negative.
     */
    public final void setOperationTimeout(final long operationTimeoutMillis) {
        this.operationTimeoutMillis = nonNegative(operationTimeoutMillis, "operation timeout");
    }

    /**
     * Gets the time to wait for the hub to settle a sent message.
     *
     * @return The milliseconds.
     */
    public final long getSendMessageTimeout() {
        return sendMessageTimeoutMillis;
    }

    /**
     * Sets the time to wait for the hub to settle a sent message.
     *
     * @param sendMessageTimeoutMillis The milliseconds.
     * @throws IllegalArgumentException if the value is negative.
     */
    public final void setSendMessageTimeout(final long sendMessageTimeoutMillis) {
        this.sendMessageTimeoutMillis = nonNegative(sendMessageTimeoutMillis, "send message timeout");
    }
}
