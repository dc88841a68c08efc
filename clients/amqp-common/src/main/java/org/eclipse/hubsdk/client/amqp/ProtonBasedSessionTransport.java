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

import java.net.HttpURLConnection;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;
import org.apache.qpid.proton.message.Message;
import org.eclipse.hubsdk.client.ClientErrorException;
import org.eclipse.hubsdk.client.ServerErrorException;
import org.eclipse.hubsdk.client.ServiceInvocationException;
import org.eclipse.hubsdk.client.auth.AuthenticationType;
import org.eclipse.hubsdk.client.auth.Credential;
import org.eclipse.hubsdk.client.auth.X509Certificate;
import org.eclipse.hubsdk.config.ClientConfigProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ConnectTimeoutException;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.net.PemKeyCertOptions;
import io.vertx.core.net.TrustOptions;
import io.vertx.proton.ProtonClient;
import io.vertx.proton.ProtonClientOptions;
import io.vertx.proton.ProtonConnection;
import io.vertx.proton.ProtonLink;
import io.vertx.proton.ProtonQoS;
import io.vertx.proton.ProtonReceiver;
import io.vertx.proton.ProtonSender;
import io.vertx.proton.ProtonSession;
import io.vertx.proton.sasl.impl.ProtonSaslExternalImpl;

/**
 * A session transport based on a vertx-proton AMQP 1.0 connection.
 * <p>
 * All methods are expected to be invoked on the vert.x context that the
 * transport's connection has been established on.
 *
 */
public class ProtonBasedSessionTransport implements SessionTransport {

    private static final Logger LOG = LoggerFactory.getLogger(ProtonBasedSessionTransport.class);

    private final Vertx vertx;
    private final ClientConfigProperties config;
    private final Map<String, AttachedLink> links = new HashMap<>();

    private ProtonClient protonClient;
    private ProtonConnection connection;
    private ProtonSession session;
    private ClaimsBasedSecurityChannel cbs;
    private String connectedHost;
    private Handler<Throwable> disconnectHandler = cause -> { };
    private BiConsumer<String, Throwable> linkErrorHandler = (name, cause) -> { };

    /**
     * Creates a new transport.
     *
     * @param vertx The vert.x instance to use.
     * @param config The configuration properties.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public ProtonBasedSessionTransport(final Vertx vertx, final ClientConfigProperties config) {
        this.vertx = Objects.requireNonNull(vertx);
        this.config = Objects.requireNonNull(config);
    }

    /**
     * Sets the client object to use for creating the AMQP 1.0 connection.
     * <p>
     * If not set, a client instance will be created when {@link #connect(Credential)}
     * is invoked.
     *
     * @param protonClient The client.
     * @throws NullPointerException if the client is {@code null}.
     */
    public void setProtonClient(final ProtonClient protonClient) {
        this.protonClient = Objects.requireNonNull(protonClient);
    }

    @Override
    public void disconnectHandler(final Handler<Throwable> handler) {
        this.disconnectHandler = Objects.requireNonNull(handler);
    }

    @Override
    public void linkErrorHandler(final BiConsumer<String, Throwable> handler) {
        this.linkErrorHandler = Objects.requireNonNull(handler);
    }

    /**
     * Checks if the AMQP connection is open.
     *
     * @return {@code true} if the connection is established.
     */
    public boolean isConnected() {
        return connection != null && !connection.isDisconnected();
    }

    @Override
    public Future<Void> connect(final Credential credential) {

        Objects.requireNonNull(credential);

        if (isConnected()) {
            LOG.debug("already connected to hub [{}:{}]", connectedHost, config.getPort());
            return Future.succeededFuture();
        }

        final ProtonClientOptions clientOptions;
        try {
            clientOptions = createClientOptions(credential);
        } catch (final IllegalArgumentException e) {
            return Future.failedFuture(e);
        }

        final String host = credential.getConnectHostName();
        final Promise<Void> result = Promise.promise();
        final ProtonClient client = protonClient != null ? protonClient : ProtonClient.create(vertx);
        LOG.debug("connecting to hub [{}://{}:{}, credential type: {}]",
                clientOptions.isSsl() ? "amqps" : "amqp", host, config.getPort(), credential.getType());

        final AtomicBoolean connectionTimeoutReached = new AtomicBoolean(false);
        final Long connectionTimeoutTimerId = config.getConnectTimeout() > 0
                ? vertx.setTimer(config.getConnectTimeout(), id -> {
                    if (connectionTimeoutReached.compareAndSet(false, true)) {
                        failConnectionAttempt(host, result, new ConnectTimeoutException(
                                "connection attempt timed out after " + config.getConnectTimeout() + "ms"));
                    }
                })
                : null;

        client.connect(
                clientOptions,
                host,
                config.getPort(),
                conAttempt -> handleConnectionAttemptResult(
                        conAttempt,
                        host,
                        connectionTimeoutTimerId,
                        connectionTimeoutReached,
                        result));
        return result.future();
    }

    private void failConnectionAttempt(final String host, final Promise<Void> result, final Throwable cause) {
        LOG.debug("can't connect to hub [{}:{}]: {}", host, config.getPort(), cause.getMessage());
        result.tryFail(cause);
    }

    private void handleConnectionAttemptResult(
            final AsyncResult<ProtonConnection> conAttempt,
            final String host,
            final Long connectionTimeoutTimerId,
            final AtomicBoolean connectionTimeoutReached,
            final Promise<Void> result) {

        if (connectionTimeoutReached.get()) {
            LOG.debug("ignoring outcome of connection attempt to hub [{}:{}]: attempt already timed out",
                    host, config.getPort());
            if (conAttempt.succeeded()) {
                closeAndDisconnect(conAttempt.result());
            }
            return;
        }

        if (conAttempt.failed()) {
            cancelTimer(connectionTimeoutTimerId);
            failConnectionAttempt(host, result, conAttempt.cause());
            return;
        }

        final ProtonConnection newConnection = conAttempt.result();
        newConnection
            .setContainer(getContainerId())
            .setHostname(config.getAmqpHostname() == null ? host : config.getAmqpHostname())
            .openHandler(openCon -> {
                cancelTimer(connectionTimeoutTimerId);
                newConnection.disconnectHandler(null);

                if (connectionTimeoutReached.get()) {
                    LOG.debug("ignoring open frame from hub [{}:{}]: connection attempt already timed out",
                            host, config.getPort());
                    closeAndDisconnect(newConnection);
                } else if (openCon.succeeded()) {
                    LOG.info("connected to hub [{}:{}, container: {}]",
                            host, config.getPort(), newConnection.getRemoteContainer());
                    newConnection.disconnectHandler(this::onRemoteDisconnect);
                    newConnection.closeHandler(remoteClose -> onRemoteClose(newConnection));
                    setConnection(newConnection, host);
                    result.tryComplete();
                } else {
                    final ErrorCondition error = newConnection.getRemoteCondition();
                    closeAndDisconnect(newConnection);
                    if (error == null) {
                        LOG.warn("can't open connection to hub [{}:{}]", host, config.getPort(), openCon.cause());
                        result.tryFail(new ServerErrorException(
                                HttpURLConnection.HTTP_UNAVAILABLE, "cannot open connection", openCon.cause()));
                    } else {
                        LOG.warn("can't open connection to hub [{}:{}]: {} - {}",
                                host, config.getPort(), error.getCondition(), error.getDescription());
                        result.tryFail(AmqpErrorConverter.fromDetachError(error));
                    }
                }
            })
            .disconnectHandler(disconnectedCon -> {
                cancelTimer(connectionTimeoutTimerId);
                if (!connectionTimeoutReached.get()) {
                    LOG.warn("can't open connection to hub [{}:{}]: underlying connection was disconnected",
                            host, config.getPort());
                    result.tryFail(new ServerErrorException(
                            HttpURLConnection.HTTP_UNAVAILABLE,
                            "underlying connection was disconnected while opening AMQP connection"));
                }
            })
            .open();
    }

    private void setConnection(final ProtonConnection newConnection, final String host) {
        this.connection = newConnection;
        this.connectedHost = host;
        this.session = newConnection.createSession();
        this.session.closeHandler(remoteClose -> {
            session.close();
            session.free();
        });
        this.session.open();
    }

    private String getContainerId() {
        return Optional.ofNullable(config.getName())
                .orElseGet(() -> "hubsdk-device-" + UUID.randomUUID());
    }

    private void cancelTimer(final Long timerId) {
        if (timerId != null) {
            vertx.cancelTimer(timerId);
        }
    }

    private static void closeAndDisconnect(final ProtonConnection con) {
        con.closeHandler(null);
        con.disconnectHandler(null);
        con.close();
        con.disconnect();
    }

    ProtonClientOptions createClientOptions(final Credential credential) {

        final ProtonClientOptions options = new ProtonClientOptions();
        options.setConnectTimeout(config.getConnectTimeout());
        options.setHeartbeat(config.getIdleTimeout());
        options.setReconnectAttempts(0);

        if (config.isTlsEnabled()) {
            options.setSsl(true);
        }
        final TrustOptions trustOptions = config.getTrustOptions();
        if (trustOptions != null) {
            options.setSsl(true).setTrustOptions(trustOptions);
        }
        if (options.isSsl()) {
            options.setHostnameVerificationAlgorithm(config.isHostnameVerificationRequired() ? "HTTPS" : "");
        }

        if (credential.getType() == AuthenticationType.X509) {
            final X509Certificate certificate = credential.getCertificate();
            if (certificate.getPassphrase() != null) {
                throw new IllegalArgumentException("passphrase protected private keys are not supported");
            }
            options.setSsl(true)
                .setKeyCertOptions(new PemKeyCertOptions()
                        .setCertValue(Buffer.buffer(certificate.getCertificate()))
                        .setKeyValue(Buffer.buffer(certificate.getKey())));
            options.addEnabledSaslMechanism(ProtonSaslExternalImpl.MECH_NAME);
        }
        return options;
    }

    private void onRemoteClose(final ProtonConnection con) {

        if (con != connection) {
            LOG.debug("ignoring close frame for stale connection");
            return;
        }
        final ErrorCondition error = con.getRemoteCondition();
        final ServiceInvocationException cause;
        if (error == null) {
            LOG.info("hub [{}:{}] closed connection", connectedHost, config.getPort());
            cause = null;
        } else {
            LOG.info("hub [{}:{}] closed connection: {} - {}",
                    connectedHost, config.getPort(), error.getCondition(), error.getDescription());
            cause = AmqpErrorConverter.fromDetachError(error);
        }
        con.disconnectHandler(null);
        con.close();
        con.disconnect();
        handleConnectionLoss(cause);
    }

    private void onRemoteDisconnect(final ProtonConnection con) {

        if (con != connection) {
            LOG.warn("cannot handle failure of unknown connection");
            return;
        }
        LOG.info("lost connection to hub [{}:{}]", connectedHost, config.getPort());
        handleConnectionLoss(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "lost connection to hub"));
    }

    private void handleConnectionLoss(final Throwable cause) {
        clearState(cause);
        disconnectHandler.handle(cause);
    }

    private void clearState(final Throwable cause) {
        if (cbs != null) {
            cbs.close(cause);
            cbs = null;
        }
        links.values().forEach(AttachedLink::release);
        links.clear();
        session = null;
        connection = null;
    }

    @Override
    public Future<Void> authenticate(final Credential credential) {

        Objects.requireNonNull(credential);
        if (credential.getSharedAccessSignature() == null) {
            return Future.failedFuture(new IllegalArgumentException("credential does not contain a token"));
        }
        if (!isConnected()) {
            return Future.failedFuture(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "not connected"));
        }
        return getOrCreateCbsChannel()
                .compose(channel -> channel.putToken(credential.getAudience(), credential.getSharedAccessSignature()));
    }

    private Future<ClaimsBasedSecurityChannel> getOrCreateCbsChannel() {

        if (cbs != null) {
            return Future.succeededFuture(cbs);
        }
        final ProtonSender sender = session.createSender(ClaimsBasedSecurityChannel.NODE_ADDRESS);
        sender.setQoS(ProtonQoS.AT_LEAST_ONCE);
        sender.setAutoSettle(true);
        final ProtonReceiver receiver = session.createReceiver(ClaimsBasedSecurityChannel.NODE_ADDRESS);
        receiver.setQoS(ProtonQoS.AT_LEAST_ONCE);
        receiver.setAutoAccept(false);
        final ClaimsBasedSecurityChannel channel = new ClaimsBasedSecurityChannel(
                vertx, sender, receiver, config.getPutTokenTimeout());
        setRemoteDetachHandlers(sender, ClaimsBasedSecurityChannel.NODE_ADDRESS,
                error -> onCbsLinkDetached(channel, error));
        setRemoteDetachHandlers(receiver, ClaimsBasedSecurityChannel.NODE_ADDRESS,
                error -> onCbsLinkDetached(channel, error));

        return Future.all(openLink(sender, ClaimsBasedSecurityChannel.NODE_ADDRESS),
                openLink(receiver, ClaimsBasedSecurityChannel.NODE_ADDRESS))
            .map(ok -> {
                LOG.debug("claims based security channel open");
                cbs = channel;
                return channel;
            })
            .recover(t -> {
                channel.close(t);
                return Future.failedFuture(t);
            });
    }

    private void onCbsLinkDetached(final ClaimsBasedSecurityChannel channel, final ServiceInvocationException error) {
        if (cbs == channel) {
            cbs = null;
            channel.close(error);
            linkErrorHandler.accept(ClaimsBasedSecurityChannel.NODE_ADDRESS, error);
        }
    }

    @Override
    public Future<Void> attachLink(final LinkOptions options) {

        Objects.requireNonNull(options);
        if (!isConnected()) {
            return Future.failedFuture(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "not connected"));
        }
        if (links.containsKey(options.getName())) {
            return Future.succeededFuture();
        }

        final Map<Symbol, Object> properties = new HashMap<>();
        options.getProperties().forEach((key, value) -> properties.put(Symbol.valueOf(key), value));

        final AttachedLink link = new AttachedLink(options);
        final List<Future<?>> opening = new ArrayList<>(2);
        if (options.getDirection().canSend()) {
            final ProtonSender sender = session.createSender(options.getAddress());
            sender.setQoS(ProtonQoS.AT_LEAST_ONCE);
            sender.setAutoSettle(true);
            sender.setProperties(properties);
            setRemoteDetachHandlers(sender, options.getAddress(), error -> onRemoteDetach(link, error));
            link.sender = sender;
            opening.add(openLink(sender, options.getAddress()));
        }
        if (options.getDirection().canReceive()) {
            final ProtonReceiver receiver = session.createReceiver(options.getAddress());
            receiver.setQoS(ProtonQoS.AT_LEAST_ONCE);
            receiver.setAutoAccept(true);
            receiver.setPrefetch(config.getInitialCredits());
            receiver.setProperties(properties);
            receiver.handler((delivery, message) -> options.getMessageHandler().handle(message));
            setRemoteDetachHandlers(receiver, options.getAddress(), error -> onRemoteDetach(link, error));
            link.receiver = receiver;
            opening.add(openLink(receiver, options.getAddress()));
        }

        return Future.all(opening)
            .<Void>map(ok -> {
                LOG.debug("attached link [name: {}, address: {}, direction: {}]",
                        options.getName(), options.getAddress(), options.getDirection());
                links.put(options.getName(), link);
                return null;
            })
            .recover(t -> {
                LOG.debug("failed to attach link [name: {}, address: {}]: {}",
                        options.getName(), options.getAddress(), t.getMessage());
                link.release();
                return Future.failedFuture(t);
            });
    }

    private <T extends ProtonLink<T>> Future<T> openLink(final T link, final String address) {

        final Promise<T> result = Promise.promise();
        link.openHandler(openAttempt -> {
            if (result.future().isComplete()) {
                LOG.debug("ignoring peer's attach frame for link [{}]: link establishment already timed out", address);
            } else if (openAttempt.failed()) {
                final ErrorCondition error = link.getRemoteCondition();
                if (error == null) {
                    LOG.debug("opening link [{}] failed", address, openAttempt.cause());
                    result.tryFail(new ClientErrorException(
                            HttpURLConnection.HTTP_NOT_FOUND, "cannot open link", openAttempt.cause()));
                } else {
                    LOG.debug("opening link [{}] failed: {} - {}", address, error.getCondition(), error.getDescription());
                    result.tryFail(AmqpErrorConverter.fromAttachError(error));
                }
            } else if (isLinkEstablished(link)) {
                result.tryComplete(link);
            } else {
                // peer will send a detach frame shortly
                LOG.debug("peer did not create terminus for link [{}]", address);
                result.tryFail(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE));
            }
        });
        link.open();
        final long timeout = config.getLinkEstablishmentTimeout();
        vertx.setTimer(timeout, tid -> {
            if (!result.future().isComplete()) {
                LOG.info("establishment of link [{}] timed out after {}ms", address, timeout);
                link.close();
                result.tryFail(new ServerErrorException(
                        HttpURLConnection.HTTP_UNAVAILABLE, "link establishment timed out"));
            }
        });
        return result.future();
    }

    private static boolean isLinkEstablished(final ProtonLink<?> link) {
        if (link instanceof ProtonSender) {
            return link.getRemoteTarget() != null;
        } else {
            return link.getRemoteSource() != null;
        }
    }

    private <T extends ProtonLink<T>> void setRemoteDetachHandlers(
            final ProtonLink<T> link,
            final String address,
            final Handler<ServiceInvocationException> detachHandler) {

        final Handler<AsyncResult<T>> handler = remoteDetach -> {
            final ErrorCondition error = link.getRemoteCondition();
            if (error == null) {
                LOG.debug("link [{}] detached by peer", address);
            } else {
                LOG.debug("link [{}] detached by peer: {} - {}", address, error.getCondition(), error.getDescription());
            }
            link.close();
            link.free();
            detachHandler.handle(AmqpErrorConverter.fromDetachError(error));
        };
        link.detachHandler(handler);
        link.closeHandler(handler);
    }

    private void onRemoteDetach(final AttachedLink link, final ServiceInvocationException error) {
        final String name = link.options.getName();
        if (links.get(name) == link) {
            links.remove(name);
            link.release();
            linkErrorHandler.accept(name, error);
        }
    }

    @Override
    public Future<Void> detachLink(final String name, final Throwable cause) {

        Objects.requireNonNull(name);
        final AttachedLink link = links.remove(name);
        if (link == null) {
            return Future.succeededFuture();
        }
        if (cause != null) {
            LOG.debug("releasing link [{}]: {}", name, cause.getMessage());
            link.release();
            return Future.succeededFuture();
        }
        LOG.debug("closing link [{}]", name);
        return Future.all(closeAndFree(link.sender), closeAndFree(link.receiver)).mapEmpty();
    }

    private Future<Void> closeAndFree(final ProtonLink<?> link) {

        final Promise<Void> result = Promise.promise();
        if (link == null) {
            result.complete();
        } else if (!link.isOpen()) {
            link.free();
            result.complete();
        } else {
            final long timerId = vertx.setTimer(config.getLinkEstablishmentTimeout(), tid -> {
                LOG.debug("did not receive peer's detach frame in time, freeing link");
                link.free();
                result.tryComplete();
            });
            link.closeHandler(remoteClose -> {
                vertx.cancelTimer(timerId);
                link.free();
                result.tryComplete();
            });
            link.close();
        }
        return result.future();
    }

    @Override
    public Future<Void> send(final String name, final Message message) {

        Objects.requireNonNull(name);
        Objects.requireNonNull(message);

        final AttachedLink link = links.get(name);
        if (link == null || link.sender == null) {
            return Future.failedFuture(new ServerErrorException(
                    HttpURLConnection.HTTP_UNAVAILABLE, "link [" + name + "] is not attached"));
        }
        final ProtonSender sender = link.sender;
        if (sender.sendQueueFull()) {
            LOG.debug("cannot send message on link [{}]: no credit available", name);
            return Future.failedFuture(new ServerErrorException(
                    HttpURLConnection.HTTP_UNAVAILABLE, "no credit available"));
        }

        final Promise<Void> result = Promise.promise();
        final long timeout = config.getSendMessageTimeout();
        final Long timerId = timeout > 0
                ? vertx.setTimer(timeout, tid -> result.tryFail(new ServerErrorException(
                        HttpURLConnection.HTTP_UNAVAILABLE,
                        "waiting for delivery update timed out after " + timeout + "ms")))
                : null;
        sender.send(message, delivery -> {
            cancelTimer(timerId);
            final ServiceInvocationException error = AmqpErrorConverter.fromDeliveryState(delivery.getRemoteState());
            if (error == null) {
                LOG.trace("hub accepted message [link: {}, message ID: {}]", name, message.getMessageId());
                result.tryComplete();
            } else {
                LOG.debug("hub did not accept message [link: {}, message ID: {}]: {}",
                        name, message.getMessageId(), error.getMessage());
                result.tryFail(error);
            }
        });
        return result.future();
    }

    @Override
    public Future<Void> disconnect() {

        if (!isConnected()) {
            clearState(null);
            return Future.succeededFuture();
        }

        final ProtonConnection connectionToClose = connection;
        final String host = connectedHost;
        final Promise<Void> result = Promise.promise();
        // make sure the loss of the connection is not reported
        connectionToClose.disconnectHandler(null);
        clearState(null);

        final Handler<Void> onClosed = v -> {
            connectionToClose.disconnect();
            result.tryComplete();
        };
        final int timeout = (config.getConnectTimeout() > 0
                ? config.getConnectTimeout()
                : ClientConfigProperties.DEFAULT_CONNECT_TIMEOUT) / 2;
        final long timerId = vertx.setTimer(timeout, tid -> {
            LOG.info("did not receive hub's close frame after {}ms", timeout);
            onClosed.handle(null);
        });
        connectionToClose.closeHandler(remoteClose -> {
            vertx.cancelTimer(timerId);
            LOG.info("closed connection to hub [{}:{}]", host, config.getPort());
            onClosed.handle(null);
        });
        LOG.info("closing connection to hub [{}:{}] ...", host, config.getPort());
        connectionToClose.close();
        return result.future();
    }

    /**
     * The sender and/or receiver link(s) attached for a name.
     */
    private static final class AttachedLink {

        private final LinkOptions options;
        private ProtonSender sender;
        private ProtonReceiver receiver;

        AttachedLink(final LinkOptions options) {
            this.options = options;
        }

        void release() {
            release(sender);
            release(receiver);
        }

        private static void release(final ProtonLink<?> link) {
            if (link != null) {
                link.detachHandler(null);
                link.closeHandler(null);
                if (link.isOpen()) {
                    link.close();
                }
                link.free();
            }
        }
    }
}
