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

import java.util.function.BiConsumer;

import org.apache.qpid.proton.message.Message;
import org.eclipse.hubsdk.client.auth.Credential;

import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * A transport level connection to the hub.
 * <p>
 * Implementations are driven by a single session and are not expected to
 * support concurrent invocations of {@link #connect(Credential)} or
 * {@link #disconnect()}.
 *
 */
public interface SessionTransport {

    /**
     * Establishes the transport level connection.
     * <p>
     * Certificate credentials are used for the TLS handshake.
     *
     * @param credential The credential to connect with.
     * @return A future indicating the outcome.
     * @throws NullPointerException if credential is {@code null}.
     */
    Future<Void> connect(Credential credential);

    /**
     * Authorizes the connection by means of a security token.
     *
     * @param credential The credential containing the token to put.
     * @return A future indicating the outcome. The future will be failed with a
     *         {@link org.eclipse.hubsdk.client.ServiceInvocationException} if the hub
     *         rejects the token.
     * @throws NullPointerException if credential is {@code null}.
     */
    Future<Void> authenticate(Credential credential);

    /**
     * Attaches a link.
     *
     * @param link The link to attach.
     * @return A future indicating the outcome.
     * @throws NullPointerException if link is {@code null}.
     */
    Future<Void> attachLink(LinkOptions link);

    /**
     * Detaches a link.
     * <p>
     * If a cause is given, the link is released without waiting for the peer
     * to acknowledge the detach.
     *
     * @param name The name of the link.
     * @param cause The error that led to detaching the link or {@code null}.
     * @return A future indicating the outcome. The future will succeed if no link
     *         with the given name is attached.
     * @throws NullPointerException if name is {@code null}.
     */
    Future<Void> detachLink(String name, Throwable cause);

    /**
     * Sends a message on an attached link.
     *
     * @param name The name of the link.
     * @param message The message to send.
     * @return A future indicating the outcome. The future will succeed once the
     *         peer has accepted the message.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    Future<Void> send(String name, Message message);

    /**
     * Closes the connection.
     *
     * @return A future indicating the outcome.
     */
    Future<Void> disconnect();

    /**
     * Sets the handler to invoke when the connection is lost or closed by the peer.
     * <p>
     * The handler is invoked with the error that caused the loss or {@code null}
     * if the peer closed the connection without an error. It is not invoked as
     * a result of {@link #disconnect()}.
     *
     * @param handler The handler.
     */
    void disconnectHandler(Handler<Throwable> handler);

    /**
     * Sets the handler to invoke when the peer detaches a link.
     * <p>
     * The handler is invoked with the name of the link and the error reported by the peer.
     *
     * @param handler The handler.
     */
    void linkErrorHandler(BiConsumer<String, Throwable> handler);
}
