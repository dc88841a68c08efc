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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.HttpURLConnection;
import java.util.HashMap;
import java.util.Map;

import org.apache.qpid.proton.amqp.messaging.Accepted;
import org.apache.qpid.proton.amqp.messaging.AmqpValue;
import org.apache.qpid.proton.amqp.messaging.ApplicationProperties;
import org.apache.qpid.proton.amqp.messaging.Rejected;
import org.apache.qpid.proton.message.Message;
import org.eclipse.hubsdk.client.ClientErrorException;
import org.eclipse.hubsdk.client.ServerErrorException;
import org.eclipse.hubsdk.client.ServiceInvocationException;
import org.eclipse.hubsdk.test.MockTimers;
import org.eclipse.hubsdk.test.VertxMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.proton.ProtonDelivery;
import io.vertx.proton.ProtonHelper;
import io.vertx.proton.ProtonReceiver;
import io.vertx.proton.ProtonSender;

/**
 * Tests verifying behavior of {@link ClaimsBasedSecurityChannel}.
 *
 */
public class ClaimsBasedSecurityChannelTest {

    private static final String AUDIENCE = "hub.example.com/devices/device-1";
    private static final String TOKEN = "SharedAccessSignature sr=hub.example.com%2Fdevices%2Fdevice-1&sig=abc&se=2000000000";

    private Vertx vertx;
    private MockTimers timers;
    private ProtonSender sender;
    private ProtonReceiver receiver;
    private ClaimsBasedSecurityChannel channel;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {
        vertx = VertxMockSupport.mockVertx();
        timers = VertxMockSupport.captureTimers(vertx);
        sender = mock(ProtonSender.class);
        when(sender.sendQueueFull()).thenReturn(Boolean.FALSE);
        receiver = mock(ProtonReceiver.class);
        channel = new ClaimsBasedSecurityChannel(vertx, sender, receiver, 1000);
    }

    private Message sentRequest() {
        final ArgumentCaptor<Message> request = ArgumentCaptor.forClass(Message.class);
        verify(sender).send(request.capture(), VertxMockSupport.anyHandler());
        return request.getValue();
    }

    private static Message response(final Object correlationId, final int status, final String description) {
        final Map<String, Object> props = new HashMap<>();
        props.put(ClaimsBasedSecurityChannel.PROPERTY_STATUS_CODE, status);
        if (description != null) {
            props.put(ClaimsBasedSecurityChannel.PROPERTY_STATUS_DESCRIPTION, description);
        }
        final Message response = ProtonHelper.message();
        response.setCorrelationId(correlationId);
        response.setApplicationProperties(new ApplicationProperties(props));
        return response;
    }

    /**
     * Verifies that a put-token request carries the token and the audience in the
     * properties expected by the claims based security node.
     */
    @Test
    public void testPutTokenSendsRequest() {

        channel.putToken(AUDIENCE, TOKEN);

        final Message request = sentRequest();
        assertThat(request.getAddress()).isEqualTo(ClaimsBasedSecurityChannel.NODE_ADDRESS);
        assertThat(request.getReplyTo()).isEqualTo(ClaimsBasedSecurityChannel.REPLY_TO_ADDRESS);
        assertThat(request.getMessageId()).isNotNull();
        assertThat(((AmqpValue) request.getBody()).getValue()).isEqualTo(TOKEN);
        final Map<String, Object> props = request.getApplicationProperties().getValue();
        assertThat(props).containsEntry("operation", "put-token");
        assertThat(props).containsEntry("type", "servicebus.windows.net:sastoken");
        assertThat(props).containsEntry("name", AUDIENCE);
        assertThat(channel.getOutstandingRequests()).isEqualTo(1);
    }

    /**
     * Verifies that a 200 response completes the request and cancels its timer.
     */
    @Test
    public void testPutTokenSucceedsOnSuccessResponse() {

        final Future<Void> result = channel.putToken(AUDIENCE, TOKEN);
        final ProtonDelivery delivery = mock(ProtonDelivery.class);

        channel.handleResponse(delivery, response(sentRequest().getMessageId(), 200, "OK"));

        assertThat(result.succeeded()).isTrue();
        assertThat(timers.pendingCount()).isEqualTo(0);
        assertThat(channel.getOutstandingRequests()).isEqualTo(0);
        verify(delivery).disposition(any(Accepted.class), eq(true));
    }

    /**
     * Verifies that an error response fails the request with the corresponding error.
     */
    @Test
    public void testPutTokenFailsOnErrorResponse() {

        final Future<Void> result = channel.putToken(AUDIENCE, TOKEN);

        channel.handleResponse(mock(ProtonDelivery.class),
                response(sentRequest().getMessageId(), HttpURLConnection.HTTP_UNAUTHORIZED, "expired"));

        assertThat(result.failed()).isTrue();
        assertThat(result.cause()).isInstanceOf(ClientErrorException.class);
        assertThat(((ServiceInvocationException) result.cause()).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_UNAUTHORIZED);
    }

    /**
     * Verifies that a response containing a status code outside of the error range
     * is treated as an internal error.
     */
    @Test
    public void testPutTokenFailsOnMalformedResponse() {

        final Future<Void> result = channel.putToken(AUDIENCE, TOKEN);

        channel.handleResponse(mock(ProtonDelivery.class), response(sentRequest().getMessageId(), 302, null));

        assertThat(result.failed()).isTrue();
        assertThat(((ServiceInvocationException) result.cause()).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_INTERNAL_ERROR);
    }

    /**
     * Verifies that a request fails with a 503 if no response arrives in time.
     */
    @Test
    public void testPutTokenTimesOut() {

        final Future<Void> result = channel.putToken(AUDIENCE, TOKEN);
        assertThat(timers.getRequestedDelays()).containsExactly(1000L);

        timers.fireNext();

        assertThat(result.failed()).isTrue();
        assertThat(result.cause()).isInstanceOf(ServerErrorException.class);
        assertThat(((ServiceInvocationException) result.cause()).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_UNAVAILABLE);
        assertThat(channel.getOutstandingRequests()).isEqualTo(0);
    }

    /**
     * Verifies that a request fails immediately if the hub rejects the request message.
     */
    @Test
    public void testPutTokenFailsIfRequestIsRejected() {

        final Future<Void> result = channel.putToken(AUDIENCE, TOKEN);
        final ArgumentCaptor<Handler<ProtonDelivery>> dispositionHandler = VertxMockSupport.argumentCaptorHandler();
        verify(sender).send(any(Message.class), dispositionHandler.capture());
        final ProtonDelivery delivery = mock(ProtonDelivery.class);
        when(delivery.getRemoteState()).thenReturn(new Rejected());

        dispositionHandler.getValue().handle(delivery);

        assertThat(result.failed()).isTrue();
        assertThat(((ServiceInvocationException) result.cause()).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_BAD_REQUEST);
        assertThat(timers.pendingCount()).isEqualTo(0);
    }

    /**
     * Verifies that no request is sent if the link has no credit.
     */
    @Test
    public void testPutTokenFailsWithoutCredit() {

        when(sender.sendQueueFull()).thenReturn(Boolean.TRUE);

        final Future<Void> result = channel.putToken(AUDIENCE, TOKEN);

        assertThat(result.failed()).isTrue();
        verify(sender, never()).send(any(Message.class), VertxMockSupport.anyHandler());
    }

    /**
     * Verifies that responses that cannot be correlated are rejected.
     */
    @Test
    public void testUnexpectedResponseIsRejected() {

        final ProtonDelivery delivery = mock(ProtonDelivery.class);

        channel.handleResponse(delivery, response("unknown", 200, null));

        verify(delivery).disposition(any(Rejected.class), eq(true));
    }

    /**
     * Verifies that closing the channel fails outstanding requests.
     */
    @Test
    public void testCloseFailsOutstandingRequests() {

        when(sender.isOpen()).thenReturn(Boolean.TRUE);
        when(receiver.isOpen()).thenReturn(Boolean.TRUE);
        final Future<Void> result = channel.putToken(AUDIENCE, TOKEN);

        channel.close(null);

        assertThat(result.failed()).isTrue();
        assertThat(((ServiceInvocationException) result.cause()).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_UNAVAILABLE);
        verify(sender).close();
        verify(receiver).close();
    }
}
