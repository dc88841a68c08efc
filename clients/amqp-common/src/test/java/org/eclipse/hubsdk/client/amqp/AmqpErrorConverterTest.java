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

import java.net.HttpURLConnection;

import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.messaging.Accepted;
import org.apache.qpid.proton.amqp.messaging.Modified;
import org.apache.qpid.proton.amqp.messaging.Rejected;
import org.apache.qpid.proton.amqp.messaging.Released;
import org.apache.qpid.proton.amqp.transport.AmqpError;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;
import org.eclipse.hubsdk.client.ServiceInvocationException;
import org.eclipse.hubsdk.client.ThrottlingException;
import org.junit.jupiter.api.Test;

/**
 * Tests verifying behavior of {@link AmqpErrorConverter}.
 *
 */
public class AmqpErrorConverterTest {

    /**
     * Verifies that a rejected attach with an unknown condition is mapped to 404.
     */
    @Test
    public void testFromAttachErrorMapsUnknownConditionToNotFound() {

        final ServiceInvocationException e = AmqpErrorConverter.fromAttachError(
                new ErrorCondition(Symbol.valueOf("vendor:whatever"), "no such node"));

        assertThat(e.getErrorCode()).isEqualTo(HttpURLConnection.HTTP_NOT_FOUND);
        assertThat(e.getMessage()).contains("no such node");
    }

    /**
     * Verifies that an unauthorized access condition is mapped to 401.
     */
    @Test
    public void testFromAttachErrorMapsUnauthorizedAccess() {

        final ServiceInvocationException e = AmqpErrorConverter.fromAttachError(
                new ErrorCondition(AmqpError.UNAUTHORIZED_ACCESS, "token expired"));

        assertThat(e.getErrorCode()).isEqualTo(HttpURLConnection.HTTP_UNAUTHORIZED);
    }

    /**
     * Verifies that the hub's throttling condition results in a throttling error.
     */
    @Test
    public void testThrottledConditionIsMappedToThrottlingException() {

        final ServiceInvocationException e = AmqpErrorConverter.fromDetachError(
                new ErrorCondition(AmqpErrorConverter.CONDITION_THROTTLED, "slow down"));

        assertThat(e).isInstanceOf(ThrottlingException.class);
        assertThat(e.getErrorCode()).isEqualTo(ThrottlingException.HTTP_TOO_MANY_REQUESTS);
    }

    /**
     * Verifies that a detach without an error is considered transient.
     */
    @Test
    public void testFromDetachErrorWithoutConditionIsUnavailable() {

        assertThat(AmqpErrorConverter.fromDetachError(null).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_UNAVAILABLE);
        assertThat(AmqpErrorConverter.fromDetachError(new ErrorCondition()).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_UNAVAILABLE);
    }

    /**
     * Verifies the mapping of delivery outcomes.
     */
    @Test
    public void testFromDeliveryState() {

        assertThat(AmqpErrorConverter.fromDeliveryState(Accepted.getInstance())).isNull();
        assertThat(AmqpErrorConverter.fromDeliveryState(new Rejected()).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_BAD_REQUEST);
        assertThat(AmqpErrorConverter.fromDeliveryState(Released.getInstance()).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_UNAVAILABLE);

        final Rejected rejected = new Rejected();
        rejected.setError(new ErrorCondition(Symbol.valueOf("com.microsoft:quota-exceeded"), "quota"));
        assertThat(AmqpErrorConverter.fromDeliveryState(rejected).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_FORBIDDEN);

        final Modified undeliverable = new Modified();
        undeliverable.setUndeliverableHere(true);
        assertThat(AmqpErrorConverter.fromDeliveryState(undeliverable).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_NOT_FOUND);
        assertThat(AmqpErrorConverter.fromDeliveryState(new Modified()).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_UNAVAILABLE);
        assertThat(AmqpErrorConverter.fromDeliveryState(null).getErrorCode())
            .isEqualTo(HttpURLConnection.HTTP_UNAVAILABLE);
    }
}
