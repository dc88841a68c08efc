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


package org.eclipse.hubsdk.client.retry;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.util.concurrent.TimeoutException;

import org.eclipse.hubsdk.client.ClientErrorException;
import org.eclipse.hubsdk.client.ResourceConflictException;
import org.eclipse.hubsdk.client.ServerErrorException;
import org.eclipse.hubsdk.client.ThrottlingException;
import org.junit.jupiter.api.Test;

/**
 * Tests verifying behavior of {@link ExponentialBackoffWithJitter}, {@link DefaultErrorFilter}
 * and {@link NoRetry}.
 *
 */
public class ExponentialBackoffWithJitterTest {

    /**
     * Verifies that transient errors are retried.
     */
    @Test
    public void testShouldRetryTransientErrors() {

        final ExponentialBackoffWithJitter policy = new ExponentialBackoffWithJitter();
        assertThat(policy.shouldRetry(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE))).isTrue();
        assertThat(policy.shouldRetry(new ServerErrorException(HttpURLConnection.HTTP_INTERNAL_ERROR))).isTrue();
        assertThat(policy.shouldRetry(new ServerErrorException(HttpURLConnection.HTTP_GATEWAY_TIMEOUT))).isTrue();
        assertThat(policy.shouldRetry(new ThrottlingException("slow down"))).isTrue();
        assertThat(policy.shouldRetry(new ConnectException("connection refused"))).isTrue();
        assertThat(policy.shouldRetry(new TimeoutException())).isTrue();
        assertThat(policy.shouldRetry(new IllegalStateException("wrapped", new IOException("reset")))).isTrue();
    }

    /**
     * Verifies that permanent errors are not retried.
     */
    @Test
    public void testShouldNotRetryPermanentErrors() {

        final ExponentialBackoffWithJitter policy = new ExponentialBackoffWithJitter();
        assertThat(policy.shouldRetry(new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST))).isFalse();
        assertThat(policy.shouldRetry(new ClientErrorException(HttpURLConnection.HTTP_UNAUTHORIZED))).isFalse();
        assertThat(policy.shouldRetry(new ClientErrorException(HttpURLConnection.HTTP_FORBIDDEN))).isFalse();
        assertThat(policy.shouldRetry(new ClientErrorException(HttpURLConnection.HTTP_NOT_FOUND))).isFalse();
        assertThat(policy.shouldRetry(new ClientErrorException(HttpURLConnection.HTTP_PRECON_FAILED))).isFalse();
        assertThat(policy.shouldRetry(new ClientErrorException(HttpURLConnection.HTTP_ENTITY_TOO_LARGE))).isFalse();
        assertThat(policy.shouldRetry(new ResourceConflictException("etag mismatch"))).isFalse();
        assertThat(policy.shouldRetry(new IllegalArgumentException())).isFalse();
        assertThat(policy.shouldRetry(new NullPointerException())).isFalse();
    }

    /**
     * Verifies that the classification of an error does not change between invocations.
     */
    @Test
    public void testShouldRetryIsPure() {

        final ExponentialBackoffWithJitter policy = new ExponentialBackoffWithJitter();
        final ServerErrorException transientError = new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE);
        final ClientErrorException permanentError = new ClientErrorException(HttpURLConnection.HTTP_FORBIDDEN);
        for (int i = 0; i < 5; i++) {
            assertThat(policy.shouldRetry(transientError)).isTrue();
            assertThat(policy.shouldRetry(permanentError)).isFalse();
        }
    }

    /**
     * Verifies that the first retry of a non-throttled failure happens immediately
     * unless disabled.
     */
    @Test
    public void testImmediateFirstRetry() {

        assertThat(new ExponentialBackoffWithJitter().nextRetryTimeoutMillis(0, false)).isEqualTo(0);
        assertThat(new ExponentialBackoffWithJitter().nextRetryTimeoutMillis(0, true)).isGreaterThanOrEqualTo(10_000);
        assertThat(new ExponentialBackoffWithJitter(false, new DefaultErrorFilter()).nextRetryTimeoutMillis(0, false))
            .isEqualTo(100);
    }

    /**
     * Verifies the delays computed for the normal constants.
     */
    @Test
    public void testNextRetryTimeoutGrowsExponentially() {

        // random value 0 selects the lower bound c * (1 - jd) = 50
        final ExponentialBackoffWithJitter lower = new ExponentialBackoffWithJitter(
                false,
                new DefaultErrorFilter(),
                ExponentialBackoffWithJitter.Parameters.normal(),
                ExponentialBackoffWithJitter.Parameters.throttled(),
                () -> 0.0);
        assertThat(lower.nextRetryTimeoutMillis(0, false)).isEqualTo(100);
        assertThat(lower.nextRetryTimeoutMillis(1, false)).isEqualTo(150);
        assertThat(lower.nextRetryTimeoutMillis(2, false)).isEqualTo(250);
        assertThat(lower.nextRetryTimeoutMillis(3, false)).isEqualTo(450);
        assertThat(lower.nextRetryTimeoutMillis(20, false)).isEqualTo(10_000);

        // random value close to 1 approaches the upper bound c * (1 - ju) = 75
        final ExponentialBackoffWithJitter upper = new ExponentialBackoffWithJitter(
                false,
                new DefaultErrorFilter(),
                ExponentialBackoffWithJitter.Parameters.normal(),
                ExponentialBackoffWithJitter.Parameters.throttled(),
                () -> 1.0);
        assertThat(upper.nextRetryTimeoutMillis(1, false)).isEqualTo(175);
    }

    /**
     * Verifies that throttled failures use the higher floor and ceiling.
     */
    @Test
    public void testNextRetryTimeoutForThrottling() {

        final ExponentialBackoffWithJitter policy = new ExponentialBackoffWithJitter();
        for (int attempt = 0; attempt < 10; attempt++) {
            assertThat(policy.nextRetryTimeoutMillis(attempt, true)).isBetween(10_000L, 60_000L);
        }
        assertThat(policy.nextRetryTimeoutMillis(30, true)).isEqualTo(60_000);
    }

    /**
     * Verifies that the no-retry policy vetoes every retry.
     */
    @Test
    public void testNoRetry() {

        final NoRetry policy = new NoRetry();
        assertThat(policy.shouldRetry(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE))).isFalse();
        assertThat(policy.nextRetryTimeoutMillis(0, false)).isEqualTo(-1);
    }
}
