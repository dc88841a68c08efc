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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.HttpURLConnection;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.eclipse.hubsdk.client.ClientErrorException;
import org.eclipse.hubsdk.client.OperationCancelledException;
import org.eclipse.hubsdk.client.ServerErrorException;
import org.eclipse.hubsdk.client.ThrottlingException;
import org.eclipse.hubsdk.test.MockTimers;
import org.eclipse.hubsdk.test.VertxMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * Tests verifying behavior of {@link RetryOperation}.
 *
 */
public class RetryOperationTest {

    private Vertx vertx;
    private MockTimers timers;
    private Clock clock;
    private RetryPolicy policy;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {
        vertx = VertxMockSupport.mockVertx();
        timers = VertxMockSupport.captureTimers(vertx);
        clock = mock(Clock.class);
        when(clock.millis()).thenReturn(0L);
        policy = mock(RetryPolicy.class);
        when(policy.shouldRetry(any())).thenAnswer(invocation -> new DefaultErrorFilter().test(invocation.getArgument(0)));
        when(policy.nextRetryTimeoutMillis(anyInt(), anyBoolean())).thenReturn(100L);
    }

    private static Supplier<Future<String>> attempts(final Deque<Future<String>> outcomes, final AtomicInteger counter) {
        return () -> {
            counter.incrementAndGet();
            return outcomes.poll();
        };
    }

    /**
     * Verifies that the first attempt is made immediately and that a successful
     * attempt settles the operation.
     */
    @Test
    public void testRetrySucceedsOnFirstAttempt() {

        final RetryOperation op = new RetryOperation(vertx, "test", policy, 1000, clock);
        final Future<String> result = op.retry(() -> Future.succeededFuture("done"));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.result()).isEqualTo("done");
        assertThat(op.getAttemptCount()).isEqualTo(1);
        assertThat(timers.getRequestedDelays()).isEmpty();
    }

    /**
     * Verifies that transient failures are retried after the delay determined by the policy.
     */
    @Test
    public void testRetryRetriesTransientFailures() {

        final AtomicInteger counter = new AtomicInteger();
        final Deque<Future<String>> outcomes = new ArrayDeque<>();
        outcomes.add(Future.failedFuture(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE)));
        outcomes.add(Future.failedFuture(new ServerErrorException(HttpURLConnection.HTTP_GATEWAY_TIMEOUT)));
        outcomes.add(Future.succeededFuture("done"));

        final RetryOperation op = new RetryOperation(vertx, "test", policy, 1000, clock);
        final Future<String> result = op.retry(attempts(outcomes, counter));

        // first retry is waiting for its timer
        assertThat(result.isComplete()).isFalse();
        assertThat(counter.get()).isEqualTo(1);
        assertThat(timers.fireNext()).isTrue();
        assertThat(counter.get()).isEqualTo(2);
        assertThat(timers.fireNext()).isTrue();

        assertThat(result.succeeded()).isTrue();
        assertThat(counter.get()).isEqualTo(3);
        assertThat(timers.getRequestedDelays()).containsExactly(100L, 100L);
        verify(policy).nextRetryTimeoutMillis(0, false);
        verify(policy).nextRetryTimeoutMillis(1, false);
    }

    /**
     * Verifies that a retry with a zero delay is run without a timer.
     */
    @Test
    public void testRetryRunsImmediateRetryWithoutTimer() {

        when(policy.nextRetryTimeoutMillis(anyInt(), anyBoolean())).thenReturn(0L);
        final AtomicInteger counter = new AtomicInteger();
        final Deque<Future<String>> outcomes = new ArrayDeque<>();
        outcomes.add(Future.failedFuture(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE)));
        outcomes.add(Future.succeededFuture("done"));

        final Future<String> result = new RetryOperation(vertx, "test", policy, 1000, clock).retry(attempts(outcomes, counter));

        assertThat(result.succeeded()).isTrue();
        assertThat(counter.get()).isEqualTo(2);
        assertThat(timers.getRequestedDelays()).isEmpty();
    }

    /**
     * Verifies that a permanent failure settles the operation without any retry.
     */
    @Test
    public void testRetryFailsOnPermanentError() {

        final ClientErrorException error = new ClientErrorException(HttpURLConnection.HTTP_UNAUTHORIZED);
        final RetryOperation op = new RetryOperation(vertx, "test", policy, 1000, clock);
        final Future<String> result = op.retry(() -> Future.failedFuture(error));

        assertThat(result.failed()).isTrue();
        assertThat(result.cause()).isSameAs(error);
        assertThat(op.getAttemptCount()).isEqualTo(1);
        verify(policy, never()).nextRetryTimeoutMillis(anyInt(), anyBoolean());
    }

    /**
     * Verifies that an always failing operation settles with the last error once the
     * projected elapsed time would exceed the budget.
     */
    @Test
    public void testRetryGivesUpWhenBudgetIsExhausted() {

        // GIVEN an operation with a budget of 1000ms and a policy asking for 300ms delays
        when(policy.nextRetryTimeoutMillis(anyInt(), anyBoolean())).thenReturn(300L);
        when(clock.millis()).thenReturn(0L, 0L, 300L, 800L);
        final AtomicInteger counter = new AtomicInteger();
        final RetryOperation op = new RetryOperation(vertx, "test", policy, 1000, clock);

        // WHEN every attempt fails with a transient error
        final Future<String> result = op.retry(() -> Future.failedFuture(
                new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "attempt " + counter.incrementAndGet())));
        while (timers.fireNext()) {
            // keep on retrying
        }

        // THEN the operation fails with the error of the third attempt
        // because a fourth attempt would have started after 800ms + 300ms
        assertThat(result.failed()).isTrue();
        assertThat(result.cause()).hasMessage("attempt 3");
        assertThat(op.getAttemptCount()).isEqualTo(3);
    }

    /**
     * Verifies that a negative delay is treated as a veto.
     */
    @Test
    public void testRetryStopsOnNegativeDelay() {

        when(policy.nextRetryTimeoutMillis(anyInt(), anyBoolean())).thenReturn(-1L);
        final Future<String> result = new RetryOperation(vertx, "test", policy, 1000, clock)
                .retry(() -> Future.failedFuture(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE)));
        assertThat(result.failed()).isTrue();
        assertThat(timers.getRequestedDelays()).isEmpty();
    }

    /**
     * Verifies that an operation without a time budget is attempted once only.
     */
    @Test
    public void testRetryWithZeroTimeoutMakesSingleAttempt() {

        final AtomicInteger counter = new AtomicInteger();
        final Future<String> result = new RetryOperation(vertx, "test", policy, 0, clock)
                .retry(() -> {
                    counter.incrementAndGet();
                    return Future.failedFuture(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE));
                });
        assertThat(result.failed()).isTrue();
        assertThat(counter.get()).isEqualTo(1);
    }

    /**
     * Verifies that throttling errors are reported to the policy as such.
     */
    @Test
    public void testRetryReportsThrottling() {

        final Deque<Future<String>> outcomes = new ArrayDeque<>();
        outcomes.add(Future.failedFuture(new ThrottlingException("slow down")));
        outcomes.add(Future.succeededFuture("done"));
        new RetryOperation(vertx, "test", policy, 1000, clock).retry(attempts(outcomes, new AtomicInteger()));
        verify(policy).nextRetryTimeoutMillis(0, true);
    }

    /**
     * Verifies that an exception thrown by the work is handled like a failed attempt.
     */
    @Test
    public void testRetryHandlesExceptionThrownByWork() {

        final Future<String> result = new RetryOperation(vertx, "test", policy, 1000, clock)
                .retry(() -> {
                    throw new IllegalArgumentException("invalid");
                });
        assertThat(result.failed()).isTrue();
        assertThat(result.cause()).isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Verifies that cancelling an operation with a pending retry cancels the timer
     * and fails the operation.
     */
    @Test
    public void testCancelStopsPendingRetry() {

        final AtomicInteger counter = new AtomicInteger();
        final RetryOperation op = new RetryOperation(vertx, "test", policy, 1000, clock);
        final Future<String> result = op.retry(() -> {
            counter.incrementAndGet();
            return Future.failedFuture(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE));
        });
        assertThat(timers.pendingCount()).isEqualTo(1);

        op.cancel();

        assertThat(result.failed()).isTrue();
        assertThat(result.cause()).isInstanceOf(OperationCancelledException.class);
        assertThat(timers.pendingCount()).isEqualTo(0);
        verify(vertx).cancelTimer(anyLong());
        assertThat(counter.get()).isEqualTo(1);
    }
}
