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

import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;

import org.eclipse.hubsdk.client.OperationCancelledException;
import org.eclipse.hubsdk.client.ServiceInvocationException;
import org.eclipse.hubsdk.client.ThrottlingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * Executes a fallible asynchronous operation until it succeeds, the retry policy vetoes
 * another attempt or the time budget is exhausted.
 * <p>
 * An instance captures the policy and the timeout at creation time and can be used to
 * run a single operation only. All attempts and all timers run on the vert.x context that
 * was current when the instance has been created.
 */
public final class RetryOperation {

    private static final Logger LOG = LoggerFactory.getLogger(RetryOperation.class);

    private final Vertx vertx;
    private final Context context;
    private final RetryPolicy policy;
    private final long timeoutMillis;
    private final Clock clock;
    private final String name;

    private Promise<?> result;
    private long startTimestamp;
    private int attemptCount;
    private Long pendingTimerId;
    private boolean cancelled;

    /**
     * Creates a new operation.
     *
     * @param vertx The vert.x instance to use for scheduling retries.
     * @param name The name of the operation to include in log messages.
     * @param policy The policy deciding about retries.
     * @param timeoutMillis The overall time budget in milliseconds. If &le; 0 the operation
     *                      is attempted once only.
     * @throws NullPointerException if any of vertx, name or policy are {@code null}.
     */
    public RetryOperation(final Vertx vertx, final String name, final RetryPolicy policy, final long timeoutMillis) {
        this(vertx, name, policy, timeoutMillis, Clock.systemUTC());
    }

    /**
     * Creates a new operation.
     *
     * @param vertx The vert.x instance to use for scheduling retries.
     * @param name The name of the operation to include in log messages.
     * @param policy The policy deciding about retries.
     * @param timeoutMillis The overall time budget in milliseconds. If &le; 0 the operation
     *                      is attempted once only.
     * @param clock The clock to measure elapsed time with.
     * @throws NullPointerException if any of vertx, name, policy or clock are {@code null}.
     */
    public RetryOperation(
            final Vertx vertx,
            final String name,
            final RetryPolicy policy,
            final long timeoutMillis,
            final Clock clock) {
        this.vertx = Objects.requireNonNull(vertx);
        this.name = Objects.requireNonNull(name);
        this.policy = Objects.requireNonNull(policy);
        this.clock = Objects.requireNonNull(clock);
        this.timeoutMillis = timeoutMillis;
        this.context = vertx.getOrCreateContext();
    }

    /**
     * Checks if an error indicates that the service is throttling requests.
     *
     * @param error The error to check.
     * @return {@code true} if the error is a {@link ThrottlingException} or carries status code 429.
     */
    public static boolean isThrottling(final Throwable error) {
        return error instanceof ThrottlingException
                || (error instanceof ServiceInvocationException
                        && ServiceInvocationException.extractStatusCode(error) == ThrottlingException.HTTP_TOO_MANY_REQUESTS);
    }

    /**
     * Runs an operation.
     * <p>
     * The first attempt is made immediately.
     *
     * @param <T> The type of the operation's result.
     * @param work The supplier performing a single attempt each time it is invoked.
     * @return A future indicating the outcome. The future will be completed with the result of the
     *         first successful attempt or failed with the error of the last attempt. It will be failed with an
     *         {@link OperationCancelledException} if the operation has been cancelled.
     * @throws NullPointerException if work is {@code null}.
     * @throws IllegalStateException if this operation has already been started.
     */
    public <T> Future<T> retry(final Supplier<Future<T>> work) {
        Objects.requireNonNull(work);
        if (result != null) {
            throw new IllegalStateException("operation has already been started");
        }
        final Promise<T> promise = Promise.promise();
        result = promise;
        startTimestamp = clock.millis();
        if (cancelled) {
            promise.tryFail(new OperationCancelledException(name + " has been cancelled"));
        } else {
            attempt(work, promise);
        }
        return promise.future();
    }

    /**
     * Cancels this operation.
     * <p>
     * A pending retry is not run anymore and the outcome of an attempt that is currently
     * in flight is ignored. The future returned by {@link #retry(Supplier)} is failed with an
     * {@link OperationCancelledException}.
     */
    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        if (pendingTimerId != null) {
            vertx.cancelTimer(pendingTimerId);
            pendingTimerId = null;
        }
        if (result != null && result.tryFail(new OperationCancelledException(name + " has been cancelled"))) {
            LOG.debug("cancelled {} after {} attempt(s)", name, attemptCount);
        }
    }

    /**
     * Gets the number of attempts that have been made so far.
     *
     * @return The number of attempts.
     */
    public int getAttemptCount() {
        return attemptCount;
    }

    private <T> void attempt(final Supplier<Future<T>> work, final Promise<T> promise) {

        attemptCount++;
        final Future<T> attemptResult;
        try {
            attemptResult = work.get();
        } catch (final RuntimeException e) {
            onAttemptFailed(work, promise, e);
            return;
        }
        attemptResult.onComplete(ar -> {
            if (cancelled) {
                LOG.trace("ignoring outcome of attempt {} of cancelled {}", attemptCount, name);
            } else if (ar.succeeded()) {
                promise.tryComplete(ar.result());
            } else {
                onAttemptFailed(work, promise, ar.cause());
            }
        });
    }

    private <T> void onAttemptFailed(final Supplier<Future<T>> work, final Promise<T> promise, final Throwable error) {

        if (timeoutMillis <= 0 || !policy.shouldRetry(error)) {
            LOG.debug("{} failed permanently after {} attempt(s): {}", name, attemptCount, error.toString());
            promise.tryFail(error);
            return;
        }
        final long delay = policy.nextRetryTimeoutMillis(attemptCount - 1, isThrottling(error));
        final long elapsed = clock.millis() - startTimestamp;
        if (delay < 0 || elapsed + delay > timeoutMillis) {
            LOG.debug("giving up on {} after {} attempt(s) [elapsed: {}ms, next delay: {}ms, budget: {}ms]: {}",
                    name, attemptCount, elapsed, delay, timeoutMillis, error.toString());
            promise.tryFail(error);
            return;
        }
        LOG.debug("attempt {} of {} failed, retrying in {}ms: {}", attemptCount, name, delay, error.toString());
        if (delay < 1) {
            context.runOnContext(go -> {
                if (!cancelled) {
                    attempt(work, promise);
                }
            });
        } else {
            pendingTimerId = vertx.setTimer(delay, tid -> {
                pendingTimerId = null;
                if (!cancelled) {
                    attempt(work, promise);
                }
            });
        }
    }
}
