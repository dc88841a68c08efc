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

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * A retry policy using exponential back off with jitter.
 * <p>
 * The time to wait before retry <em>x</em> (starting at 0) is computed as
 * <pre>
 * F(x) = min(cMin + (2^x - 1) * rand(c * (1 - jd), c * (1 - ju)), cMax)
 * </pre>
 * where {@code rand(a, b)} is a uniformly distributed random value between a and b.
 * Different sets of constants are used for normal and for throttled failures.
 */
public class ExponentialBackoffWithJitter implements RetryPolicy {

    private final Parameters normalParameters;
    private final Parameters throttledParameters;
    private final boolean immediateFirstRetry;
    private final Predicate<Throwable> errorFilter;
    private final DoubleSupplier random;

    /**
     * Creates a new policy that retries immediately on the first non-throttled failure
     * and uses the {@link DefaultErrorFilter}.
     */
    public ExponentialBackoffWithJitter() {
        this(true, new DefaultErrorFilter());
    }

    /**
     * Creates a new policy.
     *
     * @param immediateFirstRetry {@code true} if the first retry of a non-throttled failure
     *                            should happen without delay.
     * @param errorFilter The filter deciding which errors are transient.
     * @throws NullPointerException if error filter is {@code null}.
     */
    public ExponentialBackoffWithJitter(final boolean immediateFirstRetry, final Predicate<Throwable> errorFilter) {
        this(immediateFirstRetry, errorFilter, Parameters.normal(), Parameters.throttled(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Creates a new policy with custom constants.
     *
     * @param immediateFirstRetry {@code true} if the first retry of a non-throttled failure
     *                            should happen without delay.
     * @param errorFilter The filter deciding which errors are transient.
     * @param normalParameters The constants to use for normal failures.
     * @param throttledParameters The constants to use for throttled failures.
     * @param random The source of random values in the range [0, 1).
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public ExponentialBackoffWithJitter(
            final boolean immediateFirstRetry,
            final Predicate<Throwable> errorFilter,
            final Parameters normalParameters,
            final Parameters throttledParameters,
            final DoubleSupplier random) {
        this.immediateFirstRetry = immediateFirstRetry;
        this.errorFilter = Objects.requireNonNull(errorFilter);
        this.normalParameters = Objects.requireNonNull(normalParameters);
        this.throttledParameters = Objects.requireNonNull(throttledParameters);
        this.random = Objects.requireNonNull(random);
    }

    @Override
    public boolean shouldRetry(final Throwable error) {
        return errorFilter.test(error);
    }

    @Override
    public long nextRetryTimeoutMillis(final int attemptCount, final boolean throttled) {
        if (immediateFirstRetry && attemptCount == 0 && !throttled) {
            return 0;
        }
        final Parameters p = throttled ? throttledParameters : normalParameters;
        final double minRandomFactor = p.c * (1 - p.jd);
        final double maxRandomFactor = p.c * (1 - p.ju);
        final double jitter = minRandomFactor + random.getAsDouble() * (maxRandomFactor - minRandomFactor);
        final double delay = p.cMin + (Math.pow(2, Math.max(0, attemptCount)) - 1) * jitter;
        return (long) Math.min(delay, p.cMax);
    }

    /**
     * The constants of the back off function.
     */
    public static final class Parameters {

        private final double c;
        private final double cMin;
        private final double cMax;
        private final double ju;
        private final double jd;

        /**
         * Creates a new set of constants.
         *
         * @param c The base factor in milliseconds.
         * @param cMin The minimum delay in milliseconds.
         * @param cMax The maximum delay in milliseconds.
         * @param ju The upper jitter factor.
         * @param jd The lower jitter factor.
         * @throws IllegalArgumentException if any of the values is negative or if cMin &gt; cMax.
         */
        public Parameters(final double c, final double cMin, final double cMax, final double ju, final double jd) {
            if (c < 0 || cMin < 0 || cMax < 0 || ju < 0 || jd < 0) {
                throw new IllegalArgumentException("back off constants must not be negative");
            }
            if (cMin > cMax) {
                throw new IllegalArgumentException("minimum delay must not exceed maximum delay");
            }
            this.c = c;
            this.cMin = cMin;
            this.cMax = cMax;
            this.ju = ju;
            this.jd = jd;
        }

        /**
         * Gets the constants used for normal failures.
         *
         * @return c=100, cMin=100, cMax=10000, ju=0.25, jd=0.5.
         */
        public static Parameters normal() {
            return new Parameters(100, 100, 10_000, 0.25, 0.5);
        }

        /**
         * Gets the constants used for throttled failures.
         *
         * @return c=5000, cMin=10000, cMax=60000, ju=0.5, jd=0.25.
         */
        public static Parameters throttled() {
            return new Parameters(5_000, 10_000, 60_000, 0.5, 0.25);
        }
    }
}
