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

/**
 * A strategy for deciding whether and when a failed operation should be retried.
 * <p>
 * Implementations must not keep any mutable state so that the same instance can
 * be shared by any number of concurrently running operations.
 */
public interface RetryPolicy {

    /**
     * Checks if an operation that has failed with a given error should be retried.
     * <p>
     * The outcome depends on the error only, i.e. invoking this method repeatedly with
     * the same error always yields the same result.
     *
     * @param error The error that the operation has failed with.
     * @return {@code true} if the operation should be retried.
     */
    boolean shouldRetry(Throwable error);

    /**
     * Gets the time to wait before the next attempt to perform an operation.
     *
     * @param attemptCount The number of retries that have already been made,
     *                     i.e. 0 for the first retry.
     * @param throttled {@code true} if the last attempt has failed because the
     *                  service is throttling requests.
     * @return The number of milliseconds to wait or a negative value if the operation
     *         should not be retried at all.
     */
    long nextRetryTimeoutMillis(int attemptCount, boolean throttled);
}
