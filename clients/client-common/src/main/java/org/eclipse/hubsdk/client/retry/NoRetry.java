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
 * A policy that never retries.
 *
 */
public final class NoRetry implements RetryPolicy {

    /**
     * {@inheritDoc}
     *
     * @return Always {@code false}.
     */
    @Override
    public boolean shouldRetry(final Throwable error) {
        return false;
    }

    /**
     * {@inheritDoc}
     *
     * @return Always -1.
     */
    @Override
    public long nextRetryTimeoutMillis(final int attemptCount, final boolean throttled) {
        return -1;
    }
}
