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

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import org.eclipse.hubsdk.client.ServiceInvocationException;
import org.eclipse.hubsdk.client.util.StatusCodeMapper;

/**
 * The default classification of errors into transient and permanent ones.
 * <p>
 * The following errors are considered transient:
 * <ul>
 * <li>network problems ({@link IOException} and sub-classes)</li>
 * <li>timeouts ({@link TimeoutException}, status codes 408 and 504)</li>
 * <li>throttling (status code 429)</li>
 * <li>unavailability of the service (status codes 500 and 503)</li>
 * </ul>
 * Any other error, most notably authorization (401, 403), not found (404),
 * conflicts (409, 412) and invalid requests (400, 413, {@link IllegalArgumentException}),
 * is considered permanent.
 */
public class DefaultErrorFilter implements Predicate<Throwable> {

    /**
     * Checks if an error is transient.
     *
     * @param error The error to check.
     * @return {@code true} if an operation that failed with the error may succeed when retried.
     */
    @Override
    public boolean test(final Throwable error) {
        if (error == null) {
            return false;
        }
        if (error instanceof ServiceInvocationException) {
            return StatusCodeMapper.isTransient(((ServiceInvocationException) error).getErrorCode());
        }
        Throwable t = error;
        while (t != null) {
            if (t instanceof IOException || t instanceof TimeoutException) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }
}
