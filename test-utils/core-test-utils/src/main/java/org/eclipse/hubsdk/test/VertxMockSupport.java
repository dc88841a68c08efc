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

package org.eclipse.hubsdk.test;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.concurrent.atomic.AtomicLong;

import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;

import io.vertx.core.Context;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;

/**
 * Mocks of the Vert.x types that sessions, retry operations and clients run on.
 * <p>
 * The mocks execute everything synchronously on the test's thread, so a test can
 * drive a state machine step by step and assert on its state in between.
 */
public final class VertxMockSupport {

    private VertxMockSupport() {
        // prevent instantiation
    }

    /**
     * Creates a Vert.x instance whose context runs every task right away.
     *
     * @return The instance. Timers are not mocked, see {@link #runTimersImmediately(Vertx)}
     *         and {@link #captureTimers(Vertx)}.
     */
    public static Vertx mockVertx() {
        final Vertx vertx = mock(Vertx.class);
        final Context context = mock(Context.class);
        when(context.owner()).thenReturn(vertx);
        doAnswer(invocation -> {
            final Handler<Void> task = invocation.getArgument(0);
            task.handle(null);
            return null;
        }).when(context).runOnContext(anyHandler());
        when(vertx.getOrCreateContext()).thenReturn(context);
        return vertx;
    }

    /**
     * Makes timers fire as soon as they are set, regardless of their delay.
     *
     * @param vertx The instance created by {@link #mockVertx()}.
     */
    public static void runTimersImmediately(final Vertx vertx) {
        final AtomicLong timerIds = new AtomicLong();
        when(vertx.setTimer(anyLong(), anyHandler())).thenAnswer(invocation -> {
            final Handler<Long> task = invocation.getArgument(1);
            final long id = timerIds.incrementAndGet();
            task.handle(id);
            return id;
        });
    }

    /**
     * Records timers instead of firing them.
     *
     * @param vertx The instance created by {@link #mockVertx()}.
     * @return The record, which lets the test inspect the delays and fire the timers.
     */
    public static MockTimers captureTimers(final Vertx vertx) {
        final MockTimers timers = new MockTimers();
        when(vertx.setTimer(anyLong(), anyHandler())).thenAnswer(invocation -> timers.add(
                invocation.getArgument(0),
                invocation.getArgument(1)));
        when(vertx.cancelTimer(anyLong())).thenAnswer(invocation -> timers.cancel(invocation.getArgument(0)));
        return timers;
    }

    /**
     * Matches any non-null handler.
     *
     * @param <T> The type of event the handler accepts.
     * @return {@code null}, as any Mockito matcher.
     */
    @SuppressWarnings("unchecked")
    public static <T> Handler<T> anyHandler() {
        return ArgumentMatchers.any(Handler.class);
    }

    /**
     * Creates a handler that records the events it receives.
     *
     * @param <T> The type of event the handler accepts.
     * @return The handler mock.
     */
    @SuppressWarnings("unchecked")
    public static <T> Handler<T> mockHandler() {
        return mock(Handler.class);
    }

    /**
     * Creates a captor for handlers registered by the code under test.
     *
     * @param <T> The type of event the handler accepts.
     * @return The captor.
     */
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public static <T> ArgumentCaptor<Handler<T>> argumentCaptorHandler() {
        return (ArgumentCaptor) ArgumentCaptor.forClass(Handler.class);
    }
}
