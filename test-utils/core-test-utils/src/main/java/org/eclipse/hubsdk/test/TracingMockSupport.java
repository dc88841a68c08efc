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

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.mockito.Mockito;

import io.opentracing.Span;
import io.opentracing.SpanContext;
import io.opentracing.Tracer;
import io.opentracing.Tracer.SpanBuilder;
import io.opentracing.tag.Tags;

/**
 * Mocks of the OpenTracing types that the device client creates spans with.
 */
public final class TracingMockSupport {

    private TracingMockSupport() {
        // prevent instantiation
    }

    /**
     * Creates a span whose context reports fixed trace and span identifiers.
     *
     * @return The span. All fluent methods return the span itself.
     */
    public static Span mockSpan() {
        final SpanContext spanContext = mock(SpanContext.class);
        when(spanContext.toTraceId()).thenReturn("test-trace");
        when(spanContext.toSpanId()).thenReturn("test-span");
        final Span span = mock(Span.class, Mockito.RETURNS_SELF);
        when(span.context()).thenReturn(spanContext);
        return span;
    }

    /**
     * Creates a tracer that hands out the same span for every operation.
     *
     * @param spanToBuild The span that every builder starts.
     * @return The tracer.
     */
    public static Tracer mockTracer(final Span spanToBuild) {
        final SpanBuilder spanBuilder = mock(SpanBuilder.class, Mockito.RETURNS_SELF);
        when(spanBuilder.start()).thenReturn(spanToBuild);
        final Tracer tracer = mock(Tracer.class);
        when(tracer.buildSpan(anyString())).thenReturn(spanBuilder);
        return tracer;
    }

    /**
     * Verifies that a span has been marked as failed and that the failure has been logged on it.
     *
     * @param span The span created by {@link #mockSpan()}.
     */
    public static void verifyErrorLogged(final Span span) {
        verify(span, atLeastOnce()).setTag(eq(Tags.ERROR.getKey()), eq(true));
        verify(span, atLeastOnce()).log(anyMap());
    }
}
