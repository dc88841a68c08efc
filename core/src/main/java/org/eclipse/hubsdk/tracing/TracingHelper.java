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

package org.eclipse.hubsdk.tracing;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentracing.Span;
import io.opentracing.SpanContext;
import io.opentracing.Tracer;
import io.opentracing.log.Fields;
import io.opentracing.tag.IntTag;
import io.opentracing.tag.StringTag;
import io.opentracing.tag.Tags;

/**
 * Span creation and error reporting for the operations a device client performs.
 */
public final class TracingHelper {

    /**
     * The device that an operation is performed for.
     */
    public static final StringTag TAG_DEVICE_ID = new StringTag("device_id");
    /**
     * The module that an operation is performed for.
     */
    public static final StringTag TAG_MODULE_ID = new StringTag("module_id");
    /**
     * The number of attempts that an operation took until it completed.
     */
    public static final IntTag TAG_ATTEMPT = new IntTag("attempt");
    /**
     * The span log field carrying the cause of a failure.
     */
    public static final String ERROR_CAUSE_OBJECT = "error.cause.object";

    private static final Logger LOG = LoggerFactory.getLogger(TracingHelper.class);
    private static final String SDK_PACKAGE_PREFIX = "org.eclipse.hubsdk.";

    private TracingHelper() {
        // prevent instantiation
    }

    /**
     * Creates a builder for the span of an operation invoked on the hub.
     *
     * @param tracer The tracer to create the span with.
     * @param parent The context of the span to create a child of or {@code null}.
     * @param operationName The operation's name.
     * @param component The name of the component invoking the operation.
     * @return The builder.
     * @throws NullPointerException if tracer or operation name are {@code null}.
     */
    public static Tracer.SpanBuilder buildClientChildSpan(
            final Tracer tracer,
            final SpanContext parent,
            final String operationName,
            final String component) {

        Objects.requireNonNull(tracer);
        Objects.requireNonNull(operationName);

        final Tracer.SpanBuilder builder = tracer.buildSpan(operationName)
                .ignoreActiveSpan()
                .withTag(Tags.SPAN_KIND.getKey(), Tags.SPAN_KIND_CLIENT)
                .withTag(Tags.COMPONENT.getKey(), component);
        return parent == null ? builder : builder.asChildOf(parent);
    }

    /**
     * Tags a span with the identity of the device or module.
     *
     * @param span The span or {@code null}.
     * @param deviceId The device identifier or {@code null}.
     * @param moduleId The module identifier or {@code null}.
     */
    public static void setDeviceTags(final Span span, final String deviceId, final String moduleId) {
        if (span == null) {
            return;
        }
        if (deviceId != null) {
            TAG_DEVICE_ID.set(span, deviceId);
        }
        if (moduleId != null) {
            TAG_MODULE_ID.set(span, moduleId);
        }
    }

    /**
     * Marks a span as failed and logs the failure on it.
     * <p>
     * The span is not finished. Failures that point at a programming error
     * are also logged at WARN level.
     *
     * @param span The span or {@code null}.
     * @param error The failure.
     * @throws NullPointerException if error is {@code null}.
     */
    public static void logError(final Span span, final Throwable error) {
        Objects.requireNonNull(error);

        if (error instanceof NullPointerException || error instanceof IllegalStateException) {
            if (span == null) {
                LOG.warn("operation failed unexpectedly", error);
            } else {
                LOG.warn("operation failed unexpectedly [trace: {}, span: {}]",
                        span.context().toTraceId(), span.context().toSpanId(), error);
            }
        }
        if (span == null) {
            return;
        }
        final Map<String, Object> items = new HashMap<>(4);
        items.put(Fields.EVENT, Tags.ERROR.getKey());
        if (error.getMessage() != null) {
            items.put(Fields.MESSAGE, error.getMessage());
        }
        // the SDK's own exceptions carry all relevant information in their message
        items.put(Fields.ERROR_OBJECT, error.getClass().getName().startsWith(SDK_PACKAGE_PREFIX)
                ? error.toString()
                : error);
        if (error.getCause() != null) {
            items.put(ERROR_CAUSE_OBJECT, error.getCause());
        }
        span.setTag(Tags.ERROR.getKey(), true);
        span.log(items);
    }
}
