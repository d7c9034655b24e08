package com.signalplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Reactive trace-id propagation.
 *
 * <p>The Reactor Context holds the traceId for the lifetime of a pipeline invocation.
 * MDC is written only around a single log statement via {@link #withMdc}, never left
 * populated on a pooled thread.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. {@code contextWrite}
     * propagates upstream, so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** @return the traceId from {@code ctx}, or {@code "unknown"}; never {@code null} */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code traceId} into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
