package com.whatifplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Lightweight reactive tracing utility. The trace id of a simulation is its scenario id.
 *
 * <p>Reactor Context is the single source of truth for the trace id inside reactive pipelines.
 * MDC is only ever written as a temporary bridge during a log statement, never as a
 * persistent ThreadLocal store.
 *
 * <p>Usage pattern in reactive chains:
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, scenario.scenarioId());
 * </pre>
 *
 * <p>Usage pattern inside doOnEach:
 * <pre>
 *     signal -> TraceContextUtil.getTraceId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context so every operator upstream of
     * {@code contextWrite} can read it via {@link #getTraceId(ContextView)}.
     *
     * <p>{@code contextWrite} propagates upstream during subscription,
     * so call this at the end of the pipeline assembly.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /**
     * Retrieves the trace id from the Reactor {@link ContextView}.
     * Returns {@code "unknown"} if not present, never {@code null}.
     */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /**
     * Temporarily bridges {@code traceId} into MDC for the duration of {@code logAction},
     * then removes the MDC entry. Only use this inside logging side-effects.
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
