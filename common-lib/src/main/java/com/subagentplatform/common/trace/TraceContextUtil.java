package com.subagentplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the batch identifier through reactive pipelines.
 *
 * <p>Reactor Context is the single source of truth for {@code batchId} inside a batch.
 * MDC is only written as a temporary bridge during a log statement, never as a persistent
 * ThreadLocal store.
 *
 * <pre>
 *     return TraceContextUtil.withBatchId(pipeline, batchId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String BATCH_ID_KEY = "batchId";

    private TraceContextUtil() {}

    /**
     * Stores {@code batchId} in the Reactor Context. {@code contextWrite} propagates upstream
     * during subscription, so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withBatchId(Mono<T> mono, String batchId) {
        return mono.contextWrite(ctx -> ctx.put(BATCH_ID_KEY, batchId));
    }

    /**
     * @return the batchId, or {@code "unknown"} if not present; never {@code null}
     */
    public static String getBatchId(ContextView ctx) {
        return ctx.getOrDefault(BATCH_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code batchId} into MDC for the duration of {@code logAction}, then removes it.
     * Only use this around logging side-effects.
     */
    public static void withMdc(String batchId, Runnable logAction) {
        MDC.put(BATCH_ID_KEY, batchId);
        try {
            logAction.run();
        } finally {
            MDC.remove(BATCH_ID_KEY);
        }
    }
}
