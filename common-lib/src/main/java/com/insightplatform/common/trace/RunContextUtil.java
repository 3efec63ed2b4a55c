package com.insightplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a job {@code runId} through reactive pipelines.
 *
 * <p>Reactor Context is the only store for runId inside a pipeline. MDC is written
 * just for the duration of a log statement via {@link #withMdc}, then cleared.
 *
 * <pre>
 *     return RunContextUtil.withRunId(pipeline, RunContextUtil.newRunId());
 * </pre>
 */
public final class RunContextUtil {

    public static final String RUN_ID_KEY = "runId";

    private RunContextUtil() {}

    public static String newRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores {@code runId} in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly; {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** runId from the context, {@code "unknown"} when absent. */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code runId} into MDC while {@code logAction} runs. Logging side-effects only.
     */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
