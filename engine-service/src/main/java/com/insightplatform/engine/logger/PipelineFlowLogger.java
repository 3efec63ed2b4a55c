package com.insightplatform.engine.logger;

import com.insightplatform.common.trace.RunContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs stage transitions of the weekly pipeline and the trends job. Pure side-effects.
 *
 * <p>Stages, in pipeline order:
 * <ol>
 *   <li>{@link #AGGREGATION_COMPLETED}: aggregate rows upserted for the week</li>
 *   <li>{@link #SIGNALS_DETECTED}:      signals detected and upserted</li>
 *   <li>{@link #INSIGHTS_SELECTED}:     CTAs selected, insights and cooldowns written</li>
 *   <li>{@link #TRENDS_REPLACED}:       trends channel recomputed for the week</li>
 * </ol>
 *
 * <p>Usage:
 * <pre>
 *     .doOnEach(pipelineFlowLogger.stage(PipelineFlowLogger.SIGNALS_DETECTED))
 * </pre>
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String AGGREGATION_COMPLETED = "AGGREGATION_COMPLETED";
    public static final String SIGNALS_DETECTED      = "SIGNALS_DETECTED";
    public static final String INSIGHTS_SELECTED     = "INSIGHTS_SELECTED";
    public static final String TRENDS_REPLACED       = "TRENDS_REPLACED";

    /**
     * Returns a {@code doOnEach} consumer logging {@code stageName} with the element on
     * {@code onNext}. runId is read from the Reactor Context of the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = RunContextUtil.getRunId(signal.getContextView());
            RunContextUtil.withMdc(runId, () ->
                log.info("[PipelineFlow] stage={} runId={} result={}", stageName, runId, signal.get())
            );
        };
    }
}
