package com.insightplatform.engine.service;

import com.insightplatform.common.calendar.IsoWeeks;
import com.insightplatform.common.trace.RunContextUtil;
import com.insightplatform.engine.dto.AggregationReportDTO;
import com.insightplatform.engine.dto.DecisionsReportDTO;
import com.insightplatform.engine.dto.PipelineReportDTO;
import com.insightplatform.engine.dto.SignalsReportDTO;
import com.insightplatform.engine.dto.TrendsReportDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Entry point for every job. Each run gets a fresh runId in its Reactor Context.
 *
 * <p>Stages only read the committed output of the stage before, so they can also be
 * run one at a time with any delay between them.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final AggregationService aggregationService;
    private final SignalService signalService;
    private final DecisionService decisionService;
    private final TrendsService trendsService;

    public PipelineService(AggregationService aggregationService,
                           SignalService signalService,
                           DecisionService decisionService,
                           TrendsService trendsService) {
        this.aggregationService = aggregationService;
        this.signalService      = signalService;
        this.decisionService    = decisionService;
        this.trendsService      = trendsService;
    }

    public Mono<AggregationReportDTO> runAggregations(String storeId, LocalDate anyDayOfWeek) {
        return RunContextUtil.withRunId(aggregationService.run(storeId, anyDayOfWeek), RunContextUtil.newRunId());
    }

    public Mono<SignalsReportDTO> runSignals(String storeId, LocalDate anyDayOfWeek) {
        return RunContextUtil.withRunId(
            signalService.run(storeId, IsoWeeks.startOfWeek(anyDayOfWeek)), RunContextUtil.newRunId());
    }

    public Mono<DecisionsReportDTO> runDecisions(String storeId, LocalDate anyDayOfWeek) {
        return RunContextUtil.withRunId(
            decisionService.run(storeId, IsoWeeks.startOfWeek(anyDayOfWeek)), RunContextUtil.newRunId());
    }

    /**
     * Aggregation, signal detection and decision selection in order, for one store and week.
     */
    public Mono<PipelineReportDTO> runPipeline(String storeId, LocalDate anyDayOfWeek) {
        String runId = RunContextUtil.newRunId();
        log.info("Pipeline run started. storeId={} runId={}", storeId, runId);

        Mono<PipelineReportDTO> pipeline = aggregationService.run(storeId, anyDayOfWeek)
            .flatMap(agg -> signalService.run(storeId, agg.weekStart())
                .flatMap(signals -> decisionService.run(storeId, agg.weekStart())
                    .map(decisions -> new PipelineReportDTO(runId, agg, signals, decisions))))
            .doOnSuccess(r -> log.info("Pipeline run completed. storeId={} weekStart={} insights={} runId={}",
                                       storeId, r.aggregation().weekStart(), r.decisions().selected(), runId))
            .doOnError(e -> log.error("Pipeline run failed. storeId={} runId={}", storeId, runId, e));

        return RunContextUtil.withRunId(pipeline, runId);
    }

    public Mono<TrendsReportDTO> runTrends(String storeId) {
        return RunContextUtil.withRunId(trendsService.run(storeId), RunContextUtil.newRunId());
    }
}
