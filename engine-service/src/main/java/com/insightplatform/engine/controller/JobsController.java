package com.insightplatform.engine.controller;

import com.insightplatform.engine.dto.AggregationReportDTO;
import com.insightplatform.engine.dto.DecisionsReportDTO;
import com.insightplatform.engine.dto.JobRequestDTO;
import com.insightplatform.engine.dto.PipelineReportDTO;
import com.insightplatform.engine.dto.SignalsReportDTO;
import com.insightplatform.engine.dto.TrendsReportDTO;
import com.insightplatform.engine.service.PipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/jobs")
public class JobsController {

    private static final Logger log = LoggerFactory.getLogger(JobsController.class);

    private final PipelineService pipelineService;

    @Value("${insight.trends.store-id:global}")
    private String defaultTrendsStoreId;

    public JobsController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @PostMapping("/run-aggregations")
    public Mono<ResponseEntity<AggregationReportDTO>> runAggregations(@RequestBody JobRequestDTO body) {
        log.info("Aggregation job received. storeId={} weekStart={}", body.storeId(), body.weekStart());
        return requireStore(body)
            .then(Mono.defer(() -> pipelineService.runAggregations(body.storeId(), body.weekStart())))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Aggregation job error. storeId={}", body.storeId(), e));
    }

    @PostMapping("/run-signals")
    public Mono<ResponseEntity<SignalsReportDTO>> runSignals(@RequestBody JobRequestDTO body) {
        log.info("Signals job received. storeId={} weekStart={}", body.storeId(), body.weekStart());
        return requireStoreAndWeek(body)
            .then(Mono.defer(() -> pipelineService.runSignals(body.storeId(), body.weekStart())))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Signals job error. storeId={}", body.storeId(), e));
    }

    @PostMapping("/run-decisions")
    public Mono<ResponseEntity<DecisionsReportDTO>> runDecisions(@RequestBody JobRequestDTO body) {
        log.info("Decisions job received. storeId={} weekStart={}", body.storeId(), body.weekStart());
        return requireStoreAndWeek(body)
            .then(Mono.defer(() -> pipelineService.runDecisions(body.storeId(), body.weekStart())))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Decisions job error. storeId={}", body.storeId(), e));
    }

    @PostMapping("/run-pipeline")
    public Mono<ResponseEntity<PipelineReportDTO>> runPipeline(@RequestBody JobRequestDTO body) {
        log.info("Pipeline job received. storeId={} weekStart={}", body.storeId(), body.weekStart());
        return requireStore(body)
            .then(Mono.defer(() -> pipelineService.runPipeline(body.storeId(), body.weekStart())))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Pipeline job error. storeId={}", body.storeId(), e));
    }

    @PostMapping("/run-trends")
    public Mono<ResponseEntity<TrendsReportDTO>> runTrends(@RequestBody(required = false) JobRequestDTO body) {
        String storeId = body != null && body.storeId() != null && !body.storeId().isBlank()
            ? body.storeId()
            : defaultTrendsStoreId;
        log.info("Trends job received. storeId={}", storeId);
        return pipelineService.runTrends(storeId)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Trends job error. storeId={}", storeId, e));
    }

    // ── request validation ─────────────────────────────────────────────────

    private static Mono<Void> requireStore(JobRequestDTO body) {
        if (body.storeId() == null || body.storeId().isBlank()) {
            return Mono.error(new IllegalArgumentException("storeId is required"));
        }
        return Mono.empty();
    }

    private static Mono<Void> requireStoreAndWeek(JobRequestDTO body) {
        if (body.weekStart() == null) {
            return Mono.error(new IllegalArgumentException("weekStart is required"));
        }
        return requireStore(body);
    }
}
