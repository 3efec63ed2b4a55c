package com.insightplatform.engine.service;

import com.insightplatform.common.model.DetectedSignal;
import com.insightplatform.common.model.QueryAggregate;
import com.insightplatform.common.model.TopicAggregate;
import com.insightplatform.common.signal.SignalDetector;
import com.insightplatform.common.signal.SignalThresholds;
import com.insightplatform.engine.dto.SignalsReportDTO;
import com.insightplatform.engine.logger.PipelineFlowLogger;
import com.insightplatform.engine.model.AggQuery;
import com.insightplatform.engine.model.AggTopic;
import com.insightplatform.engine.repository.AggQueryRepository;
import com.insightplatform.engine.repository.AggTopicRepository;
import com.insightplatform.engine.repository.SignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

/**
 * Detects signals on an already aggregated store week and upserts them.
 */
@Service
public class SignalService {

    private static final Logger log = LoggerFactory.getLogger(SignalService.class);

    private final AggQueryRepository aggQueryRepository;
    private final AggTopicRepository aggTopicRepository;
    private final SignalRepository signalRepository;
    private final SignalThresholds thresholds;
    private final EvidenceJson evidenceJson;
    private final PipelineFlowLogger flowLogger;

    public SignalService(AggQueryRepository aggQueryRepository,
                         AggTopicRepository aggTopicRepository,
                         SignalRepository signalRepository,
                         SignalThresholds thresholds,
                         EvidenceJson evidenceJson,
                         PipelineFlowLogger flowLogger) {
        this.aggQueryRepository = aggQueryRepository;
        this.aggTopicRepository = aggTopicRepository;
        this.signalRepository   = signalRepository;
        this.thresholds         = thresholds;
        this.evidenceJson       = evidenceJson;
        this.flowLogger         = flowLogger;
    }

    public Mono<SignalsReportDTO> run(String storeId, LocalDate weekStart) {
        log.info("Signal detection started. storeId={} weekStart={}", storeId, weekStart);

        return Mono.zip(
                aggQueryRepository.findByStoreIdAndWeekStart(storeId, weekStart).map(SignalService::toQuery).collectList(),
                aggTopicRepository.findByStoreIdAndWeekStart(storeId, weekStart).map(SignalService::toTopic).collectList())
            .map(t -> SignalDetector.detect(t.getT1(), t.getT2(), weekStart, thresholds))
            .flatMap(signals -> persist(storeId, weekStart, signals)
                .map(upserted -> new SignalsReportDTO(storeId, weekStart, signals.size(), upserted)))
            .doOnEach(flowLogger.stage(PipelineFlowLogger.SIGNALS_DETECTED))
            .doOnSuccess(r -> log.info("Signals persisted. storeId={} weekStart={} detected={} upserted={}",
                                       storeId, weekStart, r.signalsDetected(), r.signalsUpserted()))
            .doOnError(e -> log.error("Signal detection failed. storeId={} weekStart={}", storeId, weekStart, e));
    }

    private Mono<Integer> persist(String storeId, LocalDate weekStart, List<DetectedSignal> signals) {
        return Flux.fromIterable(signals)
            .concatMap(s -> signalRepository.upsert(storeId, weekStart, s.type().name(),
                    s.entityType().key(), s.entityKey(), s.confidence(),
                    evidenceJson.write(SignalThresholds.STAGE, s.evidence()))
                .thenReturn(s))
            .count()
            .map(Long::intValue);
    }

    // ── row mapping ────────────────────────────────────────────────────────

    static QueryAggregate toQuery(AggQuery row) {
        return new QueryAggregate(row.getQueryNorm(), row.getSearches(), row.getClicks(), row.getPurchases(),
            row.getCtr(), row.getConversionRate(), row.getDeltaWoW(), row.getAvgResultsCount());
    }

    static TopicAggregate toTopic(AggTopic row) {
        return new TopicAggregate(row.getTopic(), row.getSearches(), row.getClicks(), row.getPurchases(),
            row.getCtr(), row.getConversionRate(), row.getDeltaWoW());
    }
}
