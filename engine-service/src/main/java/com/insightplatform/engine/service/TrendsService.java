package com.insightplatform.engine.service;

import com.insightplatform.common.aggregation.RawEventFields;
import com.insightplatform.common.calendar.IsoWeeks;
import com.insightplatform.common.model.CtaType;
import com.insightplatform.common.model.EntityType;
import com.insightplatform.common.model.InsightChannel;
import com.insightplatform.common.trends.QueryTimeSeries;
import com.insightplatform.common.trends.SearchEvent;
import com.insightplatform.common.trends.TimeSeriesBuilder;
import com.insightplatform.common.trends.TrendInsight;
import com.insightplatform.common.trends.TrendsAnalyzer;
import com.insightplatform.common.trends.TrendsConfig;
import com.insightplatform.engine.dto.TrendsReportDTO;
import com.insightplatform.engine.events.EventStream;
import com.insightplatform.engine.events.RawEventStore;
import com.insightplatform.engine.logger.PipelineFlowLogger;
import com.insightplatform.engine.repository.InsightRepository;
import com.insightplatform.engine.repository.StoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Standalone trends job: mines every search event of a store (or of all tenants for
 * {@link RawEventStore#GLOBAL_STORE_ID}) and replaces the trends channel of the
 * current week.
 *
 * <p>The replace is a full recompute: ACTIVE trends-channel rows of the week are deleted
 * and the new list is written in one transaction. Store-channel insights and rows that
 * already received feedback are left alone.
 */
@Service
public class TrendsService {

    private static final Logger log = LoggerFactory.getLogger(TrendsService.class);

    private static final List<String> TRENDS_CTA_TYPES = CtaType.forChannel(InsightChannel.TRENDS).stream()
        .map(Enum::name)
        .toList();

    private final RawEventStore rawEventStore;
    private final StoreRepository storeRepository;
    private final InsightRepository insightRepository;
    private final TransactionalOperator transactionalOperator;
    private final TrendsConfig config;
    private final EvidenceJson evidenceJson;
    private final PipelineFlowLogger flowLogger;
    private final Clock clock;

    public TrendsService(RawEventStore rawEventStore,
                         StoreRepository storeRepository,
                         InsightRepository insightRepository,
                         TransactionalOperator transactionalOperator,
                         TrendsConfig config,
                         EvidenceJson evidenceJson,
                         PipelineFlowLogger flowLogger,
                         Clock clock) {
        this.rawEventStore         = rawEventStore;
        this.storeRepository       = storeRepository;
        this.insightRepository     = insightRepository;
        this.transactionalOperator = transactionalOperator;
        this.config                = config;
        this.evidenceJson          = evidenceJson;
        this.flowLogger            = flowLogger;
        this.clock                 = clock;
    }

    public Mono<TrendsReportDTO> run(String storeId) {
        Instant now = clock.instant();
        LocalDate weekStart = IsoWeeks.startOfWeek(now);
        log.info("Trends run started. storeId={} weekStart={}", storeId, weekStart);

        return rawEventStore.readAll(EventStream.SEARCH, storeId)
            .map(TrendsService::toSearchEvent)
            .collectList()
            .flatMap(events -> {
                SortedMap<String, QueryTimeSeries> series = TimeSeriesBuilder.build(events);
                List<TrendInsight> insights = TrendsAnalyzer.distinctByEntity(
                    TrendsAnalyzer.analyze(series, config, now));
                log.info("Trends analyzed. storeId={} events={} uniqueQueries={} insights={}",
                         storeId, events.size(), series.size(), insights.size());

                return storeRepository.ensureExists(storeId, storeName(storeId))
                    .then(replace(storeId, weekStart, insights))
                    .map(counts -> new TrendsReportDTO(storeId, weekStart, events.size(), series.size(),
                                                       counts[0], counts[1]));
            })
            .doOnEach(flowLogger.stage(PipelineFlowLogger.TRENDS_REPLACED))
            .doOnError(e -> log.error("Trends run failed. storeId={} weekStart={}", storeId, weekStart, e));
    }

    /** @return {deleted, saved} */
    private Mono<int[]> replace(String storeId, LocalDate weekStart, List<TrendInsight> insights) {
        Mono<int[]> work = insightRepository.deleteActiveByStoreWeekAndCtaTypes(storeId, weekStart, TRENDS_CTA_TYPES)
            .defaultIfEmpty(0)
            .flatMap(deleted -> Flux.range(0, insights.size())
                .concatMap(i -> save(storeId, weekStart, insights.get(i), i + 1).thenReturn(i))
                .count()
                .map(saved -> new int[] {deleted, saved.intValue()}));
        return transactionalOperator.transactional(work);
    }

    private Mono<Void> save(String storeId, LocalDate weekStart, TrendInsight insight, int priority) {
        return insightRepository.upsert(storeId, weekStart, insight.type().name(),
            EntityType.QUERY.key(), insight.entityKey(), priority, insight.confidence(),
            evidenceJson.write(TrendsConfig.STAGE, insight.evidence()), insight.recommendedAction());
    }

    static SearchEvent toSearchEvent(Map<String, Object> doc) {
        return new SearchEvent(RawEventFields.displayQuery(doc), RawEventFields.timestamp(doc).orElse(null));
    }

    private static String storeName(String storeId) {
        return RawEventStore.GLOBAL_STORE_ID.equals(storeId) ? "Global Trends" : storeId;
    }
}
