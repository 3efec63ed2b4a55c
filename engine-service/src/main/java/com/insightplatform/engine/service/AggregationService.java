package com.insightplatform.engine.service;

import com.insightplatform.common.aggregation.WeeklyAggregates;
import com.insightplatform.common.aggregation.WeeklyAggregator;
import com.insightplatform.common.aggregation.WeeklyEvents;
import com.insightplatform.common.calendar.IsoWeeks;
import com.insightplatform.common.model.ProductAggregate;
import com.insightplatform.engine.dto.AggregationReportDTO;
import com.insightplatform.engine.events.EventStream;
import com.insightplatform.engine.events.RawEventStore;
import com.insightplatform.engine.logger.PipelineFlowLogger;
import com.insightplatform.engine.repository.AggProductRepository;
import com.insightplatform.engine.repository.AggQueryRepository;
import com.insightplatform.engine.repository.AggTopicRepository;
import com.insightplatform.engine.repository.ProductRepository;
import com.insightplatform.engine.repository.StoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Weekly aggregation of a store's raw events into query, topic and product rows.
 *
 * <p>The six window reads and the catalog lookup run concurrently. All writes are
 * upserts keyed by (store, week, entity), so a re-run overwrites the same rows.
 * Product rows are only written for products already in the catalog.
 */
@Service
public class AggregationService {

    private static final Logger log = LoggerFactory.getLogger(AggregationService.class);

    private final RawEventStore rawEventStore;
    private final StoreRepository storeRepository;
    private final ProductRepository productRepository;
    private final AggQueryRepository aggQueryRepository;
    private final AggTopicRepository aggTopicRepository;
    private final AggProductRepository aggProductRepository;
    private final PipelineFlowLogger flowLogger;
    private final Clock clock;

    public AggregationService(RawEventStore rawEventStore,
                              StoreRepository storeRepository,
                              ProductRepository productRepository,
                              AggQueryRepository aggQueryRepository,
                              AggTopicRepository aggTopicRepository,
                              AggProductRepository aggProductRepository,
                              PipelineFlowLogger flowLogger,
                              Clock clock) {
        this.rawEventStore        = rawEventStore;
        this.storeRepository      = storeRepository;
        this.productRepository    = productRepository;
        this.aggQueryRepository   = aggQueryRepository;
        this.aggTopicRepository   = aggTopicRepository;
        this.aggProductRepository = aggProductRepository;
        this.flowLogger           = flowLogger;
        this.clock                = clock;
    }

    /**
     * @param anyDayOfWeek a date in the target week; {@code null} for the current week
     */
    public Mono<AggregationReportDTO> run(String storeId, LocalDate anyDayOfWeek) {
        LocalDate weekStart = anyDayOfWeek != null
            ? IsoWeeks.startOfWeek(anyDayOfWeek)
            : IsoWeeks.startOfWeek(clock.instant());
        Instant thisFrom = IsoWeeks.atStartOfDay(weekStart);
        Instant thisTo   = IsoWeeks.atStartOfDay(IsoWeeks.addDays(weekStart, 7));
        Instant prevFrom = IsoWeeks.atStartOfDay(IsoWeeks.addDays(weekStart, -7));

        log.info("Aggregation started. storeId={} weekStart={}", storeId, weekStart);

        return storeRepository.ensureExists(storeId, storeId)
            .then(Mono.zip(
                productRepository.findWineries(storeId).collectList(),
                read(EventStream.SEARCH, storeId, thisFrom, thisTo),
                read(EventStream.SEARCH, storeId, prevFrom, thisFrom),
                read(EventStream.CLICK, storeId, thisFrom, thisTo),
                read(EventStream.CLICK, storeId, prevFrom, thisFrom),
                read(EventStream.PURCHASE, storeId, thisFrom, thisTo),
                read(EventStream.PURCHASE, storeId, prevFrom, thisFrom)))
            .map(t -> {
                WeeklyEvents events = new WeeklyEvents(t.getT2(), t.getT3(), t.getT4(), t.getT5(), t.getT6(), t.getT7());
                log.debug("Raw events read. storeId={} weekStart={} searches={}/{} clicks={}/{} purchases={}/{}",
                          storeId, weekStart,
                          events.searchesThisWeek().size(), events.searchesPrevWeek().size(),
                          events.clicksThisWeek().size(), events.clicksPrevWeek().size(),
                          events.purchasesThisWeek().size(), events.purchasesPrevWeek().size());
                return WeeklyAggregator.aggregate(events, t.getT1());
            })
            .flatMap(aggregates -> persist(storeId, weekStart, aggregates))
            .doOnEach(flowLogger.stage(PipelineFlowLogger.AGGREGATION_COMPLETED))
            .doOnSuccess(r -> log.info("Aggregation completed. storeId={} weekStart={} queries={} topics={} products={} productsSkipped={}",
                                       storeId, weekStart, r.queriesUpserted(), r.topicsUpserted(),
                                       r.productsUpserted(), r.productsSkipped()))
            .doOnError(e -> log.error("Aggregation failed. storeId={} weekStart={}", storeId, weekStart, e));
    }

    private Mono<List<Map<String, Object>>> read(EventStream stream, String storeId, Instant from, Instant to) {
        return rawEventStore.readWindow(stream, storeId, from, to).collectList();
    }

    // ── persistence ────────────────────────────────────────────────────────

    private Mono<AggregationReportDTO> persist(String storeId, LocalDate weekStart, WeeklyAggregates aggregates) {
        Mono<Long> queries = Flux.fromIterable(aggregates.queries())
            .concatMap(q -> aggQueryRepository.upsert(storeId, weekStart, q.queryNorm(),
                q.searches(), q.clicks(), q.purchases(),
                q.ctr(), q.conversionRate(), q.deltaWoW(), q.avgResultsCount()).thenReturn(q))
            .count();

        Mono<Long> topics = Flux.fromIterable(aggregates.topics())
            .concatMap(t -> aggTopicRepository.upsert(storeId, weekStart, t.topic(),
                t.searches(), t.clicks(), t.purchases(),
                t.ctr(), t.conversionRate(), t.deltaWoW()).thenReturn(t))
            .count();

        Mono<Long> products = Flux.fromIterable(aggregates.products())
            .concatMap(p -> productRepository.existsByStoreIdAndProductId(storeId, p.productId())
                .filter(Boolean::booleanValue)
                .flatMap(exists -> upsertProduct(storeId, weekStart, p)))
            .count();

        return queries.flatMap(q -> topics.flatMap(t -> products.map(p -> new AggregationReportDTO(
            storeId, weekStart,
            q.intValue(), t.intValue(), p.intValue(),
            aggregates.products().size() - p.intValue(),
            aggregates.summary()))));
    }

    private Mono<ProductAggregate> upsertProduct(String storeId, LocalDate weekStart, ProductAggregate p) {
        return aggProductRepository.upsert(storeId, weekStart, p.productId(),
                p.views(), p.purchases(), p.revenueCents(), p.deltaWoW())
            .thenReturn(p);
    }
}
