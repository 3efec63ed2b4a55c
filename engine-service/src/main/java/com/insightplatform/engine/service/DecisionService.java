package com.insightplatform.engine.service;

import com.insightplatform.common.decision.CtaSelector;
import com.insightplatform.common.decision.DecisionConfig;
import com.insightplatform.common.decision.DecisionOutcome;
import com.insightplatform.common.model.CooldownState;
import com.insightplatform.common.model.CtaType;
import com.insightplatform.common.model.DetectedSignal;
import com.insightplatform.common.model.EntityRef;
import com.insightplatform.common.model.EntityType;
import com.insightplatform.common.model.InsightChannel;
import com.insightplatform.common.model.InsightStatus;
import com.insightplatform.common.model.SelectedInsight;
import com.insightplatform.common.model.SignalType;
import com.insightplatform.engine.dto.DecisionsReportDTO;
import com.insightplatform.engine.logger.PipelineFlowLogger;
import com.insightplatform.engine.model.Insight;
import com.insightplatform.engine.model.InsightCooldown;
import com.insightplatform.engine.model.SignalRecord;
import com.insightplatform.engine.repository.InsightCooldownRepository;
import com.insightplatform.engine.repository.InsightRepository;
import com.insightplatform.engine.repository.InventoryRepository;
import com.insightplatform.engine.repository.SignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a week's signals into ranked store-channel insights.
 *
 * <p>Entities that already hold a store insight of the same week are exempt from the
 * cooldown check, so a re-run or a retry after partial failure selects the same set.
 * The week's writes run in one local transaction: ACTIVE store insights of the week that
 * are no longer selected are removed, then every pick is upserted with its cooldown.
 */
@Service
public class DecisionService {

    private static final Logger log = LoggerFactory.getLogger(DecisionService.class);

    private static final Set<String> STORE_CTA_TYPES = CtaType.forChannel(InsightChannel.STORE).stream()
        .map(Enum::name)
        .collect(Collectors.toUnmodifiableSet());

    private final SignalRepository signalRepository;
    private final InsightCooldownRepository cooldownRepository;
    private final InventoryRepository inventoryRepository;
    private final InsightRepository insightRepository;
    private final TransactionalOperator transactionalOperator;
    private final DecisionConfig config;
    private final EvidenceJson evidenceJson;
    private final PipelineFlowLogger flowLogger;
    private final Clock clock;

    public DecisionService(SignalRepository signalRepository,
                           InsightCooldownRepository cooldownRepository,
                           InventoryRepository inventoryRepository,
                           InsightRepository insightRepository,
                           TransactionalOperator transactionalOperator,
                           DecisionConfig config,
                           EvidenceJson evidenceJson,
                           PipelineFlowLogger flowLogger,
                           Clock clock) {
        this.signalRepository      = signalRepository;
        this.cooldownRepository    = cooldownRepository;
        this.inventoryRepository   = inventoryRepository;
        this.insightRepository     = insightRepository;
        this.transactionalOperator = transactionalOperator;
        this.config                = config;
        this.evidenceJson          = evidenceJson;
        this.flowLogger            = flowLogger;
        this.clock                 = clock;
    }

    public Mono<DecisionsReportDTO> run(String storeId, LocalDate weekStart) {
        Instant now = clock.instant();
        log.info("Decision selection started. storeId={} weekStart={}", storeId, weekStart);

        return Mono.zip(
                signalRepository.findByStoreIdAndWeekStart(storeId, weekStart).map(this::toSignal).collectList(),
                cooldownRepository.findByStoreId(storeId).map(DecisionService::toCooldown).collectList(),
                inventoryRepository.existsInStock(storeId).defaultIfEmpty(false),
                insightRepository.findByStoreIdAndWeekStart(storeId, weekStart)
                    .filter(i -> STORE_CTA_TYPES.contains(i.getCtaType()))
                    .collectList())
            .flatMap(t -> {
                if (!t.getT3()) {
                    log.info("No in-stock inventory, demand pushes suppressed. storeId={}", storeId);
                }
                List<Insight> existing = t.getT4();
                DecisionOutcome outcome = CtaSelector.select(t.getT1(), t.getT2(), decidedEntities(existing),
                                                             t.getT3(), config, now);
                return persist(storeId, weekStart, outcome.selected(), staleIds(existing, outcome.selected()), now)
                    .map(upserted -> report(storeId, weekStart, outcome, upserted));
            })
            .doOnEach(flowLogger.stage(PipelineFlowLogger.INSIGHTS_SELECTED))
            .doOnSuccess(r -> log.info("Insights selected. storeId={} weekStart={} candidates={} selected={} upserted={}",
                                       storeId, weekStart, r.candidates(), r.selected(), r.insightsUpserted()))
            .doOnError(e -> log.error("Decision selection failed. storeId={} weekStart={}", storeId, weekStart, e));
    }

    private Mono<Integer> persist(String storeId, LocalDate weekStart, List<SelectedInsight> selected,
                                  List<Long> staleIds, Instant now) {
        if (selected.isEmpty() && staleIds.isEmpty()) {
            return Mono.just(0);
        }
        Mono<Void> removeStale = staleIds.isEmpty()
            ? Mono.empty()
            : insightRepository.deleteAllById(staleIds)
                .doOnSuccess(v -> log.info("Stale insights removed. storeId={} weekStart={} ids={}",
                                           storeId, weekStart, staleIds));
        Mono<Integer> writes = removeStale.then(Flux.fromIterable(selected)
            .concatMap(s -> writeInsightWithCooldown(storeId, weekStart, s, now).thenReturn(s))
            .count()
            .map(Long::intValue));
        return transactionalOperator.transactional(writes);
    }

    private Mono<Void> writeInsightWithCooldown(String storeId, LocalDate weekStart, SelectedInsight s, Instant now) {
        String entityType = s.entityType().key();
        return insightRepository.upsert(storeId, weekStart, s.ctaType().name(),
                entityType, s.entityKey(), s.priority(), s.confidence(),
                evidenceJson.write(DecisionConfig.STAGE, s.evidence()), s.recommendedAction())
            .then(cooldownRepository.markGenerated(storeId, entityType, s.entityKey(), now))
            .doOnSuccess(v -> log.debug("Insight written. storeId={} cta={} entity={}:{} priority={}",
                                        storeId, s.ctaType(), entityType, s.entityKey(), s.priority()));
    }

    // ── same-week state ────────────────────────────────────────────────────

    static Set<EntityRef> decidedEntities(List<Insight> weekInsights) {
        Set<EntityRef> decided = new HashSet<>();
        for (Insight i : weekInsights) {
            decided.add(EntityRef.of(EntityType.fromKey(i.getEntityType()), i.getEntityKey()));
        }
        return decided;
    }

    /** ACTIVE rows of the week whose (cta, entity) is not part of the new selection. */
    static List<Long> staleIds(List<Insight> weekInsights, List<SelectedInsight> selected) {
        Set<String> kept = new HashSet<>();
        for (SelectedInsight s : selected) {
            kept.add(s.ctaType().name() + "|" + s.entityType().key() + "|" + s.entityKey());
        }
        List<Long> stale = new ArrayList<>();
        for (Insight i : weekInsights) {
            if (InsightStatus.ACTIVE.name().equals(i.getStatus())
                && !kept.contains(i.getCtaType() + "|" + i.getEntityType() + "|" + i.getEntityKey())) {
                stale.add(i.getId());
            }
        }
        return stale;
    }

    private static DecisionsReportDTO report(String storeId, LocalDate weekStart, DecisionOutcome outcome, int upserted) {
        return new DecisionsReportDTO(storeId, weekStart, outcome.candidates(), outcome.selected().size(), upserted);
    }

    // ── row mapping ────────────────────────────────────────────────────────

    private DetectedSignal toSignal(SignalRecord row) {
        return new DetectedSignal(SignalType.valueOf(row.getType()), EntityType.fromKey(row.getEntityType()),
            row.getEntityKey(), row.getConfidence(), evidenceJson.read(row.getEvidenceJson()));
    }

    static CooldownState toCooldown(InsightCooldown row) {
        return new CooldownState(EntityType.fromKey(row.getEntityType()), row.getEntityKey(),
            row.getLastGeneratedAt(), row.getLastExecutedAt());
    }
}
