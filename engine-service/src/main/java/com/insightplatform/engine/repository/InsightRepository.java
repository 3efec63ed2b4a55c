package com.insightplatform.engine.repository;

import com.insightplatform.engine.model.Insight;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.Collection;

@Repository
public interface InsightRepository extends ReactiveCrudRepository<Insight, Long> {

    /**
     * Inserts an ACTIVE insight or refreshes the ranking fields of an existing one.
     * {@code status} is never touched on conflict, so feedback survives re-runs.
     */
    @Modifying
    @Query("""
        INSERT INTO insights
            (store_id, week_start, cta_type, entity_type, entity_key, priority,
             confidence, evidence_json, recommended_action, status, created_at, updated_at)
        VALUES
            (:storeId, :weekStart, :ctaType, :entityType, :entityKey, :priority,
             :confidence, :evidenceJson, :recommendedAction, 'ACTIVE', NOW(), NOW())
        ON CONFLICT (store_id, week_start, cta_type, entity_type, entity_key) DO UPDATE SET
            priority           = EXCLUDED.priority,
            confidence         = EXCLUDED.confidence,
            evidence_json      = EXCLUDED.evidence_json,
            recommended_action = EXCLUDED.recommended_action,
            updated_at         = NOW()
        """)
    Mono<Void> upsert(String storeId, LocalDate weekStart, String ctaType,
                      String entityType, String entityKey, int priority,
                      double confidence, String evidenceJson, String recommendedAction);

    Flux<Insight> findByStoreIdAndWeekStart(String storeId, LocalDate weekStart);

    /** ACTIVE insights of a store, newest week first, then by rank. */
    @Query("""
        SELECT * FROM insights
        WHERE store_id = :storeId AND status = 'ACTIVE'
        ORDER BY week_start DESC, priority ASC
        LIMIT :limit
        """)
    Flux<Insight> findActiveByStore(String storeId, int limit);

    /**
     * Clears the ACTIVE rows of the given CTA types for one store and week.
     * Executed and dismissed rows are kept.
     */
    @Modifying
    @Query("""
        DELETE FROM insights
        WHERE store_id = :storeId
          AND week_start = :weekStart
          AND status = 'ACTIVE'
          AND cta_type IN (:ctaTypes)
        """)
    Mono<Integer> deleteActiveByStoreWeekAndCtaTypes(String storeId, LocalDate weekStart,
                                                      Collection<String> ctaTypes);

    @Modifying
    @Query("UPDATE insights SET status = :status, updated_at = NOW() WHERE id = :id")
    Mono<Integer> updateStatus(Long id, String status);
}
