package com.insightplatform.engine.repository;

import com.insightplatform.engine.model.SignalRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface SignalRepository extends ReactiveCrudRepository<SignalRecord, Long> {

    Flux<SignalRecord> findByStoreIdAndWeekStart(String storeId, LocalDate weekStart);

    /**
     * Re-detection of the same signal replaces its confidence and evidence.
     */
    @Modifying
    @Query("""
        INSERT INTO signals
            (store_id, week_start, type, entity_type, entity_key, confidence, evidence_json, updated_at)
        VALUES
            (:storeId, :weekStart, :type, :entityType, :entityKey, :confidence, :evidenceJson, NOW())
        ON CONFLICT (store_id, week_start, type, entity_type, entity_key) DO UPDATE SET
            confidence    = EXCLUDED.confidence,
            evidence_json = EXCLUDED.evidence_json,
            updated_at    = NOW()
        """)
    Mono<Void> upsert(String storeId, LocalDate weekStart, String type,
                      String entityType, String entityKey,
                      double confidence, String evidenceJson);
}
