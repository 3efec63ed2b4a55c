package com.insightplatform.engine.repository;

import com.insightplatform.engine.model.InsightCooldown;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Repository
public interface InsightCooldownRepository extends ReactiveCrudRepository<InsightCooldown, Long> {

    Flux<InsightCooldown> findByStoreId(String storeId);

    @Modifying
    @Query("""
        INSERT INTO insight_cooldowns (store_id, entity_type, entity_key, last_generated_at)
        VALUES (:storeId, :entityType, :entityKey, :generatedAt)
        ON CONFLICT (store_id, entity_type, entity_key) DO UPDATE SET
            last_generated_at = EXCLUDED.last_generated_at
        """)
    Mono<Void> markGenerated(String storeId, String entityType, String entityKey, Instant generatedAt);

    @Modifying
    @Query("""
        INSERT INTO insight_cooldowns (store_id, entity_type, entity_key, last_executed_at)
        VALUES (:storeId, :entityType, :entityKey, :executedAt)
        ON CONFLICT (store_id, entity_type, entity_key) DO UPDATE SET
            last_executed_at = EXCLUDED.last_executed_at
        """)
    Mono<Void> markExecuted(String storeId, String entityType, String entityKey, Instant executedAt);
}
