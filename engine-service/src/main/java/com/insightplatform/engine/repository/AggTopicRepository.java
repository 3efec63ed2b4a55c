package com.insightplatform.engine.repository;

import com.insightplatform.engine.model.AggTopic;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface AggTopicRepository extends ReactiveCrudRepository<AggTopic, Long> {

    Flux<AggTopic> findByStoreIdAndWeekStart(String storeId, LocalDate weekStart);

    @Modifying
    @Query("""
        INSERT INTO agg_topics
            (store_id, week_start, topic, searches, clicks, purchases,
             ctr, conversion_rate, delta_wow, updated_at)
        VALUES
            (:storeId, :weekStart, :topic, :searches, :clicks, :purchases,
             :ctr, :conversionRate, :deltaWoW, NOW())
        ON CONFLICT (store_id, week_start, topic) DO UPDATE SET
            searches        = EXCLUDED.searches,
            clicks          = EXCLUDED.clicks,
            purchases       = EXCLUDED.purchases,
            ctr             = EXCLUDED.ctr,
            conversion_rate = EXCLUDED.conversion_rate,
            delta_wow       = EXCLUDED.delta_wow,
            updated_at      = NOW()
        """)
    Mono<Void> upsert(String storeId, LocalDate weekStart, String topic,
                      int searches, int clicks, int purchases,
                      double ctr, double conversionRate, double deltaWoW);
}
