package com.insightplatform.engine.repository;

import com.insightplatform.engine.model.AggQuery;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface AggQueryRepository extends ReactiveCrudRepository<AggQuery, Long> {

    Flux<AggQuery> findByStoreIdAndWeekStart(String storeId, LocalDate weekStart);

    @Modifying
    @Query("""
        INSERT INTO agg_queries
            (store_id, week_start, query_norm, searches, clicks, purchases,
             ctr, conversion_rate, delta_wow, avg_results_count, updated_at)
        VALUES
            (:storeId, :weekStart, :queryNorm, :searches, :clicks, :purchases,
             :ctr, :conversionRate, :deltaWoW, :avgResultsCount, NOW())
        ON CONFLICT (store_id, week_start, query_norm) DO UPDATE SET
            searches          = EXCLUDED.searches,
            clicks            = EXCLUDED.clicks,
            purchases         = EXCLUDED.purchases,
            ctr               = EXCLUDED.ctr,
            conversion_rate   = EXCLUDED.conversion_rate,
            delta_wow         = EXCLUDED.delta_wow,
            avg_results_count = EXCLUDED.avg_results_count,
            updated_at        = NOW()
        """)
    Mono<Void> upsert(String storeId, LocalDate weekStart, String queryNorm,
                      int searches, int clicks, int purchases,
                      double ctr, double conversionRate, double deltaWoW, double avgResultsCount);
}
