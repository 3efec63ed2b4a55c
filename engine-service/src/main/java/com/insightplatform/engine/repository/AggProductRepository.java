package com.insightplatform.engine.repository;

import com.insightplatform.engine.model.AggProduct;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface AggProductRepository extends ReactiveCrudRepository<AggProduct, Long> {

    @Modifying
    @Query("""
        INSERT INTO agg_products
            (store_id, week_start, product_id, views, purchases, revenue_cents, delta_wow, updated_at)
        VALUES
            (:storeId, :weekStart, :productId, :views, :purchases, :revenueCents, :deltaWoW, NOW())
        ON CONFLICT (store_id, week_start, product_id) DO UPDATE SET
            views         = EXCLUDED.views,
            purchases     = EXCLUDED.purchases,
            revenue_cents = EXCLUDED.revenue_cents,
            delta_wow     = EXCLUDED.delta_wow,
            updated_at    = NOW()
        """)
    Mono<Void> upsert(String storeId, LocalDate weekStart, String productId,
                      int views, int purchases, long revenueCents, double deltaWoW);
}
