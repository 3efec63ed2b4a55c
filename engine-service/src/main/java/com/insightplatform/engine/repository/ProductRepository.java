package com.insightplatform.engine.repository;

import com.insightplatform.engine.model.Product;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ProductRepository extends ReactiveCrudRepository<Product, Long> {

    /** Distinct non-null winery names of a store's catalog; known entities for topic classification. */
    @Query("SELECT DISTINCT winery FROM products WHERE store_id = :storeId AND winery IS NOT NULL")
    Flux<String> findWineries(String storeId);

    Mono<Boolean> existsByStoreIdAndProductId(String storeId, String productId);
}
