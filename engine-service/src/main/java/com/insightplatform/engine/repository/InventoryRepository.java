package com.insightplatform.engine.repository;

import com.insightplatform.engine.model.Inventory;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface InventoryRepository extends ReactiveCrudRepository<Inventory, Long> {

    @Query("SELECT EXISTS (SELECT 1 FROM inventory WHERE store_id = :storeId AND stock_qty > 0)")
    Mono<Boolean> existsInStock(String storeId);
}
