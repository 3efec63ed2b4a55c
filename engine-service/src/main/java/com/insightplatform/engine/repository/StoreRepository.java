package com.insightplatform.engine.repository;

import com.insightplatform.engine.model.Store;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface StoreRepository extends ReactiveCrudRepository<Store, String> {

    /**
     * Creates the store row if absent. An existing row is left untouched.
     */
    @Modifying
    @Query("""
        INSERT INTO stores (id, name, created_at)
        VALUES (:id, :name, NOW())
        ON CONFLICT (id) DO NOTHING
        """)
    Mono<Void> ensureExists(String id, String name);
}
