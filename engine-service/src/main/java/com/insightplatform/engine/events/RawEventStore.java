package com.insightplatform.engine.events;

import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only access to the external, schema-flexible raw event store.
 *
 * <p>Documents are returned as plain maps; field extraction is left to
 * {@link com.insightplatform.common.aggregation.RawEventFields}. The store id
 * {@link #GLOBAL_STORE_ID} reads events of every tenant.
 */
public interface RawEventStore {

    String GLOBAL_STORE_ID = "global";

    /**
     * Events of {@code stream} for a store whose timestamp falls in {@code [from, to)}.
     */
    Flux<Map<String, Object>> readWindow(EventStream stream, String storeId, Instant from, Instant to);

    /**
     * Every event of {@code stream} for a store, regardless of time.
     */
    Flux<Map<String, Object>> readAll(EventStream stream, String storeId);
}
