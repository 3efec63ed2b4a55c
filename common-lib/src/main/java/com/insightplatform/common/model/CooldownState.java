package com.insightplatform.common.model;

import java.time.Instant;

/**
 * Last time an insight was generated for, and executed on, an entity of a store.
 * Either timestamp may be {@code null}.
 */
public record CooldownState(
    EntityType entityType,
    String entityKey,
    Instant lastGeneratedAt,
    Instant lastExecutedAt
) {

    public EntityRef entity() {
        return EntityRef.of(entityType, entityKey);
    }
}
