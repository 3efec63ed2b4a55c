package com.insightplatform.common.model;

import java.util.Map;

/**
 * A signal for one entity in one week.
 *
 * @param evidence numeric snapshot that justified the signal; keys are
 *                 {@code searches}, {@code deltaWoW}, {@code ctr}, {@code avgResultsCount},
 *                 {@code conversionRate} and {@code weekStart}, as applicable
 */
public record DetectedSignal(
    SignalType type,
    EntityType entityType,
    String entityKey,
    double confidence,
    Map<String, Object> evidence
) {

    public EntityRef entity() {
        return EntityRef.of(entityType, entityKey);
    }
}
