package com.insightplatform.common.model;

import java.util.Map;

/**
 * A ranked CTA chosen for a store and week.
 *
 * @param priority      1-based rank, 1 is the most important
 * @param priorityScore the score the rank was derived from
 */
public record SelectedInsight(
    CtaType ctaType,
    EntityType entityType,
    String entityKey,
    int priority,
    double confidence,
    double priorityScore,
    Map<String, Object> evidence,
    String recommendedAction
) {

    public EntityRef entity() {
        return EntityRef.of(entityType, entityKey);
    }
}
