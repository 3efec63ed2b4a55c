package com.insightplatform.engine.dto;

import java.time.LocalDate;
import java.util.Map;

/**
 * Insight as exposed to the copy layer and the merchant UI.
 */
public record InsightDTO(
    Long                id,
    String              storeId,
    LocalDate           weekStart,
    String              ctaType,
    String              entityType,
    String              entityKey,
    int                 priority,
    double              confidence,
    Map<String, Object> evidence,
    String              recommendedAction,
    String              status
) {}
