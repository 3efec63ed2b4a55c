package com.insightplatform.engine.dto;

import java.time.LocalDate;

/**
 * @param candidates       signals that passed the volume, cooldown and inventory guardrails
 * @param selected         candidates kept after dedupe and the weekly cap
 * @param insightsUpserted insights written together with their cooldown
 */
public record DecisionsReportDTO(
    String    storeId,
    LocalDate weekStart,
    int       candidates,
    int       selected,
    int       insightsUpserted
) {}
