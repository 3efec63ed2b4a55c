package com.insightplatform.engine.dto;

import java.time.LocalDate;

/**
 * Body of the job endpoints. {@code weekStart} may be any date of the target week.
 * Aggregation, pipeline and trends runs default to the current week; signal and
 * decision runs require it.
 */
public record JobRequestDTO(String storeId, LocalDate weekStart) {}
