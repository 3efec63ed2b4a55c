package com.insightplatform.engine.dto;

import java.time.LocalDate;

public record TrendsReportDTO(
    String    storeId,
    LocalDate weekStart,
    int       eventsRead,
    int       uniqueQueries,
    int       insightsReplaced,
    int       insightsSaved
) {}
