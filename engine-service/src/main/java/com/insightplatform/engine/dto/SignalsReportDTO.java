package com.insightplatform.engine.dto;

import java.time.LocalDate;

public record SignalsReportDTO(
    String    storeId,
    LocalDate weekStart,
    int       signalsDetected,
    int       signalsUpserted
) {}
