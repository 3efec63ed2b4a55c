package com.insightplatform.engine.dto;

import com.insightplatform.common.aggregation.StoreSummary;

import java.time.LocalDate;

/**
 * Result of one aggregation run.
 *
 * @param productsSkipped product rows not written because the product is not in the catalog
 */
public record AggregationReportDTO(
    String      storeId,
    LocalDate   weekStart,
    int         queriesUpserted,
    int         topicsUpserted,
    int         productsUpserted,
    int         productsSkipped,
    StoreSummary summary
) {}
