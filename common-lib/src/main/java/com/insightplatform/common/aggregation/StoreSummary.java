package com.insightplatform.common.aggregation;

/**
 * Store-level totals of one aggregation run. Revenue is in minor currency units.
 */
public record StoreSummary(
    long revenueThisWeekCents,
    long revenuePrevWeekCents,
    double revenueDeltaWoW,
    int searchesThisWeek,
    int searchesPrevWeek,
    int clicksThisWeek,
    int clicksPrevWeek,
    int purchasesThisWeek,
    int purchasesPrevWeek
) {}
