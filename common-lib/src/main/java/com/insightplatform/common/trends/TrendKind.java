package com.insightplatform.common.trends;

/**
 * Heuristic that produced a {@link TrendInsight}.
 */
public enum TrendKind {
    TRENDING_UP,
    TRENDING_DOWN,
    SEASONAL_OPPORTUNITY,
    PEAK_HOURS,
    EMERGING_QUERY,
    EVERGREEN_LEADER
}
