package com.insightplatform.common.trends;

/**
 * Comparison of the last N weeks of a query against the N weeks before them.
 */
public record Velocity(TrendDirection direction, double pctChange, long recentVolume, long previousVolume) {

    public static final Velocity STABLE = new Velocity(TrendDirection.STABLE, 0.0, 0L, 0L);
}
