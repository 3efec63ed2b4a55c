package com.insightplatform.common.scoring;

/**
 * Week-over-week percent change with explicit handling of empty baselines.
 */
public final class PercentChange {

    /**
     * Returned when the previous value is empty and the current one is not.
     * Confidence saturates on it and priority scoring caps it at 200.
     */
    public static final double NEW_ENTITY_PCT = 999.0;

    private PercentChange() {}

    /**
     * @return {@code 0} if both values are {@code <= 0}; {@link #NEW_ENTITY_PCT} if only
     *         {@code previous <= 0}; otherwise {@code (current - previous) / previous * 100}
     */
    public static double of(double current, double previous) {
        if (previous <= 0 && current <= 0) {
            return 0.0;
        }
        if (previous <= 0) {
            return NEW_ENTITY_PCT;
        }
        return (current - previous) / previous * 100.0;
    }
}
