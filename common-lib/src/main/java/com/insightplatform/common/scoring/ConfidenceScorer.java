package com.insightplatform.common.scoring;

/**
 * Deterministic confidence in [0, 1] from sample volume and effect size.
 *
 * <pre>
 *   volumeTerm = clamp01(log10(max(1, volume)) / 3)     saturates near volume 1000
 *   effectTerm = clamp01(|effectPercent| / 100)
 *   confidence = clamp01(0.6 * volumeTerm + 0.4 * effectTerm)
 * </pre>
 *
 * <p>Non-decreasing in volume and in |effect|. The {@link PercentChange#NEW_ENTITY_PCT}
 * sentinel saturates the effect term at 1.0. Pure function.
 */
public final class ConfidenceScorer {

    static final double VOLUME_WEIGHT = 0.6;
    static final double EFFECT_WEIGHT = 0.4;

    private ConfidenceScorer() {}

    public static double confidence(double volume, double effectPercent) {
        double volumeTerm = clamp01(Math.log10(Math.max(1.0, volume)) / 3.0);
        double effectTerm = clamp01(Math.abs(effectPercent) / 100.0);
        return clamp01(VOLUME_WEIGHT * volumeTerm + EFFECT_WEIGHT * effectTerm);
    }

    public static double clamp01(double x) {
        if (Double.isNaN(x)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, x));
    }
}
