package com.insightplatform.common.decision;

import com.insightplatform.common.exception.EngineException;

/**
 * Limits of {@link CtaSelector}.
 *
 * @param maxCtasPerWeek cap on insights per store and week
 * @param cooldownDays   days an entity stays suppressed after an insight was generated for it
 * @param minSearches    volume floor re-checked against signal evidence
 */
public record DecisionConfig(int maxCtasPerWeek, int cooldownDays, int minSearches) {

    public static final String STAGE = "decisions";

    public static DecisionConfig defaults() {
        return new DecisionConfig(3, 10, 25);
    }

    /**
     * @throws EngineException on any negative limit
     */
    public DecisionConfig validate() {
        if (maxCtasPerWeek < 0) {
            throw new EngineException(STAGE, "maxCtasPerWeek must be >= 0, was " + maxCtasPerWeek);
        }
        if (cooldownDays < 0) {
            throw new EngineException(STAGE, "cooldownDays must be >= 0, was " + cooldownDays);
        }
        if (minSearches < 0) {
            throw new EngineException(STAGE, "minSearches must be >= 0, was " + minSearches);
        }
        return this;
    }
}
