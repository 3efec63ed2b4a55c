package com.insightplatform.common.model;

/**
 * Insight lifecycle. Only external feedback moves an insight out of {@link #ACTIVE}.
 */
public enum InsightStatus {
    ACTIVE,
    EXECUTED,
    DISMISSED
}
