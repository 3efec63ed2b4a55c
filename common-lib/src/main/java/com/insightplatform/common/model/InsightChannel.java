package com.insightplatform.common.model;

/**
 * Producer of an insight. Both channels share one insight table.
 */
public enum InsightChannel {
    /** Weekly per-store aggregation, signals and CTA selection. */
    STORE,
    /** Standalone search-trends analysis. */
    TRENDS
}
