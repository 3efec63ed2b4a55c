package com.insightplatform.common.model;

/**
 * Anomaly and opportunity patterns detected on weekly aggregates.
 */
public enum SignalType {

    /** Week-over-week search growth above the spike threshold (topics and queries). */
    SPIKE_DEMAND,

    /** Enough searches, but results returned on average at or below the no-results threshold. */
    NO_RESULTS_SPIKE,

    /** Shoppers click through but do not buy. */
    HIGH_INTEREST_LOW_CONVERSION
}
