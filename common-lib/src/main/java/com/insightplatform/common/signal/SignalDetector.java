package com.insightplatform.common.signal;

import com.insightplatform.common.model.DetectedSignal;
import com.insightplatform.common.model.EntityType;
import com.insightplatform.common.model.QueryAggregate;
import com.insightplatform.common.model.SignalType;
import com.insightplatform.common.model.TopicAggregate;
import com.insightplatform.common.scoring.ConfidenceScorer;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule-based detection of weekly anomalies and opportunities.
 *
 * <p>Rules are independent; one entity may raise several signal types.
 * <ul>
 *   <li>{@link SignalType#SPIKE_DEMAND}: {@code searches >= minSearches} and
 *       {@code deltaWoW > spikeDemandDeltaPct}, for topics and for queries</li>
 *   <li>{@link SignalType#NO_RESULTS_SPIKE}: {@code searches >= minSearches} and
 *       {@code avgResultsCount <= noResultsAvgThreshold}, queries only</li>
 *   <li>{@link SignalType#HIGH_INTEREST_LOW_CONVERSION}: {@code searches >= minSearches},
 *       {@code ctr >= minCtr} and {@code conversionRate <= maxConversionRate}, queries only</li>
 * </ul>
 * Every signal's confidence is {@link ConfidenceScorer#confidence(double, double)
 * confidence(searches, deltaWoW)}.
 */
public final class SignalDetector {

    public static final String SEARCHES          = "searches";
    public static final String DELTA_WOW         = "deltaWoW";
    public static final String CTR               = "ctr";
    public static final String AVG_RESULTS_COUNT = "avgResultsCount";
    public static final String CONVERSION_RATE   = "conversionRate";
    public static final String WEEK_START        = "weekStart";

    private SignalDetector() {}

    public static List<DetectedSignal> detect(List<QueryAggregate> queries,
                                              List<TopicAggregate> topics,
                                              LocalDate weekStart,
                                              SignalThresholds thresholds) {
        List<QueryAggregate> qs = queries != null ? queries : Collections.emptyList();
        List<TopicAggregate> ts = topics != null ? topics : Collections.emptyList();
        List<DetectedSignal> signals = new ArrayList<>();
        String week = weekStart.toString();

        // ── spike demand ───────────────────────────────────────────────────
        for (TopicAggregate t : ts) {
            if (t.searches() < thresholds.minSearches()) continue;
            if (t.deltaWoW() <= thresholds.spikeDemandDeltaPct()) continue;
            Map<String, Object> evidence = evidence(t.searches(), t.deltaWoW(), week);
            evidence.put(CTR, t.ctr());
            evidence.put(CONVERSION_RATE, t.conversionRate());
            signals.add(signal(SignalType.SPIKE_DEMAND, EntityType.TOPIC, t.topic(), t.searches(), t.deltaWoW(), evidence));
        }

        for (QueryAggregate q : qs) {
            if (q.searches() < thresholds.minSearches()) continue;
            if (q.deltaWoW() <= thresholds.spikeDemandDeltaPct()) continue;
            Map<String, Object> evidence = evidence(q.searches(), q.deltaWoW(), week);
            evidence.put(CTR, q.ctr());
            evidence.put(AVG_RESULTS_COUNT, q.avgResultsCount());
            signals.add(querySignal(SignalType.SPIKE_DEMAND, q, evidence));
        }

        // ── no results ─────────────────────────────────────────────────────
        for (QueryAggregate q : qs) {
            if (q.searches() < thresholds.minSearches()) continue;
            if (q.avgResultsCount() > thresholds.noResultsAvgThreshold()) continue;
            Map<String, Object> evidence = evidence(q.searches(), q.deltaWoW(), week);
            evidence.put(AVG_RESULTS_COUNT, q.avgResultsCount());
            signals.add(querySignal(SignalType.NO_RESULTS_SPIKE, q, evidence));
        }

        // ── high interest, low conversion ──────────────────────────────────
        for (QueryAggregate q : qs) {
            if (q.searches() < thresholds.minSearches()) continue;
            if (q.ctr() < thresholds.minCtr()) continue;
            if (q.conversionRate() > thresholds.maxConversionRate()) continue;
            Map<String, Object> evidence = evidence(q.searches(), q.deltaWoW(), week);
            evidence.put(CTR, q.ctr());
            evidence.put(CONVERSION_RATE, q.conversionRate());
            signals.add(querySignal(SignalType.HIGH_INTEREST_LOW_CONVERSION, q, evidence));
        }

        return signals;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static Map<String, Object> evidence(int searches, double deltaWoW, String week) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put(SEARCHES, searches);
        evidence.put(DELTA_WOW, deltaWoW);
        evidence.put(WEEK_START, week);
        return evidence;
    }

    private static DetectedSignal querySignal(SignalType type, QueryAggregate q, Map<String, Object> evidence) {
        return signal(type, EntityType.QUERY, q.queryNorm(), q.searches(), q.deltaWoW(), evidence);
    }

    private static DetectedSignal signal(SignalType type, EntityType entityType, String key,
                                         int searches, double deltaWoW, Map<String, Object> evidence) {
        return new DetectedSignal(type, entityType, key,
            ConfidenceScorer.confidence(searches, deltaWoW),
            Collections.unmodifiableMap(evidence));
    }
}
