package com.insightplatform.common.trends;

import com.insightplatform.common.model.CtaType;

import java.util.Map;

/**
 * A trends-channel insight. {@code entityKey} is the display form of the query,
 * or a time-window label for {@link TrendKind#PEAK_HOURS}.
 */
public record TrendInsight(
    TrendKind kind,
    CtaType type,
    String entityKey,
    double confidence,
    Map<String, Object> evidence,
    String recommendedAction
) {}
