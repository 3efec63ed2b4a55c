package com.insightplatform.common.trends;

public enum TrendDirection {
    RISING,
    STABLE,
    DECLINING
}
