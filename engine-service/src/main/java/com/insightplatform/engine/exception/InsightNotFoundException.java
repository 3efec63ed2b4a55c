package com.insightplatform.engine.exception;

public class InsightNotFoundException extends RuntimeException {

    private final Long insightId;

    public InsightNotFoundException(Long insightId) {
        super("Insight not found. id=" + insightId);
        this.insightId = insightId;
    }

    public Long getInsightId() {
        return insightId;
    }
}
