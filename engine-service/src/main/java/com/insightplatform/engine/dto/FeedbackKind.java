package com.insightplatform.engine.dto;

import com.insightplatform.common.model.InsightStatus;

/**
 * Merchant verdict on an insight and the status it moves the insight to.
 */
public enum FeedbackKind {

    EXECUTED(InsightStatus.EXECUTED),
    NOT_RELEVANT(InsightStatus.DISMISSED);

    private final InsightStatus resultingStatus;

    FeedbackKind(InsightStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public InsightStatus resultingStatus() {
        return resultingStatus;
    }
}
