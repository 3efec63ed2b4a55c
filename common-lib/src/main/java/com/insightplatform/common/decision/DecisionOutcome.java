package com.insightplatform.common.decision;

import com.insightplatform.common.model.SelectedInsight;

import java.util.List;

/**
 * @param candidates signals that survived the guardrails, before de-duplication and capping
 * @param selected   ranked insights, priority 1 first
 */
public record DecisionOutcome(int candidates, List<SelectedInsight> selected) {

    public DecisionOutcome {
        selected = List.copyOf(selected);
    }
}
