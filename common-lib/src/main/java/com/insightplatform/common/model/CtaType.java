package com.insightplatform.common.model;

import java.util.Arrays;
import java.util.List;

/**
 * Call-to-action attached to an insight. The two channels keep separate vocabularies.
 */
public enum CtaType {

    PUSH_THIS_WEEK(InsightChannel.STORE),
    FIX_THIS(InsightChannel.STORE),
    REPOSITION_THIS(InsightChannel.STORE),

    PROMOTE_THIS_THEME(InsightChannel.TRENDS),
    FIX_THIS_ISSUE(InsightChannel.TRENDS),
    TALK_ABOUT_THIS(InsightChannel.TRENDS);

    private final InsightChannel channel;

    CtaType(InsightChannel channel) {
        this.channel = channel;
    }

    public InsightChannel channel() {
        return channel;
    }

    public static List<CtaType> forChannel(InsightChannel channel) {
        return Arrays.stream(values()).filter(c -> c.channel == channel).toList();
    }
}
