package com.insightplatform.common.calendar;

import java.util.List;
import java.util.Set;

/**
 * A recurring commerce occasion.
 *
 * @param name         display name
 * @param localName    name in the storefront's local language
 * @param months       months (1-12) the occasion usually falls in
 * @param keywords     query fragments, already normalized
 * @param campaignHint short merchandising suggestion for the occasion
 */
public record CalendarEvent(
    String name,
    String localName,
    Set<Integer> months,
    List<String> keywords,
    String campaignHint
) {}
