package com.insightplatform.common.aggregation;

import java.util.List;
import java.util.Map;

/**
 * Raw event documents of one store for a target week and the week before it.
 * Every list is already restricted to its window.
 */
public record WeeklyEvents(
    List<Map<String, Object>> searchesThisWeek,
    List<Map<String, Object>> searchesPrevWeek,
    List<Map<String, Object>> clicksThisWeek,
    List<Map<String, Object>> clicksPrevWeek,
    List<Map<String, Object>> purchasesThisWeek,
    List<Map<String, Object>> purchasesPrevWeek
) {

    public WeeklyEvents {
        searchesThisWeek  = copy(searchesThisWeek);
        searchesPrevWeek  = copy(searchesPrevWeek);
        clicksThisWeek    = copy(clicksThisWeek);
        clicksPrevWeek    = copy(clicksPrevWeek);
        purchasesThisWeek = copy(purchasesThisWeek);
        purchasesPrevWeek = copy(purchasesPrevWeek);
    }

    public static WeeklyEvents empty() {
        return new WeeklyEvents(null, null, null, null, null, null);
    }

    private static List<Map<String, Object>> copy(List<Map<String, Object>> docs) {
        return docs == null ? List.of() : List.copyOf(docs);
    }
}
