package com.insightplatform.common.trends;

import java.time.Instant;
import java.util.List;
import java.util.SortedMap;

/**
 * Search history of one normalized query.
 *
 * @param queryNorm   normalized query
 * @param queryRaw    most frequent raw rendering; first seen wins a tie
 * @param totalVolume number of searches
 * @param weekly      ISO week key ({@code 2025-W07}) to count
 * @param monthly     month key ({@code 2025-02}) to count
 * @param hourly      24 UTC hour buckets
 */
public record QueryTimeSeries(
    String queryNorm,
    String queryRaw,
    long totalVolume,
    SortedMap<String, Long> weekly,
    SortedMap<String, Long> monthly,
    List<Long> hourly,
    Instant firstSeen,
    Instant lastSeen
) {

    public long weekVolume(String weekKey) {
        return weekly.getOrDefault(weekKey, 0L);
    }

    public long monthVolume(String monthKey) {
        return monthly.getOrDefault(monthKey, 0L);
    }
}
