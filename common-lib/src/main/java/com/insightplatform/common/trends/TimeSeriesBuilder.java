package com.insightplatform.common.trends;

import com.insightplatform.common.calendar.IsoWeeks;
import com.insightplatform.common.text.QueryNormalizer;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds per-query time series from raw search events. Events without a query,
 * a timestamp or a non-empty normalized form are skipped.
 *
 * <p>A fresh set of accumulators is used per call and frozen into immutable
 * {@link QueryTimeSeries} values; nothing survives between runs.
 */
public final class TimeSeriesBuilder {

    private TimeSeriesBuilder() {}

    /** @return series keyed and sorted by normalized query */
    public static SortedMap<String, QueryTimeSeries> build(Iterable<SearchEvent> events) {
        Map<String, Accumulator> acc = new TreeMap<>();
        for (SearchEvent event : events) {
            if (event == null || event.query() == null || event.query().isBlank() || event.timestamp() == null) {
                continue;
            }
            String norm = QueryNormalizer.normalize(event.query());
            if (norm.isEmpty()) continue;
            acc.computeIfAbsent(norm, k -> new Accumulator()).add(event.query(), event.timestamp());
        }

        SortedMap<String, QueryTimeSeries> series = new TreeMap<>();
        acc.forEach((norm, a) -> series.put(norm, a.freeze(norm)));
        return Collections.unmodifiableSortedMap(series);
    }

    private static final class Accumulator {
        private final Map<String, Long> rawCounts = new LinkedHashMap<>();
        private final TreeMap<String, Long> weekly = new TreeMap<>();
        private final TreeMap<String, Long> monthly = new TreeMap<>();
        private final long[] hourly = new long[24];
        private long total;
        private Instant firstSeen;
        private Instant lastSeen;

        void add(String raw, Instant ts) {
            total++;
            rawCounts.merge(raw, 1L, Long::sum);
            weekly.merge(IsoWeeks.weekKey(ts), 1L, Long::sum);
            monthly.merge(IsoWeeks.monthKey(ts), 1L, Long::sum);
            hourly[IsoWeeks.hourOfDay(ts)]++;
            if (firstSeen == null || ts.isBefore(firstSeen)) firstSeen = ts;
            if (lastSeen == null || ts.isAfter(lastSeen)) lastSeen = ts;
        }

        QueryTimeSeries freeze(String norm) {
            String bestRaw = null;
            long bestCount = 0;
            for (Map.Entry<String, Long> e : rawCounts.entrySet()) {
                if (e.getValue() > bestCount) {
                    bestRaw = e.getKey();
                    bestCount = e.getValue();
                }
            }
            Long[] hours = new Long[24];
            for (int h = 0; h < 24; h++) hours[h] = hourly[h];
            return new QueryTimeSeries(norm, bestRaw, total,
                Collections.unmodifiableSortedMap(new TreeMap<>(weekly)),
                Collections.unmodifiableSortedMap(new TreeMap<>(monthly)),
                List.of(hours), firstSeen, lastSeen);
        }
    }
}
