package com.insightplatform.common.aggregation;

import com.insightplatform.common.classifier.TopicClassifier;
import com.insightplatform.common.model.ProductAggregate;
import com.insightplatform.common.model.QueryAggregate;
import com.insightplatform.common.model.TopicAggregate;
import com.insightplatform.common.scoring.PercentChange;
import com.insightplatform.common.text.QueryNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns one store's raw search, click and purchase events for a week (and the week
 * before) into per-query, per-topic and per-product weekly statistics.
 *
 * <p>When the week has no search events at all, every click counts as an implicit
 * search. The same fallback applies to the previous week. Clicks always feed the CTR
 * numerator. Events with an empty normalized query are ignored for query statistics.
 *
 * <p>Accumulators are local to one call; the result is immutable and sorted by key,
 * so identical input always yields identical output. No Spring dependencies. No I/O.
 */
public final class WeeklyAggregator {

    private WeeklyAggregator() {}

    /**
     * @param events        windowed raw events
     * @param knownEntities store-specific names (e.g. wineries) used for topic classification
     */
    public static WeeklyAggregates aggregate(WeeklyEvents events, Collection<String> knownEntities) {
        Map<String, QueryCounter> thisWeek = countQueries(events);
        Map<String, Integer> prevSearches = previousWeekSearches(events);

        List<QueryAggregate> queries = new ArrayList<>(thisWeek.size());
        thisWeek.forEach((q, c) -> queries.add(c.toAggregate(q, prevSearches.getOrDefault(q, 0))));

        List<TopicAggregate> topics = rollUpTopics(queries, prevSearches, knownEntities);
        List<ProductAggregate> products = aggregateProducts(events);

        return new WeeklyAggregates(queries, topics, products, summarize(events));
    }

    // ── queries ────────────────────────────────────────────────────────────

    private static Map<String, QueryCounter> countQueries(WeeklyEvents events) {
        Map<String, QueryCounter> stats = new TreeMap<>();
        boolean implicitSearches = events.searchesThisWeek().isEmpty();

        for (Map<String, Object> s : events.searchesThisWeek()) {
            String q = normalizedQuery(s);
            if (q.isEmpty()) continue;
            QueryCounter c = stats.computeIfAbsent(q, k -> new QueryCounter());
            c.searches++;
            c.resultsSum += RawEventFields.resultsCount(s);
            c.resultsN++;
        }

        for (Map<String, Object> click : events.clicksThisWeek()) {
            String q = normalizedQuery(click);
            if (q.isEmpty()) continue;
            QueryCounter c = stats.computeIfAbsent(q, k -> new QueryCounter());
            if (implicitSearches) {
                c.searches++;
            }
            c.clicks++;
        }

        for (Map<String, Object> p : events.purchasesThisWeek()) {
            String q = normalizedQuery(p);
            if (q.isEmpty()) continue;
            stats.computeIfAbsent(q, k -> new QueryCounter()).purchases++;
        }
        return stats;
    }

    private static Map<String, Integer> previousWeekSearches(WeeklyEvents events) {
        Map<String, Integer> counts = new HashMap<>();
        List<Map<String, Object>> source = events.searchesPrevWeek().isEmpty()
            ? events.clicksPrevWeek()
            : events.searchesPrevWeek();
        for (Map<String, Object> doc : source) {
            String q = normalizedQuery(doc);
            if (q.isEmpty()) continue;
            counts.merge(q, 1, Integer::sum);
        }
        return counts;
    }

    // ── topics ─────────────────────────────────────────────────────────────

    private static List<TopicAggregate> rollUpTopics(List<QueryAggregate> queries,
                                                     Map<String, Integer> prevSearches,
                                                     Collection<String> knownEntities) {
        Map<String, String> topicOf = new HashMap<>();
        Map<String, int[]> current = new TreeMap<>();
        for (QueryAggregate q : queries) {
            String topic = topicOf.computeIfAbsent(q.queryNorm(), k -> TopicClassifier.classify(k, knownEntities));
            int[] sums = current.computeIfAbsent(topic, k -> new int[3]);
            sums[0] += q.searches();
            sums[1] += q.clicks();
            sums[2] += q.purchases();
        }

        Map<String, Integer> previous = new HashMap<>();
        prevSearches.forEach((q, count) -> {
            String topic = topicOf.computeIfAbsent(q, k -> TopicClassifier.classify(k, knownEntities));
            previous.merge(topic, count, Integer::sum);
        });

        List<TopicAggregate> topics = new ArrayList<>(current.size());
        current.forEach((topic, sums) -> topics.add(new TopicAggregate(
            topic, sums[0], sums[1], sums[2],
            ratio(sums[1], sums[0]),
            ratio(sums[2], sums[0]),
            PercentChange.of(sums[0], previous.getOrDefault(topic, 0)))));
        return topics;
    }

    // ── products ───────────────────────────────────────────────────────────

    private static List<ProductAggregate> aggregateProducts(WeeklyEvents events) {
        Map<String, long[]> current = new TreeMap<>();
        for (Map<String, Object> click : events.clicksThisWeek()) {
            RawEventFields.productId(click)
                .ifPresent(pid -> current.computeIfAbsent(pid, k -> new long[3])[0]++);
        }
        for (Map<String, Object> p : events.purchasesThisWeek()) {
            RawEventFields.productId(p).ifPresent(pid -> {
                long[] sums = current.computeIfAbsent(pid, k -> new long[3]);
                sums[1]++;
                sums[2] += RawEventFields.revenueCents(p);
            });
        }

        Map<String, Integer> prevViews = new HashMap<>();
        for (Map<String, Object> click : events.clicksPrevWeek()) {
            RawEventFields.productId(click).ifPresent(pid -> prevViews.merge(pid, 1, Integer::sum));
        }

        List<ProductAggregate> products = new ArrayList<>(current.size());
        current.forEach((pid, sums) -> products.add(new ProductAggregate(
            pid, (int) sums[0], (int) sums[1], sums[2],
            PercentChange.of(sums[0], prevViews.getOrDefault(pid, 0)))));
        return products;
    }

    // ── store summary ──────────────────────────────────────────────────────

    private static StoreSummary summarize(WeeklyEvents events) {
        long revenueThis = events.purchasesThisWeek().stream().mapToLong(RawEventFields::revenueCents).sum();
        long revenuePrev = events.purchasesPrevWeek().stream().mapToLong(RawEventFields::revenueCents).sum();
        return new StoreSummary(
            revenueThis, revenuePrev, PercentChange.of(revenueThis, revenuePrev),
            events.searchesThisWeek().size(), events.searchesPrevWeek().size(),
            events.clicksThisWeek().size(), events.clicksPrevWeek().size(),
            events.purchasesThisWeek().size(), events.purchasesPrevWeek().size());
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static String normalizedQuery(Map<String, Object> doc) {
        return QueryNormalizer.normalize(RawEventFields.query(doc));
    }

    private static double ratio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : 0.0;
    }

    private static final class QueryCounter {
        int searches;
        int clicks;
        int purchases;
        double resultsSum;
        int resultsN;

        QueryAggregate toAggregate(String queryNorm, int previousSearches) {
            return new QueryAggregate(
                queryNorm, searches, clicks, purchases,
                ratio(clicks, searches),
                ratio(purchases, searches),
                PercentChange.of(searches, previousSearches),
                resultsN > 0 ? resultsSum / resultsN : 0.0);
        }
    }
}
