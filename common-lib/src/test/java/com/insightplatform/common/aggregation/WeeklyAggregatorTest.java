package com.insightplatform.common.aggregation;

import com.insightplatform.common.model.ProductAggregate;
import com.insightplatform.common.model.QueryAggregate;
import com.insightplatform.common.model.TopicAggregate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store "demo-store" style fixtures: the aggregator receives already-windowed events.
 */
class WeeklyAggregatorTest {

    // ── fixtures ───────────────────────────────────────────────────────────

    private static Map<String, Object> search(String query, int results) {
        Map<String, Object> m = new HashMap<>();
        m.put("query", query);
        m.put("resultsCount", results);
        return m;
    }

    private static Map<String, Object> click(String query, String productId) {
        Map<String, Object> m = new HashMap<>();
        m.put("search_query", query);
        if (productId != null) m.put("product_id", productId);
        return m;
    }

    private static Map<String, Object> purchase(String query, String productId, double revenue) {
        Map<String, Object> m = new HashMap<>();
        m.put("query", query);
        m.put("productId", productId);
        m.put("revenue", revenue);
        return m;
    }

    private static List<Map<String, Object>> times(int n, Map<String, Object> doc) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (int i = 0; i < n; i++) list.add(doc);
        return list;
    }

    @SafeVarargs
    private static List<Map<String, Object>> concat(List<Map<String, Object>>... lists) {
        List<Map<String, Object>> all = new ArrayList<>();
        for (List<Map<String, Object>> l : lists) all.addAll(l);
        return all;
    }

    private static QueryAggregate query(WeeklyAggregates agg, String q) {
        return agg.queries().stream().filter(r -> r.queryNorm().equals(q)).findFirst()
            .orElseThrow(() -> new AssertionError("missing query " + q));
    }

    private static TopicAggregate topic(WeeklyAggregates agg, String t) {
        return agg.topics().stream().filter(r -> r.topic().equals(t)).findFirst()
            .orElseThrow(() -> new AssertionError("missing topic " + t));
    }

    // ── queries ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("query aggregates")
    class QueryTests {

        @Test
        @DisplayName("25 → 80 searches gives deltaWoW 220%")
        void weekOverWeekGrowth() {
            WeeklyEvents events = new WeeklyEvents(
                times(80, search("Pinot Noir", 12)),
                times(25, search("pinot noir", 9)),
                List.of(), List.of(), List.of(), List.of());

            QueryAggregate row = query(WeeklyAggregator.aggregate(events, List.of()), "pinot noir");

            assertEquals(80, row.searches());
            assertEquals(220.0, row.deltaWoW(), 1e-9);
            assertEquals(12.0, row.avgResultsCount(), 1e-9);
        }

        @Test
        @DisplayName("ctr, conversion and average results")
        void funnelRatios() {
            WeeklyEvents events = new WeeklyEvents(
                concat(times(2, search("malbec", 0)), times(2, search("malbec", 4))),
                List.of(),
                times(2, click("Malbec", null)),
                List.of(),
                List.of(purchase("malbec", "p9", 10.0)),
                List.of());

            QueryAggregate row = query(WeeklyAggregator.aggregate(events, List.of()), "malbec");

            assertEquals(4, row.searches());
            assertEquals(0.5, row.ctr(), 1e-9);
            assertEquals(0.25, row.conversionRate(), 1e-9);
            assertEquals(2.0, row.avgResultsCount(), 1e-9);
            assertEquals(999.0, row.deltaWoW());
        }

        @Test
        @DisplayName("clicks count as searches only when the week has no search events")
        void implicitSearchesFromClicks() {
            WeeklyEvents noSearches = new WeeklyEvents(
                List.of(), List.of(), times(30, click("merlot", null)), List.of(), List.of(), List.of());
            QueryAggregate implicit = query(WeeklyAggregator.aggregate(noSearches, List.of()), "merlot");
            assertEquals(30, implicit.searches());
            assertEquals(1.0, implicit.ctr(), 1e-9);

            WeeklyEvents withSearches = new WeeklyEvents(
                times(10, search("syrah", 3)), List.of(), times(30, click("merlot", null)),
                List.of(), List.of(), List.of());
            QueryAggregate explicit = query(WeeklyAggregator.aggregate(withSearches, List.of()), "merlot");
            assertEquals(0, explicit.searches());
            assertEquals(30, explicit.clicks());
            assertEquals(0.0, explicit.ctr());
        }

        @Test
        @DisplayName("previous week also falls back to clicks when it has no searches")
        void implicitPreviousWeek() {
            WeeklyEvents events = new WeeklyEvents(
                times(20, search("merlot", 5)), List.of(),
                List.of(), times(10, click("merlot", null)),
                List.of(), List.of());

            assertEquals(100.0, query(WeeklyAggregator.aggregate(events, List.of()), "merlot").deltaWoW(), 1e-9);
        }

        @Test
        @DisplayName("events without a usable query are skipped")
        void emptyQueriesSkipped() {
            WeeklyEvents events = new WeeklyEvents(
                List.of(search("?!", 0), search("", 0), search("riesling", 1)),
                List.of(), List.of(), List.of(), List.of(), List.of());

            WeeklyAggregates agg = WeeklyAggregator.aggregate(events, List.of());

            assertEquals(1, agg.queries().size());
            assertEquals("riesling", agg.queries().get(0).queryNorm());
        }
    }

    // ── topics ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("topic roll-up")
    class TopicTests {

        @Test
        @DisplayName("queries sum into their topic; store entities take precedence")
        void rollUp() {
            WeeklyEvents events = new WeeklyEvents(
                concat(times(80, search("pinot noir", 5)), times(20, search("pinot noir reserve", 5)),
                       times(7, search("golan heights cabernet", 5))),
                concat(times(50, search("pinot noir", 5))),
                List.of(), List.of(), List.of(), List.of());

            WeeklyAggregates agg = WeeklyAggregator.aggregate(events, List.of("Golan Heights"));

            TopicAggregate pinot = topic(agg, "pinot noir");
            assertEquals(100, pinot.searches());
            assertEquals(100.0, pinot.deltaWoW(), 1e-9);
            assertEquals(7, topic(agg, "golan heights").searches());
        }

        @Test
        @DisplayName("topic present only last week produces no row this week")
        void previousOnlyTopic() {
            WeeklyEvents events = new WeeklyEvents(
                times(5, search("merlot", 1)), times(9, search("sparkling", 1)),
                List.of(), List.of(), List.of(), List.of());

            WeeklyAggregates agg = WeeklyAggregator.aggregate(events, List.of());

            assertEquals(1, agg.topics().size());
            assertEquals("merlot", agg.topics().get(0).topic());
        }
    }

    // ── products and summary ───────────────────────────────────────────────

    @Nested
    @DisplayName("products and store summary")
    class ProductTests {

        @Test
        @DisplayName("views from clicks, purchases and revenue from purchase events")
        void productFunnel() {
            WeeklyEvents events = new WeeklyEvents(
                List.of(), List.of(),
                times(3, click("chardonnay", "p1")),
                List.of(click("chardonnay", "p1")),
                List.of(purchase("chardonnay", "p1", 10.0), purchase("", "p2", 5.5)),
                List.of(purchase("chardonnay", "p1", 20.0)));

            WeeklyAggregates agg = WeeklyAggregator.aggregate(events, List.of());

            ProductAggregate p1 = agg.products().get(0);
            assertEquals("p1", p1.productId());
            assertEquals(3, p1.views());
            assertEquals(1, p1.purchases());
            assertEquals(1000L, p1.revenueCents());
            assertEquals(200.0, p1.deltaWoW(), 1e-9);

            ProductAggregate p2 = agg.products().get(1);
            assertEquals(0, p2.views());
            assertEquals(550L, p2.revenueCents());

            StoreSummary summary = agg.summary();
            assertEquals(1550L, summary.revenueThisWeekCents());
            assertEquals(2000L, summary.revenuePrevWeekCents());
            assertEquals(-22.5, summary.revenueDeltaWoW(), 1e-9);
            assertEquals(3, summary.clicksThisWeek());
            assertEquals(2, summary.purchasesThisWeek());
        }
    }

    // ── run properties ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("run properties")
    class RunTests {

        @Test
        @DisplayName("same input twice → identical aggregates")
        void idempotent() {
            WeeklyEvents events = new WeeklyEvents(
                concat(times(40, search("rose", 2)), times(12, search("cava", 0))),
                times(30, search("rose", 3)),
                times(11, click("rose", "p3")), List.of(),
                List.of(purchase("rose", "p3", 49.9)), List.of());

            assertEquals(WeeklyAggregator.aggregate(events, List.of("Tabor")),
                         WeeklyAggregator.aggregate(events, List.of("Tabor")));
        }

        @Test
        @DisplayName("zero-activity week → empty rows, zero summary")
        void emptyWeek() {
            WeeklyAggregates agg = WeeklyAggregator.aggregate(WeeklyEvents.empty(), List.of());

            assertTrue(agg.queries().isEmpty());
            assertTrue(agg.topics().isEmpty());
            assertTrue(agg.products().isEmpty());
            assertEquals(0L, agg.summary().revenueThisWeekCents());
            assertEquals(0.0, agg.summary().revenueDeltaWoW());
        }
    }
}
