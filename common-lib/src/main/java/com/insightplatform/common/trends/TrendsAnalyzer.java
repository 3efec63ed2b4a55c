package com.insightplatform.common.trends;

import com.insightplatform.common.calendar.CalendarEvent;
import com.insightplatform.common.calendar.CalendarEvents;
import com.insightplatform.common.calendar.IsoWeeks;
import com.insightplatform.common.model.CtaType;
import com.insightplatform.common.scoring.PercentChange;

import java.time.Duration;
import java.time.Instant;
import java.time.Month;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Mines per-query search time series for merchandising insights, independent of the
 * weekly store pipeline.
 *
 * <p>Heuristics, each capped at {@code maxPerType}:
 * <ol>
 *   <li>velocity: last {@code recentWeeks} weeks against the ones before, rising and declining</li>
 *   <li>seasonal: monthly spikes aligned with a {@link CalendarEvents} occasion by keyword and month</li>
 *   <li>peak hours: busiest 3-hour UTC window across qualified queries (one insight)</li>
 *   <li>emerging: qualified queries first seen within {@code emergingMaxWeeks} weeks of {@code now}</li>
 *   <li>evergreen: steady share of monthly traffic</li>
 * </ol>
 * The combined list is sorted by confidence, highest first.
 *
 * <p>Deterministic: {@code now} is a parameter. No Spring dependencies. No I/O.
 */
public final class TrendsAnalyzer {

    static final int PEAK_WINDOW_HOURS = 3;
    static final long SIGNIFICANT_MONTH_VOLUME = 100;
    static final double EVERGREEN_MAX_CV = 0.8;

    private static final Duration WEEK = Duration.ofDays(7);

    private TrendsAnalyzer() {}

    public static List<TrendInsight> analyze(SortedMap<String, QueryTimeSeries> series,
                                             TrendsConfig config,
                                             Instant now) {
        List<String> weekKeys = new ArrayList<>(new TreeSet<>(keys(series, true)));
        List<String> monthKeys = new ArrayList<>(new TreeSet<>(keys(series, false)));

        List<QueryTimeSeries> qualified = series.values().stream()
            .filter(s -> s.totalVolume() >= config.minVolume())
            .toList();

        List<TrendInsight> insights = new ArrayList<>();
        insights.addAll(velocityInsights(qualified, weekKeys, config));
        insights.addAll(seasonalInsights(qualified, monthKeys, config));
        insights.addAll(peakHoursInsight(qualified));
        insights.addAll(emergingInsights(qualified, config, now));
        insights.addAll(evergreenInsights(series, qualified, monthKeys, config));

        insights.sort(Comparator.comparingDouble(TrendInsight::confidence).reversed());
        return insights;
    }

    /**
     * Keeps the first insight per (CTA type, entity key), in list order. Several heuristics
     * may name the same query with the same CTA; storage allows one row per pair.
     */
    public static List<TrendInsight> distinctByEntity(List<TrendInsight> insights) {
        Set<String> seen = new HashSet<>();
        List<TrendInsight> distinct = new ArrayList<>();
        for (TrendInsight i : insights) {
            if (seen.add(i.type() + "|" + i.entityKey())) {
                distinct.add(i);
            }
        }
        return distinct;
    }

    // ── velocity ───────────────────────────────────────────────────────────

    /**
     * Needs at least {@code 2 * recentWeeks} distinct week keys across the whole data set;
     * otherwise {@link Velocity#STABLE}.
     */
    public static Velocity velocity(QueryTimeSeries entry, List<String> sortedWeekKeys,
                                    int recentWeeks, double thresholdPct) {
        int n = sortedWeekKeys.size();
        if (n < recentWeeks * 2) {
            return Velocity.STABLE;
        }
        long recent = 0;
        long previous = 0;
        for (String k : sortedWeekKeys.subList(n - recentWeeks, n)) recent += entry.weekVolume(k);
        for (String k : sortedWeekKeys.subList(n - 2 * recentWeeks, n - recentWeeks)) previous += entry.weekVolume(k);

        double pct = PercentChange.of(recent, previous);
        TrendDirection direction = pct > thresholdPct ? TrendDirection.RISING
            : pct < -thresholdPct ? TrendDirection.DECLINING
            : TrendDirection.STABLE;
        return new Velocity(direction, pct, recent, previous);
    }

    private static List<TrendInsight> velocityInsights(List<QueryTimeSeries> qualified,
                                                       List<String> weekKeys,
                                                       TrendsConfig config) {
        Map<QueryTimeSeries, Velocity> velocities = new LinkedHashMap<>();
        for (QueryTimeSeries s : qualified) {
            velocities.put(s, velocity(s, weekKeys, config.recentWeeks(), config.velocityThresholdPct()));
        }
        String period = "last " + config.recentWeeks() + " weeks vs previous " + config.recentWeeks() + " weeks";
        List<TrendInsight> out = new ArrayList<>();

        velocities.entrySet().stream()
            .filter(e -> e.getValue().direction() == TrendDirection.RISING
                && e.getValue().recentVolume() >= config.minVolume())
            .sorted(Comparator.comparingDouble((Map.Entry<QueryTimeSeries, Velocity> e) -> e.getValue().pctChange()).reversed())
            .limit(config.maxPerType())
            .forEach(e -> {
                QueryTimeSeries s = e.getKey();
                Velocity v = e.getValue();
                long pct = Math.round(v.pctChange());
                out.add(new TrendInsight(TrendKind.TRENDING_UP, CtaType.PROMOTE_THIS_THEME, s.queryRaw(),
                    Math.min(0.95, 0.5 + v.recentVolume() / 200.0 + v.pctChange() / 1000.0),
                    velocityEvidence(TrendKind.TRENDING_UP, s, v, period),
                    "Customer searches for \"" + s.queryRaw() + "\" are surging (up " + pct
                        + "%). Feature this theme in homepage, campaigns, and search suggestions this week."));
            });

        velocities.entrySet().stream()
            .filter(e -> e.getValue().direction() == TrendDirection.DECLINING
                && e.getValue().previousVolume() >= config.minVolume())
            .sorted(Comparator.comparingDouble(e -> e.getValue().pctChange()))
            .limit(config.maxPerType())
            .forEach(e -> {
                QueryTimeSeries s = e.getKey();
                Velocity v = e.getValue();
                long pct = Math.abs(Math.round(v.pctChange()));
                out.add(new TrendInsight(TrendKind.TRENDING_DOWN, CtaType.FIX_THIS_ISSUE, s.queryRaw(),
                    Math.min(0.9, 0.4 + v.previousVolume() / 200.0 + Math.abs(v.pctChange()) / 1000.0),
                    velocityEvidence(TrendKind.TRENDING_DOWN, s, v, period),
                    "Interest in \"" + s.queryRaw() + "\" is declining (down " + pct
                        + "%). Review product positioning, search relevance, or category placement to recover demand."));
            });
        return out;
    }

    private static Map<String, Object> velocityEvidence(TrendKind kind, QueryTimeSeries s, Velocity v, String period) {
        Map<String, Object> evidence = baseEvidence(kind, s);
        evidence.put("recentVolume", v.recentVolume());
        evidence.put("previousVolume", v.previousVolume());
        evidence.put("pctChange", Math.round(v.pctChange()));
        evidence.put("period", period);
        return evidence;
    }

    // ── seasonal ───────────────────────────────────────────────────────────

    private static List<TrendInsight> seasonalInsights(List<QueryTimeSeries> qualified,
                                                       List<String> monthKeys,
                                                       TrendsConfig config) {
        Map<String, TrendInsight> bestByEvent = new LinkedHashMap<>();

        for (QueryTimeSeries s : qualified) {
            if (s.totalVolume() < 2L * config.minVolume()) continue;

            long sum = 0;
            for (String m : monthKeys) sum += s.monthVolume(m);
            double avgMonthly = (double) sum / Math.max(1, monthKeys.size());
            if (avgMonthly < 2) continue;

            Set<Integer> spikeMonths = new LinkedHashSet<>();
            s.monthly().forEach((monthKey, vol) -> {
                if (vol > avgMonthly * 2) spikeMonths.add(IsoWeeks.monthOf(monthKey));
            });
            if (spikeMonths.isEmpty()) continue;

            CalendarEvent event = CalendarEvents.match(s.queryNorm()).stream()
                .filter(ev -> ev.months().stream().anyMatch(spikeMonths::contains))
                .findFirst()
                .orElse(null);
            if (event == null) continue;

            Map<String, Object> evidence = baseEvidence(TrendKind.SEASONAL_OPPORTUNITY, s);
            evidence.put("spikeMonths", spikeMonths.stream()
                .map(m -> Month.of(m).getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
                .toList());
            evidence.put("calendarEvent", event.name());
            evidence.put("calendarEventLocal", event.localName());
            evidence.put("avgMonthlySearches", Math.round(avgMonthly));
            evidence.put("monthlyBreakdown", new TreeMap<>(s.monthly()));

            TrendInsight insight = new TrendInsight(TrendKind.SEASONAL_OPPORTUNITY, CtaType.PROMOTE_THIS_THEME,
                s.queryRaw(),
                Math.min(0.9, 0.6 + s.totalVolume() / 500.0),
                evidence,
                event.campaignHint() + ". \"" + s.queryRaw() + "\" peaks around " + event.name()
                    + " (" + event.localName() + "). Feature it in campaigns, homepage, and social content now.");

            bestByEvent.merge(event.name(), insight,
                (existing, incoming) -> incoming.confidence() > existing.confidence() ? incoming : existing);
        }

        return bestByEvent.values().stream()
            .sorted(Comparator.comparingDouble(TrendInsight::confidence).reversed())
            .limit(config.maxPerType())
            .toList();
    }

    // ── peak hours ─────────────────────────────────────────────────────────

    private static List<TrendInsight> peakHoursInsight(List<QueryTimeSeries> qualified) {
        long[] hourly = new long[24];
        for (QueryTimeSeries s : qualified) {
            for (int h = 0; h < 24; h++) hourly[h] += s.hourly().get(h);
        }
        long total = 0;
        int peakHour = 0;
        for (int h = 0; h < 24; h++) {
            total += hourly[h];
            if (hourly[h] > hourly[peakHour]) peakHour = h;
        }
        if (total == 0) {
            return List.of();
        }

        int bestStart = 0;
        long bestVolume = -1;
        for (int start = 0; start < 24; start++) {
            long vol = 0;
            for (int k = 0; k < PEAK_WINDOW_HOURS; k++) vol += hourly[(start + k) % 24];
            if (vol > bestVolume) {
                bestVolume = vol;
                bestStart = start;
            }
        }
        String window = String.format("%02d:00-%02d:00", bestStart, (bestStart + PEAK_WINDOW_HOURS) % 24);
        long windowPct = Math.round(bestVolume * 100.0 / total);

        List<Long> distribution = new ArrayList<>(24);
        for (long v : hourly) distribution.add(v);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("kind", TrendKind.PEAK_HOURS.name());
        evidence.put("peakHour", peakHour);
        evidence.put("bestWindow", window);
        evidence.put("windowVolume", bestVolume);
        evidence.put("windowPctOfTotal", windowPct);
        evidence.put("totalSearches", total);
        evidence.put("hourlyDistribution", distribution);

        return List.of(new TrendInsight(TrendKind.PEAK_HOURS, CtaType.TALK_ABOUT_THIS,
            "Peak Hours " + window, 0.85, evidence,
            windowPct + "% of customer searches happen between " + window
                + ". Use this timing insight for scheduling social posts, newsletter sends, and promotional content."));
    }

    // ── emerging ───────────────────────────────────────────────────────────

    private static List<TrendInsight> emergingInsights(List<QueryTimeSeries> qualified,
                                                       TrendsConfig config,
                                                       Instant now) {
        Instant cutoff = now.minus(WEEK.multipliedBy(config.emergingMaxWeeks()));
        List<QueryTimeSeries> candidates = new ArrayList<>();
        for (QueryTimeSeries s : qualified) {
            if (!s.firstSeen().isBefore(cutoff) && s.totalVolume() >= config.emergingMinVolume()) {
                candidates.add(s);
            }
        }
        candidates.sort(Comparator.comparingLong(QueryTimeSeries::totalVolume).reversed());

        List<TrendInsight> out = new ArrayList<>();
        for (QueryTimeSeries s : candidates.subList(0, Math.min(candidates.size(), config.maxPerType()))) {
            long weeksOld = Math.round((double) Duration.between(s.firstSeen(), now).toMillis() / WEEK.toMillis());
            Map<String, Object> evidence = baseEvidence(TrendKind.EMERGING_QUERY, s);
            evidence.put("firstSeen", s.firstSeen().atZone(ZoneOffset.UTC).toLocalDate().toString());
            evidence.put("weeksOld", weeksOld);
            evidence.put("weeklyBreakdown", new TreeMap<>(s.weekly()));
            out.add(new TrendInsight(TrendKind.EMERGING_QUERY, CtaType.PROMOTE_THIS_THEME, s.queryRaw(),
                Math.min(0.85, 0.5 + s.totalVolume() / 100.0),
                evidence,
                "\"" + s.queryRaw() + "\" is an emerging search term (" + s.totalVolume() + " searches in "
                    + weeksOld + " week(s)). Feature it prominently in search suggestions and homepage now"
                    + " to capture growing demand."));
        }
        return out;
    }

    // ── evergreen ──────────────────────────────────────────────────────────

    private static List<TrendInsight> evergreenInsights(SortedMap<String, QueryTimeSeries> series,
                                                        List<QueryTimeSeries> qualified,
                                                        List<String> monthKeys,
                                                        TrendsConfig config) {
        Map<String, Long> monthlyTotals = new TreeMap<>();
        for (QueryTimeSeries s : series.values()) {
            s.monthly().forEach((m, vol) -> monthlyTotals.merge(m, vol, Long::sum));
        }
        List<String> significant = monthKeys.stream()
            .filter(m -> monthlyTotals.getOrDefault(m, 0L) > SIGNIFICANT_MONTH_VOLUME)
            .toList();
        if (significant.isEmpty()) {
            return List.of();
        }

        record Candidate(QueryTimeSeries series, double cv, double avgShare) {}
        List<Candidate> candidates = new ArrayList<>();
        for (QueryTimeSeries s : qualified) {
            if (s.monthly().size() < 3 || s.totalVolume() < 5L * config.minVolume()) continue;
            double[] shares = new double[significant.size()];
            for (int i = 0; i < shares.length; i++) {
                String m = significant.get(i);
                shares[i] = (double) s.monthVolume(m) / monthlyTotals.get(m);
            }
            double mean = mean(shares);
            if (mean <= 0) continue;
            double cv = coefficientOfVariation(shares);
            if (cv < EVERGREEN_MAX_CV) {
                candidates.add(new Candidate(s, cv, mean));
            }
        }
        candidates.sort(Comparator.comparingLong((Candidate c) -> c.series().totalVolume()).reversed());

        List<TrendInsight> out = new ArrayList<>();
        for (Candidate c : candidates.subList(0, Math.min(candidates.size(), config.maxPerType()))) {
            QueryTimeSeries s = c.series();
            String sharePct = String.format(Locale.ROOT, "%.1f", c.avgShare() * 100);
            Map<String, Object> evidence = baseEvidence(TrendKind.EVERGREEN_LEADER, s);
            evidence.put("monthsActive", s.monthly().size());
            evidence.put("avgMonthlySearches", Math.round((double) s.totalVolume() / s.monthly().size()));
            evidence.put("avgShareOfTraffic", sharePct + "%");
            evidence.put("shareConsistency", Math.round((1 - c.cv()) * 100) + "%");
            evidence.put("monthlyBreakdown", new TreeMap<>(s.monthly()));
            out.add(new TrendInsight(TrendKind.EVERGREEN_LEADER, CtaType.PROMOTE_THIS_THEME, s.queryRaw(),
                Math.min(0.95, 0.7 + s.totalVolume() / 2000.0),
                evidence,
                "\"" + s.queryRaw() + "\" captures ~" + sharePct + "% of all searches every month consistently."
                    + " Keep it prominently featured in navigation, homepage, and search suggestions year-round."));
        }
        return out;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static Set<String> keys(SortedMap<String, QueryTimeSeries> series, boolean weekly) {
        Set<String> keys = new HashSet<>();
        for (QueryTimeSeries s : series.values()) {
            keys.addAll(weekly ? s.weekly().keySet() : s.monthly().keySet());
        }
        return keys;
    }

    private static Map<String, Object> baseEvidence(TrendKind kind, QueryTimeSeries s) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("kind", kind.name());
        evidence.put("query", s.queryRaw());
        evidence.put("queryNorm", s.queryNorm());
        evidence.put("totalVolume", s.totalVolume());
        return evidence;
    }

    static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Population standard deviation over mean; 0 for an empty or zero-mean series. */
    static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        if (mean == 0) return 0.0;
        double sq = 0;
        for (double v : values) sq += (v - mean) * (v - mean);
        return Math.sqrt(sq / values.length) / mean;
    }
}
