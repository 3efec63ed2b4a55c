package com.insightplatform.common.aggregation;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Forgiving reader for schema-less raw event documents.
 *
 * <p>Each logical field is read from an ordered list of candidate names; the first
 * candidate holding a usable value wins. Unusable values are skipped, never thrown.
 *
 * <table>
 *   <tr><th>field</th><th>candidates, in order</th></tr>
 *   <tr><td>timestamp</td><td>{@code ts, timestamp, createdAt, created_at}</td></tr>
 *   <tr><td>query</td><td>{@code queryNorm, search_query, query}</td></tr>
 *   <tr><td>display query</td><td>{@code query, search_query, queryNorm}</td></tr>
 *   <tr><td>product id</td><td>{@code productId, product_id}</td></tr>
 *   <tr><td>revenue</td><td>{@code revenueCents, revenue (x100), revenue_cents, product_price (x100)}</td></tr>
 *   <tr><td>results count</td><td>{@code resultsCount, results_count}</td></tr>
 * </table>
 *
 * <p>Timestamps accept {@link Instant}, {@link Date}, ISO-8601 strings and epoch numbers;
 * numbers below {@value #EPOCH_MILLIS_THRESHOLD} are epoch seconds, the rest epoch millis.
 */
public final class RawEventFields {

    public static final List<String> TIMESTAMP_FIELDS     = List.of("ts", "timestamp", "createdAt", "created_at");
    public static final List<String> QUERY_FIELDS         = List.of("queryNorm", "search_query", "query");
    public static final List<String> DISPLAY_QUERY_FIELDS = List.of("query", "search_query", "queryNorm");
    public static final List<String> PRODUCT_ID_FIELDS    = List.of("productId", "product_id");
    public static final List<String> RESULTS_COUNT_FIELDS = List.of("resultsCount", "results_count");

    static final double EPOCH_MILLIS_THRESHOLD = 1e12;

    /** Offset date-times first, then local date-times and plain dates read as UTC. */
    private static final List<Function<String, Instant>> ISO_PARSERS = List.of(
        s -> OffsetDateTime.parse(s).toInstant(),
        s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
        s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private RawEventFields() {}

    public static Optional<Instant> timestamp(Map<String, ?> doc) {
        return first(doc, TIMESTAMP_FIELDS, RawEventFields::toInstant);
    }

    /** Query text used for grouping; {@code ""} when absent. */
    public static String query(Map<String, ?> doc) {
        return first(doc, QUERY_FIELDS, RawEventFields::nonBlankString).orElse("");
    }

    /** Query text as the shopper typed it; {@code ""} when absent. */
    public static String displayQuery(Map<String, ?> doc) {
        return first(doc, DISPLAY_QUERY_FIELDS, RawEventFields::nonBlankString).orElse("");
    }

    public static Optional<String> productId(Map<String, ?> doc) {
        return first(doc, PRODUCT_ID_FIELDS, RawEventFields::idString);
    }

    /** Revenue in minor currency units; {@code 0} when no monetary field is usable. */
    public static long revenueCents(Map<String, ?> doc) {
        if (doc == null) {
            return 0L;
        }
        if (doc.get("revenueCents") instanceof Number n) {
            return Math.round(n.doubleValue());
        }
        if (doc.get("revenue") instanceof Number n) {
            return Math.round(n.doubleValue() * 100);
        }
        if (doc.get("revenue_cents") instanceof Number n) {
            return Math.round(n.doubleValue());
        }
        Object price = doc.get("product_price");
        if (price instanceof Number n) {
            return Math.round(n.doubleValue() * 100);
        }
        if (price instanceof String s) {
            try {
                return Math.round(Double.parseDouble(s.trim()) * 100);
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        return 0L;
    }

    public static double resultsCount(Map<String, ?> doc) {
        return first(doc, RESULTS_COUNT_FIELDS, v -> v instanceof Number n
                ? Optional.of(n.doubleValue())
                : Optional.<Double>empty())
            .orElse(0.0);
    }

    /** True when the event's timestamp falls in {@code [from, to)}. */
    public static boolean within(Map<String, ?> doc, Instant from, Instant to) {
        return timestamp(doc)
            .map(ts -> !ts.isBefore(from) && ts.isBefore(to))
            .orElse(false);
    }

    // ── value parsers ──────────────────────────────────────────────────────

    private static <T> Optional<T> first(Map<String, ?> doc, List<String> fields,
                                         Function<Object, Optional<T>> parser) {
        if (doc == null) {
            return Optional.empty();
        }
        for (String field : fields) {
            Object value = doc.get(field);
            if (value == null) {
                continue;
            }
            Optional<T> parsed = parser.apply(value);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    static Optional<Instant> toInstant(Object value) {
        if (value instanceof Instant i) {
            return Optional.of(i);
        }
        if (value instanceof Date d) {
            return Optional.of(d.toInstant());
        }
        if (value instanceof Number n) {
            double v = n.doubleValue();
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                return Optional.empty();
            }
            double millis = v < EPOCH_MILLIS_THRESHOLD ? v * 1000 : v;
            return Optional.of(Instant.ofEpochMilli(Math.round(millis)));
        }
        if (value instanceof String s) {
            return parseIso(s.trim());
        }
        return Optional.empty();
    }

    private static Optional<Instant> parseIso(String s) {
        if (s.isEmpty()) {
            return Optional.empty();
        }
        for (Function<String, Instant> parser : ISO_PARSERS) {
            try {
                return Optional.of(parser.apply(s));
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> nonBlankString(Object value) {
        if (value instanceof String s && !s.isBlank()) {
            return Optional.of(s);
        }
        return Optional.empty();
    }

    private static Optional<String> idString(Object value) {
        if (value instanceof String s) {
            return s.isBlank() ? Optional.empty() : Optional.of(s.trim());
        }
        if (value instanceof Integer || value instanceof Long) {
            return Optional.of(value.toString());
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d == Math.rint(d) ? Optional.of(Long.toString((long) d)) : Optional.of(n.toString());
        }
        return Optional.of(value.toString());
    }
}
