package com.insightplatform.common.calendar;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;

/**
 * UTC week and month arithmetic shared by the weekly pipeline and the trends analyzer.
 *
 * <p>A week is the half-open window {@code [monday 00:00Z, next monday 00:00Z)}.
 */
public final class IsoWeeks {

    private IsoWeeks() {}

    /** Monday (UTC) of the ISO week containing {@code instant}. */
    public static LocalDate startOfWeek(Instant instant) {
        return startOfWeek(instant.atZone(ZoneOffset.UTC).toLocalDate());
    }

    /** Monday of the ISO week containing {@code date}; Mondays map to themselves. */
    public static LocalDate startOfWeek(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public static LocalDate addDays(LocalDate date, int days) {
        return date.plusDays(days);
    }

    /** Midnight UTC at the start of {@code date}. */
    public static Instant atStartOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /** ISO week-based key, e.g. {@code 2025-W07}. Sorts chronologically as a string. */
    public static String weekKey(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        int week = utc.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        int year = utc.get(IsoFields.WEEK_BASED_YEAR);
        return String.format("%04d-W%02d", year, week);
    }

    /** Calendar month key, e.g. {@code 2025-02}. */
    public static String monthKey(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        return String.format("%04d-%02d", utc.getYear(), utc.getMonthValue());
    }

    /** Month number (1-12) of a {@link #monthKey} string. */
    public static int monthOf(String monthKey) {
        return Integer.parseInt(monthKey.substring(monthKey.indexOf('-') + 1));
    }

    public static int hourOfDay(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).getHour();
    }
}
