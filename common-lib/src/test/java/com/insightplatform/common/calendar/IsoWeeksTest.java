package com.insightplatform.common.calendar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class IsoWeeksTest {

    @Nested
    @DisplayName("startOfWeek()")
    class StartOfWeekTests {

        @Test
        @DisplayName("mid-week instant → Monday of the same ISO week")
        void midWeek() {
            assertEquals(LocalDate.of(2025, 2, 10), IsoWeeks.startOfWeek(Instant.parse("2025-02-13T15:30:00Z")));
        }

        @Test
        @DisplayName("Sunday late evening still belongs to the week that started Monday")
        void sundayEvening() {
            assertEquals(LocalDate.of(2025, 2, 10), IsoWeeks.startOfWeek(Instant.parse("2025-02-16T23:59:59Z")));
        }

        @Test
        @DisplayName("Monday midnight maps to itself")
        void mondayMidnight() {
            assertEquals(LocalDate.of(2025, 2, 10), IsoWeeks.startOfWeek(Instant.parse("2025-02-10T00:00:00Z")));
        }

        @Test
        @DisplayName("window boundaries are UTC midnight and exactly 7 days apart")
        void windowBoundaries() {
            LocalDate week = LocalDate.of(2025, 2, 10);
            assertEquals(Instant.parse("2025-02-10T00:00:00Z"), IsoWeeks.atStartOfDay(week));
            assertEquals(LocalDate.of(2025, 2, 3), IsoWeeks.addDays(week, -7));
            assertEquals(Instant.parse("2025-02-17T00:00:00Z"), IsoWeeks.atStartOfDay(IsoWeeks.addDays(week, 7)));
        }
    }

    @Nested
    @DisplayName("bucket keys")
    class KeyTests {

        @Test
        @DisplayName("ISO week key uses the week-based year")
        void weekKey() {
            assertEquals("2025-W07", IsoWeeks.weekKey(Instant.parse("2025-02-13T10:00:00Z")));
            assertEquals("2025-W01", IsoWeeks.weekKey(Instant.parse("2024-12-30T10:00:00Z")));
        }

        @Test
        @DisplayName("month key and month number")
        void monthKey() {
            assertEquals("2025-02", IsoWeeks.monthKey(Instant.parse("2025-02-28T23:00:00Z")));
            assertEquals(12, IsoWeeks.monthOf("2024-12"));
            assertEquals(3, IsoWeeks.monthOf("2025-03"));
        }

        @Test
        @DisplayName("hour of day is UTC")
        void hourOfDay() {
            assertEquals(21, IsoWeeks.hourOfDay(Instant.parse("2025-02-13T21:45:00Z")));
        }
    }
}
