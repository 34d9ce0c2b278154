package com.rollup.service.persistence;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Inclusive range of UTC calendar dates.
 *
 * @param start first day in the range
 * @param end   last day in the range, not before {@code start}
 */
public record DateRange(LocalDate start, LocalDate end) {

    public static final String TODAY = "today";
    public static final String LAST_7_DAYS = "7d";
    public static final String LAST_30_DAYS = "30d";
    public static final String LAST_90_DAYS = "90d";

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range bounds must not be null");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Date range start " + start + " is after end " + end);
        }
    }

    /**
     * Resolves a named range ending today: {@code today}, {@code 30d}, {@code 90d};
     * anything else means the last 7 days.
     */
    public static DateRange parse(String range, Clock clock) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        if (range == null) {
            return new DateRange(today.minusDays(7), today);
        }
        switch (range) {
            case TODAY:
                return new DateRange(today, today);
            case LAST_30_DAYS:
                return new DateRange(today.minusDays(30), today);
            case LAST_90_DAYS:
                return new DateRange(today.minusDays(90), today);
            default:
                return new DateRange(today.minusDays(7), today);
        }
    }

    public static DateRange singleDay(LocalDate day) {
        return new DateRange(day, day);
    }

    /**
     * @param date ISO date key, e.g. {@code 2024-05-01}
     */
    public boolean contains(String date) {
        return startKey().compareTo(date) <= 0 && endKey().compareTo(date) >= 0;
    }

    public String startKey() {
        return start.toString();
    }

    public String endKey() {
        return end.toString();
    }
}
