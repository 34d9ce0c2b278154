package com.rollup.service.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Composite rollup keys: {@code yyyy-MM-dd|dimension}. Also used as row ids in the
 * repository so that the same key always upserts the same row.
 */
public final class RollupKeys {

    public static final String SEPARATOR = "|";
    public static final String UNKNOWN = "Unknown";
    public static final String DIRECT = "direct";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private RollupKeys() {
    }

    /**
     * UTC calendar date of the timestamp.
     */
    public static String dateOf(Instant timestamp) {
        return DATE_FORMAT.format(LocalDate.ofInstant(timestamp, ZoneOffset.UTC));
    }

    public static String pathKey(String date, String path) {
        return date + SEPARATOR + path;
    }

    public static String sourceKey(String date, String source) {
        return date + SEPARATOR + source;
    }

    public static String deviceKey(String date, String browser, String os) {
        return date + SEPARATOR + browser + SEPARATOR + os;
    }

    public static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
