package com.di.mllogs.util;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/** Parsing of log timestamps and the ingestion lag between them. */
public final class LogTimestamps {

    private LogTimestamps() {}

    /** Pattern of {@code createdAt} / {@code ingestedAt}: no zone, second precision. */
    public static final String PATTERN = "uuuu-MM-dd'T'HH:mm:ss";

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern(PATTERN).withResolverStyle(ResolverStyle.STRICT);

    private static final double SECONDS_PER_HOUR = 3600.0;

    /**
     * Parses a log timestamp as a UTC-naive instant.
     *
     * @param value timestamp text, e.g. {@code 2024-01-01T05:00:00}
     * @return Joda DateTime in UTC (the DATETIME representation Beam rows expect),
     *         or null when the value is null or does not match {@link #PATTERN}
     */
    public static DateTime parse(String value) {
        if (value == null) {
            return null;
        }
        try {
            LocalDateTime local = LocalDateTime.parse(value, FORMATTER);
            return new DateTime(local.toInstant(ZoneOffset.UTC).toEpochMilli(), DateTimeZone.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Elapsed hours between two instants, computed from whole epoch seconds.
     *
     * @return {@code (to - from) / 3600}, or null if either side is null
     */
    public static Double hoursBetween(DateTime from, DateTime to) {
        if (from == null || to == null) {
            return null;
        }
        long seconds = to.getMillis() / 1000 - from.getMillis() / 1000;
        return seconds / SECONDS_PER_HOUR;
    }
}
