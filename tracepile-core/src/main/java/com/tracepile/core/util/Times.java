package com.tracepile.core.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Helpers for epoch-second time values.
 */
public final class Times {

    private static final DateTimeFormatter FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private Times() {}

    /**
     * Convert epoch seconds (with fraction) to an Instant.
     */
    public static Instant toInstant(double t) {
        long seconds = (long) Math.floor(t);
        long nanos = Math.round((t - seconds) * 1e9);
        if (nanos >= 1_000_000_000L) {
            seconds += 1;
            nanos -= 1_000_000_000L;
        }
        return Instant.ofEpochSecond(seconds, nanos);
    }

    /**
     * Convert an Instant to epoch seconds.
     */
    public static double fromInstant(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1e9;
    }

    /**
     * Format epoch seconds as a UTC timestamp, or "-" for null.
     */
    public static String format(Double t) {
        if (t == null || t.isNaN()) return "-";
        return FORMAT.format(toInstant(t));
    }
}
