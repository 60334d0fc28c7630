package com.tracepile.store.pile;

import com.tracepile.core.util.Times;

import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * Calendar month (UTC) used to assign files to time buckets.
 */
public record TimeKey(int year, int month) implements Comparable<TimeKey> {

    /**
     * Key of the month containing epoch time {@code t}.
     */
    public static TimeKey of(double t) {
        YearMonth ym = YearMonth.from(Times.toInstant(Math.floor(t)).atZone(ZoneOffset.UTC));
        return new TimeKey(ym.getYear(), ym.getMonthValue());
    }

    @Override
    public int compareTo(TimeKey other) {
        return year != other.year ? Integer.compare(year, other.year) : Integer.compare(month, other.month);
    }

    @Override
    public String toString() {
        return String.format("%04d-%02d", year, month);
    }
}
