package com.example.pharmacyrota.common;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Half-open time window {@code [start, end)} within one calendar day.
 */
public record TimeWindow(LocalTime start, LocalTime end) implements Comparable<TimeWindow> {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Window end must be after start: " + start + "-" + end);
        }
    }

    public static TimeWindow of(LocalTime start, LocalTime end) {
        return new TimeWindow(start, end);
    }

    public boolean overlaps(TimeWindow other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }

    public boolean contains(TimeWindow other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    /** Touching or overlapping. */
    public boolean adjoins(TimeWindow other) {
        return !start.isAfter(other.end) && !end.isBefore(other.start);
    }

    /**
     * Extends the window by the given margins, clamped to the same day.
     */
    public TimeWindow widen(Duration before, Duration after) {
        long startMinute = Math.max(0, start.toSecondOfDay() / 60 - before.toMinutes());
        LocalTime widenedStart = LocalTime.ofSecondOfDay(startMinute * 60);
        long endSecond = Math.min(LocalTime.MAX.toSecondOfDay(), end.toSecondOfDay() + after.toSeconds());
        return new TimeWindow(widenedStart, LocalTime.ofSecondOfDay(endSecond));
    }

    @Override
    public int compareTo(TimeWindow o) {
        int c = start.compareTo(o.start);
        return c != 0 ? c : end.compareTo(o.end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
