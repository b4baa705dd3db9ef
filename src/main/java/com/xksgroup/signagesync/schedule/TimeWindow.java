package com.xksgroup.signagesync.schedule;

import java.time.LocalTime;

/**
 * Half-open time-of-day window {@code [start, end)} that may wrap past midnight.
 */
public final class TimeWindow {

    private TimeWindow() {}

    /**
     * Membership of {@code now} in the window.
     * <ul>
     *   <li>{@code start < end}: {@code start <= now < end}</li>
     *   <li>{@code start > end}: {@code now >= start || now < end} (spans midnight)</li>
     *   <li>{@code start == end}: never</li>
     * </ul>
     */
    public static boolean contains(LocalTime start, LocalTime end, LocalTime now) {
        if (start == null || end == null || now == null) {
            return false;
        }
        int cmp = start.compareTo(end);
        if (cmp < 0) {
            return !now.isBefore(start) && now.isBefore(end);
        }
        if (cmp > 0) {
            return !now.isBefore(start) || now.isBefore(end);
        }
        return false;
    }
}
