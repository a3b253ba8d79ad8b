package com.example.admission.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Counter values for the three windows of one (identifier, category) pair.
 */
public final class WindowCounts {

    private static final WindowCounts UNAVAILABLE = new WindowCounts(0L, 0L, 0L, false);
    private static final WindowCounts ZERO = new WindowCounts(0L, 0L, 0L, true);

    private final long minute;
    private final long hour;
    private final long day;
    private final boolean available;

    private WindowCounts(long minute, long hour, long day, boolean available) {
        this.minute = minute;
        this.hour = hour;
        this.day = day;
        this.available = available;
    }

    public static WindowCounts of(long minute, long hour, long day) {
        return new WindowCounts(minute, hour, day, true);
    }

    public static WindowCounts zero() {
        return ZERO;
    }

    /**
     * Sentinel returned when the backing store could not be reached; the counts are unknown.
     */
    public static WindowCounts unavailable() {
        return UNAVAILABLE;
    }

    public long getMinute() {
        return minute;
    }

    public long getHour() {
        return hour;
    }

    public long getDay() {
        return day;
    }

    @JsonIgnore
    public boolean isAvailable() {
        return available;
    }

    public long get(WindowKind window) {
        switch (window) {
            case MINUTE:
                return minute;
            case HOUR:
                return hour;
            default:
                return day;
        }
    }

    @Override
    public String toString() {
        if (!available) {
            return "WindowCounts{unavailable}";
        }
        return "WindowCounts{minute=" + minute + ", hour=" + hour + ", day=" + day + '}';
    }
}
