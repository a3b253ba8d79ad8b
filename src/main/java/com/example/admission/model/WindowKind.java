package com.example.admission.model;

/**
 * Fixed-length counting windows. Window boundaries are aligned to the epoch.
 */
public enum WindowKind {
    MINUTE("minute", 60L),
    HOUR("hour", 3_600L),
    DAY("day", 86_400L);

    private final String label;
    private final long sizeSeconds;

    WindowKind(String label, long sizeSeconds) {
        this.label = label;
        this.sizeSeconds = sizeSeconds;
    }

    public String label() {
        return label;
    }

    public long sizeSeconds() {
        return sizeSeconds;
    }

    public long indexAt(long epochSeconds) {
        return Math.floorDiv(epochSeconds, sizeSeconds);
    }

    /**
     * Seconds left until the window containing {@code epochSeconds} rolls over, in {@code [1, size]}.
     */
    public long secondsUntilRollover(long epochSeconds) {
        return sizeSeconds - Math.floorMod(epochSeconds, sizeSeconds);
    }

    /**
     * Epoch second at which the next window starts.
     */
    public long nextBoundary(long epochSeconds) {
        return (indexAt(epochSeconds) + 1) * sizeSeconds;
    }
}
