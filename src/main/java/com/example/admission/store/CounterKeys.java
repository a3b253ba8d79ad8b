package com.example.admission.store;

import com.example.admission.model.WindowKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Key layout shared by the counter store implementations:
 * {@code <prefix>:<category>:<identifier>:<window>:<index>}.
 */
public final class CounterKeys {

    /**
     * How many window indexes, counting the current one, a key can stay alive for.
     */
    private final int liveWindows;
    private final String prefix;
    private final int expiryMultiplier;

    public CounterKeys(String prefix, int expiryMultiplier) {
        if (expiryMultiplier < 1) {
            throw new IllegalArgumentException("expiryMultiplier must be >= 1");
        }
        this.prefix = prefix;
        this.expiryMultiplier = expiryMultiplier;
        // A key touched at the very end of its window lives expiryMultiplier more windows.
        this.liveWindows = expiryMultiplier + 1;
    }

    public String key(String identifier, String category, WindowKind window, long epochSeconds) {
        return key(identifier, category, window.label(), window.indexAt(epochSeconds));
    }

    private String key(String identifier, String category, String window, long index) {
        return prefix + ':' + category + ':' + identifier + ':' + window + ':' + index;
    }

    /**
     * Minute, hour and day keys, in that order.
     */
    public List<String> currentKeys(String identifier, String category, long epochSeconds) {
        List<String> keys = new ArrayList<>(WindowKind.values().length);
        for (WindowKind window : WindowKind.values()) {
            keys.add(key(identifier, category, window, epochSeconds));
        }
        return keys;
    }

    /**
     * Every key of the pair that the TTL could still keep alive at {@code epochSeconds}.
     */
    public List<String> liveKeys(String identifier, String category, long epochSeconds) {
        List<String> keys = new ArrayList<>(WindowKind.values().length * liveWindows);
        for (WindowKind window : WindowKind.values()) {
            long current = window.indexAt(epochSeconds);
            for (int back = 0; back < liveWindows; back++) {
                keys.add(key(identifier, category, window.label(), current - back));
            }
        }
        return keys;
    }

    public long ttlSeconds(WindowKind window) {
        return window.sizeSeconds() * expiryMultiplier;
    }
}
