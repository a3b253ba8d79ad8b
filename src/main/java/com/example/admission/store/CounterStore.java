package com.example.admission.store;

import com.example.admission.model.WindowCounts;

import java.time.Instant;

/**
 * Atomic minute/hour/day counters shared by every serving instance.
 * <p>
 * Implementations never throw: when the backing store cannot be reached, counting methods
 * return {@link WindowCounts#unavailable()} and {@link #reset} returns false.
 */
public interface CounterStore {

    /**
     * Atomically increments the three window counters for the pair and refreshes their expiry.
     *
     * @return post-increment counts, or the unavailable sentinel
     */
    WindowCounts incrementAll(String identifier, String category, Instant now);

    /**
     * Reads the three window counters without changing them. Missing counters read as zero.
     */
    WindowCounts peekAll(String identifier, String category, Instant now);

    /**
     * Deletes every live counter for the pair.
     *
     * @return true if at least one counter was deleted
     */
    boolean reset(String identifier, String category, Instant now);

    /**
     * Synchronous liveness probe of the backing store.
     */
    boolean isReachable();

    /**
     * @return when the store last failed an operation, or {@code null} if it never did
     */
    Instant lastFailure();

    String type();
}
