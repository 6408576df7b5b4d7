package com.tracegate.proxy.core.trace;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Insertion-ordered trace buffer holding at most {@code maxSize} entries; the
 * oldest entries are evicted first. Not thread-safe: owned by the hub thread.
 */
public final class TraceHistory {

    /** Default number of traces kept. */
    public static final int DEFAULT_MAX_SIZE = 100;

    private final int maxSize;
    private final ArrayDeque<Trace> entries;

    public TraceHistory(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("History size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new ArrayDeque<>(Math.min(maxSize, 1024));
    }

    public void append(Trace trace) {
        entries.addLast(trace);
        while (entries.size() > maxSize) {
            entries.removeFirst();
        }
    }

    /**
     * @return An immutable copy in insertion order.
     */
    public List<Trace> snapshot() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public int maxSize() {
        return maxSize;
    }
}
