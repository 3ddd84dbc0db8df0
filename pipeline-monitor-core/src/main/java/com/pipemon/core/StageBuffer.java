package com.pipemon.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Fixed-capacity ring of samples for one stage. Appending past capacity evicts the oldest entry.
 * Not thread-safe: {@link PerformanceCollector} guards every instance with its own lock.
 */
final class StageBuffer<T> {
    private final int capacity;
    private final ArrayDeque<T> entries;
    private long appended;

    StageBuffer(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    void add(T entry) {
        if (entries.size() == capacity) entries.pollFirst();
        entries.addLast(entry);
        appended++;
    }

    int size() {
        return entries.size();
    }

    /** Total number of entries ever appended, evicted ones included. */
    long appendedCount() {
        return appended;
    }

    List<T> snapshot() {
        return new ArrayList<>(entries);
    }

    /**
     * Entries appended after the {@code mark}-th append, limited to the {@code limit} most recent ones.
     * Entries already evicted are skipped.
     */
    List<T> since(long mark, int limit) {
        long fresh = Math.max(0L, appended - Math.max(0L, mark));
        int take = (int) Math.min(Math.min(fresh, entries.size()), Math.max(0, limit));
        if (take == 0) return List.of();

        List<T> out = new ArrayList<>(take);
        Iterator<T> newestFirst = entries.descendingIterator();
        for (int i = 0; i < take && newestFirst.hasNext(); i++) {
            out.add(newestFirst.next());
        }
        Collections.reverse(out);
        return out;
    }
}
