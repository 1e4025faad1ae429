package com.tool.invocation.diagnostics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded, append-only buffer that evicts its oldest element when full.
 * A capacity of zero or less makes the buffer unbounded.
 *
 * <p>Appends are O(1). Snapshots copy the requested tail and never mutate the buffer.
 * All methods are thread-safe; insertion order is preserved.</p>
 *
 * @param <T> element type
 */
public class RingBuffer<T> {

    private final int capacity;
    private final ArrayDeque<T> items;
    private long total;
    private long dropped;

    public RingBuffer(int capacity) {
        this.capacity = capacity;
        this.items = capacity > 0 ? new ArrayDeque<>(capacity) : new ArrayDeque<>();
    }

    /**
     * Appends an element, evicting the oldest one first if the buffer is at capacity.
     */
    public synchronized void append(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        if (capacity > 0 && items.size() >= capacity) {
            items.pollFirst();
            dropped++;
        }
        items.addLast(item);
        total++;
    }

    /**
     * Returns up to {@code limit} of the most recent elements.
     *
     * @param limit       maximum number of elements; zero or less returns an empty list
     * @param newestFirst order of the returned list
     */
    public synchronized List<T> snapshot(int limit, boolean newestFirst) {
        if (limit <= 0 || items.isEmpty()) {
            return List.of();
        }
        int n = Math.min(limit, items.size());
        List<T> out = new ArrayList<>(n);
        Iterator<T> it = items.descendingIterator();
        while (it.hasNext() && out.size() < n) {
            out.add(it.next());
        }
        if (!newestFirst) {
            Collections.reverse(out);
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Returns the most recent elements, newest first.
     */
    public List<T> snapshot(int limit) {
        return snapshot(limit, true);
    }

    public synchronized int size() {
        return items.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isBounded() {
        return capacity > 0;
    }

    /** Number of elements evicted because the buffer was full. */
    public synchronized long dropped() {
        return dropped;
    }

    /** Number of elements ever appended. */
    public synchronized long total() {
        return total;
    }
}
