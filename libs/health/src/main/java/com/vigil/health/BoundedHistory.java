package com.vigil.health;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity, insertion-ordered buffer that evicts its oldest entry on overflow.
 * Not thread-safe.
 *
 * @param <T> entry type
 */
public final class BoundedHistory<T> {

    private final int capacity;
    private final ArrayDeque<T> entries;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Appends an entry, evicting the oldest one when full.
     *
     * @return the evicted entry, if any
     */
    public Optional<T> append(T entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry must not be null");
        }
        T evicted = entries.size() == capacity ? entries.pollFirst() : null;
        entries.addLast(entry);
        return Optional.ofNullable(evicted);
    }

    /** Most recent entry. */
    public Optional<T> latest() {
        return Optional.ofNullable(entries.peekLast());
    }

    /** Entries from most recent to oldest. */
    public Iterator<T> newestFirst() {
        return entries.descendingIterator();
    }

    /** Copy of the entries, oldest first. */
    public List<T> snapshot() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
