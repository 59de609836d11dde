package com.ekslens.leadmaster.lead.job;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity, insertion-ordered buffer; appending past capacity evicts the oldest entry.
 * Not thread-safe on its own.
 */
class BoundedLog<T> {
    private final int capacity;
    private final Deque<T> entries;

    BoundedLog(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.entries = new ArrayDeque<>(this.capacity);
    }

    void append(T entry) {
        if (entries.size() >= capacity) {
            entries.removeFirst();
        }
        entries.addLast(entry);
    }

    List<T> snapshot() {
        return new ArrayList<>(entries);
    }

    int size() {
        return entries.size();
    }

    int capacity() {
        return capacity;
    }
}
