package com.terminaldesigner.designer.project;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Stack that keeps at most {@code limit} entries; pushing onto a full stack silently drops the oldest.
 */
class BoundedHistory<T> {

    private final Deque<T> entries = new ArrayDeque<>();
    private final int limit;

    BoundedHistory(int limit) {
        if (limit < 1) throw new IllegalArgumentException("History limit must be positive: " + limit);
        this.limit = limit;
    }

    void push(T entry) {
        entries.addLast(entry);
        while (entries.size() > limit) {
            entries.removeFirst();
        }
    }

    Optional<T> pop() {
        return Optional.ofNullable(entries.pollLast());
    }

    void clear() {
        entries.clear();
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    int size() {
        return entries.size();
    }
}
