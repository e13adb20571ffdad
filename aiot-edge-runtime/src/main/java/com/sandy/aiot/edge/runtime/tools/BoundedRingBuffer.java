package com.sandy.aiot.edge.runtime.tools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-capacity circular buffer. Appending to a full buffer evicts the oldest element.
 * Not thread-safe: callers guard it with their own lock and hand out copies only.
 */
public class BoundedRingBuffer<T> {

    private final Object[] elements;
    private int head; // index of the oldest element
    private int size;

    public BoundedRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.elements = new Object[capacity];
    }

    public void add(T element) {
        int capacity = elements.length;
        if (size < capacity) {
            elements[(head + size) % capacity] = element;
            size++;
        } else {
            elements[head] = element;
            head = (head + 1) % capacity;
        }
    }

    public void addAll(List<? extends T> items) {
        for (T item : items) add(item);
    }

    /**
     * Copy of the newest {@code limit} elements in insertion order (oldest first).
     */
    @SuppressWarnings("unchecked")
    public List<T> tail(int limit) {
        int n = Math.max(0, Math.min(limit, size));
        if (n == 0) return Collections.emptyList();
        List<T> out = new ArrayList<>(n);
        int start = size - n;
        for (int i = start; i < size; i++) {
            out.add((T) elements[(head + i) % elements.length]);
        }
        return out;
    }

    public List<T> toList() {
        return tail(size);
    }

    @SuppressWarnings("unchecked")
    public T latest() {
        if (size == 0) return null;
        return (T) elements[(head + size - 1) % elements.length];
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return elements.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }
}
