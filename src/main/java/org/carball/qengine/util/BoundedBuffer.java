package org.carball.qengine.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Fixed-capacity FIFO buffer. Appending to a full buffer evicts the oldest element within the
 * same critical section, so the size never exceeds the capacity under concurrent writers.
 */
public class BoundedBuffer<T> {

    private final int capacity;
    private final Deque<T> elements;

    public BoundedBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Appends an element, evicting the oldest one when the buffer is full.
     *
     * @return the evicted element, if any
     */
    public synchronized Optional<T> add(T element) {
        T evicted = null;
        if (elements.size() == capacity) {
            evicted = elements.pollFirst();
        }
        elements.addLast(element);
        return Optional.ofNullable(evicted);
    }

    /**
     * Appends all elements in order and returns how many older elements were evicted.
     */
    public synchronized int addAll(List<T> batch) {
        int evicted = 0;
        for (T element : batch) {
            if (add(element).isPresent()) {
                evicted++;
            }
        }
        return evicted;
    }

    public synchronized int removeIf(Predicate<T> predicate) {
        int before = elements.size();
        elements.removeIf(predicate);
        return before - elements.size();
    }

    public synchronized Optional<T> findNewest(Predicate<T> predicate) {
        Iterator<T> it = elements.descendingIterator();
        while (it.hasNext()) {
            T element = it.next();
            if (predicate.test(element)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    /**
     * Copy of the contents, oldest first.
     */
    public synchronized List<T> snapshot() {
        return new ArrayList<>(elements);
    }

    /**
     * Copy of the contents, newest first.
     */
    public synchronized List<T> snapshotNewestFirst() {
        List<T> copy = new ArrayList<>(elements);
        Collections.reverse(copy);
        return copy;
    }

    public synchronized void clear() {
        elements.clear();
    }

    public synchronized int size() {
        return elements.size();
    }

    public synchronized boolean isEmpty() {
        return elements.isEmpty();
    }

    public int capacity() {
        return capacity;
    }
}
