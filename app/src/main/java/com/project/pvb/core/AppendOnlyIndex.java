package com.project.pvb.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * Append-only list with one writer and any number of lock-free readers.
 *
 * The writer must be externally serialized. Elements are stored before the volatile
 * size is published, so a reader that sees size {@code n} sees the first {@code n}
 * elements fully written, and never a slot the writer is still filling.
 */
final class AppendOnlyIndex<T> {

    private static final int INITIAL_CAPACITY = 16;

    private volatile T[] elements;
    private volatile int size;

    /**
     * @param newArray array constructor for the element type, e.g. {@code Submission[]::new}
     */
    AppendOnlyIndex(IntFunction<T[]> newArray) {
        this.elements = newArray.apply(INITIAL_CAPACITY);
    }

    /**
     * Single-writer append. Callers hold the ledger write lock.
     */
    void append(T element) {
        T[] current = elements;
        int n = size;
        if (n == current.length) {
            current = Arrays.copyOf(current, current.length * 2);
            current[n] = element;
            elements = current;
        } else {
            current[n] = element;
        }
        size = n + 1;
    }

    int size() {
        return size;
    }

    T get(int index) {
        int n = size;
        if (index < 0 || index >= n) {
            throw new IndexOutOfBoundsException("index " + index + " outside [0, " + n + ")");
        }
        return elements[index];
    }

    /**
     * Copies {@code [from, to)} of the published prefix.
     */
    List<T> slice(int from, int to) {
        int n = size;
        T[] snapshot = elements;
        int end = Math.min(to, n);
        if (from >= end) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(snapshot).subList(from, end));
    }

    /**
     * Copies the published prefix, keeping only elements accepted by {@code filter}.
     */
    List<T> snapshot(Predicate<T> filter) {
        int n = size;
        T[] snapshot = elements;
        List<T> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            T element = snapshot[i];
            if (filter.test(element)) {
                result.add(element);
            }
        }
        return result;
    }
}
