package com.phillippitts.sitedetect.service.metrics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity window of samples; once full, each write evicts the oldest sample.
 * Thread-safe; writers and readers serialize on this instance only.
 *
 * @param <T> sample type
 */
final class SampleWindow<T> {

    private final int capacity;
    private final Deque<T> samples;

    SampleWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity);
    }

    int capacity() {
        return capacity;
    }

    synchronized void add(T sample) {
        if (samples.size() == capacity) {
            samples.pollFirst();
        }
        samples.addLast(sample);
    }

    synchronized int size() {
        return samples.size();
    }

    /** Current contents, oldest first. */
    synchronized List<T> toList() {
        return new ArrayList<>(samples);
    }

    synchronized void clear() {
        samples.clear();
    }
}
