package com.phillippitts.sitedetect.service.history;

import com.phillippitts.sitedetect.domain.DetectionResponse;
import com.phillippitts.sitedetect.exception.RequestNotFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded cache of recent responses for status polling. Not a system of record: once
 * {@code capacity} is exceeded the least recently used entry is evicted.
 */
public class RequestHistory {

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<UUID, DetectionResponse> entries;

    public RequestHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<UUID, DetectionResponse> eldest) {
                return size() > RequestHistory.this.capacity;
            }
        };
    }

    public void put(DetectionResponse response) {
        lock.lock();
        try {
            entries.put(response.requestId(), response);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the stored response for a request id.
     *
     * @throws RequestNotFoundException if the id is unknown or already evicted
     */
    public DetectionResponse get(UUID requestId) {
        return find(requestId).orElseThrow(() -> new RequestNotFoundException(requestId));
    }

    public Optional<DetectionResponse> find(UUID requestId) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(requestId));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
