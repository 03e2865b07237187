package com.driftmonitor.core;

import com.driftmonitor.model.Measurement;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Preallocated ring of observations for one metric. The lock only covers the slot writes
 * and the snapshot copy, so writers never wait on a drift computation.
 */
final class MetricSeries {

    private final String modelId;
    private final String metricName;
    private final double[] values;
    private final Instant[] timestamps;
    private final ReentrantLock lock = new ReentrantLock();
    private int oldest;
    private int size;

    MetricSeries(String modelId, String metricName, int capacity) {
        this.modelId = modelId;
        this.metricName = metricName;
        this.values = new double[capacity];
        this.timestamps = new Instant[capacity];
    }

    void append(double value, Instant timestamp, Instant cutoff) {
        lock.lock();
        try {
            evictOlderThan(cutoff);
            int capacity = values.length;
            int slot = (oldest + size) % capacity;
            values[slot] = value;
            timestamps[slot] = timestamp;
            if (size < capacity) {
                size++;
            } else {
                oldest = (oldest + 1) % capacity;
            }
        } finally {
            lock.unlock();
        }
    }

    /** The {@code count} entries with the latest timestamps, oldest first. */
    List<Measurement> latest(int count, Instant cutoff) {
        List<Measurement> live = byTime(snapshot(cutoff), cutoff);
        int n = Math.min(Math.max(count, 0), live.size());
        return live.subList(live.size() - n, live.size());
    }

    List<Measurement> since(Instant from, Instant cutoff) {
        return byTime(snapshot(cutoff), cutoff).stream()
            .filter(m -> !m.timestamp().isBefore(from))
            .toList();
    }

    int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    private List<Measurement> snapshot(Instant cutoff) {
        lock.lock();
        try {
            evictOlderThan(cutoff);
            List<Measurement> copy = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                int slot = (oldest + i) % values.length;
                copy.add(new Measurement(modelId, metricName, values[slot], timestamps[slot]));
            }
            return copy;
        } finally {
            lock.unlock();
        }
    }

    // the ring holds insertion order; a late arrival with an old timestamp can sit behind newer ones
    private static List<Measurement> byTime(List<Measurement> snapshot, Instant cutoff) {
        return snapshot.stream()
            .filter(m -> !m.timestamp().isBefore(cutoff))
            .sorted(Comparator.comparing(Measurement::timestamp))
            .toList();
    }

    private void evictOlderThan(Instant cutoff) {
        while (size > 0 && timestamps[oldest].isBefore(cutoff)) {
            timestamps[oldest] = null;
            oldest = (oldest + 1) % values.length;
            size--;
        }
    }
}
