package com.gsesentinel.core.stats;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fixed-capacity FIFO window of the most recent raw values of one series.
 *
 * <p>
 * Values are appended in arrival order and the oldest is evicted once the
 * capacity is exceeded. Mean and standard deviation are recomputed from the
 * current contents on every call to {@link #statistics()}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All methods are {@code synchronized}; a window may be read from a query
 * thread while the owning device's ingest thread appends to it.
 * </p>
 *
 * @since 1.0.0
 */
final class RollingWindow {

    private final int capacity;

    /** Sliding window of recent values. */
    private final Deque<Double> values = new ArrayDeque<>();

    /** Timestamp of the most recently appended sample, {@code null} until the first. */
    private Instant lastTimestamp;

    RollingWindow(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Append a value, evicting the oldest one if the window is full.
     *
     * @param value     sample value
     * @param timestamp sample timestamp
     * @return {@code true} if {@code timestamp} is earlier than the previous
     *         sample's
     */
    synchronized boolean append(double value, Instant timestamp) {
        boolean outOfOrder = lastTimestamp != null && timestamp != null && timestamp.isBefore(lastTimestamp);
        values.addLast(value);
        if (values.size() > capacity) {
            values.pollFirst();
        }
        if (timestamp != null && !outOfOrder) {
            lastTimestamp = timestamp;
        }
        return outOfOrder;
    }

    synchronized WindowStatistics statistics() {
        if (values.isEmpty()) {
            return WindowStatistics.EMPTY;
        }
        double mean = computeMean();
        return new WindowStatistics(values.size(), mean, computeStdDev(mean));
    }

    synchronized Double latest() {
        return values.peekLast();
    }

    synchronized int size() {
        return values.size();
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    private double computeMean() {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private double computeStdDev(double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.size());
    }
}
