package com.gsesentinel.core.stats;

import com.gsesentinel.core.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maintains one {@link RollingWindow} per (device, parameter) series.
 *
 * <p>
 * Windows are created on first use, so unknown series simply start empty.
 * Each monitor owns its own tracker instance; nothing here is static.
 * </p>
 *
 * @since 1.0.0
 */
public class RollingStatisticsTracker {

    private static final Logger LOG = LoggerFactory.getLogger(RollingStatisticsTracker.class);

    private final int windowSize;
    private final Map<SeriesKey, RollingWindow> windows = new ConcurrentHashMap<>();

    /**
     * @param windowSize capacity of each window; must be at least 1
     * @throws IllegalArgumentException if {@code windowSize} is below 1
     */
    public RollingStatisticsTracker(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    /**
     * Append a value to the series' window.
     *
     * @param deviceId  device identifier
     * @param parameter parameter name
     * @param value     sample value
     */
    public void record(String deviceId, String parameter, double value) {
        record(deviceId, parameter, value, null);
    }

    /**
     * Append a value to the series' window. A sample older than the previous
     * one is still appended in arrival order.
     *
     * @param deviceId  device identifier
     * @param parameter parameter name
     * @param value     sample value
     * @param timestamp sample timestamp, may be {@code null}
     */
    public void record(String deviceId, String parameter, double value, Instant timestamp) {
        SeriesKey key = new SeriesKey(deviceId, parameter);
        RollingWindow window = windows.computeIfAbsent(key, k -> new RollingWindow(windowSize));
        if (window.append(value, timestamp)) {
            LOG.debug("Out-of-order sample for {} at {}, appended by arrival", key, timestamp);
        }
    }

    /**
     * @return statistics over the series' current window; {@link WindowStatistics#EMPTY}
     *         for a series never recorded
     */
    public WindowStatistics stats(String deviceId, String parameter) {
        RollingWindow window = windows.get(new SeriesKey(deviceId, parameter));
        return window == null ? WindowStatistics.EMPTY : window.statistics();
    }

    /**
     * @return the most recently recorded value of the series, if any
     */
    public Optional<Double> latest(String deviceId, String parameter) {
        RollingWindow window = windows.get(new SeriesKey(deviceId, parameter));
        return window == null ? Optional.empty() : Optional.ofNullable(window.latest());
    }

    /**
     * @param deviceId device identifier
     * @return latest value per parameter of the device, sorted by parameter name
     */
    public Map<String, Double> latestValues(String deviceId) {
        Map<String, Double> result = new TreeMap<>();
        windows.forEach((key, window) -> {
            if (key.getDeviceId().equals(deviceId)) {
                Double latest = window.latest();
                if (latest != null) {
                    result.put(key.getParameter(), latest);
                }
            }
        });
        return Collections.unmodifiableMap(result);
    }

    public int getWindowSize() {
        return windowSize;
    }
}
