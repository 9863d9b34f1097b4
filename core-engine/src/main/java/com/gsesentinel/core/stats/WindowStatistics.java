package com.gsesentinel.core.stats;

import java.io.Serializable;
import java.util.Objects;

/**
 * Point-in-time statistics over a rolling window: sample count, mean and
 * population standard deviation.
 *
 * @since 1.0.0
 */
public final class WindowStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Statistics of an empty window. */
    public static final WindowStatistics EMPTY = new WindowStatistics(0, 0.0, 0.0);

    private final int count;
    private final double mean;
    private final double stdDev;

    public WindowStatistics(int count, double mean, double stdDev) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }
        this.count = count;
        this.mean = mean;
        this.stdDev = stdDev;
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    /**
     * @param value sample value
     * @return {@code |value - mean|}
     */
    public double deviation(double value) {
        return Math.abs(value - mean);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowStatistics that))
            return false;
        return count == that.count
                && Double.compare(mean, that.mean) == 0
                && Double.compare(stdDev, that.stdDev) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, mean, stdDev);
    }

    @Override
    public String toString() {
        return String.format("WindowStatistics{count=%d, mean=%.4f, stdDev=%.4f}", count, mean, stdDev);
    }
}
