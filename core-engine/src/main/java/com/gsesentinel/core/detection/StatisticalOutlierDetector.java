package com.gsesentinel.core.detection;

import com.gsesentinel.core.model.AlarmType;
import com.gsesentinel.core.model.ParameterDefinition;
import com.gsesentinel.core.model.Severity;
import com.gsesentinel.core.stats.WindowStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Statistical outlier detector based on the rolling mean.
 *
 * <p>
 * A value is an outlier when it deviates from the window mean by more than
 * {@code sigmaThreshold × σ}. Detection abstains until the window holds at
 * least {@code minSamples} values. With σ = 0 any value different from the
 * mean is an outlier.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalOutlierDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalOutlierDetector.class);

    private final int minSamples;
    private final double sigmaThreshold;

    /**
     * @param minSamples     samples required before detection engages; must be
     *                       at least 2
     * @param sigmaThreshold number of standard deviations; must be {@code > 0}
     * @throws IllegalArgumentException if either argument is out of range
     */
    public StatisticalOutlierDetector(int minSamples, double sigmaThreshold) {
        if (minSamples < 2) {
            throw new IllegalArgumentException("minSamples must be >= 2, got: " + minSamples);
        }
        if (sigmaThreshold <= 0) {
            throw new IllegalArgumentException("sigmaThreshold must be > 0, got: " + sigmaThreshold);
        }
        this.minSamples = minSamples;
        this.sigmaThreshold = sigmaThreshold;
    }

    @Override
    public Optional<Verdict> evaluate(double value, ParameterDefinition definition, WindowStatistics stats) {
        Objects.requireNonNull(stats, "WindowStatistics must not be null");

        if (stats.getCount() < minSamples) {
            LOG.trace("Statistical check on [{}] abstains: {} sample(s) < {}",
                    definition.getName(), stats.getCount(), minSamples);
            return Optional.empty();
        }

        double allowedDeviation = sigmaThreshold * stats.getStdDev();
        double diff = stats.deviation(value);
        if (diff <= allowedDeviation) {
            return Optional.empty();
        }

        double limit = value >= stats.getMean()
                ? stats.getMean() + allowedDeviation
                : stats.getMean() - allowedDeviation;

        LOG.debug("Statistical [{}] fired: value={} mean={} stddev={} deviation={}",
                definition.getName(), value, stats.getMean(), stats.getStdDev(), diff);

        return Optional.of(Verdict.violation(AlarmType.STATISTICAL_ANOMALY, Severity.WARNING, limit,
                String.format("Statistical outlier: %s=%.2f (mean=%.2f, stddev=%.2f, factor=%.1f)",
                        definition.getName(), value, stats.getMean(), stats.getStdDev(), sigmaThreshold)));
    }

    @Override
    public String getName() {
        return "statistical";
    }
}
