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
 * Absolute bounds check.
 *
 * <p>
 * Fires {@link AlarmType#THRESHOLD_HIGH} above the parameter maximum and
 * {@link AlarmType#THRESHOLD_LOW} below its minimum. The severity is
 * {@link Severity#FAULT} when the distance past the bound exceeds
 * {@code faultRangeFraction} of the parameter's range, otherwise
 * {@link Severity#WARNING}. Values exactly on a bound are in range.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdDetector.class);

    private final double faultRangeFraction;

    /**
     * @param faultRangeFraction fraction of the range past a bound that
     *                           escalates to FAULT; must be {@code >= 0}
     * @throws IllegalArgumentException if the fraction is negative
     */
    public ThresholdDetector(double faultRangeFraction) {
        if (faultRangeFraction < 0) {
            throw new IllegalArgumentException(
                    "faultRangeFraction must be >= 0, got: " + faultRangeFraction);
        }
        this.faultRangeFraction = faultRangeFraction;
    }

    @Override
    public Optional<Verdict> evaluate(double value, ParameterDefinition definition, WindowStatistics stats) {
        Objects.requireNonNull(definition, "ParameterDefinition must not be null");

        if (definition.contains(value)) {
            return Optional.empty();
        }

        boolean high = value > definition.getMaximum();
        double bound = high ? definition.getMaximum() : definition.getMinimum();
        double excess = Math.abs(value - bound);
        Severity severity = excess > faultRangeFraction * definition.range() ? Severity.FAULT : Severity.WARNING;
        AlarmType type = high ? AlarmType.THRESHOLD_HIGH : AlarmType.THRESHOLD_LOW;

        LOG.debug("Threshold [{}] fired: value={} bound={} excess={} severity={}",
                definition.getName(), value, bound, excess, severity);

        return Optional.of(Verdict.violation(type, severity, bound, String.format(
                "%s=%.2f %s bound %.2f by %.2f", definition.getName(), value,
                high ? "above" : "below", bound, excess)));
    }

    @Override
    public String getName() {
        return "threshold";
    }
}
