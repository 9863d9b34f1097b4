package com.gsesentinel.core.detection;

import com.gsesentinel.core.model.ParameterDefinition;
import com.gsesentinel.core.stats.WindowStatistics;

import java.util.Optional;

/**
 * Contract for one detection step.
 *
 * <p>
 * Implementations are <strong>stateless</strong>: the rolling statistics are
 * owned by {@link com.gsesentinel.core.stats.RollingStatisticsTracker} and
 * passed in, so a detector never mutates anything and the same instance
 * serves every series.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Classify a single sample.
     *
     * @param value      sample value
     * @param definition bounds of the sample's parameter
     * @param stats      statistics of the series' window before this sample
     * @return a violation verdict if this step fires, empty otherwise
     */
    Optional<Verdict> evaluate(double value, ParameterDefinition definition, WindowStatistics stats);

    /**
     * @return short name used in logs
     */
    String getName();
}
