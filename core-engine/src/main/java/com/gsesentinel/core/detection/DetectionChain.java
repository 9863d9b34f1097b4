package com.gsesentinel.core.detection;

import com.gsesentinel.core.config.MonitorConfig;
import com.gsesentinel.core.model.ParameterDefinition;
import com.gsesentinel.core.stats.WindowStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered list of {@link AnomalyDetector}s where the first one to fire wins.
 *
 * <p>
 * The standard chain checks absolute bounds first and the rolling statistics
 * second. The chain is deterministic and side-effect free: it classifies a
 * sample, it never touches alarm state.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionChain {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionChain.class);

    private final List<AnomalyDetector> detectors;

    /**
     * @param detectors detectors in evaluation order; must not be {@code null}
     *                  or empty
     * @throws IllegalArgumentException if {@code detectors} is empty
     */
    public DetectionChain(List<AnomalyDetector> detectors) {
        Objects.requireNonNull(detectors, "Detector list must not be null");
        if (detectors.isEmpty()) {
            throw new IllegalArgumentException("Detector list must not be empty");
        }
        this.detectors = Collections.unmodifiableList(new ArrayList<>(detectors));
    }

    /**
     * Create the standard threshold-then-statistical chain from configuration.
     *
     * @param config monitor configuration; must not be {@code null}
     * @return new chain
     */
    public static DetectionChain standard(MonitorConfig config) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        LOG.info("Creating detection chain: faultRangeFraction={} minSamples={} sigma={}",
                config.getFaultRangeFraction(), config.getMinSamples(), config.getSigmaThreshold());
        return new DetectionChain(List.of(
                new ThresholdDetector(config.getFaultRangeFraction()),
                new StatisticalOutlierDetector(config.getMinSamples(), config.getSigmaThreshold())));
    }

    /**
     * Classify a sample.
     *
     * @param value      sample value
     * @param definition the parameter's bounds
     * @param stats      statistics of the series before this sample
     * @return the first violation, or {@link Verdict#clean()}
     */
    public Verdict evaluate(double value, ParameterDefinition definition, WindowStatistics stats) {
        Objects.requireNonNull(definition, "ParameterDefinition must not be null");
        Objects.requireNonNull(stats, "WindowStatistics must not be null");
        for (AnomalyDetector detector : detectors) {
            Optional<Verdict> verdict = detector.evaluate(value, definition, stats);
            if (verdict.isPresent()) {
                return verdict.get();
            }
        }
        return Verdict.clean();
    }

    /**
     * @return unmodifiable list of detectors in evaluation order
     */
    public List<AnomalyDetector> getDetectors() {
        return detectors;
    }
}
