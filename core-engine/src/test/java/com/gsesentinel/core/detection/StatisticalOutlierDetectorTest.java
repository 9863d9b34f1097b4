package com.gsesentinel.core.detection;

import com.gsesentinel.core.model.AlarmType;
import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.ParameterDefinition;
import com.gsesentinel.core.model.Severity;
import com.gsesentinel.core.stats.WindowStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StatisticalOutlierDetector}.
 */
class StatisticalOutlierDetectorTest {

    private static final ParameterDefinition PRESSURE =
            DeviceType.CRYOGENIC_LINE.parameter("pressure").orElseThrow();

    private final StatisticalOutlierDetector detector = new StatisticalOutlierDetector(30, 3.0);

    @Test
    @DisplayName("Should abstain below the minimum sample count")
    void shouldAbstainWithFewSamples() {
        WindowStatistics stats = new WindowStatistics(29, 14.7, 0.1);

        assertThat(detector.evaluate(20.0, PRESSURE, stats)).isEmpty();
    }

    @Test
    @DisplayName("Should fire a WARNING above mean + 3 sigma")
    void shouldFireAboveBand() {
        WindowStatistics stats = new WindowStatistics(30, 14.7, 0.1);

        Optional<Verdict> verdict = detector.evaluate(15.1, PRESSURE, stats);

        assertThat(verdict).isPresent();
        assertThat(verdict.get().getAlarmType()).isEqualTo(AlarmType.STATISTICAL_ANOMALY);
        assertThat(verdict.get().getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(verdict.get().getThresholdValue()).isCloseTo(15.0, within(1e-9));
    }

    @Test
    @DisplayName("Should record mean - 3 sigma for a low excursion")
    void shouldUseLowerLimitForLowExcursion() {
        WindowStatistics stats = new WindowStatistics(50, 14.7, 0.1);

        Optional<Verdict> verdict = detector.evaluate(14.2, PRESSURE, stats);

        assertThat(verdict).isPresent();
        assertThat(verdict.get().getThresholdValue()).isCloseTo(14.4, within(1e-9));
    }

    @Test
    @DisplayName("Should NOT fire within 3 sigma")
    void shouldNotFireWithinBand() {
        WindowStatistics stats = new WindowStatistics(40, 14.7, 0.1);

        assertThat(detector.evaluate(14.95, PRESSURE, stats)).isEmpty();
        assertThat(detector.evaluate(14.45, PRESSURE, stats)).isEmpty();
    }

    @Test
    @DisplayName("Should treat any change from a constant window as an outlier")
    void shouldFireOnZeroSigma() {
        WindowStatistics stats = new WindowStatistics(30, 14.7, 0.0);

        assertThat(detector.evaluate(14.7, PRESSURE, stats)).isEmpty();
        assertThat(detector.evaluate(14.8, PRESSURE, stats)).isPresent();
    }

    @Test
    @DisplayName("Should reject invalid construction arguments")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> new StatisticalOutlierDetector(1, 3.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StatisticalOutlierDetector(30, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
