package com.gsesentinel.core.detection;

import com.gsesentinel.core.config.MonitorConfig;
import com.gsesentinel.core.model.AlarmType;
import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.ParameterDefinition;
import com.gsesentinel.core.model.Severity;
import com.gsesentinel.core.stats.WindowStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionChain}.
 */
class DetectionChainTest {

    private static final ParameterDefinition VOLTAGE =
            DeviceType.GROUND_POWER_UNIT.parameter("voltage").orElseThrow();

    private final DetectionChain chain = DetectionChain.standard(new MonitorConfig());

    @Test
    @DisplayName("Should build threshold then statistical detectors from configuration")
    void shouldBuildStandardChain() {
        assertThat(chain.getDetectors())
                .extracting(AnomalyDetector::getName)
                .containsExactly("threshold", "statistical");
    }

    @Test
    @DisplayName("Should prefer the threshold verdict when both would fire")
    void shouldPreferThreshold() {
        WindowStatistics stats = new WindowStatistics(40, 28.0, 0.1);

        Verdict verdict = chain.evaluate(40.0, VOLTAGE, stats);

        assertThat(verdict.getAlarmType()).isEqualTo(AlarmType.THRESHOLD_HIGH);
        assertThat(verdict.getSeverity()).isEqualTo(Severity.FAULT);
    }

    @Test
    @DisplayName("Should fall through to the statistical detector inside the bounds")
    void shouldFallThroughToStatistical() {
        WindowStatistics stats = new WindowStatistics(40, 28.0, 0.1);

        Verdict verdict = chain.evaluate(29.5, VOLTAGE, stats);

        assertThat(verdict.getAlarmType()).isEqualTo(AlarmType.STATISTICAL_ANOMALY);
    }

    @Test
    @DisplayName("Should return a clean verdict when nothing fires")
    void shouldReturnClean() {
        Verdict verdict = chain.evaluate(28.05, VOLTAGE, new WindowStatistics(40, 28.0, 0.1));

        assertThat(verdict.isViolation()).isFalse();
        assertThat(verdict.getAlarmType()).isNull();
    }

    @Test
    @DisplayName("Should reject an empty detector list")
    void shouldRejectEmptyChain() {
        assertThatThrownBy(() -> new DetectionChain(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
