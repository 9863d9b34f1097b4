package com.gsesentinel.core.event;

import com.gsesentinel.core.model.DeviceMode;
import com.gsesentinel.core.model.DeviceState;
import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.OperationalStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EventPublisher}.
 */
class EventPublisherTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    @DisplayName("Should deliver events in order")
    void shouldDeliverInOrder() {
        List<MonitorEvent> received = new ArrayList<>();
        MonitorEvent first = stateChange("GPU-001");
        MonitorEvent second = stateChange("CRYO-001");

        new EventPublisher(received::add).publishAll(List.of(first, second));

        assertThat(received).containsExactly(first, second);
    }

    @Test
    @DisplayName("Should keep delivering past a failure and report the undelivered events")
    void shouldReportUndelivered() {
        List<MonitorEvent> received = new ArrayList<>();
        MonitorEvent bad = stateChange("GPU-001");
        MonitorEvent good = stateChange("CRYO-001");
        EventPublisher publisher = new EventPublisher(event -> {
            if (event == bad) {
                throw new IllegalStateException("boom");
            }
            received.add(event);
        });

        assertThatThrownBy(() -> publisher.publishAll(List.of(bad, good)))
                .isInstanceOf(DeliveryException.class)
                .hasMessageContaining("1 of 2")
                .hasCauseInstanceOf(IllegalStateException.class)
                .satisfies(e -> assertThat(((DeliveryException) e).getUndeliveredEvents()).containsExactly(bad));
        assertThat(received).containsExactly(good);
    }

    @Test
    @DisplayName("Should describe state changes with before and after")
    void shouldDescribeStateChange() {
        MonitorEvent event = stateChange("GPU-001");

        assertThat(event.getType()).isEqualTo(MonitorEventType.DEVICE_STATE_CHANGED);
        assertThat(event.getPreviousState().getMode()).isEqualTo(DeviceMode.STANDBY);
        assertThat(event.getDeviceState().getMode()).isEqualTo(DeviceMode.ACTIVE);
        assertThat(event.getDescription()).contains("set_mode");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static MonitorEvent stateChange(String deviceId) {
        DeviceState before = new DeviceState(deviceId, DeviceType.GROUND_POWER_UNIT, DeviceMode.STANDBY,
                OperationalStatus.NOMINAL, null, null);
        DeviceState after = new DeviceState(deviceId, DeviceType.GROUND_POWER_UNIT, DeviceMode.ACTIVE,
                OperationalStatus.NOMINAL, "set_mode", T0);
        return MonitorEvent.ofStateChange(T0, before, after, "command set_mode");
    }
}
