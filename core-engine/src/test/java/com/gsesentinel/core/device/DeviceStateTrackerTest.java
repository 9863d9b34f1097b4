package com.gsesentinel.core.device;

import com.gsesentinel.core.MutableClock;
import com.gsesentinel.core.event.MonitorEvent;
import com.gsesentinel.core.event.MonitorEventType;
import com.gsesentinel.core.model.DeviceMode;
import com.gsesentinel.core.model.DeviceState;
import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.OperationalStatus;
import com.gsesentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DeviceStateTracker}.
 */
class DeviceStateTrackerTest {

    private MutableClock clock;
    private DeviceStateTracker tracker;
    private List<MonitorEvent> events;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        tracker = new DeviceStateTracker(clock);
        tracker.register("GPU-001", DeviceType.GROUND_POWER_UNIT);
        tracker.register("CRYO-001", DeviceType.CRYOGENIC_LINE);
        events = new ArrayList<>();
    }

    @Test
    @DisplayName("Should start new devices in STANDBY / NOMINAL")
    void shouldStartInStandby() {
        DeviceState state = tracker.state("GPU-001");

        assertThat(state.getMode()).isEqualTo(DeviceMode.STANDBY);
        assertThat(state.getStatus()).isEqualTo(OperationalStatus.NOMINAL);
        assertThat(state.getLastCommand()).isNull();
        assertThat(tracker.states()).extracting(DeviceState::getDeviceId)
                .containsExactly("CRYO-001", "GPU-001");
    }

    @Test
    @DisplayName("Should reject duplicate and unknown devices")
    void shouldGuardRegistry() {
        assertThatThrownBy(() -> tracker.register("GPU-001", DeviceType.GROUND_POWER_UNIT))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> tracker.state("GPU-404"))
                .isInstanceOf(UnknownDeviceException.class)
                .hasMessageContaining("GPU-404");
        assertThat(tracker.typeOf("GPU-404")).isEmpty();
        assertThat(tracker.typeOf("CRYO-001")).contains(DeviceType.CRYOGENIC_LINE);
    }

    @Test
    @DisplayName("Should switch mode on a mode-setting command and record it")
    void shouldApplyModeCommand() {
        tracker.applyCommand("GPU-001", "set_mode", DeviceMode.ACTIVE, Optional.empty(), events);

        DeviceState state = tracker.state("GPU-001");
        assertThat(state.getMode()).isEqualTo(DeviceMode.ACTIVE);
        assertThat(state.getLastCommand()).isEqualTo("set_mode");
        assertThat(state.getLastCommandAt()).isEqualTo(clock.instant());
        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.getType()).isEqualTo(MonitorEventType.DEVICE_STATE_CHANGED);
            assertThat(e.getPreviousState().getMode()).isEqualTo(DeviceMode.STANDBY);
            assertThat(e.getDeviceState().getMode()).isEqualTo(DeviceMode.ACTIVE);
        });
    }

    @Test
    @DisplayName("Should not emit a state change for a command that keeps mode and status")
    void shouldNotEmitForUnchangedState() {
        tracker.applyCommand("GPU-001", "disable_output", null, Optional.empty(), events);

        assertThat(events).isEmpty();
        assertThat(tracker.state("GPU-001").getLastCommand()).isEqualTo("disable_output");
    }

    @Test
    @DisplayName("Should force SHUTDOWN in emergency shutdown and re-derive on recovery")
    void shouldShutDownAndRecover() {
        tracker.refreshStatus("CRYO-001", Optional.of(Severity.FAULT), events);
        tracker.applyCommand("CRYO-001", "emergency_shutdown", DeviceMode.EMERGENCY_SHUTDOWN,
                Optional.of(Severity.FAULT), events);

        assertThat(tracker.state("CRYO-001").getStatus()).isEqualTo(OperationalStatus.SHUTDOWN);

        tracker.refreshStatus("CRYO-001", Optional.empty(), events);
        assertThat(tracker.state("CRYO-001").getStatus()).isEqualTo(OperationalStatus.SHUTDOWN);

        tracker.applyCommand("CRYO-001", "set_mode", DeviceMode.MAINTENANCE, Optional.of(Severity.WARNING), events);
        assertThat(tracker.state("CRYO-001").getMode()).isEqualTo(DeviceMode.MAINTENANCE);
        assertThat(tracker.state("CRYO-001").getStatus()).isEqualTo(OperationalStatus.WARNING);
    }

    @Test
    @DisplayName("Should come back from emergency shutdown still holding FAULT while WARNING alarms remain")
    void shouldKeepHeldFaultAcrossShutdown() {
        tracker.refreshStatus("GPU-001", Optional.of(Severity.FAULT), events);
        tracker.refreshStatus("GPU-001", Optional.of(Severity.WARNING), events);
        assertThat(tracker.state("GPU-001").getStatus()).isEqualTo(OperationalStatus.FAULT);

        tracker.applyCommand("GPU-001", "emergency_shutdown", DeviceMode.EMERGENCY_SHUTDOWN,
                Optional.of(Severity.WARNING), events);
        assertThat(tracker.state("GPU-001").getStatus()).isEqualTo(OperationalStatus.SHUTDOWN);

        tracker.applyCommand("GPU-001", "set_mode", DeviceMode.STANDBY, Optional.of(Severity.WARNING), events);
        assertThat(tracker.state("GPU-001").getMode()).isEqualTo(DeviceMode.STANDBY);
        assertThat(tracker.state("GPU-001").getStatus()).isEqualTo(OperationalStatus.FAULT);

        tracker.refreshStatus("GPU-001", Optional.empty(), events);
        assertThat(tracker.state("GPU-001").getStatus()).isEqualTo(OperationalStatus.NOMINAL);
    }

    @Test
    @DisplayName("Should derive status from the highest active severity")
    void shouldDeriveStatus() {
        assertThat(DeviceStateTracker.deriveStatus(DeviceMode.ACTIVE, OperationalStatus.NOMINAL,
                Optional.empty())).isEqualTo(OperationalStatus.NOMINAL);
        assertThat(DeviceStateTracker.deriveStatus(DeviceMode.ACTIVE, OperationalStatus.NOMINAL,
                Optional.of(Severity.INFO))).isEqualTo(OperationalStatus.NOMINAL);
        assertThat(DeviceStateTracker.deriveStatus(DeviceMode.ACTIVE, OperationalStatus.NOMINAL,
                Optional.of(Severity.WARNING))).isEqualTo(OperationalStatus.WARNING);
        assertThat(DeviceStateTracker.deriveStatus(DeviceMode.ACTIVE, OperationalStatus.WARNING,
                Optional.of(Severity.CRITICAL))).isEqualTo(OperationalStatus.FAULT);
        assertThat(DeviceStateTracker.deriveStatus(DeviceMode.ACTIVE, OperationalStatus.FAULT,
                Optional.of(Severity.WARNING))).isEqualTo(OperationalStatus.FAULT);
        assertThat(DeviceStateTracker.deriveStatus(DeviceMode.ACTIVE, OperationalStatus.FAULT,
                Optional.empty())).isEqualTo(OperationalStatus.NOMINAL);
        assertThat(DeviceStateTracker.deriveStatus(DeviceMode.EMERGENCY_SHUTDOWN, OperationalStatus.NOMINAL,
                Optional.empty())).isEqualTo(OperationalStatus.SHUTDOWN);
    }

    @Test
    @DisplayName("Should hand out one lock per device")
    void shouldProvidePerDeviceLock() {
        assertThat(tracker.lockFor("GPU-001")).isSameAs(tracker.lockFor("GPU-001"));
        assertThat(tracker.lockFor("GPU-001")).isNotSameAs(tracker.lockFor("CRYO-001"));
    }
}
