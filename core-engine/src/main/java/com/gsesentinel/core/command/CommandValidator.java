package com.gsesentinel.core.command;

import com.gsesentinel.core.model.Alarm;
import com.gsesentinel.core.model.CommandRequest;
import com.gsesentinel.core.model.DeviceMode;
import com.gsesentinel.core.model.DeviceState;
import com.gsesentinel.core.model.DeviceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a command may reach a device.
 *
 * <h3>Checks, in order</h3>
 * <ol>
 * <li>{@code emergency_shutdown} is always admitted.</li>
 * <li>The command must exist for the device type.</li>
 * <li>Its parameters must decode.</li>
 * <li>A device in emergency shutdown only accepts {@code set_mode} to another
 * mode.</li>
 * <li>Every interlock in the {@link InterlockTable} must hold.</li>
 * </ol>
 *
 * <p>
 * The validator is stateless; callers pass a consistent view of the device
 * taken under its lock.
 * </p>
 *
 * @since 1.0.0
 */
public final class CommandValidator {

    private static final Logger LOG = LoggerFactory.getLogger(CommandValidator.class);

    private final InterlockTable interlocks;

    public CommandValidator(InterlockTable interlocks) {
        this.interlocks = Objects.requireNonNull(interlocks, "InterlockTable must not be null");
    }

    /**
     * @param request         the submitted command
     * @param state           current device state
     * @param latestTelemetry latest value per parameter of the device
     * @param activeAlarms    active alarms of the device
     * @return admission carrying the decoded command, or a rejection
     */
    public Admission validate(CommandRequest request, DeviceState state, Map<String, Double> latestTelemetry,
            List<Alarm> activeAlarms) {
        Objects.requireNonNull(request, "CommandRequest must not be null");
        Objects.requireNonNull(state, "DeviceState must not be null");
        DeviceType deviceType = state.getDeviceType();

        Optional<CommandType> parsed = CommandType.fromCode(request.getCommandType());
        if (parsed.isPresent() && parsed.get().isPriority()) {
            return Admission.admit(parsed.get(), CommandParameters.None.INSTANCE);
        }
        if (parsed.isEmpty() || !parsed.get().isSupportedBy(deviceType)) {
            return Admission.reject(RejectionReason.UNSUPPORTED_COMMAND,
                    "Command '" + request.getCommandType() + "' is not supported by " + deviceType.getCode());
        }
        CommandType type = parsed.get();

        CommandParameters parameters;
        try {
            parameters = CommandParameterDecoder.decode(type, request.getParameters());
        } catch (InvalidCommandParameterException e) {
            return Admission.reject(RejectionReason.INVALID_PARAMETER, e.getMessage());
        }

        if (state.getMode() == DeviceMode.EMERGENCY_SHUTDOWN && !isRecovery(type, parameters)) {
            return Admission.reject(RejectionReason.EMERGENCY_SHUTDOWN_ACTIVE,
                    "Device " + state.getDeviceId() + " is in EMERGENCY_SHUTDOWN; only set_mode to another mode"
                            + " or emergency_shutdown is accepted");
        }

        InterlockContext context = new InterlockContext(state, latestTelemetry, activeAlarms, parameters);
        Optional<InterlockTable.Violation> violation = interlocks.check(deviceType, type, context);
        if (violation.isPresent()) {
            LOG.debug("Interlock {} blocked {} on {}", violation.get().getInterlock().getName(),
                    type.getCode(), state.getDeviceId());
            return Admission.reject(RejectionReason.INTERLOCK_VIOLATION, violation.get().getMessage());
        }
        return Admission.admit(type, parameters);
    }

    private static boolean isRecovery(CommandType type, CommandParameters parameters) {
        return type == CommandType.SET_MODE
                && parameters instanceof CommandParameters.ModeChange change
                && change.getMode() != DeviceMode.EMERGENCY_SHUTDOWN;
    }
}
