package com.gsesentinel.core;

import com.gsesentinel.core.alarm.AlarmManager;
import com.gsesentinel.core.alarm.AlarmNotFoundException;
import com.gsesentinel.core.catalog.ConfiguredParameterCatalog;
import com.gsesentinel.core.catalog.ParameterCatalog;
import com.gsesentinel.core.command.Admission;
import com.gsesentinel.core.command.CommandDecision;
import com.gsesentinel.core.command.CommandDispatcher;
import com.gsesentinel.core.command.CommandLedger;
import com.gsesentinel.core.command.CommandNotFoundException;
import com.gsesentinel.core.command.CommandParameters;
import com.gsesentinel.core.command.CommandRecord;
import com.gsesentinel.core.command.CommandType;
import com.gsesentinel.core.command.CommandValidator;
import com.gsesentinel.core.command.InterlockTable;
import com.gsesentinel.core.command.RejectionReason;
import com.gsesentinel.core.config.DeviceConfig;
import com.gsesentinel.core.config.MonitorConfig;
import com.gsesentinel.core.detection.DetectionChain;
import com.gsesentinel.core.detection.Verdict;
import com.gsesentinel.core.device.DeviceStateTracker;
import com.gsesentinel.core.event.DeliveryException;
import com.gsesentinel.core.event.EventPublisher;
import com.gsesentinel.core.event.MonitorEvent;
import com.gsesentinel.core.event.MonitorEventSink;
import com.gsesentinel.core.event.MonitorEventType;
import com.gsesentinel.core.model.Alarm;
import com.gsesentinel.core.model.CommandRequest;
import com.gsesentinel.core.model.DeviceMode;
import com.gsesentinel.core.model.DeviceState;
import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.ParameterDefinition;
import com.gsesentinel.core.model.Severity;
import com.gsesentinel.core.model.TelemetryPoint;
import com.gsesentinel.core.stats.RollingStatisticsTracker;
import com.gsesentinel.core.stats.WindowStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Entry point of the monitoring core.
 *
 * <p>
 * Telemetry flows through {@link #ingest}: the sample is validated, recorded
 * in its rolling window, classified against the window statistics that now
 * include it, and applied to the alarm lifecycle, after which the device status is
 * re-derived. Commands flow through {@link #submitCommand}: the validator
 * checks them against the device's state, latest telemetry and active alarms;
 * admitted commands are recorded, applied to the device's mode and handed to
 * the {@link CommandDispatcher}.
 * </p>
 *
 * <p>
 * Work on one device is serialized by that device's lock. Events and
 * dispatches happen after the lock is released; if either fails the in-memory
 * state is already committed and a {@link DeliveryException} is thrown.
 * </p>
 *
 * @since 1.0.0
 */
public class GseMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(GseMonitor.class);

    private final Clock clock;
    private final ParameterCatalog catalog;
    private final RollingStatisticsTracker statistics;
    private final DetectionChain detection;
    private final AlarmManager alarms;
    private final DeviceStateTracker devices;
    private final CommandValidator validator;
    private final CommandLedger ledger;
    private final CommandDispatcher dispatcher;
    private final EventPublisher publisher;

    private GseMonitor(Builder b) {
        MonitorConfig config = b.config;
        config.validate();
        this.clock = b.clock;
        this.catalog = b.catalog != null ? b.catalog : ConfiguredParameterCatalog.from(config);
        this.statistics = new RollingStatisticsTracker(config.getWindowSize());
        this.detection = DetectionChain.standard(config);
        this.alarms = new AlarmManager(clock, config.getClearHysteresis(), config.getAlarmHistoryLimit());
        this.devices = new DeviceStateTracker(clock);
        this.validator = new CommandValidator(b.interlocks);
        this.ledger = new CommandLedger(config.getCommandHistoryLimit(), config.getPendingCommandLimit());
        this.dispatcher = b.dispatcher;
        this.publisher = new EventPublisher(b.sink);

        for (DeviceConfig device : config.getDevices()) {
            devices.register(device.getId(), device.deviceType());
        }
        LOG.info("GSE monitor started: {} device(s), window={}, minSamples={}, sigma={}, hysteresis={}",
                config.getDevices().size(), config.getWindowSize(), config.getMinSamples(),
                config.getSigmaThreshold(), config.getClearHysteresis());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Register a device beyond those declared in configuration.
     *
     * @throws IllegalStateException if the id is already registered
     */
    public void registerDevice(String deviceId, DeviceType type) {
        devices.register(deviceId, type);
    }

    // ---------------------------------------------------------------
    // Telemetry
    // ---------------------------------------------------------------

    /**
     * Ingest one sample without a device-reported status.
     *
     * @see #ingest(String, String, String, Double, Severity)
     */
    public IngestResult ingest(String deviceId, String parameter, String timestamp, Double value) {
        return ingest(deviceId, parameter, timestamp, value, Severity.NOMINAL);
    }

    /**
     * Ingest one sample.
     *
     * @param deviceId       registered device id
     * @param parameter      parameter of the device's type
     * @param timestamp      ISO-8601 sample time
     * @param value          finite sample value
     * @param reportedStatus status the device attached to the sample; WARNING
     *                       or above raises a DEVICE_FAULT alarm
     * @return the accepted result with the detection verdict
     * @throws TelemetryValidationException if the sample is rejected
     * @throws DeliveryException            if resulting events could not be
     *                                      published
     */
    public IngestResult ingest(String deviceId, String parameter, String timestamp, Double value,
            Severity reportedStatus) {
        List<MonitorEvent> events = new ArrayList<>();
        IngestResult result = ingestLocked(
                new TelemetryPoint(deviceId, parameter, timestamp, value, reportedStatus), events);
        publisher.publishAll(events);
        return result;
    }

    /**
     * @see #ingest(String, String, String, Double, Severity)
     */
    public IngestResult ingest(TelemetryPoint point) {
        Objects.requireNonNull(point, "TelemetryPoint must not be null");
        return ingest(point.getDeviceId(), point.getParameter(), point.getTimestamp(), point.getValue(),
                point.getReportedStatus());
    }

    /**
     * Ingest a batch, reporting each point separately. Rejected points do not
     * abort the batch; events of the whole batch are published at the end.
     *
     * @param points samples in arrival order
     * @return one result per point, in the same order
     * @throws DeliveryException if resulting events could not be published;
     *                           every point has been applied by then
     */
    public List<IngestResult> ingestBatch(List<TelemetryPoint> points) {
        Objects.requireNonNull(points, "Point list must not be null");
        List<MonitorEvent> events = new ArrayList<>();
        List<IngestResult> results = new ArrayList<>(points.size());
        for (TelemetryPoint point : points) {
            if (point == null) {
                results.add(IngestResult.rejected(null, null, new TelemetryValidationException(
                        TelemetryValidationException.Reason.BAD_VALUE, "Telemetry point is null")));
                continue;
            }
            try {
                results.add(ingestLocked(point, events));
            } catch (TelemetryValidationException e) {
                results.add(IngestResult.rejected(point.getDeviceId(), point.getParameter(), e));
            }
        }
        publisher.publishAll(events);
        return List.copyOf(results);
    }

    private IngestResult ingestLocked(TelemetryPoint point, List<MonitorEvent> events) {
        String deviceId = point.getDeviceId();
        String parameter = point.getParameter();
        DeviceType type = devices.typeOf(deviceId).orElseThrow(() -> reject(point,
                TelemetryValidationException.Reason.UNKNOWN_DEVICE, "Unknown device '" + deviceId + "'"));
        ParameterDefinition definition = catalog.find(type, parameter).orElseThrow(() -> reject(point,
                TelemetryValidationException.Reason.UNKNOWN_PARAMETER,
                "Unknown parameter '" + parameter + "' for " + type.getCode()));
        Instant timestamp;
        try {
            timestamp = Timestamps.parse(point.getTimestamp());
        } catch (TelemetryValidationException e) {
            LOG.warn("Rejected telemetry {}/{}: {}", deviceId, parameter, e.getMessage());
            throw e;
        }
        Double boxed = point.getValue();
        if (boxed == null || !Double.isFinite(boxed)) {
            throw reject(point, TelemetryValidationException.Reason.BAD_VALUE,
                    "Value must be a finite number, got " + boxed);
        }
        double value = boxed;

        Lock lock = devices.lockFor(deviceId);
        lock.lock();
        try {
            statistics.record(deviceId, parameter, value, timestamp);
            WindowStatistics window = statistics.stats(deviceId, parameter);
            Verdict verdict = detection.evaluate(value, definition, window);
            alarms.apply(deviceId, parameter, value, verdict, point.getReportedStatus(), events);
            devices.refreshStatus(deviceId, alarms.highestActiveSeverity(deviceId), events);
            LOG.debug("{}/{}={} -> {} (n={}, mean={}, stddev={})", deviceId, parameter, value, verdict,
                    window.getCount(), window.getMean(), window.getStdDev());
            return IngestResult.accepted(deviceId, parameter, timestamp, value, verdict);
        } finally {
            lock.unlock();
        }
    }

    private static TelemetryValidationException reject(TelemetryPoint point,
            TelemetryValidationException.Reason reason, String message) {
        LOG.warn("Rejected telemetry {}/{}: {}", point.getDeviceId(), point.getParameter(), message);
        return new TelemetryValidationException(reason, message);
    }

    // ---------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------

    /**
     * Validate a command and, if admitted, record it, apply it to the device's
     * mode and dispatch it.
     *
     * @param request the command
     * @return the decision; rejections are returned, not thrown
     * @throws DeliveryException if the dispatch or an event failed after the
     *                           decision was committed
     */
    public CommandDecision submitCommand(CommandRequest request) {
        Objects.requireNonNull(request, "CommandRequest must not be null");
        String deviceId = request.getDeviceId();
        List<MonitorEvent> events = new ArrayList<>();
        CommandDecision decision;
        CommandRecord admitted = null;

        if (devices.typeOf(deviceId).isEmpty()) {
            decision = rejectCommand(request, RejectionReason.UNKNOWN_DEVICE,
                    "Unknown device '" + deviceId + "'", events);
        } else {
            Lock lock = devices.lockFor(deviceId);
            lock.lock();
            try {
                DeviceState state = devices.state(deviceId);
                Admission admission = validator.validate(request, state, statistics.latestValues(deviceId),
                        alarms.activeAlarms(deviceId));
                if (admission.isAdmitted()) {
                    admitted = admit(request, admission, events);
                    decision = CommandDecision.admitted(admitted.getId());
                } else {
                    decision = rejectCommand(request, admission.getReason(), admission.getDetail(), events);
                }
            } finally {
                lock.unlock();
            }
        }

        deliver(admitted, events);
        return decision;
    }

    private CommandRecord admit(CommandRequest request, Admission admission, List<MonitorEvent> events) {
        Instant now = clock.instant();
        String deviceId = request.getDeviceId();
        CommandType type = admission.getCommandType();
        CommandRecord record = ledger.admit(deviceId, type, admission.getParameters(), request.getIssuedBy(), now);
        events.add(MonitorEvent.ofCommand(MonitorEventType.COMMAND_ADMITTED, now, record));
        for (CommandRecord expired : ledger.expireOverflow(now)) {
            events.add(MonitorEvent.ofCommand(MonitorEventType.COMMAND_COMPLETED, now, expired));
        }
        devices.applyCommand(deviceId, type.getCode(), targetMode(type, admission.getParameters()),
                alarms.highestActiveSeverity(deviceId), events);
        LOG.info("Admitted command {} {} on {} by {}", record.getId(), type.getCode(), deviceId,
                request.getIssuedBy());
        return record;
    }

    private CommandDecision rejectCommand(CommandRequest request, RejectionReason reason, String detail,
            List<MonitorEvent> events) {
        Instant now = clock.instant();
        CommandRecord record = ledger.reject(request.getDeviceId(), request.getCommandType(),
                request.getIssuedBy(), reason, detail, now);
        events.add(MonitorEvent.ofCommand(MonitorEventType.COMMAND_REJECTED, now, record));
        LOG.warn("Rejected command {} on {} by {}: {} ({})", request.getCommandType(), request.getDeviceId(),
                request.getIssuedBy(), reason, detail);
        return CommandDecision.rejected(reason, detail);
    }

    private static DeviceMode targetMode(CommandType type, CommandParameters parameters) {
        if (type == CommandType.EMERGENCY_SHUTDOWN) {
            return DeviceMode.EMERGENCY_SHUTDOWN;
        }
        if (parameters instanceof CommandParameters.ModeChange change) {
            return change.getMode();
        }
        return null;
    }

    private void deliver(CommandRecord admitted, List<MonitorEvent> events) {
        RuntimeException dispatchFailure = null;
        if (admitted != null) {
            try {
                dispatcher.dispatch(admitted);
            } catch (RuntimeException e) {
                LOG.error("Dispatch of command {} ({}) to {} failed", admitted.getId(), admitted.getCommandType(),
                        admitted.getDeviceId(), e);
                dispatchFailure = e;
            }
        }
        try {
            publisher.publishAll(events);
        } catch (DeliveryException e) {
            if (dispatchFailure != null) {
                e.addSuppressed(dispatchFailure);
            }
            throw e;
        }
        if (dispatchFailure != null) {
            throw new DeliveryException("Command " + admitted.getId() + " was admitted but could not be dispatched",
                    List.of(), dispatchFailure);
        }
    }

    /**
     * Close an admitted command with the outcome reported by the equipment.
     *
     * @param commandId ledger id of the command
     * @param success   whether it executed
     * @param detail    optional detail from the equipment
     * @return the closed record
     * @throws CommandNotFoundException if the id is unknown
     * @throws IllegalStateException    if the command is already closed
     */
    public CommandRecord reportExecutionResult(long commandId, boolean success, String detail) {
        Instant now = clock.instant();
        CommandRecord record = ledger.complete(commandId, success, detail, now);
        if (!success) {
            LOG.warn("Command {} ({}) failed on {}: {}", commandId, record.getCommandType(), record.getDeviceId(),
                    detail);
        }
        publisher.publishAll(List.of(MonitorEvent.ofCommand(MonitorEventType.COMMAND_COMPLETED, now, record)));
        return record;
    }

    // ---------------------------------------------------------------
    // Alarms
    // ---------------------------------------------------------------

    /**
     * @param alarmId  alarm id
     * @param operator operator acknowledging the alarm
     * @return the alarm after acknowledgment
     * @throws AlarmNotFoundException if the id is unknown
     */
    public Alarm acknowledgeAlarm(long alarmId, String operator) {
        Objects.requireNonNull(operator, "operator must not be null");
        Alarm existing = alarms.find(alarmId).orElseThrow(() -> new AlarmNotFoundException(alarmId));
        List<MonitorEvent> events = new ArrayList<>();
        Alarm acknowledged;
        Lock lock = devices.lockFor(existing.getDeviceId());
        lock.lock();
        try {
            acknowledged = alarms.acknowledge(alarmId, operator, events);
        } finally {
            lock.unlock();
        }
        publisher.publishAll(events);
        return acknowledged;
    }

    public Optional<Alarm> alarm(long alarmId) {
        return alarms.find(alarmId);
    }

    /**
     * @return every active alarm, oldest first
     */
    public List<Alarm> activeAlarms() {
        return alarms.activeAlarms();
    }

    /**
     * @return active alarms of one device, oldest first
     */
    public List<Alarm> activeAlarms(String deviceId) {
        return alarms.activeAlarms(deviceId);
    }

    /**
     * @param window how far back to look
     * @return alarms triggered within the window, newest first
     */
    public List<Alarm> recentAlarms(Duration window) {
        return alarms.recentAlarms(window);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @throws com.gsesentinel.core.device.UnknownDeviceException if the device
     *                                                            is not registered
     */
    public DeviceState deviceState(String deviceId) {
        return devices.state(deviceId);
    }

    public List<DeviceState> deviceStates() {
        return devices.states();
    }

    /**
     * @throws CommandNotFoundException if the id is unknown or evicted
     */
    public CommandRecord command(long commandId) {
        return ledger.find(commandId).orElseThrow(() -> new CommandNotFoundException(commandId));
    }

    /**
     * @param deviceId device identifier
     * @return admitted commands on the device that have no execution result
     *         yet, oldest first
     */
    public List<CommandRecord> pendingCommands(String deviceId) {
        return ledger.pendingCommands(deviceId);
    }

    /**
     * @return retained command rejections, oldest first
     */
    public List<CommandRecord> recentRejections() {
        return ledger.recentRejections();
    }

    /**
     * @return window statistics of a series, {@link WindowStatistics#EMPTY} if
     *         it has no samples
     */
    public WindowStatistics statistics(String deviceId, String parameter) {
        return statistics.stats(deviceId, parameter);
    }

    public Optional<Double> latest(String deviceId, String parameter) {
        return statistics.latest(deviceId, parameter);
    }

    public Map<String, Double> latestValues(String deviceId) {
        return statistics.latestValues(deviceId);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private MonitorConfig config = new MonitorConfig();
        private ParameterCatalog catalog;
        private MonitorEventSink sink = MonitorEventSink.NONE;
        private CommandDispatcher dispatcher = CommandDispatcher.NONE;
        private Clock clock = Clock.systemUTC();
        private InterlockTable interlocks = InterlockTable.standard();

        public Builder config(MonitorConfig config) {
            this.config = Objects.requireNonNull(config, "MonitorConfig must not be null");
            return this;
        }

        /**
         * Override the catalog; by default it is built from the configuration's
         * parameter overrides.
         */
        public Builder catalog(ParameterCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "ParameterCatalog must not be null");
            return this;
        }

        public Builder sink(MonitorEventSink sink) {
            this.sink = Objects.requireNonNull(sink, "MonitorEventSink must not be null");
            return this;
        }

        public Builder dispatcher(CommandDispatcher dispatcher) {
            this.dispatcher = Objects.requireNonNull(dispatcher, "CommandDispatcher must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock must not be null");
            return this;
        }

        public Builder interlocks(InterlockTable interlocks) {
            this.interlocks = Objects.requireNonNull(interlocks, "InterlockTable must not be null");
            return this;
        }

        /**
         * @throws IllegalStateException if the configuration is invalid
         */
        public GseMonitor build() {
            return new GseMonitor(this);
        }
    }
}
