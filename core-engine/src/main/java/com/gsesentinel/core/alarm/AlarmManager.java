package com.gsesentinel.core.alarm;

import com.gsesentinel.core.detection.Verdict;
import com.gsesentinel.core.event.MonitorEvent;
import com.gsesentinel.core.event.MonitorEventType;
import com.gsesentinel.core.model.Alarm;
import com.gsesentinel.core.model.AlarmType;
import com.gsesentinel.core.model.SeriesKey;
import com.gsesentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns every alarm and drives it through
 * {@code TRIGGERED → ACKNOWLEDGED → CLEARED}.
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>At most one active alarm per (device, parameter, alarm type). A repeat
 * violation updates the active alarm in place.</li>
 * <li>CLEARED is terminal; a later violation opens a new alarm with a new
 * id.</li>
 * <li>{@code clearedAt} never precedes {@code triggeredAt}.</li>
 * </ul>
 *
 * <h3>Auto-clear</h3>
 * <p>
 * A consecutive-clean-sample streak is kept per (device, parameter). Once it
 * reaches {@code clearHysteresis}, every active alarm on that series is
 * cleared. Any violation on the series resets the streak.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Mutations for one device are expected to be serialized by the caller (the
 * monitor holds a per-device lock). Queries may run concurrently from any
 * thread and only ever see snapshots.
 * </p>
 *
 * @since 1.0.0
 */
public class AlarmManager {

    private static final Logger LOG = LoggerFactory.getLogger(AlarmManager.class);

    private static final Comparator<Alarm> OLDEST_FIRST = Comparator
            .comparing(Alarm::getTriggeredAt)
            .thenComparingLong(Alarm::getId);

    private final Clock clock;
    private final int clearHysteresis;
    private final int historyLimit;

    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<AlarmKey, AlarmRecord> active = new ConcurrentHashMap<>();
    private final Map<Long, AlarmRecord> byId = new ConcurrentHashMap<>();
    private final Map<SeriesKey, Integer> cleanStreaks = new ConcurrentHashMap<>();

    /** Cleared alarms retained for history queries, oldest first. */
    private final Deque<AlarmRecord> history = new ArrayDeque<>();

    /**
     * @param clock           source of alarm timestamps; must not be
     *                        {@code null}
     * @param clearHysteresis consecutive clean samples needed to clear; at
     *                        least 2
     * @param historyLimit    number of cleared alarms retained; at least 0
     * @throws IllegalArgumentException if a limit is out of range
     */
    public AlarmManager(Clock clock, int clearHysteresis, int historyLimit) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        if (clearHysteresis < 2) {
            throw new IllegalArgumentException("clearHysteresis must be >= 2, got: " + clearHysteresis);
        }
        if (historyLimit < 0) {
            throw new IllegalArgumentException("historyLimit must be >= 0, got: " + historyLimit);
        }
        this.clearHysteresis = clearHysteresis;
        this.historyLimit = historyLimit;
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    /**
     * Apply the classification of one sample to the series' alarms.
     *
     * <p>
     * A violation verdict raises or updates the alarm of that type. A reported
     * status of WARNING or above raises or updates a
     * {@link AlarmType#DEVICE_FAULT} alarm. If neither applies the sample is
     * clean and extends the series' clear streak.
     * </p>
     *
     * @param deviceId       device identifier
     * @param parameter      parameter name
     * @param value          sample value
     * @param verdict        detection outcome; must not be {@code null}
     * @param reportedStatus status the equipment attached to the sample
     * @param events         receives the resulting events
     */
    public void apply(String deviceId, String parameter, double value, Verdict verdict,
            Severity reportedStatus, List<MonitorEvent> events) {
        Objects.requireNonNull(verdict, "Verdict must not be null");
        SeriesKey series = new SeriesKey(deviceId, parameter);
        boolean violated = false;

        if (verdict.isViolation()) {
            raise(new AlarmKey(deviceId, parameter, verdict.getAlarmType()),
                    verdict.getSeverity(), verdict.getThresholdValue(), value, events);
            violated = true;
        }
        if (reportedStatus != null && reportedStatus.isAtLeast(Severity.WARNING)) {
            raise(new AlarmKey(deviceId, parameter, AlarmType.DEVICE_FAULT),
                    reportedStatus, null, value, events);
            violated = true;
        }

        if (violated) {
            cleanStreaks.remove(series);
            return;
        }

        int streak = cleanStreaks.merge(series, 1, Integer::sum);
        if (streak >= clearHysteresis) {
            cleanStreaks.remove(series);
            clearSeries(deviceId, parameter, events);
        }
    }

    /**
     * Record an operator acknowledgment.
     *
     * <p>
     * Acknowledging twice keeps the first acknowledgment. Acknowledging a
     * cleared alarm records who and when but the state stays CLEARED.
     * </p>
     *
     * @param alarmId  alarm identifier
     * @param operator operator name; must not be {@code null}
     * @param events   receives an ALARM_ACKNOWLEDGED event if the
     *                 acknowledgment was recorded
     * @return snapshot after the call
     * @throws AlarmNotFoundException if the id is unknown
     */
    public Alarm acknowledge(long alarmId, String operator, List<MonitorEvent> events) {
        Objects.requireNonNull(operator, "Operator must not be null");
        AlarmRecord record = byId.get(alarmId);
        if (record == null) {
            throw new AlarmNotFoundException(alarmId);
        }
        Instant now = clock.instant();
        if (record.acknowledge(operator, now)) {
            Alarm snapshot = record.snapshot();
            LOG.info("Alarm {} acknowledged by {}", alarmId, operator);
            events.add(MonitorEvent.ofAlarm(MonitorEventType.ALARM_ACKNOWLEDGED, now, snapshot));
            return snapshot;
        }
        return record.snapshot();
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @param alarmId alarm identifier
     * @return snapshot of the alarm, if it is active or still in history
     */
    public Optional<Alarm> find(long alarmId) {
        AlarmRecord record = byId.get(alarmId);
        return record == null ? Optional.empty() : Optional.of(record.snapshot());
    }

    /**
     * @return every uncleared alarm, oldest first
     */
    public List<Alarm> activeAlarms() {
        return active.values().stream()
                .map(AlarmRecord::snapshot)
                .sorted(OLDEST_FIRST)
                .toList();
    }

    /**
     * @param deviceId device identifier
     * @return the device's uncleared alarms, oldest first
     */
    public List<Alarm> activeAlarms(String deviceId) {
        return active.values().stream()
                .filter(r -> r.key().deviceId().equals(deviceId))
                .map(AlarmRecord::snapshot)
                .sorted(OLDEST_FIRST)
                .toList();
    }

    /**
     * @param window how far back to look; must not be negative
     * @return active and retained cleared alarms triggered within the window,
     *         newest first
     */
    public List<Alarm> recentAlarms(Duration window) {
        Objects.requireNonNull(window, "Window must not be null");
        if (window.isNegative()) {
            throw new IllegalArgumentException("Window must not be negative, got: " + window);
        }
        Instant cutoff = clock.instant().minus(window);
        return byId.values().stream()
                .map(AlarmRecord::snapshot)
                .filter(a -> !a.getTriggeredAt().isBefore(cutoff))
                .sorted(OLDEST_FIRST.reversed())
                .toList();
    }

    /**
     * @param deviceId device identifier
     * @return the highest severity among the device's active alarms, empty if
     *         none is active
     */
    public Optional<Severity> highestActiveSeverity(String deviceId) {
        return active.values().stream()
                .filter(r -> r.key().deviceId().equals(deviceId))
                .map(AlarmRecord::severity)
                .max(Comparator.naturalOrder());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void raise(AlarmKey key, Severity severity, Double threshold, double value,
            List<MonitorEvent> events) {
        Instant now = clock.instant();
        AlarmRecord existing = active.get(key);

        if (existing == null) {
            AlarmRecord record = new AlarmRecord(nextId.getAndIncrement(), key, severity, threshold, value, now);
            active.put(key, record);
            byId.put(record.id(), record);
            LOG.info("Alarm {} triggered: {} severity={} value={} threshold={}",
                    record.id(), key, severity, value, threshold);
            events.add(MonitorEvent.ofAlarm(MonitorEventType.ALARM_TRIGGERED, now, record.snapshot()));
            return;
        }

        if (existing.update(severity, threshold, value)) {
            LOG.info("Alarm {} severity changed to {} (value={})", existing.id(), severity, value);
            events.add(MonitorEvent.ofAlarm(MonitorEventType.ALARM_UPDATED, now, existing.snapshot()));
        } else {
            LOG.debug("Alarm {} still active: value={}", existing.id(), value);
        }
    }

    private void clearSeries(String deviceId, String parameter, List<MonitorEvent> events) {
        Instant now = clock.instant();
        for (AlarmType type : AlarmType.values()) {
            AlarmRecord record = active.remove(new AlarmKey(deviceId, parameter, type));
            if (record == null) {
                continue;
            }
            record.clear(now);
            Alarm snapshot = record.snapshot();
            LOG.info("Alarm {} cleared: {} after {}", record.id(), record.key(),
                    snapshot.getDuration().orElse(Duration.ZERO));
            events.add(MonitorEvent.ofAlarm(MonitorEventType.ALARM_CLEARED, now, snapshot));
            retain(record);
        }
    }

    private void retain(AlarmRecord cleared) {
        synchronized (history) {
            history.addLast(cleared);
            while (history.size() > historyLimit) {
                AlarmRecord evicted = history.pollFirst();
                byId.remove(evicted.id());
            }
        }
    }
}
