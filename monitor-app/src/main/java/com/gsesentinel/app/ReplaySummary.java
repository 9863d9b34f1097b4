package com.gsesentinel.app;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of a replay. Safe to read while the replay is in progress.
 */
public final class ReplaySummary {

    private final AtomicLong lines = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong telemetryAccepted = new AtomicLong();
    private final AtomicLong telemetryRejected = new AtomicLong();
    private final AtomicLong commandsAdmitted = new AtomicLong();
    private final AtomicLong commandsRejected = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    void line() {
        lines.incrementAndGet();
    }

    void skipped() {
        skipped.incrementAndGet();
    }

    void telemetry(boolean accepted) {
        (accepted ? telemetryAccepted : telemetryRejected).incrementAndGet();
    }

    void command(boolean admitted) {
        (admitted ? commandsAdmitted : commandsRejected).incrementAndGet();
    }

    void failure() {
        failures.incrementAndGet();
    }

    public long getLines() {
        return lines.get();
    }

    public long getSkipped() {
        return skipped.get();
    }

    public long getTelemetryAccepted() {
        return telemetryAccepted.get();
    }

    public long getTelemetryRejected() {
        return telemetryRejected.get();
    }

    public long getCommandsAdmitted() {
        return commandsAdmitted.get();
    }

    public long getCommandsRejected() {
        return commandsRejected.get();
    }

    /**
     * @return lines that reached the monitor but failed there (delivery
     *         errors, unknown ids, closed commands)
     */
    public long getFailures() {
        return failures.get();
    }

    @Override
    public String toString() {
        return "ReplaySummary{" +
                "lines=" + lines +
                ", skipped=" + skipped +
                ", telemetryAccepted=" + telemetryAccepted +
                ", telemetryRejected=" + telemetryRejected +
                ", commandsAdmitted=" + commandsAdmitted +
                ", commandsRejected=" + commandsRejected +
                ", failures=" + failures +
                '}';
    }
}
