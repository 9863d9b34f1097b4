package com.gsesentinel.app;

import com.gsesentinel.core.GseMonitor;
import com.gsesentinel.core.TelemetryValidationException;
import com.gsesentinel.core.command.CommandDecision;
import com.gsesentinel.core.event.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Feeds JSON-lines replay input into a {@link GseMonitor}, one line at a
 * time, in file order.
 *
 * <p>
 * Bad lines and per-line failures are logged and counted; only an I/O error
 * on the input stops the replay.
 * </p>
 */
public class ReplayRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ReplayRunner.class);

    private final GseMonitor monitor;
    private final JsonLineDecoder decoder;
    private final ReplaySummary summary = new ReplaySummary();

    public ReplayRunner(GseMonitor monitor, JsonLineDecoder decoder) {
        this.monitor = Objects.requireNonNull(monitor, "GseMonitor must not be null");
        this.decoder = Objects.requireNonNull(decoder, "JsonLineDecoder must not be null");
    }

    /**
     * Replay every line of the input.
     *
     * @param input JSON-lines input; closed by the caller
     * @return counters of the run
     * @throws IOException if the input cannot be read
     */
    public ReplaySummary run(Reader input) throws IOException {
        BufferedReader reader = input instanceof BufferedReader b ? b : new BufferedReader(input);
        String line;
        while ((line = reader.readLine()) != null) {
            summary.line();
            Optional<ReplayMessage> message = decoder.decode(line);
            if (message.isEmpty()) {
                summary.skipped();
                continue;
            }
            apply(message.get());
        }
        LOG.info("Replay finished: {}", summary);
        return summary;
    }

    /**
     * @return counters, live while a run is in progress
     */
    public ReplaySummary getSummary() {
        return summary;
    }

    private void apply(ReplayMessage message) {
        try {
            switch (message.getKind()) {
                case TELEMETRY -> {
                    monitor.ingest(message.getTelemetry());
                    summary.telemetry(true);
                }
                case COMMAND -> {
                    CommandDecision decision = monitor.submitCommand(message.getCommand());
                    summary.command(decision.isAdmitted());
                }
                case EXECUTION_RESULT -> monitor.reportExecutionResult(message.getTargetId(), message.isSuccess(),
                        message.getDetail());
                case ACKNOWLEDGE -> monitor.acknowledgeAlarm(message.getTargetId(), message.getOperator());
            }
        } catch (TelemetryValidationException e) {
            summary.telemetry(false);
        } catch (DeliveryException e) {
            summary.failure();
            LOG.error("{} applied but {} event(s) were not delivered: {}", message, e.getUndeliveredEvents().size(),
                    e.getMessage());
        } catch (NoSuchElementException | IllegalStateException e) {
            summary.failure();
            LOG.warn("Replay line rejected by monitor: {} ({})", message, e.getMessage());
        }
    }
}
