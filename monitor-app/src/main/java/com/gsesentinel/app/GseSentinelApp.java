package com.gsesentinel.app;

import com.gsesentinel.core.GseMonitor;
import com.gsesentinel.core.config.MonitorConfig;
import com.gsesentinel.core.config.MonitorConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Main entry point of the GSE Sentinel host process.
 *
 * <h3>Flow</h3>
 *
 * <pre>
 *   JSON-lines input (file or stdin)
 *     → JsonLineDecoder → telemetry / command / result / ack
 *     → GseMonitor (detection, alarms, device state, interlocks)
 *     → JsonEventSink → JSON-lines events (file or stdout)
 *     → LoggingCommandDispatcher for admitted commands
 * </pre>
 *
 * <p>
 * All settings come from environment variables via {@link AppConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class GseSentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(GseSentinelApp.class);

    private GseSentinelApp() {
    }

    public static void main(String[] args) throws IOException {
        // 1. Load configuration
        AppConfig config = AppConfig.fromEnvironment();
        LOG.info("Starting GSE Sentinel with config: {}", config);

        MonitorConfig monitorConfig = config.hasMonitorConfigPath()
                ? MonitorConfigLoader.fromFile(config.getMonitorConfigPath())
                : MonitorConfigLoader.load();

        try (Writer events = openOutput(config); Reader input = openInput(config)) {
            // 2. Assemble the monitor
            LoggingCommandDispatcher dispatcher = new LoggingCommandDispatcher();
            GseMonitor monitor = GseMonitor.builder()
                    .config(monitorConfig)
                    .sink(new JsonEventSink(events))
                    .dispatcher(dispatcher)
                    .build();

            // 3. Health endpoint with shutdown hook
            HealthServer healthServer = null;
            if (config.isHealthEnabled()) {
                healthServer = new HealthServer(monitor);
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));
                healthServer.setReady(true);
            }

            // 4. Replay
            try {
                ReplaySummary summary = new ReplayRunner(monitor, new JsonLineDecoder(config.getDefaultIssuer()))
                        .run(input);
                LOG.info("Dispatched {} command(s); {} alarm(s) still active", dispatcher.getDispatchedCount(),
                        monitor.activeAlarms().size());
                if (summary.getFailures() > 0) {
                    LOG.warn("{} replay line(s) failed inside the monitor", summary.getFailures());
                }
            } finally {
                if (healthServer != null) {
                    healthServer.stop();
                }
            }
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Reader openInput(AppConfig config) throws IOException {
        InputStream in = config.readsStdin() ? System.in : new FileInputStream(config.getInputPath());
        return new InputStreamReader(in, StandardCharsets.UTF_8);
    }

    private static Writer openOutput(AppConfig config) throws IOException {
        OutputStream out = config.writesStdout() ? System.out : new FileOutputStream(config.getEventOutputPath(), true);
        return new OutputStreamWriter(out, StandardCharsets.UTF_8);
    }
}
