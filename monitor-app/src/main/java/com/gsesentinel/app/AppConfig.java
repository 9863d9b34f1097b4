package com.gsesentinel.app;

import java.io.Serializable;

/**
 * Typed, immutable configuration of the GSE Sentinel host process.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults. An
 * empty input path means standard input; an empty output path means standard
 * output; an empty monitor config path means the classpath default.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AppConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Monitor
    // ---------------------------------------------------------------
    private final String monitorConfigPath;

    // ---------------------------------------------------------------
    // Replay input / event output
    // ---------------------------------------------------------------
    private final String inputPath;
    private final String eventOutputPath;
    private final String defaultIssuer;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final boolean healthEnabled;
    private final int healthPort;

    private AppConfig(Builder b) {
        this.monitorConfigPath = b.monitorConfigPath;
        this.inputPath = b.inputPath;
        this.eventOutputPath = b.eventOutputPath;
        this.defaultIssuer = b.defaultIssuer;
        this.healthEnabled = b.healthEnabled;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link AppConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static AppConfig fromEnvironment() {
        try {
            return new Builder()
                    .monitorConfigPath(env("GSE_CONFIG_PATH", ""))
                    .inputPath(env("GSE_INPUT_PATH", ""))
                    .eventOutputPath(env("GSE_EVENT_OUTPUT_PATH", ""))
                    .defaultIssuer(env("GSE_DEFAULT_ISSUER", "operator"))
                    .healthEnabled(Boolean.parseBoolean(env("HEALTH_ENABLED", "true")))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getMonitorConfigPath() {
        return monitorConfigPath;
    }

    /**
     * @return {@code true} if an explicit monitor configuration file is set
     */
    public boolean hasMonitorConfigPath() {
        return !monitorConfigPath.isBlank();
    }

    public String getInputPath() {
        return inputPath;
    }

    /**
     * @return {@code true} if replay input comes from standard input
     */
    public boolean readsStdin() {
        return inputPath.isBlank() || "-".equals(inputPath);
    }

    public String getEventOutputPath() {
        return eventOutputPath;
    }

    /**
     * @return {@code true} if events are written to standard output
     */
    public boolean writesStdout() {
        return eventOutputPath.isBlank() || "-".equals(eventOutputPath);
    }

    public String getDefaultIssuer() {
        return defaultIssuer;
    }

    public boolean isHealthEnabled() {
        return healthEnabled;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AppConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the health port is in
     * [1, 65535] and that the default issuer is not blank. Paths may be
     * empty but not {@code null}.
     * </p>
     */
    public static class Builder {
        private String monitorConfigPath = "";
        private String inputPath = "";
        private String eventOutputPath = "";
        private String defaultIssuer = "operator";
        private boolean healthEnabled = true;
        private int healthPort = 8080;

        public Builder monitorConfigPath(String v) {
            this.monitorConfigPath = v;
            return this;
        }

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder eventOutputPath(String v) {
            this.eventOutputPath = v;
            return this;
        }

        public Builder defaultIssuer(String v) {
            this.defaultIssuer = v;
            return this;
        }

        public Builder healthEnabled(boolean v) {
            this.healthEnabled = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link AppConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public AppConfig build() {
            requireNonNull(monitorConfigPath, "monitorConfigPath");
            requireNonNull(inputPath, "inputPath");
            requireNonNull(eventOutputPath, "eventOutputPath");
            if (defaultIssuer == null || defaultIssuer.isBlank()) {
                throw new IllegalArgumentException("defaultIssuer must not be null or blank");
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            return new AppConfig(this);
        }

        private static void requireNonNull(String value, String name) {
            if (value == null) {
                throw new IllegalArgumentException(name + " must not be null");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "AppConfig{" +
                "monitorConfigPath='" + monitorConfigPath + '\'' +
                ", inputPath='" + inputPath + '\'' +
                ", eventOutputPath='" + eventOutputPath + '\'' +
                ", defaultIssuer='" + defaultIssuer + '\'' +
                ", healthEnabled=" + healthEnabled +
                ", healthPort=" + healthPort +
                '}';
    }
}
