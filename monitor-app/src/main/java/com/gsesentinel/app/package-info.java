/**
 * Host process for GSE Sentinel.
 *
 * <p>
 * Replays JSON-lines telemetry and operator input through the core
 * {@link com.gsesentinel.core.GseMonitor} and writes the resulting alarm,
 * state and command events as JSON lines.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.gsesentinel.app.GseSentinelApp}: main entry point</li>
 * <li>{@link com.gsesentinel.app.ReplayRunner}: feeds decoded lines into the
 * monitor</li>
 * <li>{@link com.gsesentinel.app.AppConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.gsesentinel.app.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.gsesentinel.app;
