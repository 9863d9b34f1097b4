/**
 * Configuration loading and validation.
 *
 * <p>
 * Device registrations, parameter bound overrides and detection tuning are
 * defined in YAML and loaded by
 * {@link com.gsesentinel.core.config.MonitorConfigLoader} into a
 * {@link com.gsesentinel.core.config.MonitorConfig}. Validation runs right
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.gsesentinel.core.config;
