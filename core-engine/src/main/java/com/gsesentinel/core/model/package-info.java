/**
 * Domain model shared by every GSE Sentinel component.
 *
 * <ul>
 * <li>{@link com.gsesentinel.core.model.TelemetryPoint} and
 * {@link com.gsesentinel.core.model.CommandRequest}: inbound messages</li>
 * <li>{@link com.gsesentinel.core.model.Alarm} and
 * {@link com.gsesentinel.core.model.DeviceState}: immutable snapshots handed
 * out by the owning components</li>
 * <li>{@link com.gsesentinel.core.model.DeviceType}: the closed set of
 * equipment types with their parameter catalogs</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.gsesentinel.core.model;
