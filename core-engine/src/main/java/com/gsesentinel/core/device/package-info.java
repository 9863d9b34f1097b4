/**
 * Device mode and operational status state machine, plus the per-device lock
 * that serializes work on one device.
 *
 * @since 1.0.0
 */
package com.gsesentinel.core.device;
