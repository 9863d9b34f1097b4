/**
 * Alarm lifecycle: creation, in-place update, acknowledgment, auto-clear and
 * history.
 *
 * @since 1.0.0
 */
package com.gsesentinel.core.alarm;
