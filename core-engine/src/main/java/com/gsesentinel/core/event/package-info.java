/**
 * Outbound events and their delivery to the external event sink.
 *
 * @since 1.0.0
 */
package com.gsesentinel.core.event;
