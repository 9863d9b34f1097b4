package com.gsesentinel.core.event;

/**
 * Receiver of alarm, device-state and command events, typically a
 * persistence or display collaborator.
 *
 * <p>
 * Implementations may throw any {@link RuntimeException} to signal that the
 * downstream is unavailable; the core reports that to its caller as a
 * {@link DeliveryException} without rolling back its own state.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MonitorEventSink {

    /** Sink that discards every event. */
    MonitorEventSink NONE = event -> {
    };

    /**
     * @param event event to deliver; never {@code null}
     */
    void publish(MonitorEvent event);
}
