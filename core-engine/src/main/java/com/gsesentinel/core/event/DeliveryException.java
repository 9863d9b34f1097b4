package com.gsesentinel.core.event;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a downstream collaborator (event sink or command dispatcher)
 * fails after the core has already committed its own state change.
 *
 * <p>
 * The operation itself took effect; the exception carries the events that did
 * not reach the sink so the caller can replay them.
 * </p>
 *
 * @since 1.0.0
 */
public class DeliveryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient List<MonitorEvent> undeliveredEvents;

    public DeliveryException(String message, List<MonitorEvent> undeliveredEvents, Throwable cause) {
        super(message, cause);
        this.undeliveredEvents = undeliveredEvents != null
                ? List.copyOf(undeliveredEvents)
                : Collections.emptyList();
    }

    /**
     * @return events that were generated but not delivered, in order
     */
    public List<MonitorEvent> getUndeliveredEvents() {
        return undeliveredEvents;
    }
}
