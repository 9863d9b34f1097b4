package com.gsesentinel.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Delivers a batch of events to a {@link MonitorEventSink}, continuing past
 * individual failures and reporting every undelivered event at the end.
 *
 * @since 1.0.0
 */
public final class EventPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(EventPublisher.class);

    private final MonitorEventSink sink;

    public EventPublisher(MonitorEventSink sink) {
        this.sink = Objects.requireNonNull(sink, "MonitorEventSink must not be null");
    }

    /**
     * Publish every event in order.
     *
     * @param events events to deliver; must not be {@code null}
     * @throws DeliveryException if one or more events could not be delivered
     */
    public void publishAll(List<MonitorEvent> events) {
        Objects.requireNonNull(events, "Event list must not be null");
        List<MonitorEvent> failed = new ArrayList<>();
        RuntimeException firstFailure = null;

        for (MonitorEvent event : events) {
            try {
                sink.publish(event);
            } catch (RuntimeException e) {
                LOG.error("Event sink rejected {} for device {}: {}",
                        event.getType(), event.getDeviceId(), e.getMessage());
                failed.add(event);
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        if (!failed.isEmpty()) {
            throw new DeliveryException(failed.size() + " of " + events.size()
                    + " event(s) could not be delivered", failed, firstFailure);
        }
    }
}
