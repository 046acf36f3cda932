package com.supplytrace.eventmodel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator that writes each event as JSON to the log before handing it to the delegate.
 */
public class LoggingEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventPublisher.class);

    private final EventPublisher delegate;

    public LoggingEventPublisher(EventPublisher delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        this.delegate = delegate;
    }

    @Override
    public void publish(EventEnvelope<?> event) {
        if (log.isDebugEnabled()) {
            log.debug("Publishing {}: {}", event.eventType(), EventSerializer.serialize(event));
        }
        delegate.publish(event);
    }
}
