package com.supplytrace.eventmodel;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only, in-process event log.
 *
 * <p>Keeps every published envelope in publish order and refuses envelopes that fail
 * {@link EventValidator}. Used as the default sink of the ledger service and as a recording
 * publisher in tests.
 */
public class InMemoryEventLog implements EventPublisher {

    private final List<EventEnvelope<?>> events = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void publish(EventEnvelope<?> event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        ValidationResult result = EventValidator.validate(event);
        if (!result.valid()) {
            throw new IllegalArgumentException("Invalid event: " + String.join(", ", result.errors()));
        }
        lock.writeLock().lock();
        try {
            events.add(event);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Returns an immutable copy of all events, oldest first. */
    public List<EventEnvelope<?>> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Returns the events of the given type, oldest first. */
    public List<EventEnvelope<?>> ofType(EventType type) {
        return snapshot().stream()
                .filter(event -> type.value().equals(event.eventType()))
                .toList();
    }

    /** Number of events published so far. */
    public int size() {
        lock.readLock().lock();
        try {
            return events.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
