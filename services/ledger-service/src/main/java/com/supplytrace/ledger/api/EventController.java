package com.supplytrace.ledger.api;

import com.supplytrace.eventmodel.EventEnvelope;
import com.supplytrace.eventmodel.EventType;
import com.supplytrace.eventmodel.InMemoryEventLog;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read-only view of the events the ledger has published, oldest first. */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final InMemoryEventLog eventLog;

    public EventController(InMemoryEventLog eventLog) {
        this.eventLog = eventLog;
    }

    @GetMapping
    public List<EventEnvelope<?>> events(@RequestParam(required = false) String type) {
        if (type == null) {
            return eventLog.snapshot();
        }
        EventType eventType = EventType.fromString(type)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + type));
        return eventLog.ofType(eventType);
    }
}
