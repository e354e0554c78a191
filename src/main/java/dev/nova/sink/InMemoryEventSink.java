package dev.nova.sink;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps events in memory. Used when no event log is configured, and in tests.
 */
public final class InMemoryEventSink implements EventSink {

    public record StoredEvent(long id, Instant timestamp, String eventType, Map<String, Object> details) {}

    private final Clock clock;
    private final AtomicLong nextId = new AtomicLong(1);
    private final List<StoredEvent> events = new CopyOnWriteArrayList<>();

    public InMemoryEventSink() {
        this(Clock.systemUTC());
    }

    public InMemoryEventSink(Clock clock) {
        this.clock = clock;
    }

    @Override
    public EventReceipt record(String eventType, Map<String, Object> details) {
        long id = nextId.getAndIncrement();
        Instant now = clock.instant();
        events.add(new StoredEvent(id, now, eventType, details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details))));
        return new EventReceipt("success", id, now);
    }

    public List<StoredEvent> events() {
        return List.copyOf(events);
    }

    public List<String> eventTypes() {
        return events.stream().map(StoredEvent::eventType).toList();
    }

    @Override
    public String getName() {
        return "in-memory event log";
    }
}
