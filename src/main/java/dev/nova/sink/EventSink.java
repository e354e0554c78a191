package dev.nova.sink;

import java.util.Map;

/**
 * Durable append of lifecycle events (PLAN, DONE, TASK_START, ...).
 */
public interface EventSink {

    /**
     * Record an event.
     *
     * @param eventType event type, e.g. {@code PLAN}
     * @param details   event payload
     * @return receipt carrying the assigned id
     * @throws SinkUnavailableException if the event could not be stored
     */
    EventReceipt record(String eventType, Map<String, Object> details);

    /** Display name used by connectivity checks. */
    String getName();
}
