package dev.nova.tools;

import dev.nova.sink.EventReceipt;
import dev.nova.sink.EventSink;
import dev.nova.sink.SinkUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code runs_record_event(event_type, details)}: appends a lifecycle event to the event sink.
 */
public final class RecordEventTool implements Tool {

    public static final String NAME = "runs_record_event";

    private static final Logger log = LoggerFactory.getLogger(RecordEventTool.class);

    private final EventSink sink;

    public RecordEventTool(EventSink sink) {
        this.sink = sink;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ToolResult execute(Map<String, Object> args) {
        String eventType;
        Map<String, Object> details;
        try {
            eventType = ToolArgs.requireString(args, "event_type");
            details = ToolArgs.optionalMap(args, "details");
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage(), e);
        }

        try {
            EventReceipt receipt = sink.record(eventType, details);
            log.info("Event recorded event_type={} run_event_id={}", eventType, receipt.id());

            var result = new LinkedHashMap<String, Object>();
            result.put("status", receipt.status());
            result.put("run_event_id", receipt.id());
            result.put("timestamp", receipt.timestamp().toString());
            return ToolResult.success(result);
        } catch (SinkUnavailableException e) {
            log.error("Failed to record event event_type={}: {}", eventType, e.getMessage());
            return ToolResult.failure(e.getMessage(), e);
        }
    }
}
