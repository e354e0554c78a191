package dev.nova.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Appends events to a JSON Lines file, one object per line:
 * {@code {"id":1,"ts":"...","event_type":"PLAN","details":{...}}}.
 */
public final class JsonLinesEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesEventSink.class);

    private final Path file;
    private final Clock clock;
    private final ObjectMapper mapper;
    private long lastId;

    public JsonLinesEventSink(Path file, Clock clock, ObjectMapper mapper) {
        this.file = file;
        this.clock = clock;
        this.mapper = mapper;
        this.lastId = countExistingLines(file);
    }

    @Override
    public synchronized EventReceipt record(String eventType, Map<String, Object> details) {
        Instant now = clock.instant();
        long id = lastId + 1;

        ObjectNode line = mapper.createObjectNode();
        line.put("id", id);
        line.put("ts", now.toString());
        line.put("event_type", eventType);
        line.set("details", mapper.valueToTree(details == null ? Map.of() : details));

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, mapper.writeValueAsString(line) + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to record event event_type={} file={}: {}", eventType, file, e.getMessage());
            throw new SinkUnavailableException("Failed to record event " + eventType + " to " + file, e);
        }

        lastId = id;
        log.debug("Event recorded event_type={} id={}", eventType, id);
        return new EventReceipt("success", id, now);
    }

    @Override
    public String getName() {
        return "event log " + file;
    }

    private static long countExistingLines(Path file) {
        if (!Files.exists(file)) {
            return 0;
        }
        try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
            return lines.filter(l -> !l.isBlank()).count();
        } catch (IOException e) {
            throw new SinkUnavailableException("Cannot read existing event log " + file, e);
        }
    }
}
