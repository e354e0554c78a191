package dev.nova.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.nova.config.Mappers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonLinesEventSinkTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    private final ObjectMapper mapper = Mappers.standard();

    @TempDir
    Path dir;

    @Test
    void appendsOneJsonObjectPerLine() throws IOException {
        Path file = dir.resolve("events/run_events.jsonl");
        var sink = new JsonLinesEventSink(file, CLOCK, mapper);

        EventReceipt first = sink.record("PLAN", Map.of("goal", "Run ETL"));
        EventReceipt second = sink.record("DONE", Map.of("goal", "Run ETL"));

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);
        JsonNode node = mapper.readTree(lines.get(0));
        assertThat(node.get("id").asLong()).isEqualTo(1);
        assertThat(node.get("ts").asText()).isEqualTo("2026-01-15T10:00:00Z");
        assertThat(node.get("event_type").asText()).isEqualTo("PLAN");
        assertThat(node.get("details").get("goal").asText()).isEqualTo("Run ETL");
        assertThat(first.id()).isEqualTo(1);
        assertThat(second.id()).isEqualTo(2);
    }

    @Test
    void continuesNumberingAfterRestart() {
        Path file = dir.resolve("run_events.jsonl");
        new JsonLinesEventSink(file, CLOCK, mapper).record("STARTUP", Map.of());

        EventReceipt receipt = new JsonLinesEventSink(file, CLOCK, mapper).record("PLAN", Map.of());

        assertThat(receipt.id()).isEqualTo(2);
    }

    @Test
    void failsWhenFileCannotBeWritten() throws IOException {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "x");
        var sink = new JsonLinesEventSink(blocker.resolve("events.jsonl"), CLOCK, mapper);

        assertThatThrownBy(() -> sink.record("PLAN", Map.of()))
            .isInstanceOf(SinkUnavailableException.class);
    }
}
