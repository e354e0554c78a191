package dev.nova.sink;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemArtifactSinkTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path root;

    @Test
    void writesNestedArtifact() throws IOException {
        var sink = new FileSystemArtifactSink(root, CLOCK);

        ArtifactReceipt receipt = sink.writeText("etl/results/1.json", "{\"goal\":\"café\"}");

        Path written = root.resolve("etl/results/1.json");
        assertThat(Files.readString(written, StandardCharsets.UTF_8)).isEqualTo("{\"goal\":\"café\"}");
        assertThat(receipt.status()).isEqualTo("success");
        assertThat(receipt.uri()).startsWith("file:").endsWith("etl/results/1.json");
        assertThat(receipt.sizeBytes()).isEqualTo(16);
        assertThat(receipt.timestamp()).isEqualTo(CLOCK.instant());
    }

    @Test
    void overwritesExistingArtifact() throws IOException {
        var sink = new FileSystemArtifactSink(root, CLOCK);

        sink.writeText("runs/a.txt", "first");
        sink.writeText("runs/a.txt", "second");

        assertThat(Files.readString(root.resolve("runs/a.txt"))).isEqualTo("second");
    }

    @Test
    void rejectsPathsEscapingRoot() {
        var sink = new FileSystemArtifactSink(root, CLOCK);

        assertThatThrownBy(() -> sink.writeText("../outside.txt", "x"))
            .isInstanceOf(SinkUnavailableException.class)
            .hasMessageContaining("escapes");
        assertThatThrownBy(() -> sink.writeText("", "x"))
            .isInstanceOf(SinkUnavailableException.class);
    }

    @Test
    void wrapsIoFailure() throws IOException {
        Files.writeString(root.resolve("blocker"), "not a directory");
        var sink = new FileSystemArtifactSink(root, CLOCK);

        assertThatThrownBy(() -> sink.writeText("blocker/a.txt", "x"))
            .isInstanceOf(SinkUnavailableException.class)
            .hasCauseInstanceOf(IOException.class);
    }
}
