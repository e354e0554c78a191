package dev.nova.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    void classpathDefaultsMatchBuiltInDefaults() throws IOException {
        OrchestratorConfig config = ConfigLoader.load(null, Map.of());

        assertThat(config.projectId()).isEqualTo("orchestrator-nova");
        assertThat(config.region()).isEqualTo("us-central1");
        assertThat(config.artifactDir()).isEqualTo(Path.of("artifacts"));
        assertThat(config.eventLog()).isNull();
        assertThat(config.jobDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.workerThreads()).isEqualTo(4);
        assertThat(config.defaultStepTimeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(config.retry().enabled()).isFalse();
    }

    @Test
    void fileOverridesDefaults() throws IOException {
        Path file = dir.resolve("nova.json");
        Files.writeString(file, """
            {
              "region": "europe-west1",
              "eventLog": "logs/events.jsonl",
              "jobDelayMillis": 0,
              "retry": { "enabled": true }
            }
            """);

        OrchestratorConfig config = ConfigLoader.load(file, Map.of());

        assertThat(config.region()).isEqualTo("europe-west1");
        assertThat(config.projectId()).isEqualTo("orchestrator-nova");
        assertThat(config.eventLog()).isEqualTo(Path.of("logs/events.jsonl"));
        assertThat(config.jobDelay()).isEqualTo(Duration.ZERO);
        assertThat(config.retry().enabled()).isTrue();
        assertThat(config.retry().backoff()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void environmentWins() throws IOException {
        OrchestratorConfig config = ConfigLoader.load(null, Map.of(
            "PROJECT_ID", "acme",
            "REGION", "asia-east1",
            "NOVA_ARTIFACT_DIR", "/tmp/nova",
            "NOVA_EVENT_LOG", "/tmp/nova/events.jsonl"));

        assertThat(config.projectId()).isEqualTo("acme");
        assertThat(config.region()).isEqualTo("asia-east1");
        assertThat(config.artifactDir()).isEqualTo(Path.of("/tmp/nova"));
        assertThat(config.eventLog()).isEqualTo(Path.of("/tmp/nova/events.jsonl"));
    }

    @Test
    void blankEnvironmentValuesAreIgnored() throws IOException {
        OrchestratorConfig config = ConfigLoader.load(null, Map.of("PROJECT_ID", " "));

        assertThat(config.projectId()).isEqualTo("orchestrator-nova");
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> ConfigLoader.loadFromString("{\"workerThreads\": 0}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("workerThreads");
        assertThatThrownBy(() -> ConfigLoader.loadFromString("{\"defaultStepTimeoutSeconds\": 0}"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConfigLoader.loadFromString("[]"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
