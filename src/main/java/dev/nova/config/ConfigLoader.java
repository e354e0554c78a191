package dev.nova.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Loads {@link OrchestratorConfig} from JSON. Layers, later ones win:
 * classpath {@code orchestrator-nova.json}, an optional file, then environment variables
 * {@code PROJECT_ID}, {@code REGION}, {@code NOVA_ARTIFACT_DIR} and {@code NOVA_EVENT_LOG}.
 */
public final class ConfigLoader {

    public static final String DEFAULTS_RESOURCE = "/orchestrator-nova.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigLoader() {}

    /**
     * Load the layered configuration.
     *
     * @param file optional override file, may be null
     * @param env  environment variables
     */
    public static OrchestratorConfig load(Path file, Map<String, String> env) throws IOException {
        OrchestratorConfig config = OrchestratorConfig.defaults();
        try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                config = merge(config, MAPPER.readTree(in));
            }
        }
        if (file != null) {
            config = merge(config, MAPPER.readTree(file.toFile()));
        }
        return applyEnvironment(config, env);
    }

    /**
     * Parse a JSON document on top of the built-in defaults.
     */
    public static OrchestratorConfig loadFromString(String json) throws IOException {
        return merge(OrchestratorConfig.defaults(), MAPPER.readTree(json));
    }

    static OrchestratorConfig merge(OrchestratorConfig base, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Configuration must be a JSON object");
        }
        String projectId = root.has("projectId") ? root.get("projectId").asText() : base.projectId();
        String region = root.has("region") ? root.get("region").asText() : base.region();
        Path artifactDir = root.has("artifactDir") ? Path.of(root.get("artifactDir").asText()) : base.artifactDir();
        Path eventLog = base.eventLog();
        if (root.has("eventLog")) {
            JsonNode node = root.get("eventLog");
            eventLog = node.isNull() || node.asText().isBlank() ? null : Path.of(node.asText());
        }
        Duration jobDelay = root.has("jobDelayMillis")
            ? Duration.ofMillis(root.get("jobDelayMillis").asLong()) : base.jobDelay();
        int workerThreads = root.has("workerThreads")
            ? root.get("workerThreads").asInt() : base.workerThreads();
        Duration stepTimeout = root.has("defaultStepTimeoutSeconds")
            ? Duration.ofSeconds(root.get("defaultStepTimeoutSeconds").asLong()) : base.defaultStepTimeout();
        OrchestratorConfig.Retry retry = parseRetry(root.get("retry"), base.retry());

        return new OrchestratorConfig(projectId, region, artifactDir, eventLog, jobDelay, workerThreads,
            stepTimeout, retry);
    }

    private static OrchestratorConfig.Retry parseRetry(JsonNode node, OrchestratorConfig.Retry base) {
        if (node == null || node.isNull()) {
            return base;
        }
        boolean enabled = node.has("enabled") ? node.get("enabled").asBoolean() : base.enabled();
        Duration backoff = node.has("backoffMillis")
            ? Duration.ofMillis(node.get("backoffMillis").asLong()) : base.backoff();
        return new OrchestratorConfig.Retry(enabled, backoff);
    }

    static OrchestratorConfig applyEnvironment(OrchestratorConfig config, Map<String, String> env) {
        String projectId = nonBlank(env.get("PROJECT_ID"), config.projectId());
        String region = nonBlank(env.get("REGION"), config.region());
        String artifactDir = env.get("NOVA_ARTIFACT_DIR");
        String eventLog = env.get("NOVA_EVENT_LOG");
        return new OrchestratorConfig(
            projectId,
            region,
            artifactDir == null || artifactDir.isBlank() ? config.artifactDir() : Path.of(artifactDir),
            eventLog == null || eventLog.isBlank() ? config.eventLog() : Path.of(eventLog),
            config.jobDelay(),
            config.workerThreads(),
            config.defaultStepTimeout(),
            config.retry()
        );
    }

    private static String nonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
