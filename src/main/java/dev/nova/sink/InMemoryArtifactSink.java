package dev.nova.sink;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores artifacts in a map, addressed by {@code mem://<path>} URIs.
 */
public final class InMemoryArtifactSink implements ArtifactSink {

    private final Clock clock;
    private final Map<String, String> artifacts = new ConcurrentHashMap<>();

    public InMemoryArtifactSink() {
        this(Clock.systemUTC());
    }

    public InMemoryArtifactSink(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ArtifactReceipt writeText(String path, String content) {
        if (path == null || path.isBlank()) {
            throw new SinkUnavailableException("Artifact path must be non-empty");
        }
        artifacts.put(path, content);
        return new ArtifactReceipt("success", "mem://" + path,
            content.getBytes(StandardCharsets.UTF_8).length, clock.instant());
    }

    public Optional<String> read(String path) {
        return Optional.ofNullable(artifacts.get(path));
    }

    public Map<String, String> artifacts() {
        return Map.copyOf(artifacts);
    }

    @Override
    public String getName() {
        return "in-memory artifact store";
    }
}
