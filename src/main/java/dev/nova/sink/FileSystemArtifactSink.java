package dev.nova.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Writes artifacts as files below a root directory.
 */
public final class FileSystemArtifactSink implements ArtifactSink {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactSink.class);

    private final Path root;
    private final Clock clock;

    public FileSystemArtifactSink(Path root, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.clock = clock;
    }

    @Override
    public ArtifactReceipt writeText(String path, String content) {
        if (path == null || path.isBlank()) {
            throw new SinkUnavailableException("Artifact path must be non-empty");
        }
        Path target = root.resolve(path).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new SinkUnavailableException("Artifact path escapes the artifact root: " + path);
        }

        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
        } catch (IOException e) {
            log.error("Failed to write artifact path={}: {}", path, e.getMessage());
            throw new SinkUnavailableException("Failed to write artifact " + path, e);
        }

        String uri = target.toUri().toString();
        log.info("Artifact written path={} uri={} size={}", path, uri, bytes.length);
        return new ArtifactReceipt("success", uri, bytes.length, clock.instant());
    }

    public Path root() {
        return root;
    }

    @Override
    public String getName() {
        return "artifact directory " + root;
    }
}
