package dev.nova.tools;

import dev.nova.sink.ArtifactReceipt;
import dev.nova.sink.ArtifactSink;
import dev.nova.sink.SinkUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code artifacts_write_text(path, content)}: stores a text artifact.
 */
public final class WriteArtifactTool implements Tool {

    public static final String NAME = "artifacts_write_text";

    private static final Logger log = LoggerFactory.getLogger(WriteArtifactTool.class);

    private final ArtifactSink sink;

    public WriteArtifactTool(ArtifactSink sink) {
        this.sink = sink;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ToolResult execute(Map<String, Object> args) {
        String path;
        String content;
        try {
            path = ToolArgs.requireString(args, "path");
            content = ToolArgs.requireString(args, "content");
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage(), e);
        }

        try {
            ArtifactReceipt receipt = sink.writeText(path, content);

            var result = new LinkedHashMap<String, Object>();
            result.put("status", receipt.status());
            result.put("uri", receipt.uri());
            result.put("size_bytes", receipt.sizeBytes());
            result.put("timestamp", receipt.timestamp().toString());
            return ToolResult.success(result);
        } catch (SinkUnavailableException e) {
            log.error("Failed to write artifact path={}: {}", path, e.getMessage());
            return ToolResult.failure(e.getMessage(), e);
        }
    }
}
