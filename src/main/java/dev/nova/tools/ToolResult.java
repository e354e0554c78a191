package dev.nova.tools;

import java.util.Map;

/**
 * Result of invoking a tool.
 */
public sealed interface ToolResult {

    record Success(Map<String, Object> value) implements ToolResult {}

    record Failure(String error, Throwable cause) implements ToolResult {
        public Failure(String error) {
            this(error, null);
        }
    }

    static ToolResult success(Map<String, Object> value) {
        return new Success(value);
    }

    static ToolResult failure(String error, Throwable cause) {
        return new Failure(error, cause);
    }
}
