package dev.nova.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A step is one tool invocation within a plan.
 * Dependencies are indices of earlier steps in the same plan.
 */
public record Step(
    String tool,
    Map<String, Object> args,
    List<Integer> dependsOn,
    Duration timeout,
    int retryCount // carried for callers that opt into retries; the default executor ignores it
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);
    public static final int DEFAULT_RETRY_COUNT = 3;

    public Step {
        if (tool == null || tool.isBlank()) {
            throw new IllegalArgumentException("Step tool must be non-empty");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Step '%s' has non-positive timeout: %s".formatted(tool, timeout));
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("Step '%s' has negative retry count: %d".formatted(tool, retryCount));
        }
        args = args == null ? Map.of() : Values.immutableMap(args);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static Step of(String tool, Map<String, Object> args, Integer... dependsOn) {
        return new Step(tool, args, List.of(dependsOn), DEFAULT_TIMEOUT, DEFAULT_RETRY_COUNT);
    }

    public Step withTimeout(Duration newTimeout) {
        return new Step(tool, args, dependsOn, newTimeout, retryCount);
    }

    public Step withRetryCount(int newRetryCount) {
        return new Step(tool, args, dependsOn, timeout, newRetryCount);
    }
}
