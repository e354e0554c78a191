package dev.nova.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * An ordered sequence of steps derived from a goal. Array order is also execution order.
 */
public record Plan(
    String goal,
    List<Step> steps,
    Map<String, Object> metadata,
    Instant createdAt
) {
    public static final String PLANNER_VERSION = "planner_version";
    public static final String WORKFLOW = "workflow";
    public static final String ESTIMATED_DURATION_SECONDS = "estimated_duration_seconds";

    public Plan {
        goal = goal == null ? "" : goal;
        steps = List.copyOf(steps);
        metadata = metadata == null ? Map.of() : Values.immutableMap(metadata);
    }

    public Step step(int index) {
        return steps.get(index);
    }

    public int size() {
        return steps.size();
    }
}
