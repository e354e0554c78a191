package dev.nova.model;

import java.time.Duration;

/**
 * What a caller gets back after submitting a goal: the plan, its execution, and timing.
 */
public record TaskReport(
    String taskId,
    String goal,
    Plan plan,
    PlanExecution execution,
    Duration duration
) {
    public int stepsCompleted() {
        return execution.outcomes().size();
    }
}
