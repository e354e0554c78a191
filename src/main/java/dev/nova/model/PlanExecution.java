package dev.nova.model;

import java.time.Duration;
import java.util.List;

/**
 * Result of running a plan: the ordered outcomes of every attempted step.
 */
public record PlanExecution(
    Plan plan,
    PlanStatus status,
    List<StepOutcome> outcomes,
    List<String> validationErrors,
    Duration duration
) {
    public PlanExecution {
        outcomes = List.copyOf(outcomes);
        validationErrors = List.copyOf(validationErrors);
    }

    public static PlanExecution rejected(Plan plan, List<String> validationErrors) {
        return new PlanExecution(plan, PlanStatus.FAILED_TO_START, List.of(), validationErrors, Duration.ZERO);
    }

    public boolean succeeded() {
        return status == PlanStatus.COMPLETED && outcomes.stream().allMatch(StepOutcome::succeeded);
    }

    public long failedCount() {
        return outcomes.stream().filter(o -> !o.succeeded()).count();
    }
}
