package dev.nova.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Recorded result of attempting one step. Exactly one of {@code result} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepOutcome(
    String tool,
    Map<String, Object> args,
    Map<String, Object> result, // null unless status is SUCCESS
    String error,               // null when status is SUCCESS
    StepStatus status,
    Instant timestamp,
    Duration duration
) {
    public StepOutcome {
        args = args == null ? Map.of() : Values.immutableMap(args);
        result = result == null ? null : Values.immutableMap(result);
    }

    public static StepOutcome success(Step step, Map<String, Object> result, Instant at, Duration took) {
        return new StepOutcome(step.tool(), step.args(), result == null ? Map.of() : result, null,
            StepStatus.SUCCESS, at, took);
    }

    public static StepOutcome failure(Step step, StepStatus status, String error, Instant at, Duration took) {
        if (status == StepStatus.SUCCESS) {
            throw new IllegalArgumentException("Failure outcome cannot have status SUCCESS");
        }
        return new StepOutcome(step.tool(), step.args(), null, error, status, at, took);
    }

    public boolean succeeded() {
        return status.isSuccess();
    }
}
