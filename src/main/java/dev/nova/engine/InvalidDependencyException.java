package dev.nova.engine;

/**
 * A step depends on itself, on a later step, or on an index outside the plan.
 */
public class InvalidDependencyException extends OrchestrationException {

    private final int stepIndex;
    private final int dependency;

    public InvalidDependencyException(int stepIndex, int dependency) {
        super("Invalid dependency: step %d depends on %d".formatted(stepIndex, dependency));
        this.stepIndex = stepIndex;
        this.dependency = dependency;
    }

    public int stepIndex() {
        return stepIndex;
    }

    public int dependency() {
        return dependency;
    }
}
