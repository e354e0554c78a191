package dev.nova.engine;

import dev.nova.model.Plan;
import dev.nova.model.Step;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a plan can be executed: every tool is registered and every dependency
 * points to a strictly earlier step.
 */
public final class PlanValidator {

    private PlanValidator() {}

    /**
     * Validate a plan against a registry. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(Plan plan, ToolRegistry registry) {
        var errors = new ArrayList<String>();

        for (int i = 0; i < plan.size(); i++) {
            Step step = plan.step(i);

            if (!registry.contains(step.tool())) {
                errors.add("Step %d: unknown tool '%s'".formatted(i, step.tool()));
            }

            for (int dependency : step.dependsOn()) {
                if (dependency < 0 || dependency >= i) {
                    errors.add("Step %d: invalid dependency %d (must reference an earlier step)"
                        .formatted(i, dependency));
                }
            }
        }

        return errors;
    }

    /**
     * Like {@link #validate} but fails on the first problem.
     *
     * @throws UnknownToolException       if a step names an unregistered tool
     * @throws InvalidDependencyException if a dependency is not strictly backward
     */
    public static void requireValid(Plan plan, ToolRegistry registry) {
        for (int i = 0; i < plan.size(); i++) {
            Step step = plan.step(i);
            if (!registry.contains(step.tool())) {
                throw new UnknownToolException(step.tool());
            }
            for (int dependency : step.dependsOn()) {
                if (dependency < 0 || dependency >= i) {
                    throw new InvalidDependencyException(i, dependency);
                }
            }
        }
    }
}
