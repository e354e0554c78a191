package dev.nova.engine;

import dev.nova.model.Step;
import dev.nova.model.StepOutcome;

/**
 * Runs a single step. Step-level failures are returned as outcomes, never thrown.
 */
public interface StepExecutor {

    StepOutcome execute(Step step, ToolRegistry registry);
}
