package dev.nova.engine;

import dev.nova.model.Plan;
import dev.nova.model.PlanExecution;
import dev.nova.model.PlanStatus;
import dev.nova.model.Step;
import dev.nova.model.StepOutcome;
import dev.nova.tools.RecordEventTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates a plan and executes its steps one after another in array order.
 * The planner only emits backward dependencies, so array order is already a valid
 * execution order and no sorting happens here. A failing step never stops the run.
 */
public final class PlanRunner {

    private static final Logger log = LoggerFactory.getLogger(PlanRunner.class);

    private final ToolRegistry registry;
    private final StepExecutor executor;

    public PlanRunner(ToolRegistry registry, StepExecutor executor) {
        this.registry = registry;
        this.executor = executor;
    }

    public boolean validate(Plan plan) {
        List<String> errors = validationErrors(plan);
        errors.forEach(e -> log.error("Invalid plan: {}", e));
        return errors.isEmpty();
    }

    public List<String> validationErrors(Plan plan) {
        return PlanValidator.validate(plan, registry);
    }

    /**
     * Run every step of a valid plan. An invalid plan is rejected before any step runs.
     */
    public PlanExecution run(Plan plan) {
        List<String> errors = validationErrors(plan);
        if (!errors.isEmpty()) {
            log.error("Plan rejected goal={} errors={}", plan.goal(), errors);
            return PlanExecution.rejected(plan, errors);
        }

        long started = System.nanoTime();
        var outcomes = new ArrayList<StepOutcome>(plan.size());

        for (int i = 0; i < plan.size(); i++) {
            Step step = plan.step(i);
            warnOnUnmetDependencies(i, step, outcomes);

            StepOutcome outcome = executor.execute(step, registry);
            outcomes.add(outcome);

            if (!outcome.succeeded()) {
                if (RecordEventTool.NAME.equals(step.tool())) {
                    log.warn("Event recording step failed, continuing anyway index={} error={}", i, outcome.error());
                } else {
                    log.warn("Step did not succeed, continuing index={} tool={} status={} error={}",
                        i, step.tool(), outcome.status().label(), outcome.error());
                }
            }
        }

        Duration took = Duration.ofNanos(System.nanoTime() - started);
        long failed = outcomes.stream().filter(o -> !o.succeeded()).count();
        log.info("Plan completed goal={} steps={} failed={} duration_ms={}",
            plan.goal(), outcomes.size(), failed, took.toMillis());
        return new PlanExecution(plan, PlanStatus.COMPLETED, outcomes, List.of(), took);
    }

    /**
     * Like {@link #run} but throws instead of returning a rejected execution.
     *
     * @throws UnknownToolException       if a step names an unregistered tool
     * @throws InvalidDependencyException if a dependency is not strictly backward
     */
    public PlanExecution runOrThrow(Plan plan) {
        PlanValidator.requireValid(plan, registry);
        return run(plan);
    }

    private static void warnOnUnmetDependencies(int index, Step step, List<StepOutcome> outcomes) {
        for (int dependency : step.dependsOn()) {
            StepOutcome upstream = outcomes.get(dependency);
            if (!upstream.succeeded()) {
                log.warn("Step {} ({}) runs although dependency {} ended with status={}",
                    index, step.tool(), dependency, upstream.status().label());
            }
        }
    }
}
