package dev.nova.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.nova.model.Plan;
import dev.nova.model.Step;
import dev.nova.model.StepOutcome;

import java.util.List;

/**
 * Plain-text tables for plans and step outcomes.
 */
final class PlanTable {

    static final int MAX_ARGS_WIDTH = 50;

    private PlanTable() {}

    static String render(Plan plan, ObjectMapper mapper) {
        var sb = new StringBuilder();
        sb.append("Execution Plan (").append(plan.metadata().get(Plan.WORKFLOW)).append(")\n");
        sb.append(String.format("%-6s %-22s %-12s %s%n", "Step", "Tool", "Depends on", "Arguments"));
        List<Step> steps = plan.steps();
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            sb.append(String.format("%-6d %-22s %-12s %s%n",
                i + 1, step.tool(), step.dependsOn(), truncate(toJson(step, mapper))));
        }
        return sb.toString();
    }

    static String renderOutcomes(List<StepOutcome> outcomes) {
        var sb = new StringBuilder();
        for (StepOutcome outcome : outcomes) {
            sb.append("  ")
              .append(outcome.succeeded() ? "ok  " : "FAIL")
              .append(' ')
              .append(outcome.tool())
              .append(": ")
              .append(outcome.status().label());
            if (outcome.error() != null) {
                sb.append(" (").append(outcome.error()).append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static String truncate(String text) {
        if (text.length() <= MAX_ARGS_WIDTH) {
            return text;
        }
        return text.substring(0, MAX_ARGS_WIDTH - 3) + "...";
    }

    private static String toJson(Step step, ObjectMapper mapper) {
        try {
            return mapper.writeValueAsString(step.args());
        } catch (JsonProcessingException e) {
            return String.valueOf(step.args());
        }
    }
}
