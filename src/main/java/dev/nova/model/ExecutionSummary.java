package dev.nova.model;

import java.util.Map;

/**
 * Aggregate view over the execution history.
 * Either a no-history marker or totals; never a division by zero.
 */
public sealed interface ExecutionSummary {

    /** The history is empty. */
    record NoHistory(String message) implements ExecutionSummary {
        public static final NoHistory INSTANCE = new NoHistory("No execution history");
    }

    /** Counts over a non-empty history. {@code failed} counts every non-success outcome. */
    record Totals(
        int total,
        int successful,
        int failed,
        double successRate,
        StepOutcome lastEntry,
        Map<StepStatus, Integer> byStatus
    ) implements ExecutionSummary {
        public Totals {
            byStatus = Map.copyOf(byStatus);
        }
    }
}
