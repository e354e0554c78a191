package dev.nova.engine;

import dev.nova.model.ExecutionSummary;
import dev.nova.model.StepOutcome;
import dev.nova.model.StepStatus;

import java.util.EnumMap;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only log of step outcomes. Safe for concurrent appends from plans running in parallel;
 * entries are never removed or reordered.
 */
public final class ExecutionHistory {

    private final List<StepOutcome> entries = new CopyOnWriteArrayList<>();

    public void append(StepOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("Cannot append a null outcome");
        }
        entries.add(outcome);
    }

    /** Immutable snapshot in append order. */
    public List<StepOutcome> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Aggregate the log. Recomputed from the entries on every call.
     */
    public ExecutionSummary summarize() {
        List<StepOutcome> snapshot = entries();
        if (snapshot.isEmpty()) {
            return ExecutionSummary.NoHistory.INSTANCE;
        }

        var byStatus = new EnumMap<StepStatus, Integer>(StepStatus.class);
        for (StepStatus status : StepStatus.values()) {
            byStatus.put(status, 0);
        }
        for (StepOutcome outcome : snapshot) {
            byStatus.merge(outcome.status(), 1, Integer::sum);
        }

        int total = snapshot.size();
        int successful = byStatus.get(StepStatus.SUCCESS);
        return new ExecutionSummary.Totals(
            total,
            successful,
            total - successful,
            (double) successful / total,
            snapshot.get(total - 1),
            byStatus
        );
    }
}
