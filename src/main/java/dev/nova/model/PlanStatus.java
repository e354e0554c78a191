package dev.nova.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall status of a plan run.
 */
public enum PlanStatus {
    /** Every step was attempted, whatever the individual outcomes. */
    COMPLETED("completed"),
    /** Validation rejected the plan; no step was executed. */
    FAILED_TO_START("failed-to-start");

    private final String label;

    PlanStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
