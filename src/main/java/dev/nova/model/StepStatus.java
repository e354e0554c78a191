package dev.nova.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal status of one step attempt.
 */
public enum StepStatus {
    SUCCESS("success"),
    /** The capability ran and reported or raised an error. */
    FAILED("failed"),
    /** The capability did not finish within the step timeout. */
    TIMEOUT("timeout"),
    /** The step could not be started, e.g. its tool is not registered. */
    ERROR("error");

    private final String label;

    StepStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
