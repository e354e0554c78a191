package dev.nova.model;

/**
 * Classification of a goal, which selects the step template the planner emits.
 */
public enum WorkflowType {
    ETL,
    TRAINING,
    DEPLOYMENT,
    GENERIC
}
