package dev.nova.engine;

import dev.nova.model.WorkflowType;

/**
 * Decides which workflow template a goal maps to.
 */
@FunctionalInterface
public interface GoalClassifier {

    WorkflowType classify(String goal);
}
