package dev.nova.engine;

import dev.nova.model.WorkflowType;

import java.util.List;
import java.util.Locale;

/**
 * Classifies goals by case-insensitive substring match against ordered keyword groups.
 * The first group with a matching keyword wins, so a goal such as "deploy the data model"
 * is ETL because the ETL group is checked before training and deployment.
 */
public final class KeywordGoalClassifier implements GoalClassifier {

    public record KeywordGroup(WorkflowType workflow, List<String> keywords) {
        public KeywordGroup {
            keywords = List.copyOf(keywords);
        }
    }

    public static final List<KeywordGroup> DEFAULT_GROUPS = List.of(
        new KeywordGroup(WorkflowType.ETL, List.of("etl", "data", "pipeline")),
        new KeywordGroup(WorkflowType.TRAINING, List.of("train", "model")),
        new KeywordGroup(WorkflowType.DEPLOYMENT, List.of("deploy", "agent"))
    );

    private final List<KeywordGroup> groups;
    private final WorkflowType fallback;

    public KeywordGoalClassifier() {
        this(DEFAULT_GROUPS, WorkflowType.GENERIC);
    }

    public KeywordGoalClassifier(List<KeywordGroup> groups, WorkflowType fallback) {
        this.groups = List.copyOf(groups);
        this.fallback = fallback;
    }

    @Override
    public WorkflowType classify(String goal) {
        String lower = goal == null ? "" : goal.toLowerCase(Locale.ROOT);
        for (KeywordGroup group : groups) {
            for (String keyword : group.keywords()) {
                if (lower.contains(keyword)) {
                    return group.workflow();
                }
            }
        }
        return fallback;
    }
}
