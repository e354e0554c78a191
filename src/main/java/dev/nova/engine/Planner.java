package dev.nova.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.nova.model.Plan;
import dev.nova.model.Step;
import dev.nova.model.WorkflowType;
import dev.nova.tools.DeployAgentTool;
import dev.nova.tools.RecordEventTool;
import dev.nova.tools.RunJobTool;
import dev.nova.tools.TrainModelTool;
import dev.nova.tools.WriteArtifactTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns a goal into a plan. The goal is classified and a fixed template of domain steps
 * is wrapped between a PLAN event step and a DONE event step:
 * <pre>
 * 0: runs_record_event(PLAN)
 * 1..n: workflow steps, each depending on the previous one
 * n+1: runs_record_event(DONE), depending on step n
 * </pre>
 */
public final class Planner {

    public static final String PLANNER_VERSION = "1.0.0";
    public static final String PLANNING_EVENT = "PLAN_REQUESTED";
    static final int ESTIMATED_SECONDS_PER_STEP = 5;

    private static final Logger log = LoggerFactory.getLogger(Planner.class);

    private final GoalClassifier classifier;
    private final EventRecorder events;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Duration stepTimeout;
    private final AtomicLong sequence = new AtomicLong();

    public Planner(GoalClassifier classifier, EventRecorder events, Clock clock, ObjectMapper mapper,
                   Duration stepTimeout) {
        this.classifier = classifier;
        this.events = events;
        this.clock = clock;
        this.mapper = mapper;
        this.stepTimeout = stepTimeout;
    }

    public Plan plan(String goal) {
        String safeGoal = goal == null ? "" : goal;
        Instant createdAt = clock.instant();
        log.info("Creating plan goal={}", safeGoal);
        events.record(PLANNING_EVENT, Map.of("goal", safeGoal, "timestamp", createdAt.toString()));

        WorkflowType workflow = classifier.classify(safeGoal);
        // plans created in the same millisecond still get distinct artifact paths
        String stamp = createdAt.toEpochMilli() + "-" + sequence.incrementAndGet();

        var steps = new ArrayList<Step>();
        steps.add(step(RecordEventTool.NAME, eventArgs("PLAN", safeGoal)));
        steps.addAll(domainSteps(workflow, safeGoal, stamp));
        int last = steps.size() - 1;
        steps.add(step(RecordEventTool.NAME, eventArgs("DONE", safeGoal), last > 0 ? List.of(last) : List.of()));

        var metadata = new LinkedHashMap<String, Object>();
        metadata.put(Plan.PLANNER_VERSION, PLANNER_VERSION);
        metadata.put(Plan.WORKFLOW, workflow.name());
        metadata.put(Plan.ESTIMATED_DURATION_SECONDS, steps.size() * ESTIMATED_SECONDS_PER_STEP);

        Plan plan = new Plan(safeGoal, steps, metadata, createdAt);
        log.debug("Plan created workflow={} steps={}", workflow, plan.size());
        return plan;
    }

    private List<Step> domainSteps(WorkflowType workflow, String goal, String stamp) {
        // Domain steps start at index 1, after the PLAN event.
        return switch (workflow) {
            case ETL -> List.of(
                step(RunJobTool.NAME, orderedMap("payload", orderedMap("goal", goal, "pipeline", "default")), List.of(0)),
                step(WriteArtifactTool.NAME, artifactArgs("etl/results/" + stamp + ".json",
                    toJson(orderedMap("goal", goal, "status", "completed"))), List.of(1)));
            case TRAINING -> List.of(
                step(TrainModelTool.NAME, orderedMap(
                    "model_name", "orchestrator-model",
                    "config", orderedMap("epochs", 10, "batch_size", 32)), List.of(0)),
                step(WriteArtifactTool.NAME, artifactArgs("training/logs/" + stamp + ".txt",
                    "Training initiated for goal: " + goal), List.of(1)));
            case DEPLOYMENT -> List.of(
                step(DeployAgentTool.NAME, orderedMap(
                    "agent_name", "orchestrator-nova",
                    "version", "v1.0.0",
                    "config", orderedMap("replicas", 1, "memory", "2Gi")), List.of(0)));
            case GENERIC -> List.of(
                step(RunJobTool.NAME, orderedMap("payload", orderedMap("goal", goal, "type", "generic")), List.of(0)),
                step(WriteArtifactTool.NAME, artifactArgs("runs/" + stamp + ".txt",
                    "Goal: " + goal + "\nStatus: Processing"), List.of(1)));
        };
    }

    private Step step(String tool, Map<String, Object> args) {
        return step(tool, args, List.of());
    }

    private Step step(String tool, Map<String, Object> args, List<Integer> dependsOn) {
        return new Step(tool, args, dependsOn, stepTimeout, Step.DEFAULT_RETRY_COUNT);
    }

    private static Map<String, Object> eventArgs(String eventType, String goal) {
        return orderedMap("event_type", eventType, "details", Map.of("goal", goal));
    }

    private static Map<String, Object> artifactArgs(String path, String content) {
        return orderedMap("path", path, "content", content);
    }

    private static Map<String, Object> orderedMap(Object... keysAndValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    private String toJson(Map<String, Object> value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize artifact content", e);
        }
    }
}
