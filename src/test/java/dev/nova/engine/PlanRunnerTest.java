package dev.nova.engine;

import dev.nova.config.Mappers;
import dev.nova.engine.TestTools.FakeTool;
import dev.nova.model.ExecutionSummary;
import dev.nova.model.Plan;
import dev.nova.model.PlanExecution;
import dev.nova.model.PlanStatus;
import dev.nova.model.Step;
import dev.nova.model.StepOutcome;
import dev.nova.model.StepStatus;
import dev.nova.sink.InMemoryArtifactSink;
import dev.nova.sink.InMemoryEventSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanRunnerTest {

    private final ExecutorService workers = Executors.newCachedThreadPool();
    private final ExecutionHistory history = new ExecutionHistory();
    private final InMemoryEventSink events = new InMemoryEventSink(TestTools.CLOCK);
    private final InMemoryArtifactSink artifacts = new InMemoryArtifactSink(TestTools.CLOCK);
    private final Planner planner = new Planner(new KeywordGoalClassifier(), new EventRecorder(events, Runnable::run),
        TestTools.CLOCK, Mappers.standard(), Duration.ofSeconds(300));

    @AfterEach
    void shutdown() {
        workers.shutdownNow();
    }

    private PlanRunner runner(ToolRegistry registry) {
        return new PlanRunner(registry, new TimeoutStepExecutor(workers, history, TestTools.CLOCK));
    }

    private static Plan plan(Step... steps) {
        return new Plan("goal", List.of(steps), Map.of(), Instant.EPOCH);
    }

    @Test
    void etlGoalRunsEndToEnd() {
        PlanRunner runner = runner(TestTools.builtInRegistry(events, artifacts));
        Plan plan = planner.plan("Run ETL pipeline for sales data");

        PlanExecution execution = runner.run(plan);

        assertThat(execution.status()).isEqualTo(PlanStatus.COMPLETED);
        assertThat(execution.succeeded()).isTrue();
        assertThat(execution.outcomes()).extracting(StepOutcome::tool).containsExactly(
            "runs_record_event", "etl_run_job", "artifacts_write_text", "runs_record_event");
        assertThat(execution.outcomes()).allMatch(StepOutcome::succeeded);

        ExecutionSummary.Totals totals = (ExecutionSummary.Totals) history.summarize();
        assertThat(totals.total()).isEqualTo(4);
        assertThat(totals.successful()).isEqualTo(4);
        assertThat(totals.failed()).isZero();
        assertThat(totals.successRate()).isEqualTo(1.0);

        assertThat(artifacts.read("etl/results/1768471200000-1.json")).isPresent();
        assertThat(events.eventTypes()).containsExactly(Planner.PLANNING_EVENT, "PLAN", "DONE");
    }

    @Test
    void validateRejectsUnknownTool() {
        PlanRunner runner = runner(ToolRegistry.of(FakeTool.succeeding("a")));

        assertThat(runner.validate(plan(Step.of("a", Map.of()), Step.of("b", Map.of(), 0)))).isFalse();
        assertThat(runner.validate(plan(Step.of("a", Map.of()), Step.of("a", Map.of(), 0)))).isTrue();
    }

    @Test
    void validateRejectsForwardAndSelfDependencies() {
        PlanRunner runner = runner(ToolRegistry.of(FakeTool.succeeding("a")));

        assertThat(runner.validate(plan(Step.of("a", Map.of()), Step.of("a", Map.of()), Step.of("a", Map.of(), 5))))
            .isFalse();
        assertThat(runner.validate(plan(Step.of("a", Map.of()), Step.of("a", Map.of()), Step.of("a", Map.of(), 2))))
            .isFalse();
    }

    @Test
    void plannedPlansValidateAgainstBuiltInTools() {
        PlanRunner runner = runner(TestTools.builtInRegistry(events, artifacts));

        for (String goal : List.of("etl", "train", "deploy", "")) {
            assertThat(runner.validate(planner.plan(goal))).as(goal).isTrue();
        }
    }

    @Test
    void invalidPlanFailsToStartWithoutSideEffects() {
        FakeTool a = FakeTool.succeeding("a");
        PlanRunner runner = runner(ToolRegistry.of(a));

        PlanExecution execution = runner.run(plan(Step.of("a", Map.of()), Step.of("missing", Map.of(), 0)));

        assertThat(execution.status()).isEqualTo(PlanStatus.FAILED_TO_START);
        assertThat(execution.outcomes()).isEmpty();
        assertThat(execution.validationErrors()).containsExactly("Step 1: unknown tool 'missing'");
        assertThat(a.calls()).isZero();
        assertThat(history.isEmpty()).isTrue();
    }

    @Test
    void failingStepDoesNotStopTheRun() {
        FakeTool after = FakeTool.succeeding("after");
        PlanRunner runner = runner(ToolRegistry.of(
            FakeTool.succeeding("before"), FakeTool.throwing("broken", new IllegalStateException("disk full")), after));

        PlanExecution execution = runner.run(plan(
            Step.of("before", Map.of()), Step.of("broken", Map.of(), 0), Step.of("after", Map.of(), 1)));

        assertThat(execution.status()).isEqualTo(PlanStatus.COMPLETED);
        assertThat(execution.succeeded()).isFalse();
        assertThat(execution.outcomes()).extracting(StepOutcome::status)
            .containsExactly(StepStatus.SUCCESS, StepStatus.FAILED, StepStatus.SUCCESS);
        assertThat(execution.outcomes().get(1).error()).isEqualTo("disk full");
        assertThat(after.calls()).isEqualTo(1);
        assertThat(execution.failedCount()).isEqualTo(1);
    }

    @Test
    void eventRecordingFailureIsNotFatal() {
        PlanRunner runner = runner(ToolRegistry.of(
            FakeTool.failing("runs_record_event", "database down"), FakeTool.succeeding("etl_run_job")));

        PlanExecution execution = runner.run(plan(
            Step.of("runs_record_event", Map.of()),
            Step.of("etl_run_job", Map.of(), 0),
            Step.of("runs_record_event", Map.of(), 1)));

        assertThat(execution.status()).isEqualTo(PlanStatus.COMPLETED);
        assertThat(execution.outcomes()).extracting(StepOutcome::status)
            .containsExactly(StepStatus.FAILED, StepStatus.SUCCESS, StepStatus.FAILED);
    }

    @Test
    void timeoutDoesNotEscapeRun() {
        PlanRunner runner = runner(ToolRegistry.of(
            FakeTool.sleeping("slow", Duration.ofSeconds(5)), FakeTool.succeeding("next")));
        Step slow = Step.of("slow", Map.of()).withTimeout(Duration.ofMillis(100));

        PlanExecution execution = runner.run(plan(slow, Step.of("next", Map.of(), 0)));

        assertThat(execution.outcomes()).extracting(StepOutcome::status)
            .containsExactly(StepStatus.TIMEOUT, StepStatus.SUCCESS);
        assertThat(execution.outcomes().get(0).error()).isEqualTo("timed out after 0.1s");
    }

    @Test
    void runsStepsInArrayOrder() {
        var order = new java.util.concurrent.CopyOnWriteArrayList<String>();
        FakeTool first = new FakeTool("first", args -> {
            order.add("first");
            return dev.nova.tools.ToolResult.success(Map.of());
        });
        FakeTool second = new FakeTool("second", args -> {
            order.add("second");
            return dev.nova.tools.ToolResult.success(Map.of());
        });
        PlanRunner runner = runner(ToolRegistry.of(second, first));

        runner.run(plan(Step.of("first", Map.of()), Step.of("second", Map.of()), Step.of("first", Map.of(), 1)));

        assertThat(order).containsExactly("first", "second", "first");
    }

    @Test
    void runOrThrowSurfacesValidationErrors() {
        PlanRunner runner = runner(ToolRegistry.of(FakeTool.succeeding("a")));

        assertThatThrownBy(() -> runner.runOrThrow(plan(Step.of("a", Map.of(), 0))))
            .isInstanceOf(InvalidDependencyException.class);
        assertThat(history.isEmpty()).isTrue();
    }
}
