package dev.nova.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.nova.config.Mappers;
import dev.nova.config.OrchestratorConfig;
import dev.nova.model.ExecutionSummary;
import dev.nova.model.Plan;
import dev.nova.model.PlanExecution;
import dev.nova.model.Step;
import dev.nova.model.StepOutcome;
import dev.nova.model.TaskReport;
import dev.nova.sink.ArtifactSink;
import dev.nova.sink.EventSink;
import dev.nova.sink.FileSystemArtifactSink;
import dev.nova.sink.InMemoryEventSink;
import dev.nova.sink.JobRunner;
import dev.nova.sink.JsonLinesEventSink;
import dev.nova.sink.SimulatedJobRunner;
import dev.nova.tools.DeployAgentTool;
import dev.nova.tools.RecordEventTool;
import dev.nova.tools.RunJobTool;
import dev.nova.tools.Tool;
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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point tying planner, runner and history together. One instance owns one history,
 * shared by every plan it runs; use separate instances for isolated histories.
 */
public final class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final ToolRegistry registry;
    private final ExecutionHistory history;
    private final Planner planner;
    private final StepExecutor stepExecutor;
    private final PlanRunner runner;
    private final EventRecorder events;
    private final EventSink eventSink;
    private final ArtifactSink artifactSink;
    private final JobRunner jobRunner;
    private final Clock clock;
    private final ExecutorService stepWorkers;
    private final ExecutorService eventWorker;
    private final ExecutorService taskWorkers;
    private final AtomicLong taskSequence = new AtomicLong();

    private Orchestrator(Builder builder) {
        OrchestratorConfig config = builder.config;
        this.clock = builder.clock;
        ObjectMapper mapper = builder.mapper != null ? builder.mapper : Mappers.standard();

        this.eventSink = builder.eventSink != null ? builder.eventSink
            : config.eventLog() != null ? new JsonLinesEventSink(config.eventLog(), clock, mapper)
            : new InMemoryEventSink(clock);
        this.artifactSink = builder.artifactSink != null ? builder.artifactSink
            : new FileSystemArtifactSink(config.artifactDir(), clock);
        this.jobRunner = builder.jobRunner != null ? builder.jobRunner
            : new SimulatedJobRunner(config.jobDelay(), clock);

        var tools = new ArrayList<Tool>();
        tools.add(new RecordEventTool(eventSink));
        tools.add(new WriteArtifactTool(artifactSink));
        tools.add(new RunJobTool(jobRunner));
        tools.add(new TrainModelTool(clock));
        tools.add(new DeployAgentTool(clock, config.projectId(), config.region()));
        tools.addAll(builder.extraTools);
        this.registry = new ToolRegistry(tools);

        this.stepWorkers = Executors.newCachedThreadPool(daemonThreads("nova-step"));
        this.eventWorker = Executors.newSingleThreadExecutor(daemonThreads("nova-events"));
        this.taskWorkers = Executors.newFixedThreadPool(config.workerThreads(), daemonThreads("nova-task"));

        this.history = new ExecutionHistory();
        this.events = new EventRecorder(eventSink, eventWorker);
        this.planner = new Planner(builder.classifier, events, clock, mapper, config.defaultStepTimeout());

        StepExecutor executor = new TimeoutStepExecutor(stepWorkers, history, clock);
        if (config.retry().enabled()) {
            executor = new RetryingStepExecutor(executor, config.retry().backoff());
        }
        this.stepExecutor = executor;
        this.runner = new PlanRunner(registry, stepExecutor);
    }

    public static Builder builder(OrchestratorConfig config) {
        return new Builder(config);
    }

    public Plan plan(String goal) {
        return planner.plan(goal);
    }

    public boolean validate(Plan plan) {
        return runner.validate(plan);
    }

    public PlanExecution execute(Plan plan) {
        return runner.run(plan);
    }

    /** Run a single step outside of any plan. The outcome is still recorded in the history. */
    public StepOutcome executeStep(Step step) {
        return stepExecutor.execute(step, registry);
    }

    /**
     * Plan and execute a goal synchronously, recording task lifecycle events around the run.
     */
    public TaskReport executeGoal(String goal) {
        return executeGoal(nextTaskId(), goal);
    }

    /**
     * Plan and execute a goal on a background thread.
     */
    public CompletableFuture<TaskReport> submit(String goal) {
        String taskId = nextTaskId();
        log.info("Accepted task for async execution task_id={} goal={}", taskId, goal);
        return CompletableFuture.supplyAsync(() -> executeGoal(taskId, goal), taskWorkers);
    }

    public ExecutionSummary summarize() {
        return history.summarize();
    }

    public ExecutionHistory history() {
        return history;
    }

    public ToolRegistry registry() {
        return registry;
    }

    /** A check against the same collaborators the tools of this instance use. */
    public ConnectivityCheck connectivityCheck() {
        return new ConnectivityCheck(eventSink, artifactSink, jobRunner);
    }

    private TaskReport executeGoal(String taskId, String goal) {
        Instant start = clock.instant();
        long started = System.nanoTime();
        events.record("TASK_START", details("task_id", taskId, "goal", goal, "timestamp", start.toString()));

        try {
            Plan plan = planner.plan(goal);
            PlanExecution execution = runner.run(plan);
            Duration took = Duration.ofNanos(System.nanoTime() - started);

            events.record("TASK_COMPLETE", details(
                "task_id", taskId,
                "goal", goal,
                "status", execution.status().label(),
                "duration_seconds", took.toMillis() / 1000.0,
                "steps_completed", execution.outcomes().size(),
                "timestamp", clock.instant().toString()));
            return new TaskReport(taskId, goal, plan, execution, took);
        } catch (RuntimeException e) {
            log.error("Task execution failed task_id={} goal={}", taskId, goal, e);
            events.record("TASK_ERROR", details(
                "task_id", taskId,
                "goal", goal,
                "error", String.valueOf(e.getMessage()),
                "timestamp", clock.instant().toString()));
            throw e;
        }
    }

    private String nextTaskId() {
        return "task_" + clock.millis() + "_" + taskSequence.incrementAndGet();
    }

    private static Map<String, Object> details(Object... keysAndValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Stops accepting work. Submitted tasks get {@value #SHUTDOWN_GRACE_SECONDS}s to finish with their
     * step workers and event recorder still running. Step workers left over after that (abandoned by
     * timed-out steps, or by tasks that missed the grace period) are interrupted.
     */
    @Override
    public void close() {
        taskWorkers.shutdown();
        try {
            if (!taskWorkers.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Tasks still running after {}s; interrupting them", SHUTDOWN_GRACE_SECONDS);
                taskWorkers.shutdownNow();
            }
            stepWorkers.shutdownNow();
            eventWorker.shutdown();
            if (!eventWorker.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Event recorder did not drain within {}s; pending events may be lost",
                    SHUTDOWN_GRACE_SECONDS);
                eventWorker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            taskWorkers.shutdownNow();
            stepWorkers.shutdownNow();
            eventWorker.shutdownNow();
        }
    }

    public static final class Builder {
        private final OrchestratorConfig config;
        private Clock clock = Clock.systemUTC();
        private ObjectMapper mapper;
        private GoalClassifier classifier = new KeywordGoalClassifier();
        private EventSink eventSink;
        private ArtifactSink artifactSink;
        private JobRunner jobRunner;
        private final List<Tool> extraTools = new ArrayList<>();

        private Builder(OrchestratorConfig config) {
            this.config = config;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder classifier(GoalClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder eventSink(EventSink eventSink) {
            this.eventSink = eventSink;
            return this;
        }

        public Builder artifactSink(ArtifactSink artifactSink) {
            this.artifactSink = artifactSink;
            return this;
        }

        public Builder jobRunner(JobRunner jobRunner) {
            this.jobRunner = jobRunner;
            return this;
        }

        /** Register an additional tool next to the built-in ones. */
        public Builder tool(Tool tool) {
            this.extraTools.add(tool);
            return this;
        }

        public Orchestrator build() {
            return new Orchestrator(this);
        }
    }
}
