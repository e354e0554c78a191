package dev.nova.engine;

import dev.nova.model.Step;
import dev.nova.model.StepOutcome;
import dev.nova.model.StepStatus;
import dev.nova.tools.Tool;
import dev.nova.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the step's tool on a worker thread and waits at most {@link Step#timeout()}.
 * On timeout the worker is interrupted, but a tool that ignores interruption may keep running.
 * Every outcome is appended to the history. No retries; see {@link RetryingStepExecutor}.
 */
public final class TimeoutStepExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(TimeoutStepExecutor.class);

    private final ExecutorService workers;
    private final ExecutionHistory history;
    private final Clock clock;

    public TimeoutStepExecutor(ExecutorService workers, ExecutionHistory history, Clock clock) {
        this.workers = workers;
        this.history = history;
        this.clock = clock;
    }

    @Override
    public StepOutcome execute(Step step, ToolRegistry registry) {
        log.info("Executing step tool={} args={}", step.tool(), step.args());
        long started = System.nanoTime();
        StepOutcome outcome = attempt(step, registry, started);
        history.append(outcome);
        return outcome;
    }

    private StepOutcome attempt(Step step, ToolRegistry registry, long started) {
        Tool tool;
        try {
            tool = registry.resolve(step.tool());
        } catch (UnknownToolException e) {
            log.error("Step failed tool={} error={}", step.tool(), e.getMessage());
            return failure(step, StepStatus.ERROR, e.getMessage(), started);
        }

        Future<ToolResult> future;
        try {
            future = workers.submit(() -> tool.execute(step.args()));
        } catch (RejectedExecutionException e) {
            log.error("Step could not be scheduled tool={}", step.tool());
            return failure(step, StepStatus.ERROR, "Worker pool rejected step: " + e.getMessage(), started);
        }

        try {
            ToolResult result = future.get(waitNanos(step.timeout()), TimeUnit.NANOSECONDS);
            if (result instanceof ToolResult.Success success) {
                return StepOutcome.success(step, success.value(), clock.instant(), elapsedSince(started));
            }
            String error = result instanceof ToolResult.Failure failure
                ? failure.error()
                : "Tool returned no result";
            log.error("Step failed tool={} error={}", step.tool(), error);
            return failure(step, StepStatus.FAILED, error, started);
        } catch (TimeoutException e) {
            future.cancel(true);
            String error = "timed out after " + seconds(step.timeout()) + "s";
            log.error("Step timed out tool={} timeout={}s", step.tool(), seconds(step.timeout()));
            return failure(step, StepStatus.TIMEOUT, error, started);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String error = cause.getMessage() != null ? cause.getMessage() : cause.toString();
            log.error("Step failed tool={} error={}", step.tool(), error, cause);
            return failure(step, StepStatus.FAILED, error, started);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return failure(step, StepStatus.ERROR, "Interrupted while waiting for " + step.tool(), started);
        }
    }

    private StepOutcome failure(Step step, StepStatus status, String error, long started) {
        return StepOutcome.failure(step, status, error, clock.instant(), elapsedSince(started));
    }

    private static Duration elapsedSince(long started) {
        return Duration.ofNanos(System.nanoTime() - started);
    }

    /** Durations beyond the nanosecond range of a long wait as long as possible. */
    static long waitNanos(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /** 300s -> "300", 1500ms -> "1.5". */
    static String seconds(Duration duration) {
        return BigDecimal.valueOf(duration.getSeconds())
            .add(BigDecimal.valueOf(duration.getNano(), 9))
            .stripTrailingZeros()
            .toPlainString();
    }
}
