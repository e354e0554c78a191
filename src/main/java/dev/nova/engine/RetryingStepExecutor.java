package dev.nova.engine;

import dev.nova.model.Step;
import dev.nova.model.StepOutcome;
import dev.nova.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Opt-in decorator that re-invokes the delegate while a step fails, up to
 * {@link Step#retryCount()} extra attempts with a fixed pause between them.
 * Each attempt is recorded by the delegate. {@link StepStatus#ERROR} outcomes are not retried
 * since the step could not be started at all.
 */
public final class RetryingStepExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryingStepExecutor.class);

    private final StepExecutor delegate;
    private final Duration backoff;

    public RetryingStepExecutor(StepExecutor delegate, Duration backoff) {
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("Retry backoff must not be negative: " + backoff);
        }
        this.delegate = delegate;
        this.backoff = backoff;
    }

    @Override
    public StepOutcome execute(Step step, ToolRegistry registry) {
        StepOutcome outcome = delegate.execute(step, registry);
        int retries = 0;
        while (!outcome.succeeded() && outcome.status() != StepStatus.ERROR && retries < step.retryCount()) {
            retries++;
            log.warn("Retrying step tool={} attempt={}/{} after status={}",
                step.tool(), retries, step.retryCount(), outcome.status().label());
            if (!pause()) {
                break;
            }
            outcome = delegate.execute(step, registry);
        }
        return outcome;
    }

    private boolean pause() {
        if (backoff.isZero()) {
            return true;
        }
        try {
            Thread.sleep(backoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Retry pause interrupted, giving up");
            return false;
        }
    }
}
