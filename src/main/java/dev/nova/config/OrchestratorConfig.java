package dev.nova.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Runtime settings for an orchestrator instance.
 */
public record OrchestratorConfig(
    String projectId,
    String region,
    Path artifactDir,
    Path eventLog, // nullable, events are kept in memory when absent
    Duration jobDelay,
    int workerThreads,
    Duration defaultStepTimeout,
    Retry retry
) {
    public static final String DEFAULT_PROJECT_ID = "orchestrator-nova";
    public static final String DEFAULT_REGION = "us-central1";
    public static final Path DEFAULT_ARTIFACT_DIR = Path.of("artifacts");
    public static final Duration DEFAULT_JOB_DELAY = Duration.ofSeconds(1);
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final Duration DEFAULT_STEP_TIMEOUT = Duration.ofSeconds(300);

    public OrchestratorConfig {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1: " + workerThreads);
        }
        if (defaultStepTimeout.isZero() || defaultStepTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultStepTimeout must be positive: " + defaultStepTimeout);
        }
        if (jobDelay.isNegative()) {
            throw new IllegalArgumentException("jobDelay must not be negative: " + jobDelay);
        }
    }

    /** Retries are off unless explicitly enabled. */
    public record Retry(boolean enabled, Duration backoff) {
        public static Retry disabled() {
            return new Retry(false, Duration.ZERO);
        }
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig(DEFAULT_PROJECT_ID, DEFAULT_REGION, DEFAULT_ARTIFACT_DIR, null,
            DEFAULT_JOB_DELAY, DEFAULT_WORKER_THREADS, DEFAULT_STEP_TIMEOUT, Retry.disabled());
    }

    public OrchestratorConfig withArtifactDir(Path dir) {
        return new OrchestratorConfig(projectId, region, dir, eventLog, jobDelay, workerThreads,
            defaultStepTimeout, retry);
    }

    public OrchestratorConfig withJobDelay(Duration delay) {
        return new OrchestratorConfig(projectId, region, artifactDir, eventLog, delay, workerThreads,
            defaultStepTimeout, retry);
    }
}
