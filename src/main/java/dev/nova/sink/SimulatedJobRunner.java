package dev.nova.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stands in for a real job backend: waits for a fixed delay, then reports success
 * and echoes the payload back.
 */
public final class SimulatedJobRunner implements JobRunner {

    private static final Logger log = LoggerFactory.getLogger(SimulatedJobRunner.class);

    private final Duration delay;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public SimulatedJobRunner(Duration delay, Clock clock) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Job delay must not be negative: " + delay);
        }
        this.delay = delay;
        this.clock = clock;
    }

    @Override
    public JobReceipt run(Map<String, Object> payload) {
        Instant start = clock.instant();
        String jobId = "etl_" + start.toEpochMilli() + "_" + sequence.incrementAndGet();
        log.info("Starting ETL job job_id={} payload={}", jobId, payload);

        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkUnavailableException("Job " + jobId + " was interrupted", e);
        }

        Instant end = clock.instant();
        Duration took = Duration.between(start, end);
        log.info("ETL job completed job_id={} duration_ms={}", jobId, took.toMillis());
        return new JobReceipt("success", jobId, took, payload == null ? Map.of() : payload, start, end);
    }

    @Override
    public String getName() {
        return "simulated job runner";
    }
}
