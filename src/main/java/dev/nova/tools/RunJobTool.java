package dev.nova.tools;

import dev.nova.sink.JobReceipt;
import dev.nova.sink.JobRunner;
import dev.nova.sink.SinkUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code etl_run_job(payload)}: hands an ETL payload to the job runner and waits for it.
 */
public final class RunJobTool implements Tool {

    public static final String NAME = "etl_run_job";

    private static final Logger log = LoggerFactory.getLogger(RunJobTool.class);

    private final JobRunner runner;

    public RunJobTool(JobRunner runner) {
        this.runner = runner;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ToolResult execute(Map<String, Object> args) {
        Map<String, Object> payload;
        try {
            payload = ToolArgs.requireMap(args, "payload");
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage(), e);
        }

        try {
            JobReceipt receipt = runner.run(payload);

            var result = new LinkedHashMap<String, Object>();
            result.put("status", receipt.status());
            result.put("job_id", receipt.jobId());
            result.put("echo", receipt.echo());
            result.put("duration_ms", receipt.duration().toMillis());
            result.put("start_time", receipt.startTime().toString());
            result.put("end_time", receipt.endTime().toString());
            return ToolResult.success(result);
        } catch (SinkUnavailableException e) {
            log.error("ETL job failed payload={}: {}", payload, e.getMessage());
            return ToolResult.failure(e.getMessage(), e);
        }
    }
}
