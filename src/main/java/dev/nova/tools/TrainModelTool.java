package dev.nova.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code train_model(model_name, config)}: submits a training job. Submission is simulated;
 * the result describes the job that would have been queued.
 */
public final class TrainModelTool implements Tool {

    public static final String NAME = "train_model";
    static final int ESTIMATED_DURATION_MINUTES = 30;

    private static final Logger log = LoggerFactory.getLogger(TrainModelTool.class);

    private final Clock clock;

    public TrainModelTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ToolResult execute(Map<String, Object> args) {
        String modelName;
        Map<String, Object> config;
        try {
            modelName = ToolArgs.requireString(args, "model_name");
            config = ToolArgs.optionalMap(args, "config");
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage(), e);
        }

        Instant now = clock.instant();
        String jobId = "train_" + modelName + "_" + now.getEpochSecond();
        log.info("Starting training job job_id={} model_name={}", jobId, modelName);

        var result = new LinkedHashMap<String, Object>();
        result.put("status", "submitted");
        result.put("job_id", jobId);
        result.put("model_name", modelName);
        result.put("config", config);
        result.put("estimated_duration_minutes", ESTIMATED_DURATION_MINUTES);
        result.put("timestamp", now.toString());
        return ToolResult.success(result);
    }
}
