package dev.nova.sink;

import java.util.Map;

/**
 * Delegates a long-running job, such as an ETL pipeline run.
 */
public interface JobRunner {

    /**
     * Run a job to completion.
     *
     * @throws SinkUnavailableException if the job could not be run or was interrupted
     */
    JobReceipt run(Map<String, Object> payload);

    /** Display name used by connectivity checks. */
    String getName();
}
