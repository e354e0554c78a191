package dev.nova.tools;

import java.util.Map;

/**
 * A named capability that a plan step can invoke.
 * Implementations report failures through {@link ToolResult.Failure} rather than by throwing.
 */
public interface Tool {

    /** Registry name, e.g. {@code etl_run_job}. */
    String name();

    /**
     * Run the capability.
     *
     * @param args named arguments from the step
     * @return the result map, or a failure with an error message
     */
    ToolResult execute(Map<String, Object> args);
}
