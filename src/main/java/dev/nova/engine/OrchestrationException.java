package dev.nova.engine;

/**
 * Base class for orchestration failures that callers may want to tell apart.
 */
public class OrchestrationException extends RuntimeException {

    public OrchestrationException(String message) {
        super(message);
    }

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
