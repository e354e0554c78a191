package dev.nova.sink;

import dev.nova.engine.OrchestrationException;

/**
 * An external collaborator (event store, artifact store, job runner) could not complete a call.
 */
public class SinkUnavailableException extends OrchestrationException {

    public SinkUnavailableException(String message) {
        super(message);
    }

    public SinkUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
