package dev.nova.engine;

/**
 * A step names a tool that is not in the registry.
 */
public class UnknownToolException extends OrchestrationException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
