package dev.nova.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code deploy_agent(agent_name, version, config)}: deploys an agent. Deployment is simulated;
 * the endpoint is derived from the configured project and region.
 */
public final class DeployAgentTool implements Tool {

    public static final String NAME = "deploy_agent";

    private static final Logger log = LoggerFactory.getLogger(DeployAgentTool.class);

    private final Clock clock;
    private final String projectId;
    private final String region;

    public DeployAgentTool(Clock clock, String projectId, String region) {
        this.clock = clock;
        this.projectId = projectId;
        this.region = region;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ToolResult execute(Map<String, Object> args) {
        String agentName;
        String version;
        Map<String, Object> config;
        try {
            agentName = ToolArgs.requireString(args, "agent_name");
            version = ToolArgs.requireString(args, "version");
            config = ToolArgs.optionalMap(args, "config");
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage(), e);
        }

        Instant now = clock.instant();
        String deploymentId = "deploy_%s_%s_%d".formatted(agentName, version, now.getEpochSecond());
        log.info("Deploying agent deployment_id={} agent_name={} version={}", deploymentId, agentName, version);

        var result = new LinkedHashMap<String, Object>();
        result.put("status", "deployed");
        result.put("deployment_id", deploymentId);
        result.put("agent_name", agentName);
        result.put("version", version);
        result.put("config", config);
        result.put("endpoint", "https://%s-aiplatform.googleapis.com/v1/projects/%s/endpoints/%s"
            .formatted(region, projectId, deploymentId));
        result.put("timestamp", now.toString());
        return ToolResult.success(result);
    }
}
