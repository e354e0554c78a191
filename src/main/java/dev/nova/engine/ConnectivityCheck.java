package dev.nova.engine;

import dev.nova.sink.ArtifactReceipt;
import dev.nova.sink.ArtifactSink;
import dev.nova.sink.EventReceipt;
import dev.nova.sink.EventSink;
import dev.nova.sink.JobReceipt;
import dev.nova.sink.JobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Probes each external collaborator once and reports whether it answered.
 */
public final class ConnectivityCheck {

    public static final String PROBE_ARTIFACT_PATH = "test/connection.txt";

    private static final Logger log = LoggerFactory.getLogger(ConnectivityCheck.class);

    public record ComponentStatus(String component, boolean ok, String detail) {}

    private final EventSink eventSink;
    private final ArtifactSink artifactSink;
    private final JobRunner jobRunner;

    public ConnectivityCheck(EventSink eventSink, ArtifactSink artifactSink, JobRunner jobRunner) {
        this.eventSink = eventSink;
        this.artifactSink = artifactSink;
        this.jobRunner = jobRunner;
    }

    public List<ComponentStatus> run() {
        return List.of(
            probe("Event log", () -> {
                EventReceipt receipt = eventSink.record("TEST", Map.of("message", "Connectivity test"));
                return "Connected (" + eventSink.getName() + ", event " + receipt.id() + ")";
            }),
            probe("Artifact store", () -> {
                ArtifactReceipt receipt = artifactSink.writeText(PROBE_ARTIFACT_PATH, "Test content");
                return receipt.uri();
            }),
            probe("Job runner", () -> {
                JobReceipt receipt = jobRunner.run(Map.of("test", true));
                return "Working (" + receipt.jobId() + ")";
            })
        );
    }

    public static boolean allOk(List<ComponentStatus> statuses) {
        return statuses.stream().allMatch(ComponentStatus::ok);
    }

    private static ComponentStatus probe(String component, Supplier<String> call) {
        try {
            return new ComponentStatus(component, true, call.get());
        } catch (RuntimeException e) {
            log.warn("Connectivity check failed component={}: {}", component, e.getMessage());
            return new ComponentStatus(component, false, String.valueOf(e.getMessage()));
        }
    }
}
