package dev.nova.cli;

import dev.nova.engine.ConnectivityCheck;
import dev.nova.engine.ConnectivityCheck.ComponentStatus;
import dev.nova.engine.Orchestrator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "check", mixinStandardHelpOptions = true,
    description = "Test connectivity of the event log, artifact store and job runner.")
class CheckCommand implements Callable<Integer> {

    @ParentCommand
    private NovaCli parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        List<ComponentStatus> statuses;
        try (Orchestrator orchestrator = parent.openOrchestrator()) {
            statuses = orchestrator.connectivityCheck().run();
        }

        out.println("Connectivity Test Summary:");
        out.printf("%-16s %-6s %s%n", "Component", "Status", "Details");
        for (ComponentStatus status : statuses) {
            out.printf("%-16s %-6s %s%n", status.component(), status.ok() ? "ok" : "FAIL", status.detail());
        }
        return ConnectivityCheck.allOk(statuses) ? 0 : 1;
    }
}
