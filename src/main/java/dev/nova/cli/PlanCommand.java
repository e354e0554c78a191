package dev.nova.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.nova.config.Mappers;
import dev.nova.engine.Orchestrator;
import dev.nova.model.Plan;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.util.concurrent.Callable;

@Command(name = "plan", mixinStandardHelpOptions = true,
    description = "Print the plan for a goal as JSON without executing it.")
class PlanCommand implements Callable<Integer> {

    @ParentCommand
    private NovaCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Goal to plan")
    private String goal;

    @Override
    public Integer call() throws IOException {
        ObjectMapper mapper = Mappers.standard().enable(SerializationFeature.INDENT_OUTPUT);
        try (Orchestrator orchestrator = parent.openOrchestrator()) {
            Plan plan = orchestrator.plan(goal);
            spec.commandLine().getOut().println(mapper.writeValueAsString(plan));
            return 0;
        }
    }
}
