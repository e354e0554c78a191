package dev.nova.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import dev.nova.config.ConfigLoader;
import dev.nova.config.OrchestratorConfig;
import dev.nova.engine.Orchestrator;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point for orchestrator-nova.
 */
@Command(
    name = "orchestrator-nova",
    mixinStandardHelpOptions = true,
    version = "orchestrator-nova 0.1.0",
    description = "Plan a goal into tool invocations and execute them.",
    subcommands = {RunCommand.class, PlanCommand.class, CheckCommand.class}
)
public class NovaCli implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--debug", description = "Enable debug logging")
    private boolean debug;

    @Option(names = "--config", description = "JSON configuration file layered over the built-in defaults")
    private Path configFile;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    OrchestratorConfig loadConfig() throws IOException {
        if (debug) {
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.getLogger("dev.nova").setLevel(Level.DEBUG);
        }
        return ConfigLoader.load(configFile, System.getenv());
    }

    Orchestrator openOrchestrator() throws IOException {
        return Orchestrator.builder(loadConfig()).build();
    }
}
