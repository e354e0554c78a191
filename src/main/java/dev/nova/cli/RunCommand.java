package dev.nova.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.nova.config.Mappers;
import dev.nova.engine.Orchestrator;
import dev.nova.model.ExecutionSummary;
import dev.nova.model.Plan;
import dev.nova.model.PlanStatus;
import dev.nova.model.TaskReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "run", mixinStandardHelpOptions = true, description = "Plan and execute a goal.")
class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private NovaCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Goal to execute, e.g. \"Run ETL pipeline for sales data\"")
    private String goal;

    @Option(names = {"-v", "--verbose"}, description = "Print the plan and each step outcome")
    private boolean verbose;

    @Option(names = "--dry-run", description = "Show the plan without executing it")
    private boolean dryRun;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        ObjectMapper mapper = Mappers.standard();

        try (Orchestrator orchestrator = parent.openOrchestrator()) {
            if (dryRun) {
                out.println("Dry run mode - showing plan only");
                Plan plan = orchestrator.plan(goal);
                out.print(PlanTable.render(plan, mapper));
                out.println("Plan generated successfully!");
                return 0;
            }

            TaskReport report = orchestrator.executeGoal(goal);
            if (verbose) {
                out.print(PlanTable.render(report.plan(), mapper));
                out.print(PlanTable.renderOutcomes(report.execution().outcomes()));
            }

            if (report.execution().status() == PlanStatus.FAILED_TO_START) {
                err.println("Task failed to start:");
                report.execution().validationErrors().forEach(e -> err.println("  " + e));
                return 1;
            }

            out.printf("Task completed (%d of %d steps succeeded)%n",
                report.stepsCompleted() - report.execution().failedCount(), report.stepsCompleted());
            out.printf("Duration: %.2f seconds%n", report.duration().toMillis() / 1000.0);
            out.println(describe(orchestrator.summarize()));
            return 0;
        } catch (RuntimeException e) {
            log.debug("Task failed", e);
            err.println("Task failed: " + e.getMessage());
            return 1;
        }
    }

    static String describe(ExecutionSummary summary) {
        if (summary instanceof ExecutionSummary.Totals totals) {
            return "History: %d executions, %d successful, %d failed, success rate %.0f%%"
                .formatted(totals.total(), totals.successful(), totals.failed(), totals.successRate() * 100);
        }
        return ((ExecutionSummary.NoHistory) summary).message();
    }
}
