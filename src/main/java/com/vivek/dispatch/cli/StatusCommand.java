package com.vivek.dispatch.cli;

import com.vivek.core.engine.Orchestrator;
import com.vivek.core.model.RunStatus;
import com.vivek.core.model.WorkItemState;
import com.vivek.core.persistence.RunCheckpoint;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: vivek status &lt;run-id&gt;
 * <p>
 * Reads the run's checkpoint and prints its work items with their progress.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check run status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    private final Orchestrator orchestrator;

    public StatusCommand(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var checkpointOpt = orchestrator.status(runId);
        if (checkpointOpt.isEmpty()) {
            ConsoleOutput.error("Run not found: " + runId);
            return ExitCodes.ABORTED;
        }
        RunCheckpoint checkpoint = checkpointOpt.get();

        System.out.println();
        System.out.println("RUN " + checkpoint.runId());
        System.out.println("Request: " + checkpoint.request());
        RunStatus status = checkpoint.status();
        if (status == RunStatus.COMPLETED) {
            ConsoleOutput.success("Status: " + status);
        } else if (status == RunStatus.FAILED) {
            ConsoleOutput.error("Status: " + status);
        } else {
            ConsoleOutput.info("Status: " + status);
        }

        var items = checkpoint.workItems();
        if (!items.isEmpty()) {
            System.out.println();
            System.out.printf("  %-10s %-6s %-12s %-5s %-6s %s%n",
                    "ITEM", "MODE", "STATUS", "ITER", "SCORE", "FILE");
            System.out.println("  " + "-".repeat(64));
            for (var item : items) {
                WorkItemState state = checkpoint.itemStates().getOrDefault(item.id(), WorkItemState.pending(item.id()));
                System.out.printf("  %-10s %-6s %-12s %-5d %-6s %s%n",
                        item.id(), item.mode().label(), state.status(), state.iterationCount(),
                        ConsoleOutput.score(state.lastJudgment() != null ? state.lastJudgment().score() : null),
                        ConsoleOutput.truncate(item.filePath(), 40));
            }
        }

        var context = checkpoint.context();
        ConsoleOutput.info("Context: " + context.tasks().size() + " tasks, " + context.items().size() + " items");

        var errors = checkpoint.errors();
        if (!errors.isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Errors (" + errors.size() + "):");
            for (var e : errors) {
                ConsoleOutput.error("  " + e);
            }
        }
        return ExitCodes.OK;
    }
}
