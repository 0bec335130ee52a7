package com.vivek.dispatch.cli;

import com.vivek.core.engine.Orchestrator;
import com.vivek.core.model.WorkItemStatus;
import com.vivek.core.persistence.RunCheckpoint;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: vivek history
 * <p>
 * Lists the most recent runs as a table: Run ID | Status | Items done | Request (truncated).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recent runs")
@Component
public class HistoryCommand implements Callable<Integer> {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final Orchestrator orchestrator;

    public HistoryCommand(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<RunCheckpoint> runs = orchestrator.history(limit);
        if (runs.isEmpty()) {
            ConsoleOutput.info("No runs found.");
            return ExitCodes.OK;
        }

        ConsoleOutput.info("Runs (" + runs.size() + "):");
        System.out.println();
        System.out.printf("  %-22s %-10s %-7s %s%n", "RUN ID", "STATUS", "DONE", "REQUEST");
        System.out.println("  " + "-".repeat(76));
        for (RunCheckpoint run : runs) {
            long done = run.itemStates().values().stream()
                    .filter(s -> s.status() == WorkItemStatus.DONE)
                    .count();
            System.out.printf("  %-22s %-10s %-7s %s%n", run.runId(), run.status(),
                    done + "/" + run.workItems().size(), ConsoleOutput.truncate(run.request(), 40));
        }
        return ExitCodes.OK;
    }
}
