package com.vivek.dispatch.cli;

import com.vivek.core.engine.Orchestrator;
import com.vivek.core.events.EventBus;
import com.vivek.core.model.RunSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: vivek run "&lt;request&gt;"
 * <p>
 * Plans the request, generates every work item and prints live progress followed by the
 * run summary. Exits 0 when every item succeeded, 1 when some failed, 2 when the run aborted.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Plan and execute a request")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    private final Orchestrator orchestrator;
    private final EventBus eventBus;

    public RunCommand(Orchestrator orchestrator, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String runId = orchestrator.generateRunId();
        RunSummary summary;
        try (var subscription = eventBus.subscribe(runId, ConsoleOutput::event)) {
            summary = orchestrator.run(runId, request);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Run " + runId + " failed: " + ConsoleOutput.rootCauseMessage(e));
            ConsoleOutput.info("Inspect it with: vivek status " + runId);
            return ExitCodes.ABORTED;
        }

        ConsoleOutput.summary(summary);
        return summary.allSucceeded() ? ExitCodes.OK : ExitCodes.ITEMS_FAILED;
    }
}
