package com.vivek.dispatch.cli;

import com.vivek.core.engine.Orchestrator;
import com.vivek.core.events.EventBus;
import com.vivek.core.model.RunSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: vivek resume &lt;run-id&gt;
 * <p>
 * Continues a checkpointed run from its unfinished work items.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume an interrupted run")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    private final Orchestrator orchestrator;
    private final EventBus eventBus;

    public ResumeCommand(Orchestrator orchestrator, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (orchestrator.status(runId).isEmpty()) {
            ConsoleOutput.error("Run not found: " + runId);
            return ExitCodes.ABORTED;
        }

        RunSummary summary;
        try (var subscription = eventBus.subscribe(runId, ConsoleOutput::event)) {
            summary = orchestrator.resume(runId);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Resume of " + runId + " failed: " + ConsoleOutput.rootCauseMessage(e));
            return ExitCodes.ABORTED;
        }

        ConsoleOutput.summary(summary);
        return summary.allSucceeded() ? ExitCodes.OK : ExitCodes.ITEMS_FAILED;
    }
}
