package com.vivek.dispatch.cli;

import com.vivek.core.context.ContextSnapshot;
import com.vivek.core.engine.Orchestrator;
import com.vivek.core.events.EventBus;
import com.vivek.core.events.VivekEvent;
import com.vivek.core.model.ExecutionMode;
import com.vivek.core.model.FailureReason;
import com.vivek.core.model.QualityJudgment;
import com.vivek.core.model.RunStatus;
import com.vivek.core.model.RunSummary;
import com.vivek.core.model.WorkItem;
import com.vivek.core.model.WorkItemState;
import com.vivek.core.model.WorkItemStatus;
import com.vivek.core.persistence.RunCheckpoint;
import com.vivek.core.scheduler.PlanInvalidException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Exercises picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private Orchestrator orchestrator;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        orchestrator = mock(Orchestrator.class);
        eventBus = new EventBus();
        when(orchestrator.status(anyString())).thenReturn(Optional.empty());
        when(orchestrator.history(anyInt())).thenReturn(List.of());
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(orchestrator, eventBus);
                }
                if (cls == ResumeCommand.class) {
                    return (K) new ResumeCommand(orchestrator, eventBus);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(orchestrator);
                }
                if (cls == HistoryCommand.class) {
                    return (K) new HistoryCommand(orchestrator);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new VivekCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static RunSummary summary(String runId, RunSummary.ItemReport... items) {
        return new RunSummary(runId, RunStatus.COMPLETED, List.of(items), List.of());
    }

    private static RunSummary.ItemReport done(String id, String path) {
        return new RunSummary.ItemReport(id, path, WorkItemStatus.DONE, FailureReason.NONE, "", 1, 0.9);
    }

    private static RunCheckpoint checkpoint(String runId, RunStatus status) {
        var items = List.of(
                new WorkItem("ITEM-001", "src/Login.java", ExecutionMode.CODER, "Handler", List.of()),
                new WorkItem("ITEM-002", "src/LoginTest.java", ExecutionMode.SDET, "Tests", List.of(0)));
        var states = Map.of("ITEM-001", WorkItemState.pending("ITEM-001")
                .done("code", 2, new QualityJudgment(0.85, true, "ok")));
        var t = Instant.parse("2026-05-01T12:00:00Z");
        return RunCheckpoint.started(runId, "Build a login service", t)
                .withPlan(items, states, t)
                .withContext(ContextSnapshot.empty(), t)
                .withStatus(status, t);
    }

    @Nested
    @DisplayName("help output")
    class Help {

        @Test
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("run", "resume", "status", "history", "help")) {
                assertTrue(result.output().contains(sub), "help should list " + sub);
            }
        }

        @Test
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Vivek 0.1.0"));
        }

        @Test
        void noArgumentsPrintsUsage() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("VIVEK v0.1.0"));
            assertTrue(result.output().contains("Usage: vivek"));
        }
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("exits 0 when every item succeeded and prints live events")
        void allSucceeded() {
            when(orchestrator.generateRunId()).thenReturn("VIVEK-2026-AAAA0001");
            when(orchestrator.run("VIVEK-2026-AAAA0001", "Build login")).thenAnswer(invocation -> {
                eventBus.publish(new VivekEvent(VivekEvent.ITEM_ACCEPTED, "VIVEK-2026-AAAA0001", "ITEM-001",
                        Map.of("iterations", 2, "score", 0.85), Instant.now()));
                return summary("VIVEK-2026-AAAA0001", done("ITEM-001", "src/Login.java"));
            });

            CliResult result = execute("run", "Build login");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[ACCEPTED] ITEM-001 after 2 iteration(s), score 0.85"));
            assertTrue(result.output().contains("1 succeeded"));
            assertTrue(result.output().contains("src/Login.java"));
        }

        @Test
        void exitsOneWhenItemsFailed() {
            when(orchestrator.generateRunId()).thenReturn("R1");
            when(orchestrator.run("R1", "Build login")).thenReturn(summary("R1",
                    done("ITEM-001", "a.java"),
                    new RunSummary.ItemReport("ITEM-002", "b.java", WorkItemStatus.FAILED,
                            FailureReason.QUALITY_EXHAUSTED, "weak", 3, 0.4)));

            CliResult result = execute("run", "Build login");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("QUALITY_EXHAUSTED"));
            assertTrue(result.output().contains("1 quality-failed"));
        }

        @Test
        void exitsTwoWhenAborted() {
            when(orchestrator.generateRunId()).thenReturn("R1");
            when(orchestrator.run("R1", "Build login"))
                    .thenThrow(new PlanInvalidException("Dependency cycle among work items [A, B]"));

            CliResult result = execute("run", "Build login");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Dependency cycle among work items [A, B]"));
            assertTrue(result.output().contains("vivek status R1"));
        }

        @Test
        void missingRequestIsUsageError() {
            CliResult result = execute("run");
            assertNotEquals(0, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    @Nested
    @DisplayName("resume")
    class Resume {

        @Test
        void unknownRun() {
            CliResult result = execute("resume", "R9");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Run not found: R9"));
            verify(orchestrator, never()).resume(anyString());
        }

        @Test
        void resumesKnownRun() {
            when(orchestrator.status("R1")).thenReturn(Optional.of(checkpoint("R1", RunStatus.EXECUTING)));
            when(orchestrator.resume("R1")).thenReturn(summary("R1", done("ITEM-001", "a.java")));

            CliResult result = execute("resume", "R1");

            assertEquals(0, result.exitCode());
            verify(orchestrator).resume("R1");
        }
    }

    @Nested
    @DisplayName("status and history")
    class Inspection {

        @Test
        void statusPrintsItems() {
            when(orchestrator.status("R1")).thenReturn(Optional.of(checkpoint("R1", RunStatus.COMPLETED)));

            CliResult result = execute("status", "R1");

            assertEquals(0, result.exitCode());
            String out = result.output();
            assertTrue(out.contains("RUN R1"));
            assertTrue(out.contains("Status: COMPLETED"));
            assertTrue(out.contains("ITEM-001"));
            assertTrue(out.contains("0.85"));
            assertTrue(out.contains("PENDING"));
        }

        @Test
        void statusOfUnknownRun() {
            CliResult result = execute("status", "nope");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Run not found: nope"));
        }

        @Test
        void emptyHistory() {
            CliResult result = execute("history");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No runs found."));
        }

        @Test
        void historyListsRuns() {
            when(orchestrator.history(2)).thenReturn(List.of(
                    checkpoint("R2", RunStatus.FAILED), checkpoint("R1", RunStatus.COMPLETED)));

            CliResult result = execute("history", "-n", "2");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Runs (2):"));
            assertTrue(result.output().contains("1/2"));
            assertTrue(result.output().contains("FAILED"));
        }
    }
}
