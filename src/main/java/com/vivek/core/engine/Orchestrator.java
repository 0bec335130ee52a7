package com.vivek.core.engine;

import com.vivek.core.context.ContextCategory;
import com.vivek.core.context.ContextCursor;
import com.vivek.core.context.ContextStore;
import com.vivek.core.context.StoreInvariantException;
import com.vivek.core.events.EventBus;
import com.vivek.core.events.VivekEvent;
import com.vivek.core.gateway.Planner;
import com.vivek.core.iteration.IterationController;
import com.vivek.core.iteration.IterationListener;
import com.vivek.core.iteration.IterationOutcome;
import com.vivek.core.iteration.IterationState;
import com.vivek.core.iteration.QualityExhaustedException;
import com.vivek.core.iteration.RunInterruptedException;
import com.vivek.core.iteration.TransportException;
import com.vivek.core.iteration.TransportRetry;
import com.vivek.core.logging.MdcContext;
import com.vivek.core.metrics.VivekMetrics;
import com.vivek.core.model.ExecutionMode;
import com.vivek.core.model.FailureReason;
import com.vivek.core.model.QualityJudgment;
import com.vivek.core.model.RunStatus;
import com.vivek.core.model.RunSummary;
import com.vivek.core.model.WorkItem;
import com.vivek.core.model.WorkItemState;
import com.vivek.core.model.WorkItemStatus;
import com.vivek.core.persistence.CheckpointStore;
import com.vivek.core.persistence.RunCheckpoint;
import com.vivek.core.retrieval.TagNormalizer;
import com.vivek.core.scheduler.DependencyScheduler;
import com.vivek.core.scheduler.PlanInvalidException;
import com.vivek.core.scheduler.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs a request end to end: plan, schedule once, then drive every work item through the
 * {@link IterationController} in schedule order.
 * <p>
 * A failing item does not stop the run; items depending on it are marked failed without being
 * attempted. An invalid plan or a broken context store aborts the run. The run is checkpointed
 * after every item transition so that {@link #resume(String)} can pick it up again.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final Planner planner;
    private final DependencyScheduler scheduler;
    private final IterationController iterationController;
    private final TagNormalizer tagNormalizer;
    private final CheckpointStore checkpointStore;
    private final TransportRetry transportRetry;
    private final EventBus eventBus;
    private final VivekMetrics metrics;
    private final Clock clock;

    public Orchestrator(Planner planner, DependencyScheduler scheduler, IterationController iterationController,
                        TagNormalizer tagNormalizer, CheckpointStore checkpointStore, TransportRetry transportRetry,
                        EventBus eventBus, VivekMetrics metrics, Clock clock) {
        this.planner = planner;
        this.scheduler = scheduler;
        this.iterationController = iterationController;
        this.tagNormalizer = tagNormalizer;
        this.checkpointStore = checkpointStore;
        this.transportRetry = transportRetry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public RunSummary run(String request) {
        return run(generateRunId(), request);
    }

    /**
     * Plans and executes a request under the given run id.
     *
     * @throws PlanInvalidException    if the plan is unusable; nothing is generated
     * @throws StoreInvariantException if the context store is corrupted mid-run
     * @throws TransportException      if the planner stays unreachable
     * @throws RunInterruptedException if the thread is interrupted while waiting to retry
     */
    public RunSummary run(String runId, String request) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("Request must not be blank");
        }
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {}: {}", runId, request);
            var run = new RunContext(RunCheckpoint.started(runId, request, clock.instant()),
                    new ContextStore(tagNormalizer, clock));
            save(run);
            publish(VivekEvent.RUN_STARTED, runId, null, Map.of("request", request, "resumed", false));

            List<WorkItem> items;
            Schedule schedule;
            try {
                long start = clock.millis();
                items = transportRetry.execute("plan", () -> planner.plan(request),
                        retry -> metrics.recordTransportRetry("plan"));
                schedule = scheduler.schedule(items);
                metrics.recordPlanningDuration(clock.millis() - start);
                initialiseContext(run, items);
            } catch (PlanInvalidException | TransportException | StoreInvariantException
                     | RunInterruptedException e) {
                throw abort(run, e);
            }

            var states = new LinkedHashMap<String, WorkItemState>();
            for (WorkItem item : items) {
                states.put(item.id(), WorkItemState.pending(item.id()));
            }
            run.checkpoint = run.checkpoint
                    .withPlan(items, states, clock.instant())
                    .withContext(run.store.snapshot(), clock.instant())
                    .withStatus(RunStatus.EXECUTING, clock.instant());
            save(run);
            publish(VivekEvent.RUN_PLANNED, runId, null, Map.of(
                    "items", schedule.size(),
                    "batches", schedule.batches().size(),
                    "order", schedule.order().stream().map(WorkItem::id).toList()));

            return execute(run, schedule);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Continues a checkpointed run. Items interrupted mid-flight start over; finished items are
     * left as they are. A run that never got past planning is planned again.
     *
     * @throws IllegalArgumentException if no checkpoint exists for the run id
     */
    public RunSummary resume(String runId) {
        RunCheckpoint checkpoint = checkpointStore.load(runId)
                .orElseThrow(() -> new IllegalArgumentException("No checkpoint for run " + runId));
        if (checkpoint.workItems().isEmpty()) {
            log.info("Run {} has no plan yet; planning again", runId);
            return run(runId, checkpoint.request());
        }

        MdcContext.setRun(runId);
        try {
            var store = new ContextStore(tagNormalizer, clock);
            var run = new RunContext(checkpoint, store);
            try {
                store.restore(checkpoint.context());
            } catch (StoreInvariantException e) {
                throw abort(run, e);
            }

            var states = new LinkedHashMap<String, WorkItemState>();
            int reset = 0;
            for (WorkItem item : checkpoint.workItems()) {
                WorkItemState state = Optional.ofNullable(checkpoint.stateOf(item.id()))
                        .orElseGet(() -> WorkItemState.pending(item.id()));
                WorkItemState restored = state.resetIfInterrupted();
                if (restored != state) {
                    reset++;
                }
                states.put(item.id(), restored);
            }
            run.checkpoint = checkpoint
                    .withPlan(checkpoint.workItems(), states, clock.instant())
                    .withStatus(RunStatus.EXECUTING, clock.instant());
            save(run);
            log.info("Resuming run {}: {} item(s) reset from in-progress", runId, reset);
            publish(VivekEvent.RUN_STARTED, runId, null,
                    Map.of("request", checkpoint.request(), "resumed", true));

            Schedule schedule;
            try {
                schedule = scheduler.schedule(checkpoint.workItems());
            } catch (PlanInvalidException e) {
                throw abort(run, e);
            }
            return execute(run, schedule);
        } finally {
            MdcContext.clear();
        }
    }

    public Optional<RunCheckpoint> status(String runId) {
        return checkpointStore.load(runId);
    }

    public List<RunCheckpoint> history(int limit) {
        return checkpointStore.listRecent(limit);
    }

    /**
     * Generates a run id of the form {@code VIVEK-YYYY-XXXXXXXX}.
     */
    public String generateRunId() {
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        return "VIVEK-%d-%s".formatted(year, suffix);
    }

    // ── Execution ───────────────────────────────────────────────────

    private RunSummary execute(RunContext run, Schedule schedule) {
        String runId = run.checkpoint.runId();
        try {
            for (WorkItem item : schedule.order()) {
                WorkItemState state = run.state(item.id());
                if (state.status().isTerminal()) {
                    log.debug("Work item {} already {}, skipping", item.id(), state.status());
                    continue;
                }
                Optional<String> failedDependency = failedDependency(run, item);
                if (failedDependency.isPresent()) {
                    String detail = "Blocked by failed dependency " + failedDependency.get();
                    log.warn("Work item {} not attempted: {}", item.id(), detail);
                    update(run, state.failed(FailureReason.DEPENDENCY_FAILED, detail,
                            state.iterationCount(), state.lastJudgment()));
                    publish(VivekEvent.ITEM_FAILED, runId, item.id(), Map.of(
                            "reason", FailureReason.DEPENDENCY_FAILED.name(), "detail", detail));
                    continue;
                }
                executeItem(run, item);
            }
        } catch (StoreInvariantException | RunInterruptedException e) {
            throw abort(run, e);
        }

        run.checkpoint = run.checkpoint.withStatus(RunStatus.COMPLETED, clock.instant());
        save(run);
        RunSummary summary = run.checkpoint.toSummary();
        metrics.recordRunResult(RunStatus.COMPLETED.name());
        log.info("Run {} completed: {} succeeded, {} quality-failed, {} transport-failed, {} blocked",
                runId, summary.succeeded().size(), summary.qualityFailed().size(),
                summary.transportFailed().size(), summary.blocked().size());
        publish(VivekEvent.RUN_COMPLETED, runId, null, Map.of(
                "status", RunStatus.COMPLETED.name(),
                "succeeded", summary.succeeded().size(),
                "failed", summary.items().size() - summary.succeeded().size()));
        return summary;
    }

    private void executeItem(RunContext run, WorkItem item) {
        String runId = run.checkpoint.runId();
        String mode = item.mode().label();
        MdcContext.setItem(runId, item.id(), mode);
        long start = clock.millis();
        try {
            ContextCursor cursor = focusTask(run, item);
            update(run, run.state(item.id()).inProgress());
            publish(VivekEvent.ITEM_STARTED, runId, item.id(), Map.of(
                    "filePath", item.filePath(), "mode", mode));

            IterationListener listener = (workItem, from, to, iterations, judgment) ->
                    onTransition(run, workItem, from, to, iterations, judgment);
            try {
                IterationOutcome outcome = iterationController.execute(
                        item, run.checkpoint.request(), run.store, cursor, listener);
                update(run, run.state(item.id()).done(outcome.result(), outcome.iterations(), outcome.judgment()));
                metrics.recordItemDuration(mode, WorkItemStatus.DONE.name(), clock.millis() - start);
                publish(VivekEvent.ITEM_ACCEPTED, runId, item.id(), Map.of(
                        "iterations", outcome.iterations(), "score", outcome.judgment().score()));
            } catch (QualityExhaustedException e) {
                failItem(run, item, FailureReason.QUALITY_EXHAUSTED, e.getFeedback(),
                        e.getIterations(), e.getLastJudgment(), start);
            } catch (TransportException e) {
                WorkItemState current = run.state(item.id());
                failItem(run, item, FailureReason.TRANSPORT_EXHAUSTED, e.getMessage(),
                        current.iterationCount(), current.lastJudgment(), start);
            }
        } finally {
            MdcContext.clearItem();
        }
    }

    private void failItem(RunContext run, WorkItem item, FailureReason reason, String detail,
                          int iterations, QualityJudgment judgment, long start) {
        log.warn("Work item {} failed ({}): {}", item.id(), reason, detail);
        update(run, run.state(item.id()).failed(reason, detail, iterations, judgment));
        metrics.recordItemDuration(item.mode().label(), WorkItemStatus.FAILED.name(), clock.millis() - start);
        publish(VivekEvent.ITEM_FAILED, run.checkpoint.runId(), item.id(), Map.of(
                "reason", reason.name(), "detail", detail != null ? detail : "", "iterations", iterations));
    }

    private void onTransition(RunContext run, WorkItem item, IterationState from, IterationState to,
                              int iterations, QualityJudgment judgment) {
        WorkItemState current = run.state(item.id());
        if (current.iterationCount() != iterations || current.lastJudgment() != judgment) {
            update(run, current.iterated(iterations, judgment));
        } else {
            run.checkpoint = run.checkpoint.withContext(run.store.snapshot(), clock.instant());
            save(run);
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("from", from.name());
        payload.put("to", to.name());
        payload.put("iteration", iterations);
        if (judgment != null) {
            payload.put("score", judgment.score());
            payload.put("passed", judgment.passed());
        }
        publish(VivekEvent.ITEM_ITERATION, run.checkpoint.runId(), item.id(), payload);
    }

    private Optional<String> failedDependency(RunContext run, WorkItem item) {
        List<WorkItem> plan = run.checkpoint.workItems();
        for (int index : item.dependencyIds()) {
            WorkItem dependency = plan.get(index);
            if (run.state(dependency.id()).status() == WorkItemStatus.FAILED) {
                return Optional.of(dependency.id());
            }
        }
        return Optional.empty();
    }

    // ── Context mapping ─────────────────────────────────────────────

    private void initialiseContext(RunContext run, List<WorkItem> items) {
        String runId = run.checkpoint.runId();
        var plan = new StringBuilder();
        for (WorkItem item : items) {
            plan.append("- ").append(item.id()).append(' ').append(item.filePath())
                    .append(" [").append(item.mode().label()).append("] ")
                    .append(item.description()).append('\n');
        }
        run.store.createSession(runId, run.checkpoint.request(), plan.toString().stripTrailing());

        var planTags = new LinkedHashSet<String>();
        items.forEach(item -> planTags.addAll(item.effectiveTags()));
        run.store.addItem("Planned " + items.size() + " work item(s) for: " + run.checkpoint.request()
                + "\n" + plan.toString().stripTrailing(), ContextCategory.DECISION, planTags, runId);

        var modes = new LinkedHashSet<ExecutionMode>();
        items.forEach(item -> modes.add(item.mode()));
        for (ExecutionMode mode : modes) {
            ensureActivity(run, items, mode);
        }
    }

    private String ensureActivity(RunContext run, List<WorkItem> items, ExecutionMode mode) {
        String runId = run.checkpoint.runId();
        String activityId = runId + "/" + mode.label();
        if (run.store.getActivity(activityId).isPresent()) {
            return activityId;
        }
        var rationale = new StringBuilder();
        var tags = new LinkedHashSet<String>();
        for (WorkItem item : items) {
            if (item.mode() == mode) {
                rationale.append(item.id()).append(": ").append(item.description()).append('\n');
                tags.addAll(item.tags());
            }
        }
        run.store.createActivity(activityId, runId, mode.label() + " work items", tags, mode.label(),
                mode.label(), rationale.toString().stripTrailing());
        return activityId;
    }

    private ContextCursor focusTask(RunContext run, WorkItem item) {
        if (run.store.getTask(item.id()).isPresent()) {
            return run.store.focusTask(item.id());
        }
        String activityId = ensureActivity(run, run.checkpoint.workItems(), item.mode());
        run.store.createTask(item.id(), activityId, item.description(), item.effectiveTags());
        return run.store.cursor();
    }

    // ── Checkpointing ───────────────────────────────────────────────

    private void update(RunContext run, WorkItemState state) {
        run.checkpoint = run.checkpoint.withItemState(state, run.store.snapshot(), clock.instant());
        save(run);
    }

    private void save(RunContext run) {
        checkpointStore.save(run.checkpoint);
    }

    private RuntimeException abort(RunContext run, RuntimeException cause) {
        String runId = run.checkpoint.runId();
        log.error("Run {} aborted: {}", runId, cause.getMessage(), cause);
        run.checkpoint = run.checkpoint
                .withError(cause.getClass().getSimpleName() + ": " + cause.getMessage(), clock.instant())
                .withStatus(RunStatus.FAILED, clock.instant());
        save(run);
        metrics.recordRunResult(RunStatus.FAILED.name());
        publish(VivekEvent.RUN_FAILED, runId, null, Map.of(
                "error", cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()));
        return cause;
    }

    private void publish(String type, String runId, String itemId, Map<String, Object> payload) {
        eventBus.publish(new VivekEvent(type, runId, itemId, payload, clock.instant()));
    }

    private static final class RunContext {
        private RunCheckpoint checkpoint;
        private final ContextStore store;

        private RunContext(RunCheckpoint checkpoint, ContextStore store) {
            this.checkpoint = checkpoint;
            this.store = store;
        }

        private WorkItemState state(String itemId) {
            WorkItemState state = checkpoint.stateOf(itemId);
            return state != null ? state : WorkItemState.pending(itemId);
        }
    }
}
