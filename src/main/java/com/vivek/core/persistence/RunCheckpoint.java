package com.vivek.core.persistence;

import com.vivek.core.context.ContextSnapshot;
import com.vivek.core.model.RunStatus;
import com.vivek.core.model.RunSummary;
import com.vivek.core.model.WorkItem;
import com.vivek.core.model.WorkItemState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted state of a run: the plan, one state record per work item id, the whole context
 * store and any run-level errors. Enough to resume a run from its last transition.
 */
public record RunCheckpoint(
    String runId,
    String request,
    RunStatus status,
    List<WorkItem> workItems,
    Map<String, WorkItemState> itemStates,
    ContextSnapshot context,
    List<String> errors,
    Instant createdAt,
    Instant updatedAt
) {

    public RunCheckpoint {
        workItems = workItems != null ? List.copyOf(workItems) : List.of();
        itemStates = itemStates != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(itemStates))
                : Map.of();
        context = context != null ? context : ContextSnapshot.empty();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static RunCheckpoint started(String runId, String request, Instant now) {
        return new RunCheckpoint(runId, request, RunStatus.PLANNING, List.of(), Map.of(),
                ContextSnapshot.empty(), List.of(), now, now);
    }

    public RunCheckpoint withStatus(RunStatus newStatus, Instant now) {
        return new RunCheckpoint(runId, request, newStatus, workItems, itemStates, context, errors, createdAt, now);
    }

    public RunCheckpoint withPlan(List<WorkItem> items, Map<String, WorkItemState> states, Instant now) {
        return new RunCheckpoint(runId, request, status, items, states, context, errors, createdAt, now);
    }

    public RunCheckpoint withItemState(WorkItemState state, ContextSnapshot snapshot, Instant now) {
        var states = new LinkedHashMap<>(itemStates);
        states.put(state.itemId(), state);
        return new RunCheckpoint(runId, request, status, workItems, states, snapshot, errors, createdAt, now);
    }

    public RunCheckpoint withContext(ContextSnapshot snapshot, Instant now) {
        return new RunCheckpoint(runId, request, status, workItems, itemStates, snapshot, errors, createdAt, now);
    }

    public RunCheckpoint withError(String error, Instant now) {
        var all = new ArrayList<>(errors);
        all.add(error);
        return new RunCheckpoint(runId, request, status, workItems, itemStates, context, all, createdAt, now);
    }

    public WorkItemState stateOf(String itemId) {
        return itemStates.get(itemId);
    }

    /**
     * Report of every planned item in plan order. Items without a state record are reported
     * as pending.
     */
    public RunSummary toSummary() {
        var reports = new ArrayList<RunSummary.ItemReport>(workItems.size());
        for (WorkItem item : workItems) {
            WorkItemState state = itemStates.getOrDefault(item.id(), WorkItemState.pending(item.id()));
            reports.add(new RunSummary.ItemReport(
                    item.id(),
                    item.filePath(),
                    state.status(),
                    state.failureReason(),
                    state.failureDetail(),
                    state.iterationCount(),
                    state.lastJudgment() != null ? state.lastJudgment().score() : null));
        }
        return new RunSummary(runId, status, reports, errors);
    }
}
