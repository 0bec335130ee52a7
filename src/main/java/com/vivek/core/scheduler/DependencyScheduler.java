package com.vivek.core.scheduler;

import com.vivek.core.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Orders work items so that no item runs before its dependencies.
 *
 * <p>Dependencies are indices into the plan's item list. Items are grouped level by level
 * (Kahn's algorithm); within a level the original list order is kept, so the resulting
 * order is deterministic.
 */
@Service
public class DependencyScheduler {

    private static final Logger log = LoggerFactory.getLogger(DependencyScheduler.class);

    /**
     * Validates the plan and computes its schedule.
     *
     * @throws PlanInvalidException if the plan is empty, malformed, or has a cycle
     */
    public Schedule schedule(List<WorkItem> items) {
        validate(items);

        int n = items.size();
        int[] remaining = new int[n];
        List<List<Integer>> dependents = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            dependents.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            var deps = new HashSet<>(items.get(i).dependencyIds());
            remaining[i] = deps.size();
            for (int dep : deps) {
                dependents.get(dep).add(i);
            }
        }

        var batches = new ArrayList<List<WorkItem>>();
        var ready = new ArrayList<Integer>();
        for (int i = 0; i < n; i++) {
            if (remaining[i] == 0) {
                ready.add(i);
            }
        }
        int scheduled = 0;
        while (!ready.isEmpty()) {
            var batch = new ArrayList<WorkItem>(ready.size());
            var next = new ArrayList<Integer>();
            for (int index : ready) {
                batch.add(items.get(index));
                for (int dependent : dependents.get(index)) {
                    if (--remaining[dependent] == 0) {
                        next.add(dependent);
                    }
                }
            }
            next.sort(Integer::compare);
            batches.add(batch);
            scheduled += batch.size();
            ready = next;
        }

        if (scheduled < n) {
            var stuck = new ArrayList<String>();
            for (int i = 0; i < n; i++) {
                if (remaining[i] > 0) {
                    stuck.add(items.get(i).id());
                }
            }
            throw new PlanInvalidException("Dependency cycle among work items " + stuck);
        }

        log.info("Scheduled {} work items in {} batches", n, batches.size());
        return new Schedule(batches);
    }

    /**
     * Checks structure and dependency references, not cycles.
     */
    public void validate(List<WorkItem> items) {
        if (items == null || items.isEmpty()) {
            throw new PlanInvalidException("Plan contains no work items");
        }
        var ids = new HashSet<String>();
        for (int i = 0; i < items.size(); i++) {
            WorkItem item = items.get(i);
            if (item == null) {
                throw new PlanInvalidException("Work item at index " + i + " is null");
            }
            if (isBlank(item.id())) {
                throw new PlanInvalidException("Work item at index " + i + " has no id");
            }
            if (!ids.add(item.id())) {
                throw new PlanInvalidException("Duplicate work item id: " + item.id());
            }
            if (isBlank(item.filePath())) {
                throw new PlanInvalidException("Work item " + item.id() + " has no file path");
            }
            if (isBlank(item.description())) {
                throw new PlanInvalidException("Work item " + item.id() + " has no description");
            }
            for (Integer dep : item.dependencyIds()) {
                if (dep == null || dep < 0 || dep >= items.size()) {
                    throw new PlanInvalidException("Work item " + item.id()
                            + " depends on out-of-range index " + dep);
                }
                if (dep == i) {
                    throw new PlanInvalidException("Work item " + item.id() + " depends on itself");
                }
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
