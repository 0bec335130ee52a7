package com.vivek.core.scheduler;

import com.vivek.core.model.WorkItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Execution order of a plan.
 *
 * @param batches ready batches; every item in batch k depends only on items in earlier batches
 */
public record Schedule(List<List<WorkItem>> batches) {

    public Schedule {
        batches = batches.stream().map(List::copyOf).toList();
    }

    /** Total order: the batches concatenated. */
    public List<WorkItem> order() {
        var order = new ArrayList<WorkItem>();
        batches.forEach(order::addAll);
        return List.copyOf(order);
    }

    public int size() {
        return batches.stream().mapToInt(List::size).sum();
    }
}
