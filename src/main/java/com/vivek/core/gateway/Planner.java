package com.vivek.core.gateway;

import com.vivek.core.model.WorkItem;

import java.util.List;

/**
 * Breaks a natural-language request into file-scoped work items.
 */
@FunctionalInterface
public interface Planner {

    /**
     * @return work items whose dependency ids index into the returned list
     * @throws com.vivek.core.scheduler.PlanInvalidException if no usable plan can be produced
     */
    List<WorkItem> plan(String request);
}
