package com.vivek.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A single file-scoped unit of generation work within a run plan.
 *
 * @param id            unique identifier (e.g., "ITEM-001")
 * @param filePath      file to create or modify, relative to the project root
 * @param fileStatus    whether the file is new or already exists
 * @param mode          what to generate: implementation or tests
 * @param description   what this item should accomplish
 * @param dependencyIds indices into the plan's item list that must complete first
 * @param tags          retrieval tags assigned by the planner (may be empty)
 * @param language      programming language hint (may be empty)
 */
public record WorkItem(
    String id,
    String filePath,
    FileStatus fileStatus,
    ExecutionMode mode,
    String description,
    List<Integer> dependencyIds,
    List<String> tags,
    String language
) implements Serializable {

    public WorkItem {
        fileStatus = fileStatus != null ? fileStatus : FileStatus.NEW;
        mode = mode != null ? mode : ExecutionMode.CODER;
        dependencyIds = dependencyIds != null ? List.copyOf(dependencyIds) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
        language = language != null ? language : "";
    }

    public WorkItem(String id, String filePath, ExecutionMode mode, String description,
                    List<Integer> dependencyIds) {
        this(id, filePath, FileStatus.NEW, mode, description, dependencyIds, List.of(), "");
    }

    /**
     * Tags used to retrieve and record context for this item: the planner's tags plus
     * a file tag and a mode tag, so that feedback recorded for the item is always
     * reachable from the item's own next iteration.
     */
    public List<String> effectiveTags() {
        var all = new java.util.ArrayList<String>(tags.size() + 2);
        all.addAll(tags);
        all.add("file:" + filePath);
        all.add("mode:" + mode.label());
        return List.copyOf(all);
    }
}
