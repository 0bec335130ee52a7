package com.vivek.core.context;

import java.util.List;

/**
 * A group of related tasks within a session, one per execution mode in a run.
 */
public record Activity(
    String id,
    String sessionId,
    String description,
    List<String> tags,
    String mode,
    String component,
    String plannerRationale
) {
    public Activity {
        tags = tags != null ? List.copyOf(tags) : List.of();
        mode = mode != null ? mode : "";
        component = component != null ? component : "";
        plannerRationale = plannerRationale != null ? plannerRationale : "";
    }
}
