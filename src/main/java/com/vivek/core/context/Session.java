package com.vivek.core.context;

import java.time.Instant;

/**
 * Top-level context record: one per orchestration run.
 */
public record Session(
    String id,
    String originalRequest,
    String highLevelPlan,
    Instant createdAt
) {}
