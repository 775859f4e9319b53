package com.jumbo.projection.goal;

import java.util.List;
import java.util.Map;

/**
 * Row of {@code goal_views}. {@code embeddedContext} holds the optional context blocks captured
 * with the goal (invariants, guidelines, files to touch, ...) keyed by payload field name.
 */
public record GoalView(
    String goalId,
    String objective,
    List<String> successCriteria,
    List<String> scopeIn,
    List<String> scopeOut,
    List<String> boundaries,
    String status,
    String note,
    String claimedBy,
    String claimedAt,
    String claimExpiresAt,
    Map<String, Object> embeddedContext,
    List<String> progress,
    String nextGoalId,
    long version,
    String createdAt,
    String updatedAt
) {
}
