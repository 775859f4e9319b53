package com.jumbo.projection.guideline;

import java.util.List;

/**
 * An execution rule for the project. {@code category} is one of testing, codingStyle, process,
 * communication, documentation, security, performance or other.
 */
public record GuidelineView(
    String guidelineId,
    String category,
    String title,
    String description,
    String rationale,
    String enforcement,
    List<String> examples,
    boolean removed,
    String removedAt,
    String removalReason,
    long version,
    String createdAt,
    String updatedAt
) {
}
