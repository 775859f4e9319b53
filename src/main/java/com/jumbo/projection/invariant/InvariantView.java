package com.jumbo.projection.invariant;

public record InvariantView(
    String invariantId,
    String title,
    String description,
    String rationale,
    String enforcement,
    long version,
    String createdAt,
    String updatedAt
) {
}
