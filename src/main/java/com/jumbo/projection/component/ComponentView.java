package com.jumbo.projection.component;

public record ComponentView(
    String componentId,
    String name,
    String type,
    String description,
    String responsibility,
    String path,
    String status,
    String deprecationReason,
    long version,
    String createdAt,
    String updatedAt
) {
}
