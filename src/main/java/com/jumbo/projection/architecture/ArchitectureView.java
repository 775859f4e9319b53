package com.jumbo.projection.architecture;

import java.util.List;
import java.util.Map;

/**
 * The project's architecture. There is at most one; {@code dataStores} entries carry
 * {@code name}, {@code type} and {@code purpose}.
 */
public record ArchitectureView(
    String architectureId,
    String description,
    String organization,
    List<String> patterns,
    List<String> principles,
    List<Map<String, Object>> dataStores,
    List<String> stack,
    long version,
    String createdAt,
    String updatedAt
) {
}
