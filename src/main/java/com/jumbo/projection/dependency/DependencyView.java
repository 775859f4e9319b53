package com.jumbo.projection.dependency;

/**
 * A consumer component depending on a provider, optionally through an endpoint and contract.
 */
public record DependencyView(
    String dependencyId,
    String consumerId,
    String providerId,
    String endpoint,
    String contract,
    String status,
    String removedAt,
    String removalReason,
    long version,
    String createdAt,
    String updatedAt
) {
}
