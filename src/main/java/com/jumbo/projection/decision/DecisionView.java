package com.jumbo.projection.decision;

import java.util.List;

public record DecisionView(
    String decisionId,
    String title,
    String context,
    String rationale,
    List<String> alternatives,
    String consequences,
    String status,
    String supersededBy,
    String reversalReason,
    String reversedAt,
    long version,
    String createdAt,
    String updatedAt
) {
}
