package com.jumbo.projection.decision;

import java.util.List;
import java.util.Optional;

public interface DecisionReader {

    Optional<DecisionView> findById(String decisionId);

    /** {@code status} null means any status. */
    List<DecisionView> findAll(String status);
}
