package com.jumbo.projection.goal;

import java.util.List;
import java.util.Optional;

public interface GoalReader {

    Optional<GoalView> findById(String goalId);

    List<GoalView> findByStatus(String status);

    List<GoalView> findAll();
}
