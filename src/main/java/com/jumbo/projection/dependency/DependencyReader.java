package com.jumbo.projection.dependency;

import java.util.List;
import java.util.Optional;

public interface DependencyReader {

    Optional<DependencyView> findById(String dependencyId);

    /** {@code status} null means any status. */
    List<DependencyView> findAll(String status);

    List<DependencyView> findByConsumerId(String consumerId);

    List<DependencyView> findByProviderId(String providerId);
}
