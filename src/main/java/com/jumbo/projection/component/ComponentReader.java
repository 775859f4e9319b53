package com.jumbo.projection.component;

import java.util.List;
import java.util.Optional;

public interface ComponentReader {

    Optional<ComponentView> findById(String componentId);

    /** {@code status} null means any status. */
    List<ComponentView> findAll(String status);
}
