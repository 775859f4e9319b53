package com.jumbo.projection.invariant;

import java.util.List;
import java.util.Optional;

public interface InvariantReader {

    Optional<InvariantView> findById(String invariantId);

    List<InvariantView> findAll();
}
