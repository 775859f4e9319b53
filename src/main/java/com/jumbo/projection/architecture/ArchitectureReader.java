package com.jumbo.projection.architecture;

import java.util.Optional;

public interface ArchitectureReader {

    Optional<ArchitectureView> find();
}
