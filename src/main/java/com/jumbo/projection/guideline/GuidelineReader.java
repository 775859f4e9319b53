package com.jumbo.projection.guideline;

import java.util.List;
import java.util.Optional;

public interface GuidelineReader {

    /** Includes removed guidelines. */
    Optional<GuidelineView> findById(String guidelineId);

    /** Guidelines that are not removed; {@code category} null means every category. */
    List<GuidelineView> findAll(String category);
}
