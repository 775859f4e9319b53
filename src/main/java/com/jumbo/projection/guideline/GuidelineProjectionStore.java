package com.jumbo.projection.guideline;

import com.jumbo.projection.JdbcProjectionStore;
import com.jumbo.projection.JsonColumns;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class GuidelineProjectionStore extends JdbcProjectionStore implements GuidelineReader {

    private static final Set<String> UPDATABLE = Set.of(
        "category", "title", "description", "rationale", "enforcement", "examples",
        "isRemoved", "removedAt", "removalReason", "version", "updatedAt");

    private final RowMapper<GuidelineView> rowMapper = (rs, rowNum) -> new GuidelineView(
        rs.getString("guidelineId"),
        rs.getString("category"),
        rs.getString("title"),
        rs.getString("description"),
        rs.getString("rationale"),
        rs.getString("enforcement"),
        json.readStrings(rs.getString("examples")),
        rs.getInt("isRemoved") == 1,
        rs.getString("removedAt"),
        rs.getString("removalReason"),
        rs.getLong("version"),
        rs.getString("createdAt"),
        rs.getString("updatedAt")
    );

    public GuidelineProjectionStore(JdbcTemplate jdbcTemplate, JsonColumns json) {
        super(jdbcTemplate, json, "guideline_views", "guidelineId", UPDATABLE);
    }

    public void insert(GuidelineView guideline) {
        jdbcTemplate.update("""
            INSERT OR REPLACE INTO guideline_views (
                guidelineId, category, title, description, rationale, enforcement, examples,
                isRemoved, removedAt, removalReason, version, createdAt, updatedAt
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            guideline.guidelineId(),
            guideline.category(),
            guideline.title(),
            guideline.description(),
            guideline.rationale(),
            guideline.enforcement(),
            json.writeList(guideline.examples()),
            guideline.removed() ? 1 : 0,
            guideline.removedAt(),
            guideline.removalReason(),
            guideline.version(),
            guideline.createdAt(),
            guideline.updatedAt());
    }

    @Override
    public Optional<GuidelineView> findById(String guidelineId) {
        return jdbcTemplate.query("SELECT * FROM guideline_views WHERE guidelineId = ?", rowMapper, guidelineId)
            .stream()
            .findFirst();
    }

    @Override
    public List<GuidelineView> findAll(String category) {
        if (category == null) {
            return jdbcTemplate.query(
                "SELECT * FROM guideline_views WHERE isRemoved = 0 ORDER BY category, createdAt", rowMapper);
        }
        return jdbcTemplate.query(
            "SELECT * FROM guideline_views WHERE isRemoved = 0 AND category = ? ORDER BY createdAt", rowMapper, category);
    }
}
