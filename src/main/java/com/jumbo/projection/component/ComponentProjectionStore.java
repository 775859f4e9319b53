package com.jumbo.projection.component;

import com.jumbo.projection.JdbcProjectionStore;
import com.jumbo.projection.JsonColumns;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class ComponentProjectionStore extends JdbcProjectionStore implements ComponentReader {

    private static final Set<String> UPDATABLE = Set.of(
        "type", "description", "responsibility", "path", "status", "deprecationReason", "version", "updatedAt");

    private static final RowMapper<ComponentView> ROW_MAPPER = (rs, rowNum) -> new ComponentView(
        rs.getString("componentId"),
        rs.getString("name"),
        rs.getString("type"),
        rs.getString("description"),
        rs.getString("responsibility"),
        rs.getString("path"),
        rs.getString("status"),
        rs.getString("deprecationReason"),
        rs.getLong("version"),
        rs.getString("createdAt"),
        rs.getString("updatedAt")
    );

    public ComponentProjectionStore(JdbcTemplate jdbcTemplate, JsonColumns json) {
        super(jdbcTemplate, json, "component_views", "componentId", UPDATABLE);
    }

    public void insert(ComponentView component) {
        jdbcTemplate.update("""
            INSERT OR REPLACE INTO component_views (
                componentId, name, type, description, responsibility, path, status,
                deprecationReason, version, createdAt, updatedAt
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            component.componentId(),
            component.name(),
            component.type(),
            component.description(),
            component.responsibility(),
            component.path(),
            component.status(),
            component.deprecationReason(),
            component.version(),
            component.createdAt(),
            component.updatedAt());
    }

    @Override
    public Optional<ComponentView> findById(String componentId) {
        return jdbcTemplate.query("SELECT * FROM component_views WHERE componentId = ?", ROW_MAPPER, componentId)
            .stream()
            .findFirst();
    }

    @Override
    public List<ComponentView> findAll(String status) {
        if (status == null) {
            return jdbcTemplate.query("SELECT * FROM component_views ORDER BY name, componentId", ROW_MAPPER);
        }
        return jdbcTemplate.query(
            "SELECT * FROM component_views WHERE status = ? ORDER BY name, componentId", ROW_MAPPER, status);
    }
}
