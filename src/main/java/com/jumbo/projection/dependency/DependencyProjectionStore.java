package com.jumbo.projection.dependency;

import com.jumbo.projection.JdbcProjectionStore;
import com.jumbo.projection.JsonColumns;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class DependencyProjectionStore extends JdbcProjectionStore implements DependencyReader {

    private static final Set<String> UPDATABLE = Set.of(
        "endpoint", "contract", "status", "removedAt", "removalReason", "version", "updatedAt");

    private static final RowMapper<DependencyView> ROW_MAPPER = (rs, rowNum) -> new DependencyView(
        rs.getString("dependencyId"),
        rs.getString("consumerId"),
        rs.getString("providerId"),
        rs.getString("endpoint"),
        rs.getString("contract"),
        rs.getString("status"),
        rs.getString("removedAt"),
        rs.getString("removalReason"),
        rs.getLong("version"),
        rs.getString("createdAt"),
        rs.getString("updatedAt")
    );

    public DependencyProjectionStore(JdbcTemplate jdbcTemplate, JsonColumns json) {
        super(jdbcTemplate, json, "dependency_views", "dependencyId", UPDATABLE);
    }

    public void insert(DependencyView dependency) {
        jdbcTemplate.update("""
            INSERT OR REPLACE INTO dependency_views (
                dependencyId, consumerId, providerId, endpoint, contract, status,
                removedAt, removalReason, version, createdAt, updatedAt
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            dependency.dependencyId(),
            dependency.consumerId(),
            dependency.providerId(),
            dependency.endpoint(),
            dependency.contract(),
            dependency.status(),
            dependency.removedAt(),
            dependency.removalReason(),
            dependency.version(),
            dependency.createdAt(),
            dependency.updatedAt());
    }

    @Override
    public Optional<DependencyView> findById(String dependencyId) {
        return jdbcTemplate.query("SELECT * FROM dependency_views WHERE dependencyId = ?", ROW_MAPPER, dependencyId)
            .stream()
            .findFirst();
    }

    @Override
    public List<DependencyView> findAll(String status) {
        if (status == null) {
            return jdbcTemplate.query("SELECT * FROM dependency_views ORDER BY createdAt, dependencyId", ROW_MAPPER);
        }
        return jdbcTemplate.query(
            "SELECT * FROM dependency_views WHERE status = ? ORDER BY createdAt, dependencyId", ROW_MAPPER, status);
    }

    @Override
    public List<DependencyView> findByConsumerId(String consumerId) {
        return jdbcTemplate.query(
            "SELECT * FROM dependency_views WHERE consumerId = ? ORDER BY createdAt DESC", ROW_MAPPER, consumerId);
    }

    @Override
    public List<DependencyView> findByProviderId(String providerId) {
        return jdbcTemplate.query(
            "SELECT * FROM dependency_views WHERE providerId = ? ORDER BY createdAt DESC", ROW_MAPPER, providerId);
    }
}
