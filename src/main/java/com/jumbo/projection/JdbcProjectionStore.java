package com.jumbo.projection;

import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared write plumbing of the projection tables: a single-key row, partial column updates
 * limited to a fixed set of column names, and deletes.
 */
public abstract class JdbcProjectionStore {

    protected final JdbcTemplate jdbcTemplate;
    protected final JsonColumns json;

    private final String table;
    private final String keyColumn;
    private final Set<String> updatableColumns;

    protected JdbcProjectionStore(JdbcTemplate jdbcTemplate, JsonColumns json,
                                  String table, String keyColumn, Set<String> updatableColumns) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.table = table;
        this.keyColumn = keyColumn;
        this.updatableColumns = updatableColumns;
    }

    /**
     * Sets the given columns on one row. Values are bound as-is, so list and object columns
     * must already be serialized.
     *
     * @return number of rows changed, 0 when the row does not exist
     */
    public int updateColumns(String key, Map<String, Object> changes) {
        if (changes.isEmpty()) {
            return 0;
        }
        StringBuilder sql = new StringBuilder("UPDATE ").append(table).append(" SET ");
        List<Object> args = new ArrayList<>(changes.size() + 1);
        for (Map.Entry<String, Object> change : changes.entrySet()) {
            if (!updatableColumns.contains(change.getKey())) {
                throw new IllegalArgumentException("Column " + change.getKey() + " is not updatable on " + table);
            }
            if (!args.isEmpty()) {
                sql.append(", ");
            }
            sql.append(change.getKey()).append(" = ?");
            args.add(change.getValue());
        }
        sql.append(" WHERE ").append(keyColumn).append(" = ?");
        args.add(key);
        return jdbcTemplate.update(sql.toString(), args.toArray());
    }

    public int delete(String key) {
        return jdbcTemplate.update("DELETE FROM " + table + " WHERE " + keyColumn + " = ?", key);
    }

    public int count() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }
}
