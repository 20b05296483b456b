package com.ivamare.transition.repository.impl;

import com.ivamare.transition.model.ComplianceRecord;
import com.ivamare.transition.repository.ComplianceRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;

/**
 * JDBC implementation of ComplianceRepository.
 */
public class JdbcComplianceRepository implements ComplianceRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ComplianceRecordRowMapper rowMapper = new ComplianceRecordRowMapper();

    public JdbcComplianceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long record(ComplianceRecord record) {
        String sql = """
            INSERT INTO transition_engine.compliance_log
                (entity_type, entity_id, user_id, rule_id, rule_name, is_compliant, message, ts)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """;

        Long id = jdbcTemplate.queryForObject(sql, Long.class,
            record.entityType(),
            record.entityId(),
            record.userId(),
            record.ruleId(),
            record.ruleName(),
            record.compliant(),
            record.message(),
            Timestamp.from(record.timestamp())
        );
        if (id == null) {
            throw new IllegalStateException("Compliance insert returned no id");
        }
        return id;
    }

    @Override
    public List<ComplianceRecord> findByEntity(String entityType, String entityId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        String sql = """
            SELECT id, entity_type, entity_id, user_id, rule_id, rule_name, is_compliant, message, ts
            FROM transition_engine.compliance_log
            WHERE entity_type = ? AND entity_id = ?
            ORDER BY ts DESC, id DESC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, rowMapper, entityType, entityId, limit);
    }

    private static class ComplianceRecordRowMapper implements RowMapper<ComplianceRecord> {
        @Override
        public ComplianceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ComplianceRecord(
                rs.getLong("id"),
                rs.getString("entity_type"),
                rs.getString("entity_id"),
                rs.getString("user_id"),
                rs.getString("rule_id"),
                rs.getString("rule_name"),
                rs.getBoolean("is_compliant"),
                rs.getString("message"),
                rs.getTimestamp("ts").toInstant()
            );
        }
    }
}
