package com.ivamare.transition.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.transition.exception.TransactionLogException;
import com.ivamare.transition.model.TransitionAttempt;
import com.ivamare.transition.repository.TransactionLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of TransactionLogRepository.
 *
 * <p>Rows go to {@code transition_engine.transaction_log}; ids come from the
 * table's sequence so concurrent writers never collide.
 */
public class JdbcTransactionLogRepository implements TransactionLogRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransactionLogRepository.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String INSERT_SQL = """
        INSERT INTO transition_engine.transaction_log
            (entity_type, entity_id, from_state, to_state, user_id, username, ts,
             success, failure_reason, metadata, duration_ms, transaction_id)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?)
        RETURNING id
        """;

    private static final String SELECT_COLUMNS = """
        SELECT id, entity_type, entity_id, from_state, to_state, user_id, username, ts,
               success, failure_reason, metadata, duration_ms, transaction_id
        FROM transition_engine.transaction_log
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final int maxLimit;
    private final RowMapper<TransitionAttempt> attemptMapper;

    public JdbcTransactionLogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, int maxLimit) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.maxLimit = maxLimit;
        this.attemptMapper = (rs, rowNum) -> {
            long durationMs = rs.getLong("duration_ms");
            Long duration = rs.wasNull() ? null : durationMs;
            return new TransitionAttempt(
                rs.getLong("id"),
                rs.getString("entity_type"),
                rs.getString("entity_id"),
                rs.getString("from_state"),
                rs.getString("to_state"),
                rs.getString("user_id"),
                rs.getString("username"),
                rs.getTimestamp("ts").toInstant(),
                rs.getBoolean("success"),
                rs.getString("failure_reason"),
                parseMetadata(rs.getLong("id"), rs.getString("metadata")),
                duration,
                rs.getString("transaction_id")
            );
        };
    }

    @Override
    public long append(TransitionAttempt attempt) {
        try {
            Long id = jdbcTemplate.queryForObject(
                INSERT_SQL,
                Long.class,
                attempt.entityType(),
                attempt.entityId(),
                attempt.fromState(),
                attempt.toState(),
                attempt.userId(),
                attempt.username(),
                Timestamp.from(attempt.timestamp()),
                attempt.success(),
                attempt.failureReason(),
                serializeMetadata(attempt.metadata()),
                attempt.durationMs(),
                attempt.transactionId()
            );
            if (id == null) {
                throw new IllegalStateException("Insert returned no id");
            }
            log.debug("Appended transition attempt {} for {}/{} (success={})",
                id, attempt.entityType(), attempt.entityId(), attempt.success());
            return id;
        } catch (DataAccessException | IllegalStateException | JsonProcessingException e) {
            throw new TransactionLogException(attempt.entityType(), attempt.entityId(), e);
        }
    }

    @Override
    public List<TransitionAttempt> getEntityHistory(String entityType, String entityId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE entity_type = ? AND entity_id = ? ORDER BY ts DESC, id DESC LIMIT ?",
            attemptMapper,
            entityType, entityId, Math.min(limit, maxLimit)
        );
    }

    @Override
    public List<TransitionAttempt> getByTransactionId(String transactionId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE transaction_id = ? ORDER BY ts ASC, id ASC",
            attemptMapper,
            transactionId
        );
    }

    @Override
    public long count(Boolean success) {
        Long count = success == null
            ? jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM transition_engine.transaction_log", Long.class)
            : jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM transition_engine.transaction_log WHERE success = ?", Long.class, success);
        return count != null ? count : 0L;
    }

    private String serializeMetadata(Map<String, Object> metadata) throws JsonProcessingException {
        if (metadata == null || metadata.isEmpty()) return null;
        return objectMapper.writeValueAsString(metadata);
    }

    private Map<String, Object> parseMetadata(long id, String json) {
        if (json == null) return Map.of();
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata on transaction log row {}: {}", id, e.getMessage());
            return Map.of();
        }
    }
}
