package com.ivamare.transition.repository.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.transition.exception.TransactionLogException;
import com.ivamare.transition.model.Actor;
import com.ivamare.transition.model.TransitionAttempt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcTransactionLogRepositoryTest {

    private static final Actor ACTOR = Actor.of("7", "alice");

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcTransactionLogRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcTransactionLogRepository(jdbcTemplate, new ObjectMapper(), 100);
    }

    @Nested
    class AppendTests {

        @Test
        void shouldInsertAttemptAndReturnGeneratedId() {
            when(jdbcTemplate.queryForObject(contains("INSERT INTO transition_engine.transaction_log"),
                eq(Long.class), any(Object[].class))).thenReturn(17L);

            long id = repository.append(TransitionAttempt.succeeded(
                "task", "42", "pending", "in_progress", ACTOR, Map.of("source", "api"), 5L, null));

            assertEquals(17L, id);
            ArgumentCaptor<Object[]> args = ArgumentCaptor.forClass(Object[].class);
            verify(jdbcTemplate).queryForObject(anyString(), eq(Long.class), args.capture());
            Object[] values = args.getValue();
            assertEquals(12, values.length);
            assertEquals("task", values[0]);
            assertEquals("42", values[1]);
            assertEquals("7", values[4]);
            assertInstanceOf(Timestamp.class, values[6]);
            assertEquals(true, values[7]);
            assertNull(values[8]);
            assertTrue(((String) values[9]).contains("\"source\":\"api\""));
            assertEquals(5L, values[10]);
        }

        @Test
        void shouldStoreNullMetadataWhenEmpty() {
            when(jdbcTemplate.queryForObject(anyString(), eq(Long.class), any(Object[].class))).thenReturn(1L);

            repository.append(TransitionAttempt.failed(
                "task", "42", "pending", "completed", ACTOR, "invalid transition", Map.of(), 0L, "tx-1"));

            ArgumentCaptor<Object[]> args = ArgumentCaptor.forClass(Object[].class);
            verify(jdbcTemplate).queryForObject(anyString(), eq(Long.class), args.capture());
            assertEquals("invalid transition", args.getValue()[8]);
            assertNull(args.getValue()[9]);
            assertEquals("tx-1", args.getValue()[11]);
        }

        @Test
        void shouldWrapDatabaseFailure() {
            when(jdbcTemplate.queryForObject(anyString(), eq(Long.class), any(Object[].class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

            TransactionLogException e = assertThrows(TransactionLogException.class, () -> repository.append(
                TransitionAttempt.succeeded("task", "42", "pending", "in_progress", ACTOR, null, 1L, null)));

            assertInstanceOf(DataAccessResourceFailureException.class, e.getCause());
        }

        @Test
        void shouldFailWhenNoIdReturned() {
            when(jdbcTemplate.queryForObject(anyString(), eq(Long.class), any(Object[].class))).thenReturn(null);

            assertThrows(TransactionLogException.class, () -> repository.append(
                TransitionAttempt.succeeded("task", "42", "pending", "in_progress", ACTOR, null, 1L, null)));
        }
    }

    @Nested
    class HistoryTests {

        @Test
        @SuppressWarnings("unchecked")
        void shouldQueryNewestFirst() {
            when(jdbcTemplate.query(
                contains("ORDER BY ts DESC, id DESC"),
                any(RowMapper.class),
                eq("task"), eq("42"), eq(20)
            )).thenReturn(List.of());

            List<TransitionAttempt> result = repository.getEntityHistory("task", "42", 20);

            assertTrue(result.isEmpty());
        }

        @Test
        @SuppressWarnings("unchecked")
        void shouldCapLimit() {
            when(jdbcTemplate.query(anyString(), any(RowMapper.class), eq("task"), eq("42"), eq(100)))
                .thenReturn(List.of());

            repository.getEntityHistory("task", "42", 10_000);

            verify(jdbcTemplate).query(anyString(), any(RowMapper.class), eq("task"), eq("42"), eq(100));
        }

        @Test
        void shouldRejectNonPositiveLimit() {
            assertThrows(IllegalArgumentException.class, () -> repository.getEntityHistory("task", "42", 0));
            verifyNoInteractions(jdbcTemplate);
        }

        @Test
        @SuppressWarnings("unchecked")
        void shouldMapRows() throws Exception {
            ResultSet rs = mock(ResultSet.class);
            Instant ts = Instant.parse("2026-03-01T10:15:30Z");
            when(rs.getLong("id")).thenReturn(3L);
            when(rs.getString("entity_type")).thenReturn("task");
            when(rs.getString("entity_id")).thenReturn("42");
            when(rs.getString("from_state")).thenReturn("pending");
            when(rs.getString("to_state")).thenReturn("completed");
            when(rs.getString("user_id")).thenReturn("7");
            when(rs.getString("username")).thenReturn("alice");
            when(rs.getTimestamp("ts")).thenReturn(Timestamp.from(ts));
            when(rs.getBoolean("success")).thenReturn(false);
            when(rs.getString("failure_reason")).thenReturn("invalid transition");
            when(rs.getString("metadata")).thenReturn("{\"source\":\"api\"}");
            when(rs.getLong("duration_ms")).thenReturn(0L);
            when(rs.wasNull()).thenReturn(true);
            when(rs.getString("transaction_id")).thenReturn(null);

            when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class)))
                .thenAnswer(invocation -> {
                    RowMapper<TransitionAttempt> mapper = invocation.getArgument(1);
                    return List.of(mapper.mapRow(rs, 0));
                });

            List<TransitionAttempt> result = repository.getEntityHistory("task", "42", 10);

            assertEquals(1, result.size());
            TransitionAttempt attempt = result.get(0);
            assertEquals(3L, attempt.id());
            assertEquals(ts, attempt.timestamp());
            assertFalse(attempt.success());
            assertEquals("invalid transition", attempt.failureReason());
            assertEquals("api", attempt.metadata().get("source"));
            assertNull(attempt.durationMs());
            assertNull(attempt.transactionId());
        }

        @Test
        @SuppressWarnings("unchecked")
        void shouldReturnEmptyMetadataWhenUnreadable() throws Exception {
            ResultSet rs = mock(ResultSet.class);
            when(rs.getTimestamp("ts")).thenReturn(Timestamp.from(Instant.now()));
            when(rs.getBoolean("success")).thenReturn(true);
            lenient().when(rs.getString("metadata")).thenReturn("not json");

            when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class)))
                .thenAnswer(invocation -> {
                    RowMapper<TransitionAttempt> mapper = invocation.getArgument(1);
                    return List.of(mapper.mapRow(rs, 0));
                });

            List<TransitionAttempt> result = repository.getEntityHistory("task", "42", 10);

            assertTrue(result.get(0).metadata().isEmpty());
        }
    }

    @Nested
    class CorrelationTests {

        @Test
        @SuppressWarnings("unchecked")
        void shouldQueryByTransactionIdInChronologicalOrder() {
            when(jdbcTemplate.query(
                contains("WHERE transaction_id = ? ORDER BY ts ASC, id ASC"),
                any(RowMapper.class),
                eq("tx-1")
            )).thenReturn(List.of());

            assertTrue(repository.getByTransactionId("tx-1").isEmpty());
        }
    }

    @Nested
    class CountTests {

        @Test
        void shouldCountAll() {
            when(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM transition_engine.transaction_log", Long.class)).thenReturn(12L);

            assertEquals(12L, repository.count(null));
        }

        @Test
        void shouldCountByOutcome() {
            when(jdbcTemplate.queryForObject(contains("WHERE success = ?"), eq(Long.class), eq(false)))
                .thenReturn(4L);

            assertEquals(4L, repository.count(false));
        }

        @Test
        void shouldTreatNullCountAsZero() {
            when(jdbcTemplate.queryForObject(anyString(), eq(Long.class))).thenReturn(null);

            assertEquals(0L, repository.count(null));
        }
    }
}
