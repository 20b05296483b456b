package com.ivamare.transition.health;

import com.ivamare.transition.rules.RuleStore;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Health indicator for the Transition Engine.
 *
 * <p>Checks:
 * <ul>
 *   <li>transition_engine schema exists</li>
 *   <li>Reports loaded entity types and logged attempt counts</li>
 * </ul>
 */
public class TransitionEngineHealthIndicator implements HealthIndicator {

    private static final int CONNECTION_VALIDITY_TIMEOUT_SECONDS = 3;

    private final JdbcTemplate jdbcTemplate;
    private final RuleStore ruleStore;
    private final DataSource dataSource;

    public TransitionEngineHealthIndicator(JdbcTemplate jdbcTemplate, RuleStore ruleStore) {
        this(jdbcTemplate, ruleStore, null);
    }

    public TransitionEngineHealthIndicator(JdbcTemplate jdbcTemplate, RuleStore ruleStore, DataSource dataSource) {
        this.jdbcTemplate = jdbcTemplate;
        this.ruleStore = ruleStore;
        this.dataSource = dataSource;
    }

    @Override
    public Health health() {
        try {
            if (dataSource != null && !isConnectionValid()) {
                return Health.down()
                    .withDetail("error", "Database connection invalid")
                    .build();
            }

            Boolean schemaExists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM information_schema.schemata WHERE schema_name = 'transition_engine')",
                Boolean.class
            );

            if (!Boolean.TRUE.equals(schemaExists)) {
                return Health.down()
                    .withDetail("error", "transition_engine schema not found")
                    .build();
            }

            Long attempts = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM transition_engine.transaction_log",
                Long.class
            );

            Long failedAttempts = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM transition_engine.transaction_log WHERE success = false",
                Long.class
            );

            Health.Builder builder = Health.up()
                .withDetail("schema", "transition_engine")
                .withDetail("entityTypes", ruleStore.listEntityTypes())
                .withDetail("attempts", attempts != null ? attempts : 0L)
                .withDetail("failedAttempts", failedAttempts != null ? failedAttempts : 0L);

            addPoolStats(builder);

            return builder.build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private boolean isConnectionValid() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(CONNECTION_VALIDITY_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    private void addPoolStats(Health.Builder builder) {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                builder.withDetail("pool.active", pool.getActiveConnections());
                builder.withDetail("pool.idle", pool.getIdleConnections());
                builder.withDetail("pool.total", pool.getTotalConnections());
                builder.withDetail("pool.pending", pool.getThreadsAwaitingConnection());
            }
        }
    }
}
