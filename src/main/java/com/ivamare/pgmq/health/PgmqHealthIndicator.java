package com.ivamare.pgmq.health;

import com.ivamare.pgmq.client.PgmqDialect;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Health indicator for PGMQ availability.
 *
 * <p>Checks:
 * <ul>
 *   <li>A pooled connection is valid (when a DataSource is given)</li>
 *   <li>PGMQ extension is installed</li>
 *   <li>Reports the number of queues and HikariCP pool usage</li>
 * </ul>
 */
public class PgmqHealthIndicator implements HealthIndicator {

    private static final int CONNECTION_VALIDITY_TIMEOUT_SECONDS = 3;

    private final JdbcTemplate jdbcTemplate;
    private final DataSource dataSource;
    private final PgmqDialect dialect;

    public PgmqHealthIndicator(JdbcTemplate jdbcTemplate, PgmqDialect dialect) {
        this(jdbcTemplate, null, dialect);
    }

    public PgmqHealthIndicator(JdbcTemplate jdbcTemplate, DataSource dataSource, PgmqDialect dialect) {
        this.jdbcTemplate = jdbcTemplate;
        this.dataSource = dataSource;
        this.dialect = dialect;
    }

    @Override
    public Health health() {
        try {
            if (dataSource != null && !isConnectionValid()) {
                return Health.down()
                    .withDetail("error", "Database connection invalid")
                    .build();
            }

            Boolean pgmqAvailable = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM pg_extension WHERE extname = 'pgmq')",
                Boolean.class
            );

            if (!Boolean.TRUE.equals(pgmqAvailable)) {
                return Health.down()
                    .withDetail("error", "PGMQ extension not installed")
                    .build();
            }

            Integer queueCount = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM (" + dialect.listQueuesSql() + ") q",
                Integer.class
            );

            Health.Builder builder = Health.up()
                .withDetail("pgmq", "available")
                .withDetail("dialect", dialect.name())
                .withDetail("queues", queueCount != null ? queueCount : 0);

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
