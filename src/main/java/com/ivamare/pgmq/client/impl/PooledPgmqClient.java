package com.ivamare.pgmq.client.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.pgmq.client.PgmqDialect;
import com.ivamare.pgmq.model.PartitionOptions;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * A {@link JdbcPgmqClient} that owns its connection pool.
 *
 * <p>Closing the client closes the pool. Intended for callers that construct the client
 * themselves rather than receive it from a Spring context.
 */
public class PooledPgmqClient extends JdbcPgmqClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PooledPgmqClient.class);

    private final HikariDataSource dataSource;

    public PooledPgmqClient(HikariDataSource dataSource, ObjectMapper objectMapper, PgmqDialect dialect,
                            int defaultVisibilityTimeout, PartitionOptions defaultPartitionOptions) {
        super(new JdbcTemplate(dataSource), objectMapper, dialect, defaultVisibilityTimeout, defaultPartitionOptions);
        this.dataSource = dataSource;
    }

    public HikariDataSource getDataSource() {
        return dataSource;
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.info("Closed PGMQ connection pool {}", dataSource.getPoolName());
        }
    }
}
