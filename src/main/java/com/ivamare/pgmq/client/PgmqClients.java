package com.ivamare.pgmq.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.pgmq.PgmqProperties;
import com.ivamare.pgmq.client.impl.PooledPgmqClient;
import com.ivamare.pgmq.exception.PgmqConnectionException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for clients that own their connection pool.
 *
 * <pre>
 * try (PooledPgmqClient client = PgmqClients.create(properties)) {
 *     client.createQueue("orders");
 *     long msgId = client.send("orders", Map.of("hello", "world"));
 * }
 * </pre>
 */
public final class PgmqClients {

    private static final Logger log = LoggerFactory.getLogger(PgmqClients.class);

    static final String POOL_NAME = "pgmq-pool";

    private PgmqClients() {
    }

    /**
     * Open a fixed-size pool for the configured database and wrap it in a client.
     *
     * @param properties connection, pool and client settings
     * @return a client that must be closed by the caller
     */
    public static PooledPgmqClient create(PgmqProperties properties) {
        return create(properties, defaultObjectMapper());
    }

    public static PooledPgmqClient create(PgmqProperties properties, ObjectMapper objectMapper) {
        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(hikariConfig(properties));
        } catch (HikariPool.PoolInitializationException e) {
            throw new PgmqConnectionException("Cannot open connection pool to " + properties.getJdbcUrl(), e);
        }
        log.info("Opened PGMQ connection pool to {} (size={}, dialect={})",
            properties.getJdbcUrl(), properties.getPoolSize(), properties.getDialect());
        return new PooledPgmqClient(
            dataSource,
            objectMapper,
            properties.getDialect(),
            properties.getDefaultVisibilityTimeout(),
            properties.getDefaultPartitionOptions()
        );
    }

    /**
     * Pool settings derived from the properties. A fixed pool: minimum idle equals maximum size.
     *
     * @param properties connection settings
     * @return HikariCP configuration
     */
    public static HikariConfig hikariConfig(PgmqProperties properties) {
        if (properties.getPoolSize() < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1, got " + properties.getPoolSize());
        }
        HikariConfig config = new HikariConfig();
        config.setPoolName(POOL_NAME);
        config.setJdbcUrl(properties.getJdbcUrl());
        config.setUsername(properties.getUsername());
        config.setPassword(properties.getPassword());
        config.setMaximumPoolSize(properties.getPoolSize());
        config.setMinimumIdle(properties.getPoolSize());
        config.setConnectionTimeout(properties.getConnectionTimeout().toMillis());
        return config;
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }
}
