package com.ivamare.pgmq;

import com.ivamare.pgmq.client.PgmqDialect;
import com.ivamare.pgmq.model.PartitionOptions;
import com.ivamare.pgmq.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the PGMQ client.
 *
 * <p>Example configuration:
 * <pre>
 * pgmq:
 *   host: localhost
 *   port: 5432
 *   database: postgres
 *   username: postgres
 *   password: postgres
 *   pool-size: 10
 *   dialect: schema
 *   default-visibility-timeout: 30
 *   partition-size: 5000
 *   initialize-schema: true
 *   retry:
 *     max-attempts: 5
 *     backoff: 2s
 * </pre>
 *
 * <p>Every key can be supplied from the environment through relaxed binding,
 * e.g. {@code PGMQ_HOST} or {@code PGMQ_POOL_SIZE}.
 */
@ConfigurationProperties(prefix = "pgmq")
public class PgmqProperties {

    /**
     * Enable/disable PGMQ auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Database host, used when the client owns its connection pool.
     */
    private String host = "localhost";

    /**
     * Database port.
     */
    private int port = 5432;

    /**
     * Database name.
     */
    private String database = "postgres";

    private String username = "postgres";

    private String password = "postgres";

    /**
     * Fixed number of pooled connections.
     */
    private int poolSize = 10;

    /**
     * How long to wait for a pooled connection before failing.
     */
    private Duration connectionTimeout = Duration.ofSeconds(30);

    /**
     * PGMQ SQL API generation: LEGACY (pgmq_* functions) or SCHEMA (pgmq.* functions).
     * LEGACY only targets pre-1.0 extension releases; use SCHEMA for pgmq 1.0 and later.
     */
    private PgmqDialect dialect = PgmqDialect.LEGACY;

    /**
     * Visibility timeout in seconds for reads that do not pass one.
     */
    private int defaultVisibilityTimeout = 30;

    /**
     * Partition size for partitioned queues created without explicit options.
     */
    private long partitionSize = PartitionOptions.DEFAULT_PARTITION_SIZE;

    /**
     * Run CREATE EXTENSION IF NOT EXISTS pgmq on startup.
     */
    private boolean initializeSchema = false;

    /**
     * Retry settings for schema initialization.
     */
    private RetryProperties retry = new RetryProperties();

    /**
     * Build the JDBC URL for the configured host, port and database.
     *
     * @return a PostgreSQL JDBC URL
     */
    public String getJdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    /**
     * Partition options derived from {@link #getPartitionSize()}.
     *
     * @return default partition options
     */
    public PartitionOptions getDefaultPartitionOptions() {
        return PartitionOptions.ofSize(partitionSize);
    }

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public void setConnectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
    }

    public PgmqDialect getDialect() {
        return dialect;
    }

    public void setDialect(PgmqDialect dialect) {
        this.dialect = dialect;
    }

    public int getDefaultVisibilityTimeout() {
        return defaultVisibilityTimeout;
    }

    public void setDefaultVisibilityTimeout(int defaultVisibilityTimeout) {
        this.defaultVisibilityTimeout = defaultVisibilityTimeout;
    }

    public long getPartitionSize() {
        return partitionSize;
    }

    public void setPartitionSize(long partitionSize) {
        this.partitionSize = partitionSize;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    /**
     * Bounded retry configuration.
     */
    public static class RetryProperties {

        /**
         * Total attempts, including the first one.
         */
        private int maxAttempts = 5;

        /**
         * Fixed delay between attempts.
         */
        private Duration backoff = Duration.ofSeconds(2);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }

        /**
         * @return a fixed-delay policy built from these settings
         */
        public RetryPolicy toPolicy() {
            return RetryPolicy.fixed(maxAttempts, backoff);
        }
    }
}
