package com.ivamare.pgmq.client.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.pgmq.client.PgmqClient;
import com.ivamare.pgmq.client.PgmqDialect;
import com.ivamare.pgmq.client.QueueNames;
import com.ivamare.pgmq.exception.PgmqException;
import com.ivamare.pgmq.exception.PgmqExceptionTranslator;
import com.ivamare.pgmq.exception.QueueAlreadyExistsException;
import com.ivamare.pgmq.exception.UnsupportedQueueOperationException;
import com.ivamare.pgmq.model.PartitionOptions;
import com.ivamare.pgmq.model.PgmqMessage;
import com.ivamare.pgmq.model.QueueInfo;
import com.ivamare.pgmq.model.QueueMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * JdbcTemplate-based implementation of PgmqClient.
 *
 * <p>JdbcTemplate borrows a connection from the pool for each statement and returns it when
 * the statement completes, so one instance can be shared between threads.
 */
public class JdbcPgmqClient implements PgmqClient {

    private static final Logger log = LoggerFactory.getLogger(JdbcPgmqClient.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final RowMapper<Boolean> ROW_PRESENT = (rs, rowNum) -> Boolean.TRUE;

    /** Visibility timeout used by {@link #readOne(String)} unless configured otherwise. */
    public static final int DEFAULT_VISIBILITY_TIMEOUT_SECONDS = 30;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final PgmqDialect dialect;
    private final int defaultVisibilityTimeout;
    private final PartitionOptions defaultPartitionOptions;

    public JdbcPgmqClient(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this(jdbcTemplate, objectMapper, PgmqDialect.LEGACY,
            DEFAULT_VISIBILITY_TIMEOUT_SECONDS, PartitionOptions.defaults());
    }

    public JdbcPgmqClient(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, PgmqDialect dialect,
                          int defaultVisibilityTimeout, PartitionOptions defaultPartitionOptions) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.defaultPartitionOptions = Objects.requireNonNull(defaultPartitionOptions, "defaultPartitionOptions");
        requireNonNegative("defaultVisibilityTimeout", defaultVisibilityTimeout);
        this.defaultVisibilityTimeout = defaultVisibilityTimeout;
    }

    // --- Queue lifecycle ---

    @Override
    public void createQueue(String queueName) {
        QueueNames.validate(queueName);
        String table = dialect.queueTable(queueName);

        List<Boolean> created = execute("create queue", queueName,
            () -> jdbcTemplate.query(dialect.createSql(), ROW_PRESENT, queueName, table));

        if (created.isEmpty()) {
            throw new QueueAlreadyExistsException(queueName);
        }
        log.info("Created queue {}", queueName);
    }

    @Override
    public void createPartitionedQueue(String queueName) {
        createPartitionedQueue(queueName, defaultPartitionOptions);
    }

    @Override
    public void createPartitionedQueue(String queueName, PartitionOptions options) {
        QueueNames.validate(queueName);
        Objects.requireNonNull(options, "options");
        if (options.hasRetentionInterval() && !dialect.supportsRetention()) {
            throw new UnsupportedQueueOperationException("Partition retention", dialect);
        }

        String table = dialect.queueTable(queueName);
        Object[] params;
        if (dialect.supportsRetention()) {
            long retention = options.hasRetentionInterval()
                ? options.retentionInterval()
                : PgmqDialect.DEFAULT_RETENTION_INTERVAL;
            params = new Object[] {
                queueName, String.valueOf(options.partitionSize()), String.valueOf(retention), table
            };
        } else {
            params = new Object[] {queueName, options.partitionSize(), table};
        }

        List<Boolean> created = execute("create partitioned queue", queueName,
            () -> jdbcTemplate.query(dialect.createPartitionedSql(), ROW_PRESENT, params));

        if (created.isEmpty()) {
            throw new QueueAlreadyExistsException(queueName);
        }
        log.info("Created partitioned queue {} (partitionSize={})", queueName, options.partitionSize());
    }

    @Override
    public boolean dropQueue(String queueName) {
        QueueNames.validate(queueName);
        String table = dialect.queueTable(queueName);

        List<Boolean> dropped = execute("drop queue", queueName,
            () -> jdbcTemplate.query(dialect.dropQueueSql(), ROW_PRESENT, queueName, table));

        if (dropped.isEmpty()) {
            log.debug("Queue {} not dropped: does not exist", queueName);
            return false;
        }
        log.info("Dropped queue {}", queueName);
        return true;
    }

    @Override
    public List<QueueInfo> listQueues() {
        return execute("list queues", null,
            () -> jdbcTemplate.query(dialect.listQueuesSql(), this::mapToQueueInfo));
    }

    // --- Sending ---

    @Override
    public long send(String queueName, Map<String, Object> message) {
        return send(queueName, message, 0);
    }

    @Override
    public long send(String queueName, Map<String, Object> message, int delaySeconds) {
        QueueNames.validate(queueName);
        Objects.requireNonNull(message, "message");
        requireNonNegative("delaySeconds", delaySeconds);
        if (delaySeconds > 0 && !dialect.supportsDelay()) {
            throw new UnsupportedQueueOperationException("Delayed send", dialect);
        }

        String json = toJson(message);
        Object[] params = dialect.supportsDelay()
            ? new Object[] {queueName, json, delaySeconds}
            : new Object[] {queueName, json};

        Long msgId = execute("send", queueName,
            () -> jdbcTemplate.queryForObject(dialect.sendSql(), Long.class, params));

        if (msgId == null) {
            throw new PgmqException("No message id returned when sending to queue " + queueName);
        }

        log.debug("Sent message to {}: msgId={}", queueName, msgId);
        return msgId;
    }

    @Override
    public List<Long> sendBatch(String queueName, List<Map<String, Object>> messages) {
        return sendBatch(queueName, messages, 0);
    }

    @Override
    public List<Long> sendBatch(String queueName, List<Map<String, Object>> messages, int delaySeconds) {
        QueueNames.validate(queueName);
        Objects.requireNonNull(messages, "messages");
        requireNonNegative("delaySeconds", delaySeconds);
        if (messages.isEmpty()) {
            return List.of();
        }
        if (!dialect.supportsBatchSend()) {
            throw new UnsupportedQueueOperationException("Batch send", dialect);
        }

        Object[] params = new Object[messages.size() + 2];
        params[0] = queueName;
        for (int i = 0; i < messages.size(); i++) {
            params[i + 1] = toJson(Objects.requireNonNull(messages.get(i), "message"));
        }
        params[params.length - 1] = delaySeconds;

        List<Long> msgIds = execute("send batch", queueName,
            () -> jdbcTemplate.query(dialect.sendBatchSql(messages.size()), (rs, rowNum) -> rs.getLong(1), params));

        log.debug("Sent {} messages to {}", msgIds.size(), queueName);
        return msgIds;
    }

    // --- Reading ---

    @Override
    public List<PgmqMessage> read(String queueName, int visibilityTimeoutSeconds, int limit) {
        QueueNames.validate(queueName);
        requireNonNegative("visibilityTimeoutSeconds", visibilityTimeoutSeconds);
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }

        List<PgmqMessage> messages = execute("read", queueName,
            () -> jdbcTemplate.query(dialect.readSql(), this::mapToPgmqMessage,
                queueName, visibilityTimeoutSeconds, limit));

        log.debug("Read {} message(s) from {} (vt={}s, limit={})",
            messages.size(), queueName, visibilityTimeoutSeconds, limit);
        return messages;
    }

    @Override
    public Optional<PgmqMessage> readOne(String queueName) {
        return readOne(queueName, defaultVisibilityTimeout);
    }

    @Override
    public Optional<PgmqMessage> pop(String queueName) {
        QueueNames.validate(queueName);

        List<PgmqMessage> messages = execute("pop", queueName,
            () -> jdbcTemplate.query(dialect.popSql(), this::mapToPgmqMessage, queueName));

        return first(messages);
    }

    @Override
    public Optional<PgmqMessage> setVisibilityTimeout(String queueName, long msgId, int visibilityTimeoutSeconds) {
        QueueNames.validate(queueName);
        requireValidMsgId(msgId);
        requireNonNegative("visibilityTimeoutSeconds", visibilityTimeoutSeconds);

        List<PgmqMessage> updated = execute("set visibility timeout", queueName,
            () -> jdbcTemplate.query(dialect.setVisibilityTimeoutSql(), this::mapToPgmqMessage,
                queueName, msgId, visibilityTimeoutSeconds));

        if (updated.isEmpty()) {
            log.debug("Message {} not found in {}, visibility timeout unchanged", msgId, queueName);
        }
        return first(updated);
    }

    // --- Completion ---

    @Override
    public boolean delete(String queueName, long msgId) {
        QueueNames.validate(queueName);
        requireValidMsgId(msgId);

        Boolean result = execute("delete", queueName,
            () -> jdbcTemplate.queryForObject(dialect.deleteSql(), Boolean.class, queueName, msgId));

        boolean deleted = Boolean.TRUE.equals(result);
        if (!deleted) {
            log.debug("Message {} not found in {}, nothing deleted", msgId, queueName);
        }
        return deleted;
    }

    @Override
    public boolean archive(String queueName, long msgId) {
        QueueNames.validate(queueName);
        requireValidMsgId(msgId);

        Boolean result = execute("archive", queueName,
            () -> jdbcTemplate.queryForObject(dialect.archiveSql(), Boolean.class, queueName, msgId));

        boolean archived = Boolean.TRUE.equals(result);
        if (!archived) {
            log.debug("Message {} not found in {}, nothing archived", msgId, queueName);
        }
        return archived;
    }

    @Override
    public Optional<PgmqMessage> readArchived(String queueName, long msgId) {
        QueueNames.validate(queueName);
        requireValidMsgId(msgId);

        List<PgmqMessage> results = execute("read archive", queueName,
            () -> jdbcTemplate.query(dialect.readArchivedSql(queueName), this::mapToPgmqMessage, msgId));

        return first(results);
    }

    @Override
    public QueueMetrics metrics(String queueName) {
        QueueNames.validate(queueName);

        List<QueueMetrics> results = execute("read metrics", queueName,
            () -> jdbcTemplate.query(dialect.metricsSql(), this::mapToQueueMetrics, queueName));

        if (results.isEmpty()) {
            throw new PgmqException("No metrics returned for queue " + queueName);
        }
        return results.get(0);
    }

    @Override
    public PgmqDialect dialect() {
        return dialect;
    }

    // --- Helper Methods ---

    private <T> T execute(String operation, String queueName, Supplier<T> statement) {
        try {
            return statement.get();
        } catch (DataAccessException e) {
            throw PgmqExceptionTranslator.translate(operation, queueName, e);
        }
    }

    private PgmqMessage mapToPgmqMessage(ResultSet rs, int rowNum) throws SQLException {
        long msgId = rs.getLong("msg_id");
        int readCount = rs.getInt("read_ct");

        Timestamp enqueuedAt = rs.getTimestamp("enqueued_at");
        Timestamp vt = rs.getTimestamp("vt");

        Map<String, Object> message = fromJson(rs.getString("message"));

        return new PgmqMessage(
            msgId,
            readCount,
            enqueuedAt != null ? enqueuedAt.toInstant() : null,
            vt != null ? vt.toInstant() : null,
            message
        );
    }

    private QueueInfo mapToQueueInfo(ResultSet rs, int rowNum) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new QueueInfo(
            rs.getString("queue_name"),
            rs.getBoolean("is_partitioned"),
            createdAt != null ? createdAt.toInstant() : null
        );
    }

    private QueueMetrics mapToQueueMetrics(ResultSet rs, int rowNum) throws SQLException {
        return new QueueMetrics(
            rs.getString("queue_name"),
            rs.getLong("queue_length"),
            nullableInt(rs, "newest_msg_age_sec"),
            nullableInt(rs, "oldest_msg_age_sec")
        );
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private String toJson(Map<String, Object> map) {
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new PgmqException("Failed to serialize message to JSON", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new PgmqException("Failed to deserialize message from JSON", e);
        }
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
    }

    private static void requireValidMsgId(long msgId) {
        if (msgId < 0) {
            throw new IllegalArgumentException("msgId must not be negative, got " + msgId);
        }
    }
}
