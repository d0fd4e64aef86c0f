package com.ivamare.pgmq.client;

/**
 * The generation of the PGMQ SQL API a client talks to.
 *
 * <p>Both generations expose the same operations with the same positional parameters;
 * they differ in where the functions and queue tables live and in a few capabilities:
 * <ul>
 *   <li>{@link #LEGACY}: {@code pgmq_create}, {@code pgmq_send}, ... in the {@code public}
 *       schema, queue tables {@code pgmq_<queue>}. No delayed or batch send, no retention
 *       setting for partitioned queues. Only pre-1.0 extension releases ship these functions.</li>
 *   <li>{@link #SCHEMA}: {@code pgmq.create}, {@code pgmq.send}, ... in the {@code pgmq}
 *       schema, queue tables {@code pgmq.q_<queue>} and archives {@code pgmq.a_<queue>}.</li>
 * </ul>
 *
 * <p>Statements returned here embed only function and table names; queue names are always
 * bound as parameters, except in {@link #queueTable} and {@link #archiveTable} which callers
 * must feed with names already checked by {@link QueueNames#validate(String)}.
 */
public enum PgmqDialect {

    LEGACY("pgmq_", "json", false, false, false) {
        @Override
        public String queueTable(String queueName) {
            return "public.pgmq_" + queueName;
        }

        @Override
        public String archiveTable(String queueName) {
            return "public.pgmq_" + queueName + "_archive";
        }

        @Override
        public String createPartitionedSql() {
            return "SELECT pgmq_create_partitioned(?, ?) WHERE to_regclass(?::text) IS NULL";
        }

        @Override
        public String sendSql() {
            return "SELECT pgmq_send(?, ?::json)";
        }

        @Override
        public String listQueuesSql() {
            return "SELECT queue_name, false AS is_partitioned, created_at FROM pgmq_list_queues()";
        }
    },

    SCHEMA("pgmq.", "jsonb", true, true, true) {
        @Override
        public String queueTable(String queueName) {
            return "pgmq.q_" + queueName;
        }

        @Override
        public String archiveTable(String queueName) {
            return "pgmq.a_" + queueName;
        }

        @Override
        public String createPartitionedSql() {
            return "SELECT pgmq.create_partitioned(?, ?, ?) WHERE to_regclass(?::text) IS NULL";
        }

        @Override
        public String sendSql() {
            return "SELECT pgmq.send(?, ?::jsonb, ?)";
        }

        @Override
        public String listQueuesSql() {
            return "SELECT queue_name, is_partitioned, created_at FROM pgmq.list_queues()";
        }
    };

    /** Retention passed to {@code pgmq.create_partitioned} when none is given. */
    public static final long DEFAULT_RETENTION_INTERVAL = 100_000;

    private final String functionPrefix;
    private final String payloadType;
    private final boolean supportsDelay;
    private final boolean supportsBatchSend;
    private final boolean supportsRetention;

    PgmqDialect(String functionPrefix, String payloadType,
                boolean supportsDelay, boolean supportsBatchSend, boolean supportsRetention) {
        this.functionPrefix = functionPrefix;
        this.payloadType = payloadType;
        this.supportsDelay = supportsDelay;
        this.supportsBatchSend = supportsBatchSend;
        this.supportsRetention = supportsRetention;
    }

    /**
     * Fully qualified name of the table holding live messages.
     */
    public abstract String queueTable(String queueName);

    /**
     * Fully qualified name of the table holding archived messages.
     */
    public abstract String archiveTable(String queueName);

    /**
     * Guarded partitioned create. Legacy binds (name, size, table); schema binds
     * (name, size, retention, table).
     */
    public abstract String createPartitionedSql();

    /**
     * Send statement. Legacy binds (name, payload); schema binds (name, payload, delay).
     */
    public abstract String sendSql();

    public abstract String listQueuesSql();

    /**
     * Create a queue only when its table does not exist yet. Binds (name, table);
     * returns one row when the queue was created, none when it already existed.
     */
    public String createSql() {
        return "SELECT " + fn("create") + "(?) WHERE to_regclass(?::text) IS NULL";
    }

    /**
     * Drop a queue only when its table exists. Binds (name, table);
     * returns one row when the queue was dropped.
     */
    public String dropQueueSql() {
        return "SELECT " + fn("drop_queue") + "(?) WHERE to_regclass(?::text) IS NOT NULL";
    }

    /**
     * Batch send; binds (name, payload..., delay). Only meaningful when
     * {@link #supportsBatchSend()}.
     */
    public String sendBatchSql(int messageCount) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(fn("send_batch")).append("(?, ARRAY[");
        for (int i = 0; i < messageCount; i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append("?::").append(payloadType);
        }
        return sql.append("]::").append(payloadType).append("[], ?)").toString();
    }

    public String readSql() {
        return "SELECT msg_id, read_ct, enqueued_at, vt, message FROM " + fn("read") + "(?, ?, ?)";
    }

    public String popSql() {
        return "SELECT msg_id, read_ct, enqueued_at, vt, message FROM " + fn("pop") + "(?)";
    }

    public String setVisibilityTimeoutSql() {
        return "SELECT msg_id, read_ct, enqueued_at, vt, message FROM " + fn("set_vt") + "(?, ?::bigint, ?)";
    }

    public String archiveSql() {
        return "SELECT " + fn("archive") + "(?, ?::bigint)";
    }

    public String deleteSql() {
        return "SELECT " + fn("delete") + "(?, ?::bigint)";
    }

    public String metricsSql() {
        return "SELECT queue_name, queue_length, newest_msg_age_sec, oldest_msg_age_sec FROM "
            + fn("metrics") + "(?)";
    }

    /**
     * Look up an archived message; the archive table name is inlined.
     */
    public String readArchivedSql(String queueName) {
        return "SELECT msg_id, read_ct, enqueued_at, vt, message FROM " + archiveTable(queueName)
            + " WHERE msg_id = ?";
    }

    public boolean supportsDelay() {
        return supportsDelay;
    }

    public boolean supportsBatchSend() {
        return supportsBatchSend;
    }

    public boolean supportsRetention() {
        return supportsRetention;
    }

    private String fn(String name) {
        return functionPrefix + name;
    }
}
