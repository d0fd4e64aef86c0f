package com.ivamare.pgmq.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PgmqDialectTest {

    @Nested
    @DisplayName("LEGACY")
    class LegacyTests {

        private final PgmqDialect dialect = PgmqDialect.LEGACY;

        @Test
        void shouldUsePublicPrefixedFunctions() {
            assertEquals("SELECT pgmq_create(?) WHERE to_regclass(?::text) IS NULL", dialect.createSql());
            assertEquals("SELECT pgmq_send(?, ?::json)", dialect.sendSql());
            assertEquals("SELECT pgmq_archive(?, ?::bigint)", dialect.archiveSql());
            assertEquals("SELECT pgmq_delete(?, ?::bigint)", dialect.deleteSql());
            assertEquals("SELECT msg_id, read_ct, enqueued_at, vt, message FROM pgmq_read(?, ?, ?)", dialect.readSql());
        }

        @Test
        void shouldNameTablesInPublicSchema() {
            assertEquals("public.pgmq_orders", dialect.queueTable("orders"));
            assertEquals("public.pgmq_orders_archive", dialect.archiveTable("orders"));
        }

        @Test
        void shouldNotSupportNewerFeatures() {
            assertFalse(dialect.supportsDelay());
            assertFalse(dialect.supportsBatchSend());
            assertFalse(dialect.supportsRetention());
        }
    }

    @Nested
    @DisplayName("SCHEMA")
    class SchemaTests {

        private final PgmqDialect dialect = PgmqDialect.SCHEMA;

        @Test
        void shouldUseSchemaQualifiedFunctions() {
            assertEquals("SELECT pgmq.create(?) WHERE to_regclass(?::text) IS NULL", dialect.createSql());
            assertEquals("SELECT pgmq.send(?, ?::jsonb, ?)", dialect.sendSql());
            assertEquals("SELECT pgmq.drop_queue(?) WHERE to_regclass(?::text) IS NOT NULL", dialect.dropQueueSql());
            assertEquals(
                "SELECT pgmq.create_partitioned(?, ?, ?) WHERE to_regclass(?::text) IS NULL",
                dialect.createPartitionedSql());
        }

        @Test
        void shouldNameTablesInPgmqSchema() {
            assertEquals("pgmq.q_orders", dialect.queueTable("orders"));
            assertEquals("pgmq.a_orders", dialect.archiveTable("orders"));
        }

        @Test
        void shouldBuildOnePlaceholderPerBatchMessage() {
            assertEquals(
                "SELECT * FROM pgmq.send_batch(?, ARRAY[?::jsonb, ?::jsonb, ?::jsonb]::jsonb[], ?)",
                dialect.sendBatchSql(3));
        }

        @Test
        void shouldSupportNewerFeatures() {
            assertTrue(dialect.supportsDelay());
            assertTrue(dialect.supportsBatchSend());
            assertTrue(dialect.supportsRetention());
        }
    }
}
