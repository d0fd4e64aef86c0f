package com.ivamare.pgmq.schema;

import com.ivamare.pgmq.exception.DatabaseExceptionClassifier;
import com.ivamare.pgmq.exception.PgmqConnectionException;
import com.ivamare.pgmq.exception.PgmqException;
import com.ivamare.pgmq.retry.BoundedRetry;
import com.ivamare.pgmq.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.SQLException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PgmqSchemaInitializerTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private PgmqSchemaInitializer initializer;

    @BeforeEach
    void setUp() {
        BoundedRetry retry = new BoundedRetry(RetryPolicy.fixed(3, Duration.ofSeconds(2)),
            DatabaseExceptionClassifier::isTransient, duration -> { });
        initializer = new PgmqSchemaInitializer(jdbcTemplate, retry);
    }

    @Test
    void shouldCreateExtension() {
        initializer.ensureExtension();

        verify(jdbcTemplate).execute(PgmqSchemaInitializer.CREATE_EXTENSION_SQL);
    }

    @Test
    void shouldRetryWhileDatabaseIsStarting() {
        doThrow(new CannotGetJdbcConnectionException("the database system is starting up"))
            .doNothing()
            .when(jdbcTemplate).execute(PgmqSchemaInitializer.CREATE_EXTENSION_SQL);

        initializer.ensureExtension();

        verify(jdbcTemplate, times(2)).execute(PgmqSchemaInitializer.CREATE_EXTENSION_SQL);
    }

    @Test
    void shouldTranslateFailureAfterAttemptsRunOut() {
        doThrow(new CannotGetJdbcConnectionException("refused"))
            .when(jdbcTemplate).execute(PgmqSchemaInitializer.CREATE_EXTENSION_SQL);

        assertThrows(PgmqConnectionException.class, () -> initializer.ensureExtension());

        verify(jdbcTemplate, times(3)).execute(PgmqSchemaInitializer.CREATE_EXTENSION_SQL);
    }

    @Test
    void shouldNotRetryPermanentFailures() {
        SQLException cause = new SQLException("extension \"pgmq\" is not available", "0A000");
        doThrow(new BadSqlGrammarException("create extension", PgmqSchemaInitializer.CREATE_EXTENSION_SQL, cause))
            .when(jdbcTemplate).execute(PgmqSchemaInitializer.CREATE_EXTENSION_SQL);

        PgmqException ex = assertThrows(PgmqException.class, () -> initializer.ensureExtension());

        assertEquals(PgmqException.class, ex.getClass());
        verify(jdbcTemplate, times(1)).execute(PgmqSchemaInitializer.CREATE_EXTENSION_SQL);
    }

    @Test
    void shouldReportInstalledExtension() {
        when(jdbcTemplate.queryForObject(eq(PgmqSchemaInitializer.EXTENSION_EXISTS_SQL), eq(Boolean.class)))
            .thenReturn(true);

        assertTrue(initializer.isExtensionInstalled());
    }

    @Test
    void shouldReportMissingExtension() {
        when(jdbcTemplate.queryForObject(eq(PgmqSchemaInitializer.EXTENSION_EXISTS_SQL), eq(Boolean.class)))
            .thenReturn(null);

        assertFalse(initializer.isExtensionInstalled());
    }
}
