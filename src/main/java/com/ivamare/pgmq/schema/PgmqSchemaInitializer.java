package com.ivamare.pgmq.schema;

import com.ivamare.pgmq.exception.PgmqExceptionTranslator;
import com.ivamare.pgmq.retry.BoundedRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Objects;

/**
 * Installs the PGMQ extension.
 *
 * <p>Meant for application startup, when the database may still be starting: the statement is
 * repeated under the supplied {@link BoundedRetry} until it succeeds or attempts run out.
 */
public class PgmqSchemaInitializer {

    private static final Logger log = LoggerFactory.getLogger(PgmqSchemaInitializer.class);

    static final String CREATE_EXTENSION_SQL = "CREATE EXTENSION IF NOT EXISTS pgmq CASCADE";
    static final String EXTENSION_EXISTS_SQL = "SELECT EXISTS (SELECT 1 FROM pg_extension WHERE extname = 'pgmq')";

    private final JdbcTemplate jdbcTemplate;
    private final BoundedRetry retry;

    public PgmqSchemaInitializer(JdbcTemplate jdbcTemplate, BoundedRetry retry) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.retry = Objects.requireNonNull(retry, "retry");
    }

    /**
     * Create the pgmq extension (and its dependencies) if it is not installed yet.
     *
     * <p>The raw Spring exception is retried so the transient classification sees the
     * original cause; the final failure is translated.
     */
    public void ensureExtension() {
        try {
            retry.run("Create pgmq extension", () -> jdbcTemplate.execute(CREATE_EXTENSION_SQL));
        } catch (DataAccessException e) {
            throw PgmqExceptionTranslator.translate("create pgmq extension", null, e);
        }
        log.info("pgmq extension is installed");
    }

    /**
     * @return true if the pgmq extension is installed in the current database
     */
    public boolean isExtensionInstalled() {
        try {
            return Boolean.TRUE.equals(jdbcTemplate.queryForObject(EXTENSION_EXISTS_SQL, Boolean.class));
        } catch (DataAccessException e) {
            throw PgmqExceptionTranslator.translate("check pgmq extension", null, e);
        }
    }
}
