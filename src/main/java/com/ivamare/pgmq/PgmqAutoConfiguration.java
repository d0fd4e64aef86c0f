package com.ivamare.pgmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.pgmq.client.PgmqClient;
import com.ivamare.pgmq.client.PgmqClients;
import com.ivamare.pgmq.client.impl.JdbcPgmqClient;
import com.ivamare.pgmq.retry.BoundedRetry;
import com.ivamare.pgmq.schema.PgmqSchemaInitializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Auto-configuration for the PGMQ client.
 *
 * <p>Automatically configures, on top of the application's {@link JdbcTemplate}:
 * <ul>
 *   <li>PGMQ Client</li>
 *   <li>Bounded retry for startup tasks</li>
 *   <li>Schema initializer (runs on startup when {@code pgmq.initialize-schema=true})</li>
 * </ul>
 *
 * <p>When schema initialization is enabled the extension is installed before the client bean
 * is handed out, so beans that create queues at startup see an installed extension.
 *
 * <p>To disable auto-configuration:
 * <pre>
 * pgmq.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, JdbcTemplateAutoConfiguration.class})
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "pgmq", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PgmqProperties.class)
public class PgmqAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper pgmqObjectMapper() {
        return PgmqClients.defaultObjectMapper();
    }

    // --- PGMQ Client ---

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JdbcTemplate.class)
    public PgmqClient pgmqClient(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, PgmqProperties properties,
                                 ObjectProvider<PgmqSchemaInitializer> schemaInitializer) {
        // Forces the initializer, and with it CREATE EXTENSION, to run first
        schemaInitializer.getIfAvailable();
        return new JdbcPgmqClient(
            jdbcTemplate,
            objectMapper,
            properties.getDialect(),
            properties.getDefaultVisibilityTimeout(),
            properties.getDefaultPartitionOptions()
        );
    }

    // --- Retry ---

    @Bean
    @ConditionalOnMissingBean
    public BoundedRetry pgmqBoundedRetry(PgmqProperties properties) {
        return new BoundedRetry(properties.getRetry().toPolicy());
    }

    // --- Schema ---

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JdbcTemplate.class)
    public PgmqSchemaInitializer pgmqSchemaInitializer(JdbcTemplate jdbcTemplate, BoundedRetry retry,
                                                       PgmqProperties properties) {
        PgmqSchemaInitializer initializer = new PgmqSchemaInitializer(jdbcTemplate, retry);
        if (properties.isInitializeSchema()) {
            initializer.ensureExtension();
        }
        return initializer;
    }
}
