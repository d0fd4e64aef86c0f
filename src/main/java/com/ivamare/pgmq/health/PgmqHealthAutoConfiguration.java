package com.ivamare.pgmq.health;

import com.ivamare.pgmq.PgmqAutoConfiguration;
import com.ivamare.pgmq.PgmqProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Auto-configuration for the PGMQ health indicator.
 */
@AutoConfiguration(after = PgmqAutoConfiguration.class)
@ConditionalOnClass({HealthIndicator.class, JdbcTemplate.class})
@ConditionalOnProperty(prefix = "pgmq", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PgmqHealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(PgmqHealthIndicator.class)
    @ConditionalOnBean({JdbcTemplate.class, PgmqProperties.class})
    public PgmqHealthIndicator pgmqHealthIndicator(JdbcTemplate jdbcTemplate,
                                                   ObjectProvider<DataSource> dataSource,
                                                   PgmqProperties properties) {
        return new PgmqHealthIndicator(jdbcTemplate, dataSource.getIfAvailable(), properties.getDialect());
    }
}
