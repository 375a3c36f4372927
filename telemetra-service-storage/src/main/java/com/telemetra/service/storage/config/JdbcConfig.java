package com.telemetra.service.storage.config;

import com.telemetra.service.core.config.TelemetraProperties;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Configuration
@ConditionalOnClass(NamedParameterJdbcTemplate.class)
@Slf4j
public class JdbcConfig {

    public static final String SCOPED_QUERY_JDBC_TEMPLATE = "scopedQueryJdbcTemplate";

    @Bean
    @Primary
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(JdbcTemplate jdbcTemplate) {
        return new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    /** Template for tenant ad-hoc queries: statement timeout and a hard row cap. */
    @Bean(SCOPED_QUERY_JDBC_TEMPLATE)
    public JdbcTemplate scopedQueryJdbcTemplate(DataSource dataSource, TelemetraProperties properties) {
        TelemetraProperties.Query query = properties.getQuery();
        JdbcTemplate template = new JdbcTemplate(dataSource);
        template.setQueryTimeout(query.getTimeoutSeconds());
        template.setMaxRows(query.getMaxLimit());
        log.info("Scoped query template timeout={}s maxRows={}", query.getTimeoutSeconds(), query.getMaxLimit());
        return template;
    }
}
