package com.segments.config;

import com.segments.infrastructure.store.JdbcReportingStore;
import com.segments.infrastructure.store.ReportingStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Store wiring. The Hikari pool behind {@code dataSource} opens its first connection
 * lazily and is closed by the context on shutdown.
 */
@Configuration
public class StoreConfig {

    @Bean
    public ReportingStore reportingStore(DataSource dataSource, ReportingProperties properties) {
        JdbcTemplate queries = new JdbcTemplate(dataSource);
        queries.setQueryTimeout(properties.getQueryTimeoutSeconds());

        // exports are unbounded: no timeout, rows streamed by the driver
        JdbcTemplate exports = new JdbcTemplate(dataSource);
        exports.setFetchSize(properties.getExportFetchSize());

        return new JdbcReportingStore(queries, exports);
    }
}
