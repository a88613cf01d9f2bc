package com.strata.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;

/**
 * Connection pool for the relational entity catalog.
 */
@Configuration
public class CatalogConfig {
    private static final Logger logger = LoggerFactory.getLogger(CatalogConfig.class);

    @Value("${strata.catalog.url:jdbc:postgresql://localhost:5432/sentry}")
    private String url;

    @Value("${strata.catalog.username:postgres}")
    private String username;

    @Value("${strata.catalog.password:}")
    private String password;

    @Value("${strata.catalog.pool.size:10}")
    private int poolSize;

    @Bean(name = "catalogDataSource")
    public DataSource catalogDataSource() {
        try {
            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(url);
            config.setUsername(username);
            config.setPassword(password);
            config.setPoolName("strata-catalog");
            config.setReadOnly(true);

            config.setMaximumPoolSize(poolSize);
            config.setMinimumIdle(2);
            config.setConnectionTimeout(30000);
            config.setIdleTimeout(600000);
            config.setMaxLifetime(1800000);
            // Pool starts even when the catalog is briefly unreachable.
            config.setInitializationFailTimeout(-1);

            HikariDataSource dataSource = new HikariDataSource(config);

            logger.info("Catalog DataSource initialized: {}", url);
            return dataSource;

        } catch (Exception e) {
            logger.error("Failed to initialize catalog DataSource", e);
            throw new IllegalStateException("Catalog DataSource initialization failed", e);
        }
    }

    @Bean(name = "catalogJdbcTemplate")
    public NamedParameterJdbcTemplate catalogJdbcTemplate(@Qualifier("catalogDataSource") DataSource catalogDataSource) {
        return new NamedParameterJdbcTemplate(catalogDataSource);
    }
}
