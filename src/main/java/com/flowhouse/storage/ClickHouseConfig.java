package com.flowhouse.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * ClickHouse connection pool and the JdbcTemplate shared by flow queries,
 * dictionary lookups, inserts and schema setup.
 *
 * The pool starts even when ClickHouse is unreachable; requests fail individually
 * until it comes up. DateTime values are handed out in UTC.
 */
@Configuration
public class ClickHouseConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseConfig.class);

    static final String POOL_NAME = "flowhouse-clickhouse";

    private final ClickHouseProperties properties;

    public ClickHouseConfig(ClickHouseProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "clickHouseDataSource")
    public DataSource clickHouseDataSource() {
        HikariDataSource dataSource = new HikariDataSource(hikariConfig());
        logger.info("ClickHouse pool {} created for {} (max {} connections)",
            POOL_NAME, properties.getUrl(), properties.getPool().getSize());
        return dataSource;
    }

    @Bean(name = "clickHouseJdbcTemplate")
    public JdbcTemplate clickHouseJdbcTemplate(DataSource clickHouseDataSource) {
        return new JdbcTemplate(clickHouseDataSource);
    }

    HikariConfig hikariConfig() {
        ClickHouseProperties.Pool pool = properties.getPool();

        HikariConfig config = new HikariConfig();
        config.setPoolName(POOL_NAME);
        config.setJdbcUrl(properties.getUrl());
        config.setUsername(properties.getUsername());
        config.setPassword(properties.getPassword());
        config.setMaximumPoolSize(pool.getSize());
        config.setMinimumIdle(Math.min(pool.getMinIdle(), pool.getSize()));
        config.setConnectionTimeout(pool.getConnectionTimeout().toMillis());
        config.setInitializationFailTimeout(-1);
        config.setReadOnly(false);

        config.addDataSourceProperty("database", properties.getDatabase());
        config.addDataSourceProperty("socket_timeout", String.valueOf(properties.getSocketTimeout().toMillis()));
        config.addDataSourceProperty("max_execution_time", String.valueOf(properties.getMaxExecutionTime()));
        config.addDataSourceProperty("use_server_time_zone", "false");
        config.addDataSourceProperty("use_time_zone", "UTC");
        return config;
    }
}
