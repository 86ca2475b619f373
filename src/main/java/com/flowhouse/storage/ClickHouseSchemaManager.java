package com.flowhouse.storage;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;

/**
 * Manages ClickHouse schema creation
 */
@Component
public class ClickHouseSchemaManager {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseSchemaManager.class);

    private final JdbcTemplate jdbcTemplate;
    private final int retentionDays;

    public ClickHouseSchemaManager(
            @Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate,
            @Value("${flowhouse.storage.retention-days:14}") int retentionDays) {
        this.jdbcTemplate = jdbcTemplate;
        this.retentionDays = retentionDays;
    }

    /**
     * Create tables on startup
     */
    @PostConstruct
    public void createTables() {
        try {
            createFlowsTable();
            logger.info("ClickHouse schema initialized successfully");
        } catch (Exception e) {
            logger.error("Failed to initialize ClickHouse schema", e);
            // Don't throw - queries report their own failures
        }
    }

    /**
     * Create the flows table, partitioned in ten-minute slices with a retention TTL
     */
    void createFlowsTable() {
        String sql = """
            CREATE TABLE IF NOT EXISTS flows (
                agent           IPv6,
                int_in          UInt32,
                int_out         UInt32,
                src_ip_addr     IPv6,
                dst_ip_addr     IPv6,
                src_ip_pfx_addr IPv6,
                src_ip_pfx_len  UInt8,
                dst_ip_pfx_addr IPv6,
                dst_ip_pfx_len  UInt8,
                src_asn         UInt32,
                dst_asn         UInt32,
                ip_protocol     UInt8,
                src_port        UInt16,
                dst_port        UInt16,
                timestamp       DateTime,
                size            UInt64,
                packets         UInt64,
                samplerate      UInt64
            )
            ENGINE = MergeTree()
            PARTITION BY toStartOfTenMinutes(timestamp)
            ORDER BY (timestamp)
            TTL timestamp + INTERVAL %d DAY
            SETTINGS index_granularity = 8192
            """.formatted(retentionDays);

        jdbcTemplate.execute(sql);
        logger.info("Created table: flows with ten-minute partitioning and {}-day TTL", retentionDays);
    }
}
