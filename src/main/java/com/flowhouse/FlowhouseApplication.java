package com.flowhouse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Flowhouse.
 *
 * Flowhouse stores sampled network flow records in ClickHouse and lets an operator
 * break traffic volume down by arbitrary flow dimensions over a time range.
 *
 * Key Features:
 * - Breakdown queries over raw, virtual and dictionary-enriched flow fields
 * - Throughput time series rendered as CSV, one column per breakdown combination
 * - Dictionary value lookups for building filter forms
 * - Batched flow inserts into a TTL-bounded MergeTree table
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FlowhouseApplication {

    /**
     * Main entry point for the Flowhouse application.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(FlowhouseApplication.class, args);
    }
}
