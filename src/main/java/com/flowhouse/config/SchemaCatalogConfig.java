package com.flowhouse.config;

import com.flowhouse.schema.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the schema catalog once at startup from the configured dictionary bindings
 */
@Configuration
public class SchemaCatalogConfig {
    private static final Logger logger = LoggerFactory.getLogger(SchemaCatalogConfig.class);

    @Bean
    public SchemaCatalog schemaCatalog(DictionaryProperties dictionaryProperties) {
        SchemaCatalog catalog = SchemaCatalog.forFlows(dictionaryProperties.toBindings());
        logger.info("Schema catalog initialized with {} fields and {} dictionary bindings",
            catalog.getFields().size(), catalog.getBindings().size());
        return catalog;
    }
}
