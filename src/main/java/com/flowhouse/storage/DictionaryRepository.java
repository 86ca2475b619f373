package com.flowhouse.storage;

import com.flowhouse.domain.DictionaryBinding;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;

/**
 * Reads ClickHouse dictionary structure and contents.
 *
 * Dictionary descriptions rarely change and are read for every field catalog
 * request, so they are cached for a short while.
 */
@Repository
public class DictionaryRepository {
    private static final Logger logger = LoggerFactory.getLogger(DictionaryRepository.class);

    private static final int CACHE_MAX_SIZE = 256;

    private final JdbcTemplate jdbcTemplate;
    private final Cache<String, List<String>> describeCache;

    public DictionaryRepository(
            @Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate,
            @Value("${flowhouse.dictionaries.describe-cache-ttl:5m}") Duration describeCacheTtl) {
        this.jdbcTemplate = jdbcTemplate;
        this.describeCache = Caffeine.newBuilder()
            .maximumSize(CACHE_MAX_SIZE)
            .expireAfterWrite(describeCacheTtl)
            .recordStats()
            .build();
    }

    /**
     * Column names of a dictionary, key columns first
     *
     * @param dictionary dictionary name, optionally database-qualified
     * @return column names in dictionary order
     */
    public List<String> describeDictionary(String dictionary) {
        requireValidName(dictionary);
        return describeCache.get(dictionary, this::loadDescription);
    }

    private List<String> loadDescription(String dictionary) {
        String sql = "DESCRIBE TABLE dictionary('" + dictionary + "')";
        List<String> columns = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("name"));
        logger.debug("Dictionary {} has columns {}", dictionary, columns);
        return List.copyOf(columns);
    }

    /**
     * All values of one dictionary column, as text
     *
     * @param dictionary dictionary name
     * @param column column of that dictionary
     * @return values in storage order, possibly with duplicates and empty strings
     * @throws IllegalArgumentException if the column is not part of the dictionary
     */
    public List<String> dictionaryValues(String dictionary, String column) {
        List<String> columns = describeDictionary(dictionary);
        if (!columns.contains(column)) {
            throw new IllegalArgumentException(
                String.format("Dictionary %s has no column %s", dictionary, column));
        }

        String sql = "SELECT DISTINCT toString(" + column + ") FROM dictionary('" + dictionary + "')";
        long startQuery = System.currentTimeMillis();
        List<String> values = jdbcTemplate.queryForList(sql, String.class);
        logger.debug("Read {} values of {}.{} in {} ms",
            values.size(), dictionary, column, System.currentTimeMillis() - startQuery);
        return values;
    }

    private static void requireValidName(String dictionary) {
        if (!DictionaryBinding.isDictionaryName(dictionary)) {
            throw new IllegalArgumentException("Invalid dictionary name: " + dictionary);
        }
    }
}
