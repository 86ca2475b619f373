package com.flowhouse.query;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Sparse throughput time series: bucket timestamp to series key to value.
 *
 * Timestamps are epoch seconds. Values are unsigned 64-bit quantities stored in a
 * {@code long}. Adding a value for an existing (timestamp, key) pair replaces it.
 * Instances are built by one request and not shared.
 */
public class FlowSeries {

    private final TreeMap<Long, Map<String, Long>> points = new TreeMap<>();
    private final TreeSet<String> keys = new TreeSet<>();

    public void add(long timestamp, String key, long value) {
        points.computeIfAbsent(timestamp, ts -> new HashMap<>()).put(key, value);
        keys.add(key);
    }

    /**
     * Distinct timestamps, ascending
     */
    public NavigableSet<Long> getTimestamps() {
        return Collections.unmodifiableNavigableSet(points.navigableKeySet());
    }

    /**
     * Distinct series keys, in lexicographic order
     */
    public SortedSet<String> getKeys() {
        return Collections.unmodifiableSortedSet(keys);
    }

    /**
     * Value at a timestamp for a key, or 0 when the combination has no data
     */
    public long getValue(long timestamp, String key) {
        Map<String, Long> row = points.get(timestamp);
        if (row == null) {
            return 0L;
        }
        return row.getOrDefault(key, 0L);
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * Number of (timestamp, key) data points
     */
    public int size() {
        return points.values().stream().mapToInt(Map::size).sum();
    }
}
