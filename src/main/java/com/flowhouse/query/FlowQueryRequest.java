package com.flowhouse.query;

import com.google.common.collect.ImmutableList;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A breakdown query as submitted by the query form.
 *
 * Breakdown order is significant: it defines the GROUP BY order and the order of
 * the components in every series key. Filters keep the order in which their
 * parameters arrived.
 */
public class FlowQueryRequest {

    public static final String PARAM_BREAKDOWN = "breakdown";
    public static final String PARAM_TIME_START = "time_start";
    public static final String PARAM_TIME_END = "time_end";
    public static final String FILTER_METADATA_PREFIX = "filter_field";

    private final List<String> breakdownFields;
    private final String timeStart;
    private final String timeEnd;
    private final Map<String, List<String>> filters;

    public FlowQueryRequest(
            List<String> breakdownFields,
            String timeStart,
            String timeEnd,
            Map<String, List<String>> filters) {
        this.breakdownFields = breakdownFields == null ? null : ImmutableList.copyOf(breakdownFields);
        this.timeStart = timeStart;
        this.timeEnd = timeEnd;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (filters != null) {
            filters.forEach((field, values) -> copy.put(field, ImmutableList.copyOf(values)));
        }
        this.filters = Collections.unmodifiableMap(copy);
    }

    /**
     * Build a request from raw query-string parameters.
     *
     * Every parameter other than the breakdown list, the time bounds and the
     * {@code filter_field*} form metadata is taken as a filter on the field of
     * the same name.
     */
    public static FlowQueryRequest fromParameters(Map<String, List<String>> parameters) {
        Map<String, List<String>> filters = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : parameters.entrySet()) {
            String name = entry.getKey();
            if (PARAM_BREAKDOWN.equals(name)
                    || PARAM_TIME_START.equals(name)
                    || PARAM_TIME_END.equals(name)
                    || name.startsWith(FILTER_METADATA_PREFIX)) {
                continue;
            }
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                continue;
            }
            filters.put(name, entry.getValue());
        }

        return new FlowQueryRequest(
            parameters.get(PARAM_BREAKDOWN),
            first(parameters.get(PARAM_TIME_START)),
            first(parameters.get(PARAM_TIME_END)),
            filters);
    }

    private static String first(List<String> values) {
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Breakdown fields in request order, or null when the parameter was absent
     */
    public List<String> getBreakdownFields() {
        return breakdownFields;
    }

    public String getTimeStart() {
        return timeStart;
    }

    public String getTimeEnd() {
        return timeEnd;
    }

    public Map<String, List<String>> getFilters() {
        return filters;
    }
}
