package com.flowhouse.query;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A generated aggregate statement with its bound parameters and the fields that
 * were dropped while building it.
 */
public class BuiltQuery {

    private final String sql;
    private final List<Object> parameters;
    private final List<String> breakdownFields;
    private final List<ResolutionWarning> warnings;

    public BuiltQuery(String sql, List<Object> parameters, List<String> breakdownFields,
                      List<ResolutionWarning> warnings) {
        this.sql = sql;
        this.parameters = ImmutableList.copyOf(parameters);
        this.breakdownFields = ImmutableList.copyOf(breakdownFields);
        this.warnings = ImmutableList.copyOf(warnings);
    }

    public String getSql() {
        return sql;
    }

    /**
     * Values for the statement's placeholders, in placeholder order
     */
    public List<Object> getParameters() {
        return parameters;
    }

    /**
     * Breakdown fields that made it into the statement, in select order
     */
    public List<String> getBreakdownFields() {
        return breakdownFields;
    }

    public List<ResolutionWarning> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
