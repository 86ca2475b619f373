package com.flowhouse.query;

/**
 * Thrown when a query request is missing a required parameter or carries one
 * that cannot be parsed. Nothing has been sent to the database at that point.
 */
public class QueryValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        MISSING_BREAKDOWN,
        MISSING_START_TIME,
        MISSING_END_TIME,
        TIME_PARSE,
        INVERTED_TIME_RANGE
    }

    private final Reason reason;

    public QueryValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public QueryValidationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
