package com.flowhouse.query;

/**
 * Exception thrown when a flow query fails in or after the database:
 * connection problems, rejected statements, timeouts, undecodable results.
 */
public class QueryExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String query;

    public QueryExecutionException(String message) {
        super(message);
        this.query = null;
    }

    public QueryExecutionException(String message, String query) {
        super(message);
        this.query = query;
    }

    public QueryExecutionException(String message, String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        return sb.toString();
    }
}
