package com.flowhouse.schema;

/**
 * Thrown when a logical field name cannot be mapped to a SQL expression.
 *
 * Resolution failures are recoverable: the query builder drops the offending
 * breakdown field or filter and carries on with the rest of the request.
 */
public class ResolutionException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Why a field could not be resolved
     */
    public enum Reason {
        /** Plain name that is neither a catalog field nor a flows column */
        UNKNOWN_FIELD,
        /** Dictionary-qualified name whose base field has no dictionary binding */
        MISSING_DICTIONARY,
        /** Name containing characters that are not allowed in an identifier */
        INVALID_NAME
    }

    private final String field;
    private final Reason reason;

    public ResolutionException(String field, Reason reason, String message) {
        super(message);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " [Field: " + field + ", Reason: " + reason + "]";
    }
}
