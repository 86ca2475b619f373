package com.flowhouse.query;

import com.flowhouse.schema.ResolutionException;

/**
 * Records a breakdown field or filter that was left out of a query because it
 * could not be resolved.
 */
public class ResolutionWarning {

    /**
     * Where the dropped field appeared in the request
     */
    public enum Role {
        BREAKDOWN,
        FILTER
    }

    private final String field;
    private final Role role;
    private final ResolutionException.Reason reason;
    private final String message;

    public ResolutionWarning(String field, Role role, ResolutionException.Reason reason, String message) {
        this.field = field;
        this.role = role;
        this.reason = reason;
        this.message = message;
    }

    static ResolutionWarning of(ResolutionException e, Role role) {
        return new ResolutionWarning(e.getField(), role, e.getReason(), e.getMessage());
    }

    public String getField() {
        return field;
    }

    public Role getRole() {
        return role;
    }

    public ResolutionException.Reason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return role + ":" + field + " (" + reason + ")";
    }
}
