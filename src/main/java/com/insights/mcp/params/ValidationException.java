package com.insights.mcp.params;

import com.insights.mcp.InsightsException;

/**
 * A field is missing, mistyped or mis-shaped. Always names the offending field.
 */
public class ValidationException extends InsightsException {
    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public static ValidationException missing(String field, String expected) {
        return new ValidationException(field, "Missing required param: " + field + " (" + expected + ")");
    }

    public static ValidationException shape(String field, String expected) {
        return new ValidationException(field, field + " must be " + expected);
    }

    public String getField() {
        return field;
    }
}
