package com.insights.mcp;

/**
 * Base type for every failure a tool call can report back to its caller.
 * The message is what ends up in the {@code message} field of an error response.
 */
public abstract class InsightsException extends Exception {

    protected InsightsException(String message) {
        super(message);
    }

    protected InsightsException(String message, Throwable cause) {
        super(message, cause);
    }
}
