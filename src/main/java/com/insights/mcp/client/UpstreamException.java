package com.insights.mcp.client;

import com.insights.mcp.InsightsException;

/**
 * The data engine could not be reached, reported an error, or answered with an unexpected shape.
 */
public class UpstreamException extends InsightsException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
