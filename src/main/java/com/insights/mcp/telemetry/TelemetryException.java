package com.insights.mcp.telemetry;

import com.insights.mcp.InsightsException;

/**
 * The telemetry log could not be read, parsed or written.
 */
public class TelemetryException extends InsightsException {
    public TelemetryException(String message) {
        super(message);
    }

    public TelemetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
