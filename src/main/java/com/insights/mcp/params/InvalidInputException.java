package com.insights.mcp.params;

import com.insights.mcp.InsightsException;

/**
 * The raw request could not be read at all: malformed JSON or a top level that is not an object.
 */
public class InvalidInputException extends InsightsException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
