package com.insights.mcp.params;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Validates one JSON value and converts it to its typed form.
 */
@FunctionalInterface
public interface FieldParser<T> {

    /**
     * @param field name of the field being parsed, used in error messages
     * @param value the raw value, never null or JSON null
     * @throws ValidationException if the value has the wrong shape
     */
    T parse(String field, JsonNode value) throws ValidationException;
}
