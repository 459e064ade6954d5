package com.insights.mcp.model;

import java.util.Arrays;
import java.util.List;

/**
 * One get_data filter triad, e.g. {@code ["within", "qual", [0, 2]]}.
 *
 * @param function  filter function name
 * @param column    column the function applies to
 * @param parameter function argument, any JSON value as plain Java (may be null)
 */
public record FilterCondition(String function, String column, Object parameter) {

    /** Wire form: a three element list. */
    public List<Object> toUpstream() {
        return Arrays.asList(function, column, parameter);
    }
}
