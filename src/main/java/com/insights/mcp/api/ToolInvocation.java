package com.insights.mcp.api;

import java.util.Map;

/**
 * A single tool call with its parsed arguments.
 */
@FunctionalInterface
public interface ToolInvocation {
    Object invoke(Map<String, Object> args) throws Exception;
}
