package com.insights.mcp.telemetry;

import java.util.Map;

import com.insights.mcp.api.ToolInvocation;

/**
 * Tool invocation wrapper that times the call and records its sizes.
 * The wrapped call's return value is handed back untouched.
 */
public class TelemetryInterceptor implements ToolInvocation {
    private final ToolInvocation wrapped;
    private final TelemetryLogger telemetryLogger;
    private final String toolName;

    public TelemetryInterceptor(ToolInvocation wrapped, TelemetryLogger logger, String toolName) {
        this.wrapped = wrapped;
        this.telemetryLogger = logger;
        this.toolName = toolName;
    }

    @Override
    public Object invoke(Map<String, Object> args) throws Exception {
        final long start = System.nanoTime();
        final Object response = wrapped.invoke(args);
        final double durationMs = (System.nanoTime() - start) / 1_000_000.0;
        telemetryLogger.logCall(toolName, args, response, durationMs);
        return response;
    }
}
