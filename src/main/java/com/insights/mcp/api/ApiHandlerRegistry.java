package com.insights.mcp.api;

import java.io.IOException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.insights.mcp.McpServerManager;
import com.insights.mcp.model.ToolResponse;
import com.insights.mcp.services.GuidanceResources;
import com.insights.mcp.telemetry.TelemetryInterceptor;
import com.insights.mcp.telemetry.TelemetryLogger;
import com.insights.mcp.utils.HttpUtils;
import com.insights.mcp.utils.Json;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * Registers and manages API endpoints for the HTTP server.
 * Tool endpoints are discovered from @McpTool methods on the given tool objects.
 */
public class ApiHandlerRegistry {
    private static final Logger LOG = LogManager.getLogger(ApiHandlerRegistry.class);

    static final String TOOLS_PATH = "/mcp/tools";
    static final String RESOURCES_PATH = "/mcp/resources";
    static final String RESOURCE_PATH = "/resources/";

    private final McpServerManager serverManager;
    private final TelemetryLogger telemetryLogger;
    private final GuidanceResources guidance;
    private final List<Object> toolProviders;
    private final List<ToolDef> toolDefs = new ArrayList<>();

    /**
     * @param telemetryLogger records each tool call, or null to record nothing
     * @param toolProviders   objects whose @McpTool methods become endpoints
     */
    public ApiHandlerRegistry(McpServerManager serverManager, TelemetryLogger telemetryLogger,
                              GuidanceResources guidance, Object... toolProviders) {
        this.serverManager = serverManager;
        this.telemetryLogger = telemetryLogger;
        this.guidance = guidance;
        this.toolProviders = List.of(toolProviders);
    }

    /**
     * Register all API endpoints with the server
     */
    public void registerAllEndpoints() {
        if (!serverManager.isServerRunning()) {
            LOG.warn("Cannot register endpoints: Server is not running");
            return;
        }

        final HttpServer server = serverManager.getServer();
        for (final Object provider : toolProviders) {
            registerTools(server, provider);
        }
        server.createContext(TOOLS_PATH, exchange ->
            HttpUtils.sendJson(exchange, Json.serialize(toolDefs.stream().map(ToolDef::toToolMap).toList())));
        server.createContext(RESOURCES_PATH, exchange ->
            HttpUtils.sendJson(exchange, Json.serialize(guidance.list())));
        server.createContext(RESOURCE_PATH, this::serveResource);

        LOG.info("Registered {} tool endpoints", toolDefs.size());
    }

    /**
     * Tools found so far, in registration order.
     */
    public List<ToolDef> getToolDefs() {
        return List.copyOf(toolDefs);
    }

    /**
     * Discover the @McpTool methods of a provider, sorted by tool name.
     */
    public static List<ToolDef> discoverTools(final Class<?> providerType) {
        final List<ToolDef> defs = new ArrayList<>();
        for (final Method method : providerType.getMethods()) {
            final McpTool annotation = method.getAnnotation(McpTool.class);
            if (annotation != null) {
                defs.add(ToolDef.fromMethod(method, annotation));
            }
        }
        defs.sort(Comparator.comparing(ToolDef::getName));
        return defs;
    }

    private void registerTools(final HttpServer server, final Object provider) {
        for (final ToolDef def : discoverTools(provider.getClass())) {
            ToolInvocation invocation = args -> def.invoke(provider, args);
            if (telemetryLogger != null) {
                invocation = new TelemetryInterceptor(invocation, telemetryLogger, def.getName());
            }
            final ToolInvocation call = invocation;
            server.createContext("/" + def.getName(), exchange -> handleTool(exchange, def, call));
            toolDefs.add(def);
        }
    }

    void handleTool(final HttpExchange exchange, final ToolDef def, final ToolInvocation call) throws IOException {
        final String expected = def.isPost() ? "POST" : "GET";
        if (!expected.equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, def.getName() + " expects " + expected);
            return;
        }

        final Map<String, Object> args;
        try {
            args = def.parseParams(exchange);
        } catch (IOException e) {
            LOG.warn("Bad request for {}: {}", def.getName(), e.getMessage());
            sendError(exchange, 400, e.getMessage());
            return;
        }

        final Object response;
        try {
            response = call.invoke(args);
        } catch (Exception e) {
            LOG.error("Tool {} failed", def.getName(), e);
            sendError(exchange, 500, "Error processing request: " + e.getMessage());
            return;
        }
        HttpUtils.sendJson(exchange, Json.serialize(response));
    }

    private void serveResource(final HttpExchange exchange) throws IOException {
        final String name = exchange.getRequestURI().getPath().substring(RESOURCE_PATH.length());
        final var document = guidance.read(name);
        if (document.isEmpty()) {
            sendError(exchange, 404, "Unknown resource: " + name);
            return;
        }
        HttpUtils.send(exchange, 200, HttpUtils.MARKDOWN_CONTENT_TYPE, document.get());
    }

    private static void sendError(final HttpExchange exchange, final int status, final String message) throws IOException {
        HttpUtils.send(exchange, status, HttpUtils.JSON_CONTENT_TYPE, Json.serialize(ToolResponse.error(message)));
    }
}
