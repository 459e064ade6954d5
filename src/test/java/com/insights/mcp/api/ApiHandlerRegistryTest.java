package com.insights.mcp.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.JsonNode;
import com.insights.mcp.McpServerManager;
import com.insights.mcp.services.GuidanceResources;
import com.insights.mcp.services.InsightsTools;
import com.insights.mcp.utils.Json;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

@ExtendWith(MockitoExtension.class)
class ApiHandlerRegistryTest {

    @Mock
    private McpServerManager mockServerManager;

    @Mock
    private HttpServer mockHttpServer;

    @Mock
    private InsightsTools mockTools;

    private ApiHandlerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ApiHandlerRegistry(mockServerManager, null, new GuidanceResources(), mockTools);
    }

    @Test
    void testRegisterAllEndpoints_ServerNotRunning() {
        when(mockServerManager.isServerRunning()).thenReturn(false);

        registry.registerAllEndpoints();

        verify(mockServerManager, never()).getServer();
        assertTrue(registry.getToolDefs().isEmpty());
    }

    @Test
    void testRegisterAllEndpoints_RegistersToolsAndListings() {
        when(mockServerManager.isServerRunning()).thenReturn(true);
        when(mockServerManager.getServer()).thenReturn(mockHttpServer);

        registry.registerAllEndpoints();

        verify(mockHttpServer).createContext(eq("/insights_get_data"), any(HttpHandler.class));
        verify(mockHttpServer).createContext(eq("/insights_get_meta"), any(HttpHandler.class));
        verify(mockHttpServer).createContext(eq("/insights_get_countby"), any(HttpHandler.class));
        verify(mockHttpServer).createContext(eq("/mcp/tools"), any(HttpHandler.class));
        verify(mockHttpServer).createContext(eq("/mcp/resources"), any(HttpHandler.class));
        verify(mockHttpServer).createContext(eq("/resources/"), any(HttpHandler.class));
        assertEquals(3, registry.getToolDefs().size());
    }

    // =========================================================================
    // handleTool
    // =========================================================================

    private static HttpExchange exchange(String method, String body, ByteArrayOutputStream out) {
        final HttpExchange exchange = mock(HttpExchange.class);
        when(exchange.getRequestMethod()).thenReturn(method);
        if (body != null) {
            when(exchange.getRequestBody()).thenReturn(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
        }
        when(exchange.getResponseHeaders()).thenReturn(new Headers());
        when(exchange.getResponseBody()).thenReturn(out);
        return exchange;
    }

    private static ToolDef getDataDef() {
        return ApiHandlerRegistry.discoverTools(InsightsTools.class).stream()
            .filter(d -> d.getName().equals("insights_get_data"))
            .findFirst()
            .orElseThrow();
    }

    @Test
    void testHandleTool_Success() throws Exception {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final HttpExchange exchange = exchange("POST", "{\"query\": \"{}\"}", out);

        registry.handleTool(exchange, getDataDef(), args -> Map.of("echo", args.get("query")));

        verify(exchange).sendResponseHeaders(eq(200), anyLong());
        assertEquals("{\"echo\":\"{}\"}", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testHandleTool_WrongMethod() throws Exception {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final HttpExchange exchange = exchange("GET", null, out);

        registry.handleTool(exchange, getDataDef(), args -> {
            throw new AssertionError("must not be called");
        });

        verify(exchange).sendResponseHeaders(eq(405), anyLong());
        final JsonNode body = Json.parse(out.toString(StandardCharsets.UTF_8));
        assertEquals("error", body.get("status").asText());
    }

    @Test
    void testHandleTool_BadBody() throws Exception {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final HttpExchange exchange = exchange("POST", "{oops", out);

        registry.handleTool(exchange, getDataDef(), args -> "unused");

        verify(exchange).sendResponseHeaders(eq(400), anyLong());
        assertTrue(Json.parse(out.toString(StandardCharsets.UTF_8)).get("message").asText().contains("not valid JSON"));
    }

    @Test
    void testHandleTool_MissingRequiredArgumentIsClientError() throws Exception {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final HttpExchange exchange = exchange("POST", "{}", out);

        registry.handleTool(exchange, getDataDef(), args -> {
            throw new AssertionError("must not be called");
        });

        verify(exchange).sendResponseHeaders(eq(400), anyLong());
        assertEquals("Missing required parameter: query",
            Json.parse(out.toString(StandardCharsets.UTF_8)).get("message").asText());
        verify(mockTools, never()).insightsGetData(anyString());
    }

    @Test
    void testHandleTool_InvocationFailure() throws Exception {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final HttpExchange exchange = exchange("POST", "{\"query\": \"{}\"}", out);

        registry.handleTool(exchange, getDataDef(), args -> {
            throw new IllegalStateException("engine down");
        });

        verify(exchange).sendResponseHeaders(eq(500), anyLong());
        assertEquals("Error processing request: engine down",
            Json.parse(out.toString(StandardCharsets.UTF_8)).get("message").asText());
    }
}
