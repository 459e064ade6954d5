package com.insights.mcp.utils;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.sun.net.httpserver.HttpExchange;

/**
 * Utility methods for HTTP operations
 */
public final class HttpUtils {
    private static final Logger LOG = LogManager.getLogger(HttpUtils.class);

    public static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";
    public static final String MARKDOWN_CONTENT_TYPE = "text/markdown; charset=utf-8";

    private HttpUtils() {}

    /**
     * Parse query parameters from the URL, e.g. ?key=schema&tbl=trades
     */
    public static Map<String, String> parseQueryParams(HttpExchange exchange) {
        var query = exchange.getRequestURI().getRawQuery();
        if (query == null) return Map.of();

        return Arrays.stream(query.split("&"))
            .filter(p -> p.contains("="))
            .map(p -> p.split("=", 2))
            .filter(kv -> kv.length == 2)
            .collect(Collectors.toMap(
                kv -> decodeUrlParameter(kv[0]),
                kv -> decodeUrlParameter(kv[1]),
                (v1, v2) -> v1 // In case of duplicate keys, keep the first value
            ));
    }

    /**
     * Helper method to decode URL parameters safely
     */
    private static String decodeUrlParameter(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            LOG.warn("Error decoding URL parameter: {} - {}", value, e.getMessage());
            return value; // Return the original value if decoding fails
        }
    }

    /**
     * Send a JSON body with status 200.
     */
    public static void sendJson(HttpExchange exchange, String json) throws IOException {
        send(exchange, 200, JSON_CONTENT_TYPE, json);
    }

    public static void send(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        var bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (var os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
