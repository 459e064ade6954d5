package com.insights.mcp.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.insights.mcp.config.InsightsConfig;
import com.insights.mcp.utils.Json;

/**
 * {@link InsightsClient} over the kdb Insights service gateway REST API.
 *
 * <p>Every call is a JSON POST answered with {@code {"header": {...}, "payload": ...}}.
 * A non-2xx status or a non-zero {@code header.rc} is reported as an {@link UpstreamException}.
 * No request timeout is applied.
 */
public class HttpInsightsClient implements InsightsClient {
    private static final Logger LOG = LogManager.getLogger(HttpInsightsClient.class);

    static final String GET_DATA_PATH = "servicegateway/kxi/getData";
    static final String GET_META_PATH = "servicegateway/kxi/getMeta";
    private static final String GATEWAY_PREFIX = "servicegateway/";
    private static final int MAX_ERROR_BODY = 200;

    private final HttpClient http;
    private final String baseUrl;
    private final Optional<String> token;

    public HttpInsightsClient(InsightsConfig config) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.gatewayConnectTimeoutSeconds()))
                .build(),
            config.gatewayUrl(),
            config.gatewayToken());
    }

    HttpInsightsClient(HttpClient http, String baseUrl, Optional<String> token) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
    }

    @Override
    public List<JsonNode> getData(String table, Map<String, Object> params) throws UpstreamException {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("table", table);
        body.putAll(params);
        final JsonNode payload = post(GET_DATA_PATH, body).payload();
        if (!payload.isArray()) {
            throw new UpstreamException("Unexpected getData payload: expected a list of records");
        }
        final List<JsonNode> rows = new ArrayList<>(payload.size());
        payload.forEach(rows::add);
        return rows;
    }

    @Override
    public JsonNode getMeta() throws UpstreamException {
        final JsonNode payload = post(GET_META_PATH, Map.of()).payload();
        if (!payload.isObject()) {
            throw new UpstreamException("Unexpected getMeta payload: expected an object");
        }
        return payload;
    }

    @Override
    public AggregationResult invokeCustomAggregation(String name, Map<String, Object> params) throws UpstreamException {
        return post(aggregationPath(name), params);
    }

    /**
     * Gateway path of a named aggregation: {@code .example.countBy} is served at
     * {@code servicegateway/example/countBy}.
     */
    static String aggregationPath(String name) {
        final String trimmed = name.startsWith(".") ? name.substring(1) : name;
        return GATEWAY_PREFIX + trimmed.replace('.', '/');
    }

    private AggregationResult post(String path, Map<String, Object> body) throws UpstreamException {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + "/" + path))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(Json.serialize(body)));
        token.ifPresent(t -> builder.header("Authorization", "Bearer " + t));

        final HttpResponse<String> response;
        try {
            LOG.debug("POST {}", path);
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamException("Gateway request to " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Gateway request to " + path + " was interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new UpstreamException("Gateway returned HTTP " + response.statusCode() + " for " + path
                + ": " + abbreviate(response.body()));
        }

        final JsonNode root;
        try {
            root = Json.parse(response.body());
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Malformed gateway response from " + path + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject() || !root.has("payload")) {
            throw new UpstreamException("Unexpected gateway response from " + path + ": no payload");
        }

        final JsonNode header = root.path("header");
        final int rc = header.path("rc").asInt(0);
        if (rc != 0) {
            throw new UpstreamException("Gateway error rc=" + rc + ": " + header.path("ai").asText("unknown"));
        }
        return new AggregationResult(header, root.get("payload"));
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
