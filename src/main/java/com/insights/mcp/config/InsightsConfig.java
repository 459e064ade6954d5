package com.insights.mcp.config;

import java.nio.file.Path;
import java.util.Optional;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

/**
 * Server settings, read through MicroProfile Config.
 *
 * <p>Defaults live in {@code META-INF/microprofile-config.properties}; system properties and
 * environment variables ({@code INSIGHTS_GATEWAY_URL} and so on) override them.
 * <ul>
 *   <li>{@code insights.server.port}: HTTP port of the tool server (default 8080)</li>
 *   <li>{@code insights.gateway.url}: base URL of the service gateway</li>
 *   <li>{@code insights.gateway.token}: optional bearer token passed to the gateway</li>
 *   <li>{@code insights.gateway.connect-timeout-seconds}: connect timeout (default 10)</li>
 *   <li>{@code insights.countby.aggregation}: aggregation backing the count-by tool</li>
 *   <li>{@code insights.telemetry.log-file}: telemetry log path</li>
 *   <li>{@code insights.telemetry.enabled}: record telemetry at all (default true)</li>
 * </ul>
 */
public record InsightsConfig(
        int serverPort,
        String gatewayUrl,
        Optional<String> gatewayToken,
        int gatewayConnectTimeoutSeconds,
        String countByAggregation,
        Path telemetryLogFile,
        boolean telemetryEnabled) {

    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_GATEWAY_URL = "http://localhost:5050";
    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;
    public static final String DEFAULT_COUNT_BY_AGGREGATION = ".example.countBy";
    public static final String DEFAULT_TELEMETRY_LOG = "insights_size_log.json";

    public InsightsConfig {
        if (serverPort < 0 || serverPort > 65535) {
            throw new IllegalArgumentException("insights.server.port out of range: " + serverPort);
        }
        if (gatewayConnectTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("insights.gateway.connect-timeout-seconds must be positive");
        }
    }

    /** Load from the default MicroProfile Config of the current class loader. */
    public static InsightsConfig load() {
        return from(ConfigProvider.getConfig());
    }

    public static InsightsConfig from(Config config) {
        return new InsightsConfig(
            config.getOptionalValue("insights.server.port", Integer.class).orElse(DEFAULT_PORT),
            config.getOptionalValue("insights.gateway.url", String.class).orElse(DEFAULT_GATEWAY_URL),
            config.getOptionalValue("insights.gateway.token", String.class).filter(t -> !t.isBlank()),
            config.getOptionalValue("insights.gateway.connect-timeout-seconds", Integer.class)
                .orElse(DEFAULT_CONNECT_TIMEOUT_SECONDS),
            config.getOptionalValue("insights.countby.aggregation", String.class).orElse(DEFAULT_COUNT_BY_AGGREGATION),
            Path.of(config.getOptionalValue("insights.telemetry.log-file", String.class).orElse(DEFAULT_TELEMETRY_LOG)),
            config.getOptionalValue("insights.telemetry.enabled", Boolean.class).orElse(true));
    }
}
