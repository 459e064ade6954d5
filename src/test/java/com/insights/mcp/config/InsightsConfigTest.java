package com.insights.mcp.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.Test;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;

class InsightsConfigTest {

    private static Config configOf(Map<String, String> properties) {
        return new SmallRyeConfigBuilder()
            .withSources(new PropertiesConfigSource(properties, "test", 500))
            .build();
    }

    @Test
    void testDefaults() {
        final InsightsConfig config = InsightsConfig.from(configOf(Map.of()));

        assertEquals(8080, config.serverPort());
        assertEquals("http://localhost:5050", config.gatewayUrl());
        assertEquals(Optional.empty(), config.gatewayToken());
        assertEquals(10, config.gatewayConnectTimeoutSeconds());
        assertEquals(".example.countBy", config.countByAggregation());
        assertEquals(Path.of("insights_size_log.json"), config.telemetryLogFile());
        assertTrue(config.telemetryEnabled());
    }

    @Test
    void testOverrides() {
        final InsightsConfig config = InsightsConfig.from(configOf(Map.of(
            "insights.server.port", "9090",
            "insights.gateway.url", "https://gw.example.com",
            "insights.gateway.token", "abc",
            "insights.countby.aggregation", ".custom.countBy",
            "insights.telemetry.log-file", "/tmp/sizes.json",
            "insights.telemetry.enabled", "false")));

        assertEquals(9090, config.serverPort());
        assertEquals("https://gw.example.com", config.gatewayUrl());
        assertEquals(Optional.of("abc"), config.gatewayToken());
        assertEquals(".custom.countBy", config.countByAggregation());
        assertEquals(Path.of("/tmp/sizes.json"), config.telemetryLogFile());
        assertFalse(config.telemetryEnabled());
    }

    @Test
    void testPortOutOfRange() {
        assertThrows(IllegalArgumentException.class,
            () -> InsightsConfig.from(configOf(Map.of("insights.server.port", "70000"))));
    }

    @Test
    void testTimeoutMustBePositive() {
        assertThrows(IllegalArgumentException.class,
            () -> InsightsConfig.from(configOf(Map.of("insights.gateway.connect-timeout-seconds", "0"))));
    }
}
