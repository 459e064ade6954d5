package com.insights;

import java.io.IOException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.insights.mcp.McpServerManager;
import com.insights.mcp.api.ApiHandlerRegistry;
import com.insights.mcp.client.HttpInsightsClient;
import com.insights.mcp.config.InsightsConfig;
import com.insights.mcp.params.AllowListSanitizer;
import com.insights.mcp.params.ParamNormalizer;
import com.insights.mcp.services.CallExecutor;
import com.insights.mcp.services.GuidanceResources;
import com.insights.mcp.services.InsightsTools;
import com.insights.mcp.services.QueryPipeline;
import com.insights.mcp.services.ResponseGovernor;
import com.insights.mcp.telemetry.TelemetryLogger;

/**
 * Starts the HTTP server that exposes the Insights query tools.
 */
public final class InsightsMcpServer {
    private static final Logger LOG = LogManager.getLogger(InsightsMcpServer.class);

    private InsightsMcpServer() {}

    public static void main(String[] args) throws IOException {
        final InsightsConfig config = InsightsConfig.load();
        final McpServerManager serverManager = start(config);
        Runtime.getRuntime().addShutdownHook(new Thread(serverManager::stopServer, "insights-mcp-shutdown"));
    }

    /**
     * Wire the tools against the configured gateway and start serving.
     */
    public static McpServerManager start(InsightsConfig config) throws IOException {
        final QueryPipeline pipeline = new QueryPipeline(
            new AllowListSanitizer(),
            new ParamNormalizer(),
            new CallExecutor(new HttpInsightsClient(config), config.countByAggregation()),
            new ResponseGovernor());
        final TelemetryLogger telemetry = config.telemetryEnabled()
            ? new TelemetryLogger(config.telemetryLogFile())
            : null;
        if (telemetry == null) {
            LOG.info("Telemetry disabled");
        } else {
            LOG.info("Recording tool call sizes to {}", telemetry.getLog().getPath());
        }

        final McpServerManager serverManager = new McpServerManager(config.serverPort());
        serverManager.startServer();
        new ApiHandlerRegistry(serverManager, telemetry, new GuidanceResources(), new InsightsTools(pipeline))
            .registerAllEndpoints();
        return serverManager;
    }
}
