package com.insights.mcp;

import java.io.IOException;
import java.net.InetSocketAddress;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.sun.net.httpserver.HttpServer;

/**
 * Manages the HTTP server for the Insights MCP tools
 */
public class McpServerManager {
    private static final Logger LOG = LogManager.getLogger(McpServerManager.class);

    private HttpServer server;
    private final int port;

    /**
     * @param port the port to listen on; 0 picks a free port
     */
    public McpServerManager(int port) {
        this.port = port;
    }

    /**
     * Start the HTTP server on the configured port
     *
     * @throws IOException if the port cannot be bound
     */
    public synchronized void startServer() throws IOException {
        // Stop existing server if running
        if (server != null) {
            LOG.info("Stopping existing HTTP server before starting new one.");
            stopServer();
        }

        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.setExecutor(null);
        server.start();
        LOG.info("Insights MCP HTTP server started on port {}", server.getAddress().getPort());
    }

    /**
     * Stop the HTTP server if it is running
     */
    public synchronized void stopServer() {
        if (server != null) {
            LOG.info("Stopping Insights MCP HTTP server...");
            server.stop(1); // Give open exchanges a second to finish
            server = null;
            LOG.info("Insights MCP HTTP server stopped.");
        }
    }

    /**
     * @return the HTTP server or null if not running
     */
    public synchronized HttpServer getServer() {
        return server;
    }

    public synchronized boolean isServerRunning() {
        return server != null;
    }
}
