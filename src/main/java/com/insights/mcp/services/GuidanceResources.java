package com.insights.mcp.services;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only guidance documents for the query tools, served from the classpath.
 */
public class GuidanceResources {
    public static final String URI_PREFIX = "file://guidance/";
    public static final String MIME_TYPE = "text/markdown";

    private static final Map<String, String> DESCRIPTIONS = new LinkedHashMap<>();

    static {
        DESCRIPTIONS.put("insights-get-data", "Parameters and examples for insights_get_data");
        DESCRIPTIONS.put("insights-get-countby", "Parameters and examples for insights_get_countby");
        DESCRIPTIONS.put("insights-get-meta", "Metadata sections returned by insights_get_meta");
    }

    private final Map<String, String> documents = new LinkedHashMap<>();

    /**
     * @throws IllegalStateException if a document is missing from the classpath
     */
    public GuidanceResources() {
        for (String name : DESCRIPTIONS.keySet()) {
            documents.put(name, load(name));
        }
    }

    /** Entries for the /mcp/resources listing. */
    public List<Map<String, String>> list() {
        final List<Map<String, String>> resources = new ArrayList<>();
        DESCRIPTIONS.forEach((name, description) -> {
            final Map<String, String> resource = new LinkedHashMap<>();
            resource.put("uri", URI_PREFIX + name);
            resource.put("name", name);
            resource.put("description", description);
            resource.put("mimeType", MIME_TYPE);
            resources.add(resource);
        });
        return resources;
    }

    /**
     * @param name a resource name, with or without the {@value #URI_PREFIX} prefix
     */
    public Optional<String> read(String name) {
        final String key = name.startsWith(URI_PREFIX) ? name.substring(URI_PREFIX.length()) : name;
        return Optional.ofNullable(documents.get(key));
    }

    private static String load(String name) {
        final String resource = "/guidance/" + name + ".md";
        try (InputStream in = GuidanceResources.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Guidance resource not found on classpath: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read guidance resource " + resource, e);
        }
    }
}
