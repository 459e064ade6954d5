package com.insights.mcp.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class GuidanceResourcesTest {

    private final GuidanceResources guidance = new GuidanceResources();

    @Test
    void testListsAllGuidanceUris() {
        final List<String> uris = guidance.list().stream().map(r -> r.get("uri")).toList();

        assertEquals(List.of(
            "file://guidance/insights-get-data",
            "file://guidance/insights-get-countby",
            "file://guidance/insights-get-meta"), uris);
    }

    @Test
    void testReadByNameOrUri() {
        final Optional<String> byName = guidance.read("insights-get-data");

        assertTrue(byName.isPresent());
        assertTrue(byName.get().startsWith("# insights_get_data"));
        assertEquals(byName, guidance.read("file://guidance/insights-get-data"));
    }

    @Test
    void testUnknownResource() {
        assertTrue(guidance.read("insights-sql").isEmpty());
    }

    @Test
    void testEntriesCarryMimeType() {
        for (Map<String, String> resource : guidance.list()) {
            assertEquals("text/markdown", resource.get("mimeType"));
        }
    }
}
