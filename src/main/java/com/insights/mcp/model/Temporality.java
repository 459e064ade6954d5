package com.insights.mcp.model;

/**
 * Whether get_data returns a point-in-time snapshot or a time-slice view.
 * SLICE requests must name their slice explicitly.
 */
public enum Temporality {
    SLICE("slice"),
    SNAPSHOT("snapshot");

    private final String wireName;

    Temporality(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
