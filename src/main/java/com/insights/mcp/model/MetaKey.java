package com.insights.mcp.model;

/**
 * Sections of the gateway's getMeta response.
 */
public enum MetaKey {
    RC("rc"),
    DAP("dap"),
    API("api"),
    AGG("agg"),
    ASSEMBLY("assembly"),
    SCHEMA("schema");

    private final String wireName;

    MetaKey(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Only schema and assembly rows can be narrowed to a single table. */
    public boolean supportsTableFilter() {
        return this == SCHEMA || this == ASSEMBLY;
    }
}
