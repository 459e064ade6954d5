package com.insights.mcp.model;

public enum Fill {
    FORWARD("forward"),
    ZERO("zero");

    private final String wireName;

    Fill(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
