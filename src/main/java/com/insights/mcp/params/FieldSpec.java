package com.insights.mcp.params;

/**
 * One allow-listed field of a tool: its name, accepted shape and presence rule.
 *
 * @param expected short shape description used in "missing" messages, e.g. {@code str}
 */
public record FieldSpec<T>(String name, FieldParser<T> parser, Presence presence, String expected) {

    public static <T> FieldSpec<T> required(String name, FieldParser<T> parser, String expected) {
        return new FieldSpec<>(name, parser, Presence.required(), expected);
    }

    public static <T> FieldSpec<T> optional(String name, FieldParser<T> parser, String expected) {
        return new FieldSpec<>(name, parser, Presence.optional(), expected);
    }
}
