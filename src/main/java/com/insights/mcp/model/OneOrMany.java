package com.insights.mcp.model;

import java.util.List;

/**
 * A parameter that callers may pass either as a single value or as a list.
 * {@link #toList()} gives the canonical list form used downstream.
 */
public sealed interface OneOrMany<T> permits OneOrMany.One, OneOrMany.Many {

    List<T> toList();

    /** The shape the caller used: a bare value for One, a list for Many. */
    Object toUpstream();

    static <T> OneOrMany<T> one(T value) {
        return new One<>(value);
    }

    static <T> OneOrMany<T> many(List<T> values) {
        return new Many<>(values);
    }

    record One<T>(T value) implements OneOrMany<T> {
        @Override
        public List<T> toList() {
            return List.of(value);
        }

        @Override
        public Object toUpstream() {
            return value;
        }
    }

    record Many<T>(List<T> values) implements OneOrMany<T> {
        public Many {
            values = List.copyOf(values);
        }

        @Override
        public List<T> toList() {
            return values;
        }

        @Override
        public Object toUpstream() {
            return values;
        }
    }
}
