package com.insights.mcp.params;

import java.time.Instant;
import java.util.function.Function;

/**
 * When a field has to be present.
 */
public sealed interface Presence permits Presence.Required, Presence.Omittable, Presence.RequiredWhen {

    static Presence required() {
        return new Required();
    }

    static Presence optional() {
        return new Omittable(null);
    }

    /** Optional, with a fallback computed from the call time when absent. */
    static Presence optional(Function<Instant, ?> fallback) {
        return new Omittable(fallback);
    }

    /**
     * Required when another field normalized to {@code value}; ignored otherwise.
     * Checked only after every unconditional field has been validated.
     */
    static Presence requiredWhen(String field, Object value, String label) {
        return new RequiredWhen(field, value, label);
    }

    record Required() implements Presence {}

    record Omittable(Function<Instant, ?> fallback) implements Presence {}

    record RequiredWhen(String field, Object value, String label) implements Presence {}
}
