package com.insights.mcp.params;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;
import com.insights.mcp.model.Aggregations;
import com.insights.mcp.model.FilterCondition;
import com.insights.mcp.model.OneOrMany;
import com.insights.mcp.utils.Json;

/**
 * The accepted parameter shapes. Each factory returns a parser that either yields the
 * canonical typed value or fails naming the field.
 */
public final class FieldShapes {

    private FieldShapes() {}

    public static FieldParser<String> nonEmptyString() {
        return (field, value) -> {
            if (!value.isTextual() || value.asText().isEmpty()) {
                throw ValidationException.shape(field, "a non-empty string");
            }
            return value.asText();
        };
    }

    /** {@code str | list[str]}. */
    public static FieldParser<OneOrMany<String>> stringOrList() {
        return (field, value) -> {
            if (value.isTextual()) {
                return OneOrMany.one(value.asText());
            }
            if (value.isArray()) {
                return OneOrMany.many(strings(field, value, "str or list[str]"));
            }
            throw ValidationException.shape(field, "str or list[str]");
        };
    }

    public static FieldParser<List<String>> nonEmptyStringList() {
        return (field, value) -> {
            if (!value.isArray() || value.isEmpty()) {
                throw ValidationException.shape(field, "a non-empty list[str]");
            }
            return strings(field, value, "a non-empty list[str]");
        };
    }

    /** {@code [[function, column, parameter], ...]}. */
    public static FieldParser<List<FilterCondition>> filterConditions() {
        return (field, value) -> {
            if (!value.isArray()) {
                throw ValidationException.shape(field, "a list");
            }
            final List<FilterCondition> conditions = new ArrayList<>();
            for (JsonNode item : value) {
                if (!item.isArray() || item.size() != 3) {
                    throw new ValidationException(field,
                        "Each filter condition must be a 3-item list: ['function','column','parameter']");
                }
                if (!item.get(0).isTextual() || !item.get(1).isTextual()) {
                    throw new ValidationException(field, "filter function and column must be strings");
                }
                conditions.add(new FilterCondition(item.get(0).asText(), item.get(1).asText(), Json.toPlain(item.get(2))));
            }
            return conditions;
        };
    }

    /** {@code str | list[str] | list[[assignName, aggFn, column]]}, never mixed. */
    public static FieldParser<Aggregations> aggregations() {
        final String expected = "str, list[str], or list of 3-string lists";
        return (field, value) -> {
            if (value.isTextual()) {
                return new Aggregations.Columns(List.of(value.asText()));
            }
            if (!value.isArray()) {
                throw ValidationException.shape(field, expected);
            }
            boolean allText = true;
            boolean allLists = true;
            for (JsonNode item : value) {
                allText &= item.isTextual();
                allLists &= item.isArray();
            }
            if (allText) {
                return new Aggregations.Columns(strings(field, value, expected));
            }
            if (!allLists) {
                throw ValidationException.shape(field, expected);
            }
            final List<Aggregations.Triplet> triplets = new ArrayList<>();
            for (JsonNode trip : value) {
                if (trip.size() != 3 || !trip.get(0).isTextual() || !trip.get(1).isTextual() || !trip.get(2).isTextual()) {
                    throw new ValidationException(field,
                        "aggregations triplets must be ['assignname','agg','column'] (3 strings)");
                }
                triplets.add(new Aggregations.Triplet(trip.get(0).asText(), trip.get(1).asText(), trip.get(2).asText()));
            }
            return new Aggregations.Triplets(triplets);
        };
    }

    /** {@code dict[str, str]}. */
    public static FieldParser<Map<String, String>> stringMap() {
        return (field, value) -> {
            if (!value.isObject()) {
                throw ValidationException.shape(field, "dict[str, str]");
            }
            final Map<String, String> map = new LinkedHashMap<>();
            for (var it = value.fields(); it.hasNext(); ) {
                final var entry = it.next();
                if (!entry.getValue().isTextual()) {
                    throw ValidationException.shape(field, "dict[str, str]");
                }
                map.put(entry.getKey(), entry.getValue().asText());
            }
            return map;
        };
    }

    /**
     * One of a fixed set of strings, mapped onto an enum constant.
     */
    public static <E extends Enum<E>> FieldParser<E> oneOf(Class<E> type, Function<E, String> wireName) {
        final E[] constants = type.getEnumConstants();
        final List<String> names = new ArrayList<>();
        for (E constant : constants) {
            names.add("'" + wireName.apply(constant) + "'");
        }
        final String expected = String.join(" or ", names);
        return (field, value) -> {
            if (value.isTextual()) {
                for (E constant : constants) {
                    if (wireName.apply(constant).equals(value.asText())) {
                        return constant;
                    }
                }
            }
            throw ValidationException.shape(field, expected);
        };
    }

    /**
     * {@code int | list[int]}. Every integer is clamped into {@code [-bound, bound]}; list
     * entries must be non-zero.
     */
    public static FieldParser<OneOrMany<Integer>> clampedLimit(int bound) {
        return (field, value) -> {
            if (value.isIntegralNumber()) {
                return OneOrMany.one(clamp(value.bigIntegerValue(), bound));
            }
            if (value.isArray() && !value.isEmpty()) {
                final List<Integer> limits = new ArrayList<>();
                for (JsonNode item : value) {
                    if (!item.isIntegralNumber() || item.bigIntegerValue().signum() == 0) {
                        throw ValidationException.shape(field, "int or list[int]");
                    }
                    limits.add(clamp(item.bigIntegerValue(), bound));
                }
                return OneOrMany.many(limits);
            }
            throw ValidationException.shape(field, "int or list[int]");
        };
    }

    /** Saturate {@code value} into {@code [-bound, bound]}. */
    public static int clamp(long value, int bound) {
        return (int) Math.max(-bound, Math.min(value, bound));
    }

    public static int clamp(BigInteger value, int bound) {
        if (value.bitLength() < Long.SIZE) {
            return clamp(value.longValue(), bound);
        }
        return value.signum() < 0 ? -bound : bound;
    }

    private static List<String> strings(String field, JsonNode array, String expected) throws ValidationException {
        final List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isTextual()) {
                throw ValidationException.shape(field, expected);
            }
            values.add(item.asText());
        }
        return values;
    }
}
