package com.insights.mcp.params;

import static com.insights.mcp.params.FieldShapes.aggregations;
import static com.insights.mcp.params.FieldShapes.clampedLimit;
import static com.insights.mcp.params.FieldShapes.filterConditions;
import static com.insights.mcp.params.FieldShapes.nonEmptyString;
import static com.insights.mcp.params.FieldShapes.nonEmptyStringList;
import static com.insights.mcp.params.FieldShapes.oneOf;
import static com.insights.mcp.params.FieldShapes.stringMap;
import static com.insights.mcp.params.FieldShapes.stringOrList;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

import com.insights.mcp.model.CountByCall;
import com.insights.mcp.model.Fill;
import com.insights.mcp.model.GetDataCall;
import com.insights.mcp.model.GetMetaCall;
import com.insights.mcp.model.MetaKey;
import com.insights.mcp.model.OneOrMany;
import com.insights.mcp.model.Temporality;
import com.insights.mcp.model.ToolResponse;

/**
 * Field contracts of the three query tools.
 */
public final class ToolSchemas {

    /** Timestamp layout used for defaulted get_data time bounds. */
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSS").withZone(ZoneOffset.UTC);

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(15);

    private static final int MAX_ROWS = ToolResponse.MAX_ROWS_RETURNED;

    public static final ToolSchema GET_DATA = new ToolSchema(
        GetDataCall.TOOL_NAME,
        List.of(
            FieldSpec.required("table", nonEmptyString(), "str"),
            new FieldSpec<>("start_time", nonEmptyString(),
                Presence.optional(now -> TIMESTAMP_FORMAT.format(now.minus(DEFAULT_WINDOW))), "str"),
            new FieldSpec<>("end_time", nonEmptyString(),
                Presence.optional(TIMESTAMP_FORMAT::format), "str"),
            FieldSpec.optional("input_timezone", nonEmptyString(), "str"),
            FieldSpec.optional("output_timezone", nonEmptyString(), "str"),
            FieldSpec.optional("filter", filterConditions(), "list"),
            FieldSpec.optional("group_by", stringOrList(), "str or list[str]"),
            FieldSpec.optional("aggregations", aggregations(), "str, list[str] or list[list[str]]"),
            FieldSpec.optional("fill", oneOf(Fill.class, Fill::wireName), "str"),
            FieldSpec.optional("temporality", oneOf(Temporality.class, Temporality::wireName), "str"),
            new FieldSpec<>("slice", nonEmptyStringList(),
                Presence.requiredWhen("temporality", Temporality.SLICE, Temporality.SLICE.wireName()), "list[str]"),
            FieldSpec.optional("sort_columns", stringOrList(), "str or list[str]"),
            FieldSpec.optional("labels", stringMap(), "dict[str, str]"),
            defaultedLimit()),
        List.of(),
        ToolSchemas::assembleGetData);

    public static final ToolSchema COUNT_BY = new ToolSchema(
        CountByCall.TOOL_NAME,
        List.of(
            FieldSpec.required("table", nonEmptyString(), "str"),
            FieldSpec.required("byCols", stringOrList(), "str or list[str]"),
            FieldSpec.required("startTS", nonEmptyString(), "str"),
            FieldSpec.required("endTS", nonEmptyString(), "str"),
            defaultedLimit()),
        List.of(),
        p -> new CountByCall(
            p.require("table"),
            p.<OneOrMany<String>>require("byCols").toList(),
            p.require("startTS"),
            p.require("endTS"),
            p.require("limit")));

    public static final ToolSchema GET_META = new ToolSchema(
        GetMetaCall.TOOL_NAME,
        List.of(
            new FieldSpec<>("key", oneOf(MetaKey.class, MetaKey::wireName),
                Presence.optional(now -> MetaKey.ASSEMBLY), "str"),
            FieldSpec.optional("tbl", nonEmptyString(), "str")),
        List.of(ToolSchemas::tableFilterNeedsTableKey),
        p -> new GetMetaCall(p.require("key"), p.find("tbl")));

    private ToolSchemas() {}

    private static FieldSpec<OneOrMany<Integer>> defaultedLimit() {
        return new FieldSpec<>("limit", clampedLimit(MAX_ROWS),
            Presence.optional(now -> OneOrMany.one(MAX_ROWS)), "int or list[int]");
    }

    private static GetDataCall assembleGetData(NormalizedParams p) {
        return new GetDataCall(
            p.require("table"),
            p.require("start_time"),
            p.require("end_time"),
            p.find("input_timezone"),
            p.find("output_timezone"),
            p.getOrDefault("filter", List.of()),
            p.<OneOrMany<String>>find("group_by").map(OneOrMany::toList).orElse(List.of()),
            p.find("aggregations"),
            p.find("fill"),
            p.find("temporality"),
            p.getOrDefault("slice", List.of()),
            p.<OneOrMany<String>>find("sort_columns").map(OneOrMany::toList).orElse(List.of()),
            p.getOrDefault("labels", Map.of()),
            p.require("limit"));
    }

    private static void tableFilterNeedsTableKey(NormalizedParams p) throws ValidationException {
        final MetaKey key = p.require("key");
        if (p.contains("tbl") && !key.supportsTableFilter()) {
            throw new ValidationException("tbl", "tbl is only supported with key 'schema' or 'assembly'");
        }
    }
}
