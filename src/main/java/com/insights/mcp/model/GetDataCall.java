package com.insights.mcp.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized get_data request.
 * Empty lists and maps stand for "not supplied" and are left out of the upstream parameters.
 */
public record GetDataCall(
        String table,
        String startTime,
        String endTime,
        Optional<String> inputTimezone,
        Optional<String> outputTimezone,
        List<FilterCondition> filter,
        List<String> groupBy,
        Optional<Aggregations> aggregations,
        Optional<Fill> fill,
        Optional<Temporality> temporality,
        List<String> slice,
        List<String> sortColumns,
        Map<String, String> labels,
        OneOrMany<Integer> limit) implements CallDescriptor {

    public static final String TOOL_NAME = "insights_get_data";

    public GetDataCall {
        filter = List.copyOf(filter);
        groupBy = List.copyOf(groupBy);
        slice = List.copyOf(slice);
        sortColumns = List.copyOf(sortColumns);
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    @Override
    public String toolName() {
        return TOOL_NAME;
    }

    @Override
    public Map<String, Object> toUpstreamParams() {
        final Map<String, Object> params = new LinkedHashMap<>();
        params.put("start_time", startTime);
        params.put("end_time", endTime);
        inputTimezone.ifPresent(tz -> params.put("input_timezone", tz));
        outputTimezone.ifPresent(tz -> params.put("output_timezone", tz));
        if (!filter.isEmpty()) {
            params.put("filter", filter.stream().map(FilterCondition::toUpstream).toList());
        }
        if (!groupBy.isEmpty()) params.put("group_by", groupBy);
        aggregations.ifPresent(a -> params.put("aggregations", a.toUpstream()));
        fill.ifPresent(f -> params.put("fill", f.wireName()));
        temporality.ifPresent(t -> params.put("temporality", t.wireName()));
        if (!slice.isEmpty()) params.put("slice", slice);
        if (!sortColumns.isEmpty()) params.put("sort_columns", sortColumns);
        if (!labels.isEmpty()) params.put("labels", labels);
        params.put("limit", limit.toUpstream());
        return params;
    }
}
