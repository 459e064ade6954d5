package com.insights.mcp.model;

import java.util.List;

/**
 * get_data aggregations. Either plain column names, or {@code [assignName, aggFn, column]} triplets.
 * A request never mixes the two.
 */
public sealed interface Aggregations permits Aggregations.Columns, Aggregations.Triplets {

    Object toUpstream();

    record Columns(List<String> columns) implements Aggregations {
        public Columns {
            columns = List.copyOf(columns);
        }

        @Override
        public Object toUpstream() {
            return columns;
        }
    }

    record Triplets(List<Triplet> triplets) implements Aggregations {
        public Triplets {
            triplets = List.copyOf(triplets);
        }

        @Override
        public Object toUpstream() {
            return triplets.stream().map(Triplet::toUpstream).toList();
        }
    }

    record Triplet(String assignName, String aggFn, String column) {
        List<String> toUpstream() {
            return List.of(assignName, aggFn, column);
        }
    }
}
