package com.insights.mcp.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.JsonNode;
import com.insights.mcp.client.AggregationResult;
import com.insights.mcp.client.InsightsClient;
import com.insights.mcp.client.UpstreamException;
import com.insights.mcp.model.CountByCall;
import com.insights.mcp.model.GetDataCall;
import com.insights.mcp.model.GetMetaCall;
import com.insights.mcp.model.MetaKey;
import com.insights.mcp.model.OneOrMany;
import com.insights.mcp.model.QueryResult;
import com.insights.mcp.utils.Json;

@ExtendWith(MockitoExtension.class)
class CallExecutorTest {

    private static final String META = """
        {
          "rc": {"name": "rc-0"},
          "schema": [
            {"table": "trade", "columns": ["time", "sym", "price"]},
            {"table": "quote", "columns": ["time", "sym", "bid"]}
          ],
          "assembly": [
            {"assembly": "equities", "tbls": ["trade", "quote"]},
            {"assembly": "fx", "tbls": ["fxrate"]}
          ]
        }
        """;

    @Mock
    private InsightsClient client;

    private CallExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new CallExecutor(client, ".example.countBy");
    }

    private static GetDataCall getData(String table) {
        return new GetDataCall(table, "s", "e", Optional.empty(), Optional.empty(), List.of(), List.of("sym"),
            Optional.empty(), Optional.empty(), Optional.empty(), List.of(), List.of(), Map.of(), OneOrMany.one(10));
    }

    @Test
    void testGetData_ForwardsTableAndParams() throws Exception {
        final List<JsonNode> rows = List.of(Json.parse("{\"sym\":\"AAPL\"}"));
        when(client.getData(eq("trade"), anyMap())).thenReturn(rows);

        final QueryResult result = executor.execute(getData("trade"));

        assertEquals(1, result.rowCount());
        @SuppressWarnings("unchecked")
        final ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(client).getData(eq("trade"), params.capture());
        assertEquals(List.of("sym"), params.getValue().get("group_by"));
        assertEquals(10, params.getValue().get("limit"));
    }

    @Test
    void testCountBy_UsesConfiguredAggregation() throws Exception {
        final CountByCall call = new CountByCall("orders", List.of("sym"), "a", "b", OneOrMany.one(1000));
        when(client.invokeCustomAggregation(".example.countBy", call.toUpstreamParams()))
            .thenReturn(new AggregationResult(Json.parse("{\"rc\":0}"), Json.parse("[{\"sym\":\"A\",\"cnt\":3}]")));

        final QueryResult result = executor.execute(call);

        assertEquals(1, result.rowCount());
        assertEquals(3, result.rows().get(0).get("cnt").asInt());
    }

    @Test
    void testCountBy_NonListPayloadIsUpstreamError() throws Exception {
        final CountByCall call = new CountByCall("orders", List.of("sym"), "a", "b", OneOrMany.one(1000));
        when(client.invokeCustomAggregation(eq(".example.countBy"), anyMap()))
            .thenReturn(new AggregationResult(Json.createObject(), Json.parse("{\"cnt\":3}")));

        assertThrows(UpstreamException.class, () -> executor.execute(call));
    }

    @Test
    void testGetMeta_SchemaFilteredByTable() throws Exception {
        when(client.getMeta()).thenReturn(Json.parse(META));

        final QueryResult result = executor.execute(new GetMetaCall(MetaKey.SCHEMA, Optional.of("quote")));

        assertEquals(1, result.rowCount());
        assertEquals("quote", result.rows().get(0).get("table").asText());
    }

    @Test
    void testGetMeta_AssemblyFilteredByContainedTable() throws Exception {
        when(client.getMeta()).thenReturn(Json.parse(META));

        final QueryResult result = executor.execute(new GetMetaCall(MetaKey.ASSEMBLY, Optional.of("fxrate")));

        assertEquals(1, result.rowCount());
        assertEquals("fx", result.rows().get(0).get("assembly").asText());
    }

    @Test
    void testGetMeta_ObjectSectionIsOneRow() throws Exception {
        final JsonNode meta = Json.parse(META);
        when(client.getMeta()).thenReturn(meta);

        final QueryResult result = executor.execute(new GetMetaCall(MetaKey.RC, Optional.empty()));

        assertEquals(1, result.rowCount());
        assertSame(meta.get("rc"), result.rows().get(0));
    }

    @Test
    void testGetMeta_MissingSectionIsUpstreamError() throws Exception {
        when(client.getMeta()).thenReturn(Json.parse(META));

        final UpstreamException e = assertThrows(UpstreamException.class,
            () -> executor.execute(new GetMetaCall(MetaKey.DAP, Optional.empty())));

        assertTrue(e.getMessage().contains("'dap'"));
    }

    @Test
    void testRuntimeFailureIsWrapped() throws Exception {
        when(client.getMeta()).thenThrow(new IllegalStateException("socket closed"));

        final UpstreamException e = assertThrows(UpstreamException.class,
            () -> executor.execute(new GetMetaCall(MetaKey.ASSEMBLY, Optional.empty())));

        assertEquals("Data engine call failed: socket closed", e.getMessage());
    }
}
