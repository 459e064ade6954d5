package com.insights.mcp.model;

import java.util.Map;

/**
 * Fully validated, immutable request for one tool. Each tool has its own layout.
 */
public sealed interface CallDescriptor permits GetDataCall, CountByCall, GetMetaCall {

    /** Name of the tool this descriptor was built for. */
    String toolName();

    /** Keyword parameters as the gateway expects them, in declaration order. */
    Map<String, Object> toUpstreamParams();
}
