package com.insights.mcp.api;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.insights.mcp.services.GuidanceResources;
import com.insights.mcp.utils.HttpUtils;
import com.insights.mcp.utils.Json;
import com.sun.net.httpserver.HttpExchange;

/**
 * A tool read off an {@link McpTool} method: its wire name, arguments and schemas, and how to
 * call it with arguments decoded from an HTTP request.
 */
public class ToolDef {

    /**
     * One string argument of the tool, in method order.
     *
     * @param defaultValue value used when the caller leaves the argument out, or null
     */
    public record Arg(String name, boolean required, String defaultValue, String description) {

        static Arg of(final Parameter parameter, final Param param) {
            final String name = param.name().isEmpty() ? Json.toSnakeCase(parameter.getName()) : param.name();
            final boolean required = Param.REQUIRED.equals(param.defaultValue());
            final String defaultValue = required || param.defaultValue().isEmpty() ? null : param.defaultValue();
            return new Arg(name, required, defaultValue, param.value());
        }

        /** A query parameter; empty counts as absent. */
        String fromQuery(final String raw) {
            return raw == null || raw.isEmpty() ? defaultValue : raw;
        }

        /** A body field. A structured value is passed on as its JSON text. */
        String fromJson(final JsonNode node) {
            if (node == null || node.isNull() || node.isMissingNode()) return defaultValue;
            return node.isTextual() ? node.asText() : node.toString();
        }

        Map<String, Object> schema() {
            final Map<String, Object> schema = new LinkedHashMap<>();
            schema.put("type", "string");
            if (!description.isEmpty()) {
                schema.put("description", description);
            }
            if (defaultValue != null) {
                schema.put("default", defaultValue);
            }
            return schema;
        }
    }

    private final String name;
    private final String description;
    private final boolean post;
    private final List<Arg> args;
    private final Class<?> responseType;
    private final Method method;

    private ToolDef(final McpTool tool, final String name, final List<Arg> args, final Method method) {
        this.name = name;
        this.post = tool.post();
        this.args = List.copyOf(args);
        this.responseType = tool.responseType();
        this.method = method;
        this.description = describe(tool, this.args);
    }

    /**
     * @throws IllegalArgumentException if a parameter of {@code method} has no {@link Param} or is not a String
     */
    public static ToolDef fromMethod(final Method method, final McpTool tool) {
        final String name = tool.name().isEmpty() ? Json.toSnakeCase(method.getName()) : tool.name();
        final List<Arg> args = new ArrayList<>();
        for (final Parameter parameter : method.getParameters()) {
            final Param param = parameter.getAnnotation(Param.class);
            if (param == null) {
                throw new IllegalArgumentException("Tool " + name + " has a parameter without @Param: "
                    + parameter.getName());
            }
            if (parameter.getType() != String.class) {
                throw new IllegalArgumentException("Tool " + name + " parameter " + parameter.getName()
                    + " must be a String");
            }
            args.add(Arg.of(parameter, param));
        }
        return new ToolDef(tool, name, args, method);
    }

    /**
     * Decode the arguments of a request, keyed by wire name in method order. Absent arguments
     * take their default, or null when they have none.
     *
     * @throws IOException if the body cannot be read or is not a JSON object, or a required
     *                     argument is missing
     */
    public Map<String, Object> parseParams(final HttpExchange exchange) throws IOException {
        final Map<String, Object> values = new LinkedHashMap<>();
        if (args.isEmpty()) return values;

        if (post) {
            final JsonNode body = readBody(exchange);
            args.forEach(a -> values.put(a.name(), a.fromJson(body.get(a.name()))));
        } else {
            final Map<String, String> query = HttpUtils.parseQueryParams(exchange);
            args.forEach(a -> values.put(a.name(), a.fromQuery(query.get(a.name()))));
        }
        for (final Arg arg : args) {
            if (arg.required() && values.get(arg.name()) == null) {
                throw new IOException("Missing required parameter: " + arg.name());
            }
        }
        return values;
    }

    private JsonNode readBody(final HttpExchange exchange) throws IOException {
        final String text = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        if (text.isBlank()) {
            return Json.createObject();
        }
        final JsonNode body;
        try {
            body = Json.parse(text);
        } catch (JsonProcessingException e) {
            throw new IOException("Request body for " + name + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!body.isObject()) {
            throw new IOException("Request body for " + name + " must be a JSON object");
        }
        return body;
    }

    /**
     * Call the tool method on {@code target}. An exception thrown by the method is rethrown as is.
     *
     * @throws IllegalArgumentException if a required argument is missing
     */
    public Object invoke(final Object target, final Map<String, Object> values) throws Exception {
        final Object[] callArgs = new Object[args.size()];
        for (int i = 0; i < callArgs.length; i++) {
            final Arg arg = args.get(i);
            callArgs[i] = values.get(arg.name());
            if (callArgs[i] == null && arg.required()) {
                throw new IllegalArgumentException("Missing required parameter: " + arg.name());
            }
        }
        try {
            return method.invoke(target, callArgs);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Entry for the /mcp/tools listing.
     */
    public Map<String, Object> toToolMap() {
        final Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("name", name);
        tool.put("description", description);
        tool.put("method", post ? "POST" : "GET");
        tool.put("inputSchema", inputSchema());

        final JsonNode output = SchemaGenerator.generateSchema(responseType);
        if (output != null) {
            tool.put("outputSchema", output);
        }
        return tool;
    }

    public String toInputSchemaJson() {
        return Json.serialize(inputSchema());
    }

    private Map<String, Object> inputSchema() {
        final Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        if (args.isEmpty()) return schema;

        final Map<String, Object> properties = new LinkedHashMap<>();
        args.forEach(a -> properties.put(a.name(), a.schema()));
        schema.put("properties", properties);

        final List<String> required = args.stream().filter(Arg::required).map(Arg::name).toList();
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public boolean isPost() { return post; }
    public List<Arg> getParams() { return args; }
    public Class<?> getResponseType() { return responseType; }

    private static String describe(final McpTool tool, final List<Arg> args) {
        final StringBuilder text = new StringBuilder(tool.description());
        if (!tool.guidance().isEmpty()) {
            text.append("\n\n    Guidance: ").append(GuidanceResources.URI_PREFIX).append(tool.guidance());
        }
        if (!args.isEmpty()) {
            text.append("\n\n    Parameters:\n");
            for (final Arg arg : args) {
                text.append("        ").append(arg.name()).append(": ").append(arg.description());
                if (arg.defaultValue() != null) {
                    text.append(" (default: ").append(arg.defaultValue()).append(")");
                }
                text.append('\n');
            }
        }
        return text.toString().stripTrailing();
    }
}
