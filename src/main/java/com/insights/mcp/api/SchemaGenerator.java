package com.insights.mcp.api;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.github.victools.jsonschema.module.jackson.JacksonOption;
import com.insights.mcp.utils.Json;

/**
 * outputSchema of a tool, derived from its response record with victools/jsonschema-generator.
 * Property names are snake_case, as {@link Json} writes them.
 */
public final class SchemaGenerator {
    private static final com.github.victools.jsonschema.generator.SchemaGenerator GENERATOR = create();
    private static final Map<Class<?>, JsonNode> CACHE = new ConcurrentHashMap<>();

    private SchemaGenerator() {}

    private static com.github.victools.jsonschema.generator.SchemaGenerator create() {
        final SchemaGeneratorConfigBuilder builder =
            new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON)
                .with(new JacksonModule(JacksonOption.RESPECT_JSONPROPERTY_REQUIRED));
        builder.forFields().withPropertyNameOverrideResolver(field -> Json.toSnakeCase(field.getDeclaredName()));
        return new com.github.victools.jsonschema.generator.SchemaGenerator(builder.build());
    }

    /**
     * @return the schema of {@code responseType}, or null for {@code Void}. Callers must not modify it.
     */
    public static JsonNode generateSchema(final Class<?> responseType) {
        if (responseType == Void.class || responseType == void.class) {
            return null;
        }
        return CACHE.computeIfAbsent(responseType, GENERATOR::generateSchema);
    }
}
