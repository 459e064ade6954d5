package com.insights.mcp.params;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.insights.mcp.model.CallDescriptor;

/**
 * Declarative contract of one tool: its allow-listed fields, cross-field checks, and how the
 * normalized values become that tool's descriptor.
 */
public record ToolSchema(String toolName, List<FieldSpec<?>> fields, List<PostCheck> postChecks, Assembler assembler) {

    public ToolSchema {
        fields = List.copyOf(fields);
        postChecks = List.copyOf(postChecks);
    }

    /** The field names, in declaration order. */
    public Set<String> allowList() {
        final Set<String> names = new LinkedHashSet<>();
        for (FieldSpec<?> field : fields) {
            names.add(field.name());
        }
        return names;
    }

    @FunctionalInterface
    public interface PostCheck {
        void verify(NormalizedParams params) throws ValidationException;
    }

    @FunctionalInterface
    public interface Assembler {
        CallDescriptor assemble(NormalizedParams params);
    }
}
