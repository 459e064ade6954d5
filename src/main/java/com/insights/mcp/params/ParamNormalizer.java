package com.insights.mcp.params;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.insights.mcp.model.CallDescriptor;

/**
 * Turns a sanitized request into a tool's call descriptor by walking that tool's {@link ToolSchema}.
 *
 * <p>Fields are validated independently first. Conditional fields ({@link Presence.RequiredWhen})
 * are evaluated afterwards, once the field they depend on has its normalized value, followed by
 * the schema's post-checks.
 */
public class ParamNormalizer {
    private static final Logger LOG = LogManager.getLogger(ParamNormalizer.class);

    private final Clock clock;

    public ParamNormalizer() {
        this(Clock.systemUTC());
    }

    public ParamNormalizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws ValidationException naming the first field that breaks the schema
     */
    public CallDescriptor normalize(ToolSchema schema, SanitizedRequest request) throws ValidationException {
        final Instant callTime = clock.instant();
        final Map<String, Object> values = new LinkedHashMap<>();
        final List<FieldSpec<?>> conditional = new ArrayList<>();

        for (FieldSpec<?> spec : schema.fields()) {
            final Presence presence = spec.presence();
            if (presence instanceof Presence.RequiredWhen) {
                conditional.add(spec);
            } else if (request.has(spec.name())) {
                values.put(spec.name(), spec.parser().parse(spec.name(), request.get(spec.name())));
            } else if (presence instanceof Presence.Required) {
                throw ValidationException.missing(spec.name(), spec.expected());
            } else if (presence instanceof Presence.Omittable opt && opt.fallback() != null) {
                values.put(spec.name(), opt.fallback().apply(callTime));
            }
        }

        for (FieldSpec<?> spec : conditional) {
            final Presence.RequiredWhen when = (Presence.RequiredWhen) spec.presence();
            if (!Objects.equals(values.get(when.field()), when.value())) {
                if (request.has(spec.name())) {
                    LOG.debug("Ignoring {} since {} is not '{}'", spec.name(), when.field(), when.label());
                }
                continue;
            }
            final String requirement = spec.name() + " must be provided as " + spec.expected()
                + " when " + when.field() + "='" + when.label() + "'";
            if (!request.has(spec.name())) {
                throw new ValidationException(spec.name(), requirement);
            }
            try {
                values.put(spec.name(), spec.parser().parse(spec.name(), request.get(spec.name())));
            } catch (ValidationException e) {
                throw new ValidationException(spec.name(), requirement);
            }
        }

        final NormalizedParams params = new NormalizedParams(values);
        for (ToolSchema.PostCheck check : schema.postChecks()) {
            check.verify(params);
        }
        return schema.assembler().assemble(params);
    }
}
