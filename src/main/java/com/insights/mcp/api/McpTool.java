package com.insights.mcp.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Exposes a public method as a tool endpoint at {@code /<name>}.
 *
 * <p>{@link ApiHandlerRegistry} finds these at startup. Every method parameter needs a {@link Param}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface McpTool {
    /** Tool name; the snake_case form of the method name when empty. */
    String name() default "";

    /** What the tool does. The parameter list is appended to it. */
    String description();

    /** POST with a JSON object body when true, GET with query parameters otherwise. */
    boolean post() default false;

    /** Record type the method returns, for the listed outputSchema. */
    Class<?> responseType() default Void.class;

    /** Name of the guidance document callers should read first, if any. */
    String guidance() default "";
}
