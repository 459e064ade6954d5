package com.insights.mcp.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes one argument of an {@link McpTool} method.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Param {
    /** Marks an argument without a default. No caller can send this text. */
    String REQUIRED = "\0required";

    /** Description shown in the tool listing. */
    String value();

    /** Name on the wire; the snake_case form of the Java parameter name when empty. */
    String name() default "";

    /** Default value. Empty means the argument is optional with no default. */
    String defaultValue() default REQUIRED;
}
