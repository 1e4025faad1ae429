package com.tool.invocation.schema;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes one argument of a tool whose arguments are declared as a record.
 *
 * <p>An argument is required unless it has a {@link #defaultValue()} or is {@link #optional()}.
 * Optional arguments are nullable and default to {@code null}.</p>
 *
 * <pre>
 * record ReadFileArgs(
 *     &#64;ToolArg(description = "Repository path") String path,
 *     &#64;ToolArg(defaultValue = "\"main\"") String ref,
 *     &#64;ToolArg(optional = true) Integer maxLines) {}
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface ToolArg {

    /** Wire name; defaults to the snake_case form of the component name. */
    String name() default "";

    String description() default "";

    /**
     * Default value as a JSON literal ({@code 10}, {@code true}, {@code "main"}, {@code []}).
     * A value that is not valid JSON is taken as a plain string.
     */
    String defaultValue() default "";

    /** Not required; accepts null; defaults to null unless {@link #defaultValue()} is set. */
    boolean optional() default false;
}
