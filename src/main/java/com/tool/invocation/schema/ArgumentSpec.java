package com.tool.invocation.schema;

import java.lang.reflect.RecordComponent;

/**
 * One argument of a record-declared tool signature, as read by {@link SchemaDeriver}.
 *
 * @param name         wire name of the argument
 * @param component    record component the argument binds to
 * @param required     true when the argument has no default and is not optional
 * @param nullable     true when {@code null} is an accepted value
 * @param hasDefault   true when a default value (possibly {@code null}) applies when the argument is absent
 * @param defaultValue the default, already parsed from its JSON literal
 * @param description  human-readable description, empty if none
 */
public record ArgumentSpec(
        String name,
        RecordComponent component,
        boolean required,
        boolean nullable,
        boolean hasDefault,
        Object defaultValue,
        String description
) {
}
