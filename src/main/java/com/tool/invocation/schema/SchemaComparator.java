package com.tool.invocation.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Decides whether a previously published schema must be republished.
 *
 * <p>A schema counts as changed when the required set or the property set differ, or when any
 * shared property differs in type, nullability, default (presence or value), items or enum values.
 * Descriptions are ignored.</p>
 */
public final class SchemaComparator {

    private SchemaComparator() {
        // utility class
    }

    public static boolean hasChanged(Map<String, Object> published, Map<String, Object> candidate) {
        return !differences(published, candidate).isEmpty();
    }

    /**
     * Human-readable list of the differences, empty when the schemas are equivalent.
     */
    public static List<String> differences(Map<String, Object> published, Map<String, Object> candidate) {
        List<String> diffs = new ArrayList<>();
        if (published == null || candidate == null) {
            if (published != candidate) {
                diffs.add("schema added or removed");
            }
            return diffs;
        }
        if (!Objects.equals(Schemas.types(published), Schemas.types(candidate))) {
            diffs.add("root type changed");
        }

        TreeSet<String> oldRequired = new TreeSet<>(Schemas.required(published));
        TreeSet<String> newRequired = new TreeSet<>(Schemas.required(candidate));
        if (!oldRequired.equals(newRequired)) {
            diffs.add("required changed: " + oldRequired + " -> " + newRequired);
        }

        Map<String, Object> oldProps = Schemas.properties(published);
        Map<String, Object> newProps = Schemas.properties(candidate);
        TreeSet<String> names = new TreeSet<>(oldProps.keySet());
        names.addAll(newProps.keySet());
        for (String name : names) {
            Object before = oldProps.get(name);
            Object after = newProps.get(name);
            if (before == null) {
                diffs.add("property added: " + name);
            } else if (after == null) {
                diffs.add("property removed: " + name);
            } else {
                compareProperty(name, asMap(before), asMap(after), diffs);
            }
        }
        return diffs;
    }

    private static void compareProperty(String name, Map<String, Object> before, Map<String, Object> after,
                                        List<String> diffs) {
        if (!Objects.equals(new TreeSet<>(Schemas.types(before)), new TreeSet<>(Schemas.types(after)))) {
            diffs.add(name + ": type " + Schemas.types(before) + " -> " + Schemas.types(after));
        }
        if (Schemas.isNullable(before) != Schemas.isNullable(after)) {
            diffs.add(name + ": nullable changed");
        }
        boolean hadDefault = before.containsKey("default");
        boolean hasDefault = after.containsKey("default");
        if (hadDefault != hasDefault) {
            diffs.add(name + (hasDefault ? ": default added" : ": default removed"));
        } else if (hadDefault && !Objects.equals(
                Schemas.canonicalJson(before.get("default")), Schemas.canonicalJson(after.get("default")))) {
            diffs.add(name + ": default changed");
        }
        if (!Objects.equals(canonical(before.get("items")), canonical(after.get("items")))) {
            diffs.add(name + ": items changed");
        }
        if (!Objects.equals(canonical(before.get("enum")), canonical(after.get("enum")))) {
            diffs.add(name + ": enum changed");
        }
    }

    private static String canonical(Object value) {
        return value == null ? null : Schemas.canonicalJson(value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
    }
}
