package com.tool.invocation.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tolerant aliasing applied to call arguments before validation.
 *
 * <ul>
 *   <li>camelCase keys are renamed to the snake_case property the schema declares ({@code filePath} to {@code file_path})</li>
 *   <li>a compound {@code full_name} / {@code repository} value {@code "owner/repo"} is split into
 *       {@code owner} and {@code repo} when the schema declares both and neither was given</li>
 * </ul>
 *
 * <p>Only keys are renamed or split; values are never coerced, so validation afterwards
 * accepts nothing it would not accept for the canonical spelling.</p>
 */
public class ArgumentNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ArgumentNormalizer.class);

    private static final List<String> COMPOUND_REPOSITORY_KEYS = List.of("full_name", "repository", "repo_full_name");

    public Map<String, Object> normalize(Map<String, Object> schema, Map<String, Object> args) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (args == null || args.isEmpty()) {
            return out;
        }
        Map<String, Object> properties = Schemas.properties(schema);

        for (Map.Entry<String, Object> entry : args.entrySet()) {
            String key = entry.getKey();
            if (!properties.containsKey(key)) {
                String snake = SchemaDeriver.snakeCase(key);
                if (!snake.equals(key) && properties.containsKey(snake) && !args.containsKey(snake)) {
                    log.debug("args.alias from={} to={}", key, snake);
                    key = snake;
                }
            }
            out.put(key, entry.getValue());
        }

        splitCompoundRepository(properties, out);
        return out;
    }

    private void splitCompoundRepository(Map<String, Object> properties, Map<String, Object> args) {
        if (!properties.containsKey("owner") || !properties.containsKey("repo")
                || args.containsKey("owner") || args.containsKey("repo")) {
            return;
        }
        for (String alias : COMPOUND_REPOSITORY_KEYS) {
            if (properties.containsKey(alias) || !(args.get(alias) instanceof String compound)) {
                continue;
            }
            String[] parts = compound.trim().split("/");
            if (parts.length == 2 && !parts[0].isBlank() && !parts[1].isBlank()) {
                args.remove(alias);
                args.put("owner", parts[0]);
                args.put("repo", parts[1]);
                log.debug("args.split from={} owner={} repo={}", alias, parts[0], parts[1]);
                return;
            }
        }
    }
}
