package com.tool.invocation.tool;

import com.tool.invocation.schema.NameSuggester;
import com.tool.invocation.schema.SchemaComparator;
import com.tool.invocation.schema.SchemaOverrides;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only table of tool descriptors, built once at startup and read at call time.
 *
 * <p>Lookup is layered: exact name, then case-insensitive, then canonical (separators, leading
 * slashes, module qualifiers and case ignored). A case-insensitive or canonical candidate that
 * matches more than one registered name is ambiguous and resolves to nothing.</p>
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final SchemaOverrides overrides;
    private final Map<String, ToolDescriptor> tools = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> byLowerCase = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> byCanonical = new ConcurrentHashMap<>();

    public ToolRegistry() {
        this(SchemaOverrides.none());
    }

    public ToolRegistry(SchemaOverrides overrides) {
        this.overrides = Objects.requireNonNull(overrides, "overrides is required");
    }

    /**
     * Registers a tool, applying its schema override if one is configured.
     *
     * @throws DuplicateToolException if the exact name is already registered
     */
    public synchronized ToolDescriptor register(ToolDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor is required");
        String name = descriptor.name();
        if (tools.containsKey(name)) {
            throw new DuplicateToolException(name);
        }
        if (overrides.forTool(name).isPresent()) {
            descriptor.publish(overrides.apply(name, descriptor.publishedSchema()));
        }
        tools.put(name, descriptor);
        byLowerCase.computeIfAbsent(ToolNames.lower(name), k -> ConcurrentHashMap.newKeySet()).add(name);
        byCanonical.computeIfAbsent(ToolNames.canonicalize(name), k -> ConcurrentHashMap.newKeySet()).add(name);
        log.debug("tool.registered name={} mutating={} schemaHash={}", name, descriptor.mutating(),
                descriptor.schemaHash());
        return descriptor;
    }

    public Optional<ToolDescriptor> find(String requested) {
        if (requested == null || requested.isBlank()) {
            return Optional.empty();
        }
        ToolDescriptor exact = tools.get(requested);
        if (exact != null) {
            return Optional.of(exact);
        }

        Optional<String> resolved = unique(byLowerCase.get(ToolNames.lower(requested)));
        if (resolved.isEmpty()) {
            resolved = unique(byCanonical.get(ToolNames.canonicalize(requested)));
        }
        if (resolved.isEmpty()) {
            String unqualified = ToolNames.unqualified(requested);
            if (!unqualified.equals(requested.trim())) {
                ToolDescriptor bare = tools.get(unqualified);
                resolved = bare != null
                        ? Optional.of(bare.name())
                        : unique(byCanonical.get(ToolNames.canonicalize(unqualified)));
            }
        }
        resolved.ifPresent(name -> log.debug("tool.resolved requested={} name={}", requested, name));
        return resolved.map(tools::get);
    }

    /**
     * Closest registered name for an unknown tool, if any is close enough.
     */
    public Optional<String> suggest(String requested) {
        return NameSuggester.suggest(requested, tools.keySet());
    }

    /**
     * Snapshot of all descriptors sorted by name.
     */
    public List<ToolDescriptor> list() {
        List<ToolDescriptor> out = new ArrayList<>(tools.values());
        out.sort(Comparator.comparing(ToolDescriptor::name));
        return out;
    }

    public Set<String> names() {
        return new TreeSet<>(tools.keySet());
    }

    public int size() {
        return tools.size();
    }

    /**
     * Publishes {@code candidate} as the tool's schema if it differs from the published one
     * in required members, property set, types or defaults.
     *
     * @return true if the schema was replaced
     * @throws IllegalArgumentException if the tool is not registered
     */
    public synchronized boolean republishIfChanged(String name, Map<String, Object> candidate) {
        ToolDescriptor descriptor = tools.get(name);
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown tool: " + name);
        }
        Map<String, Object> effective = overrides.apply(name, candidate);
        List<String> differences = SchemaComparator.differences(descriptor.publishedSchema(), effective);
        if (differences.isEmpty()) {
            return false;
        }
        descriptor.publish(effective);
        log.info("tool.schema.republished name={} changes={} schemaHash={}", name, differences,
                descriptor.schemaHash());
        return true;
    }

    private static Optional<String> unique(Set<String> candidates) {
        if (candidates == null || candidates.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(candidates.iterator().next());
    }
}
