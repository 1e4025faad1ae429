package com.tool.invocation.gate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Heuristically extracts the branch/ref and path a call operates on from its arguments.
 *
 * <p>A call may name several refs, e.g. a merge names both the branch it lands on ({@code base}) and
 * the branch it takes changes from ({@code head}). All of them are kept so the write gate can deny a
 * call when any one of them is the protected ref. The primary ref is the first one found; refs a
 * mutation lands on are ranked ahead of source refs.</p>
 */
public final class TargetRefExtractor {

    static final List<String> REF_KEYS = List.of(
            "target_ref", "ref", "branch", "target_branch", "base", "base_branch", "head", "head_branch");
    static final List<String> PATH_KEYS = List.of("target_path", "path", "file_path", "filepath");

    private TargetRefExtractor() {
        // utility class
    }

    /**
     * Target of a call; {@code ref} and {@code path} may be null.
     *
     * @param ref  primary ref, the first element of {@code refs}
     * @param refs every distinct ref named by the call, in key priority order
     * @param path primary path
     */
    public record Target(String ref, List<String> refs, String path) {

        public Target {
            refs = refs != null ? List.copyOf(refs) : List.of();
        }

        public Target(String ref, String path) {
            this(ref, ref != null ? List.of(ref) : List.of(), path);
        }
    }

    public static Target extract(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return new Target(null, null);
        }
        List<String> refs = allNonBlank(args, REF_KEYS);
        List<String> paths = allNonBlank(args, PATH_KEYS);
        return new Target(refs.isEmpty() ? null : refs.get(0), refs, paths.isEmpty() ? null : paths.get(0));
    }

    private static List<String> allNonBlank(Map<String, Object> args, List<String> keys) {
        List<String> values = new ArrayList<>();
        for (String key : keys) {
            if (args.get(key) instanceof String value && !value.isBlank() && !values.contains(value.trim())) {
                values.add(value.trim());
            }
        }
        return values;
    }
}
