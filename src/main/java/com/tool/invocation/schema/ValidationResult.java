package com.tool.invocation.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of validating a call's arguments against a tool schema.
 *
 * @param errors            one line per violation, prefixed with the argument path
 * @param unknownArguments  argument names the schema does not declare
 * @param suggestions       closest declared name for each unknown argument that has one
 * @param missingRequired   required arguments that were absent
 * @param requiredArguments all required argument names
 * @param optionalArguments all optional argument names
 */
public record ValidationResult(
        List<String> errors,
        List<String> unknownArguments,
        Map<String, String> suggestions,
        List<String> missingRequired,
        List<String> requiredArguments,
        List<String> optionalArguments
) {

    public ValidationResult {
        errors = List.copyOf(errors);
        unknownArguments = List.copyOf(unknownArguments);
        suggestions = Collections.unmodifiableMap(new LinkedHashMap<>(suggestions));
        missingRequired = List.copyOf(missingRequired);
        requiredArguments = List.copyOf(requiredArguments);
        optionalArguments = List.copyOf(optionalArguments);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    /**
     * Guidance attached to validation failures: expected arguments and likely typos.
     */
    public Map<String, Object> guidance() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (!unknownArguments.isEmpty()) {
            out.put("unknown_args", unknownArguments);
        }
        if (!suggestions.isEmpty()) {
            out.put("did_you_mean", suggestions);
        }
        if (!missingRequired.isEmpty()) {
            out.put("missing_required", missingRequired);
        }
        out.put("required_args", requiredArguments);
        out.put("optional_args", optionalArguments);
        return out;
    }

    /**
     * JSON-friendly form returned by {@code validate_args}.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("valid", valid());
        out.put("errors", errors);
        out.putAll(guidance());
        return out;
    }
}
