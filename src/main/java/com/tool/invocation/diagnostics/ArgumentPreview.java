package com.tool.invocation.diagnostics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded, single-line JSON preview of call arguments for diagnostics records.
 *
 * <p>Strings are cut at 2,000 characters, lists at 100 items, maps at 200 entries and nesting at
 * depth 6. Redaction is applied by {@link DiagnosticsStore} when the record is stored.</p>
 */
public final class ArgumentPreview {

    static final int MAX_STRING = 2_000;
    static final int MAX_ITEMS = 100;
    static final int MAX_ENTRIES = 200;
    static final int MAX_DEPTH = 6;
    static final int MAX_PREVIEW = 4_000;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ArgumentPreview() {
        // utility class
    }

    public static String of(Map<String, Object> args) {
        Object bounded = bound(args != null ? args : Map.of(), 0);
        String json;
        try {
            json = MAPPER.writeValueAsString(bounded);
        } catch (JsonProcessingException e) {
            json = String.valueOf(bounded);
        }
        json = json.replace('\n', ' ').replace('\r', ' ');
        return json.length() > MAX_PREVIEW ? json.substring(0, MAX_PREVIEW) + "...(truncated)" : json;
    }

    /**
     * Details added to every call event: preview, sorted key list and key count.
     */
    public static Map<String, Object> details(Map<String, Object> args) {
        Map<String, Object> safe = args != null ? args : Map.of();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("arg_keys", safe.keySet().stream().sorted().toList());
        out.put("arg_count", safe.size());
        out.put("args_preview", of(safe));
        return out;
    }

    static Object bound(Object value, int depth) {
        if (value == null || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof CharSequence text) {
            String s = text.toString();
            return s.length() > MAX_STRING ? s.substring(0, MAX_STRING) + "...(truncated)" : s;
        }
        if (depth >= MAX_DEPTH) {
            return "...(max depth)";
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            int count = 0;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (count++ >= MAX_ENTRIES) {
                    out.put("...", (map.size() - MAX_ENTRIES) + " more entries");
                    break;
                }
                out.put(String.valueOf(entry.getKey()), bound(entry.getValue(), depth + 1));
            }
            return out;
        }
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>();
            int count = 0;
            for (Object item : items) {
                if (count++ >= MAX_ITEMS) {
                    out.add("... " + (items.size() - MAX_ITEMS) + " more items");
                    break;
                }
                out.add(bound(item, depth + 1));
            }
            return out;
        }
        return bound(String.valueOf(value), depth);
    }
}
