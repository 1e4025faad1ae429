package com.tool.invocation.diagnostics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scrubs credential-shaped substrings from text before it is stored in a diagnostics buffer.
 * This is a best-effort filter for accidental leaks from upstream or subprocess output,
 * not a security boundary.
 */
public final class Redactor {

    private static final Pattern BASIC_AUTH =
            Pattern.compile("Authorization:\\s*Basic\\s+[A-Za-z0-9+/=]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern BEARER =
            Pattern.compile("Authorization:\\s*Bearer\\s+[^\\s\"']+", Pattern.CASE_INSENSITIVE);
    private static final Pattern GITHUB_TOKEN =
            Pattern.compile("\\b(?:gh[pousr]_[A-Za-z0-9]{20,}|github_pat_[A-Za-z0-9_]{20,})\\b");
    private static final Pattern EMAIL =
            Pattern.compile("\\b[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}\\b");
    private static final Pattern IPV4 =
            Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");

    private Redactor() {
        // utility class
    }

    /**
     * Redacts auth headers, hosted-git tokens, e-mail addresses and IPv4 addresses.
     *
     * @param text the text to scrub, may be null
     * @return the scrubbed text, or null when the input was null
     */
    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String s = BASIC_AUTH.matcher(text).replaceAll("Authorization: Basic [REDACTED]");
        s = BEARER.matcher(s).replaceAll("Authorization: Bearer [REDACTED]");
        s = GITHUB_TOKEN.matcher(s).replaceAll("[REDACTED_TOKEN]");
        s = EMAIL.matcher(s).replaceAll("[REDACTED_EMAIL]");
        return IPV4.matcher(s).replaceAll("[REDACTED_IP]");
    }

    /**
     * Recursively redacts every string found in maps and lists. Other values pass through.
     */
    public static Object redactValue(Object value) {
        if (value instanceof String s) {
            return redact(s);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.put(String.valueOf(entry.getKey()), redactValue(entry.getValue()));
            }
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(redactValue(item));
            }
            return out;
        }
        return value;
    }
}
