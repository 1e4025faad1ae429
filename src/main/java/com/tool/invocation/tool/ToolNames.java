package com.tool.invocation.tool;

import java.util.Locale;

/**
 * Canonical forms of tool names used for tolerant lookup.
 */
public final class ToolNames {

    private ToolNames() {
        // utility class
    }

    /**
     * Lowercased name with leading slashes and all separators removed:
     * {@code /Create-Issue}, {@code create_issue} and {@code createIssue} all become {@code createissue}.
     */
    public static String canonicalize(String name) {
        if (name == null) {
            return "";
        }
        String stripped = stripLeadingSlashes(name.trim());
        StringBuilder out = new StringBuilder(stripped.length());
        for (int i = 0; i < stripped.length(); i++) {
            char c = stripped.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                out.append(Character.toLowerCase(c));
            }
        }
        return out.toString();
    }

    /**
     * Drops a module qualifier: {@code github.create_issue}, {@code tools:create_issue} and
     * {@code tools/create_issue} become {@code create_issue}. Names without a qualifier are returned unchanged.
     */
    public static String unqualified(String name) {
        String stripped = stripLeadingSlashes(name.trim());
        int cut = Math.max(stripped.lastIndexOf('.'), Math.max(stripped.lastIndexOf(':'), stripped.lastIndexOf('/')));
        return cut >= 0 && cut < stripped.length() - 1 ? stripped.substring(cut + 1) : stripped;
    }

    static String lower(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static String stripLeadingSlashes(String name) {
        int i = 0;
        while (i < name.length() && name.charAt(i) == '/') {
            i++;
        }
        return name.substring(i);
    }
}
