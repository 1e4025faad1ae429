package com.tool.invocation.cache;

import com.tool.invocation.schema.Schemas;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Derives dedup fingerprints from a tool name and its normalized arguments.
 * Argument order does not matter; values are compared by their canonical JSON form.
 */
public final class Fingerprints {

    private Fingerprints() {
        // utility class
    }

    public static String of(String toolName, Map<String, Object> normalizedArgs) {
        String canonicalArgs = Schemas.canonicalJson(normalizedArgs != null ? normalizedArgs : Map.of());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(toolName.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(canonicalArgs.getBytes(StandardCharsets.UTF_8));
            return toolName + ":" + HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
