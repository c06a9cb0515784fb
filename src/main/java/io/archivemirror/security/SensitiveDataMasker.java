package io.archivemirror.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.archivemirror.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credential-like fields before registry rows leave the process.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final int VISIBLE_PREFIX = 4;
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "secret", "token", "authorization", "credential"
    );

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(Object value) {
        return masked(Jsons.mapper().valueToTree(value));
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                JsonNode value = entry.getValue();
                if (isSensitiveKey(key) && value.isValueNode()) {
                    out.put(key, maskValue(value.asText("")));
                } else {
                    out.set(key, masked(value));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        return input;
    }

    /**
     * Keeps a short prefix of long values so operators can still tell credentials apart.
     */
    public static String maskValue(String value) {
        if (value == null || value.isEmpty()) {
            return MASK;
        }
        String v = value.trim();
        if (v.length() < VISIBLE_PREFIX * 3) {
            return MASK;
        }
        return v.substring(0, VISIBLE_PREFIX) + MASK;
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
