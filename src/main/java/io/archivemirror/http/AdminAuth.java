package io.archivemirror.http;

import com.sun.net.httpserver.HttpExchange;
import io.archivemirror.util.Hashing;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Bearer tokens for operator endpoints. Several tokens may be active at once for rotation.
 * With no tokens configured the admin API is open.
 */
public record AdminAuth(List<String> tokens) {
    public AdminAuth {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public static AdminAuth disabled() {
        return new AdminAuth(List.of());
    }

    /**
     * Accepts comma-separated values, blanks dropped.
     */
    public static AdminAuth parse(List<String> raw) {
        List<String> out = new ArrayList<>();
        if (raw != null) {
            for (String value : raw) {
                if (value == null) {
                    continue;
                }
                for (String part : value.split(",")) {
                    String token = part.trim();
                    if (!token.isEmpty() && !out.contains(token)) {
                        out.add(token);
                    }
                }
            }
        }
        return new AdminAuth(out);
    }

    public boolean enabled() {
        return !tokens.isEmpty();
    }

    public boolean accepts(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        boolean match = false;
        for (String candidate : tokens) {
            match |= Hashing.constantTimeEquals(candidate, token.trim());
        }
        return match;
    }

    /**
     * Writes 401/403 and returns false when the request is not from an operator.
     */
    public boolean authorize(HttpExchange exchange, Map<String, String> query) throws IOException {
        if (!enabled()) {
            return true;
        }
        String token = HttpSupport.extractToken(exchange, query);
        if (token == null) {
            HttpSupport.writeJson(exchange, Map.of("error", "missing_token"), 401);
            return false;
        }
        if (!accepts(token)) {
            HttpSupport.writeJson(exchange, Map.of("error", "forbidden_token"), 403);
            return false;
        }
        return true;
    }
}
