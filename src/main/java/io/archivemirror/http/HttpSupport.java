package io.archivemirror.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.archivemirror.agent.FetchException;
import io.archivemirror.pairing.PairingException;
import io.archivemirror.util.Jsons;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Request parsing, JSON responses and error mapping shared by the origin and mirror servers.
 */
public final class HttpSupport {
    private static final Logger LOG = Logger.getLogger(HttpSupport.class);

    private HttpSupport() {
    }

    /**
     * Wraps a handler so that domain failures become JSON errors and the exchange is always closed.
     */
    public static HttpHandler guarded(String route, HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (PairingException e) {
                writeError(exchange, e.failure().httpStatus(), e.failure().errorCode(), e.getMessage());
            } catch (BadRequestException e) {
                writeError(exchange, 400, e.error(), e.getMessage());
            } catch (IllegalArgumentException e) {
                writeError(exchange, 400, "bad_request", e.getMessage());
            } catch (IllegalStateException e) {
                writeError(exchange, 409, "invalid_state", e.getMessage());
            } catch (FetchException e) {
                LOG.warnf("Origin call from %s failed (%s): %s", route, e.failure(), e.getMessage());
                writeError(exchange, 502, "origin_unreachable", e.getMessage());
            } catch (IOException e) {
                LOG.debugf("Client I/O ended on %s: %s", route, e.getMessage());
            } catch (RuntimeException e) {
                LOG.errorf(e, "Unhandled error on %s", route);
                writeError(exchange, 500, "internal_error", "internal error");
            } finally {
                exchange.close();
            }
        };
    }

    public static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    public static void writeText(HttpExchange exchange, String body, String contentType, int status) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    /**
     * Writes {@code {"error": ..., "message": ...}} unless a response is already under way.
     */
    public static void writeError(HttpExchange exchange, int status, String error, String message) throws IOException {
        if (exchange.getResponseCode() != -1) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        if (message != null && !message.isBlank()) {
            body.put("message", message);
        }
        writeJson(exchange, body, status);
    }

    public static void notFound(HttpExchange exchange) throws IOException {
        writeJson(exchange, Map.of("error", "not_found", "path", exchange.getRequestURI().getPath()), 404);
    }

    public static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        if (method == null) {
            writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
            return false;
        }
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeJson(exchange, Map.of("error", "method_not_allowed", "method", method), 405);
        return false;
    }

    public static String extractToken(HttpExchange exchange, Map<String, String> query) {
        String authz = exchange.getRequestHeaders().getFirst("Authorization");
        if (authz != null && authz.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String token = authz.substring(7).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        String queryToken = query == null ? null : query.get("token");
        if (queryToken != null && !queryToken.isBlank()) {
            return queryToken.trim();
        }
        return null;
    }

    /**
     * Query string plus, for POST, a flat JSON object or form body. Nested JSON values are
     * kept as their JSON text.
     */
    public static Map<String, String> parseParams(HttpExchange exchange) throws IOException {
        Map<String, String> out = new LinkedHashMap<>(parseQuery(exchange.getRequestURI()));
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            return out;
        }
        byte[] raw = exchange.getRequestBody().readAllBytes();
        String body = new String(raw, StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            return out;
        }
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        String normalized = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (normalized.contains("application/json") || body.startsWith("{")) {
            JsonNode node = readTree(body);
            if (!node.isObject()) {
                throw new BadRequestException("invalid_json", "request body must be a JSON object");
            }
            node.fieldNames().forEachRemaining(key -> {
                JsonNode value = node.path(key);
                if (value.isNull()) {
                    out.put(key, "");
                } else if (value.isValueNode()) {
                    out.put(key, value.asText());
                } else {
                    out.put(key, value.toString());
                }
            });
            return out;
        }
        out.putAll(parseQueryString(body));
        return out;
    }

    public static <T> T readJsonBody(HttpExchange exchange, Class<T> type) throws IOException {
        byte[] raw = exchange.getRequestBody().readAllBytes();
        if (raw.length == 0) {
            throw new BadRequestException("invalid_json", "request body is empty");
        }
        try {
            T value = Jsons.mapper().readValue(raw, type);
            if (value == null) {
                throw new BadRequestException("invalid_json", "request body is null");
            }
            return value;
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new BadRequestException("invalid_json", e.getOriginalMessage());
        }
    }

    private static JsonNode readTree(String body) {
        try {
            return Jsons.mapper().readTree(body);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new BadRequestException("invalid_json", e.getOriginalMessage());
        }
    }

    public static Map<String, String> parseQuery(URI uri) {
        String raw = uri == null ? null : uri.getRawQuery();
        return parseQueryString(raw);
    }

    static Map<String, String> parseQueryString(String raw) {
        Map<String, String> out = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            out.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return out;
    }

    /**
     * Path segments after {@code prefix}, e.g. {@code /api/mirrors/m1/status} with prefix
     * {@code /api/mirrors} gives {@code [m1, status]}.
     */
    public static List<String> segmentsAfter(HttpExchange exchange, String prefix) {
        String path = exchange.getRequestURI().getPath();
        List<String> out = new ArrayList<>();
        if (path == null || !path.startsWith(prefix)) {
            return out;
        }
        for (String part : path.substring(prefix.length()).split("/")) {
            if (!part.isEmpty()) {
                out.add(URLDecoder.decode(part, StandardCharsets.UTF_8));
            }
        }
        return out;
    }

    public static int parseIntOrDefault(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new BadRequestException("bad_request", "not a number: " + raw);
        }
    }

    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
