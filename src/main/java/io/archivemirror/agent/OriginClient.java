package io.archivemirror.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.archivemirror.heartbeat.HeartbeatReport;
import io.archivemirror.pairing.PairingException;
import io.archivemirror.pairing.PairingFailure;
import io.archivemirror.pairing.PairingService;
import io.archivemirror.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The mirror's calls into the origin: pairing, heartbeats and content fetches.
 */
public final class OriginClient {
    private final String baseUrl;
    private final HttpClient client;
    private final Duration requestTimeout;
    private final Duration fetchTimeout;

    public OriginClient(String baseUrl, long connectTimeoutMs, long requestTimeoutMs, long fetchTimeoutMs) {
        String value = baseUrl == null ? "" : baseUrl.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        this.baseUrl = value;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1L, connectTimeoutMs)))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.requestTimeout = Duration.ofMillis(Math.max(1L, requestTimeoutMs));
        this.fetchTimeout = Duration.ofMillis(Math.max(1L, fetchTimeoutMs));
    }

    public String baseUrl() {
        return baseUrl;
    }

    public PairingService.Redemption redeem(String code, String mirrorName, String directUrl, String tunnelUrl, int capacity) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pairing_code", code);
        body.put("mirror_name", mirrorName);
        body.put("direct_url", directUrl);
        if (tunnelUrl != null && !tunnelUrl.isBlank()) {
            body.put("cloudflare_url", tunnelUrl);
        }
        body.put("capacity", capacity);
        HttpResponse<byte[]> response = postJson("/api/pairing/redeem", null, body);
        JsonNode json = readJson(response.body());
        if (response.statusCode() / 100 == 2) {
            String mirrorId = json.path("mirror_id").asText("");
            String credential = json.path("credential").asText("");
            if (mirrorId.isBlank() || credential.isBlank()) {
                throw new FetchException(FetchFailure.UNREACHABLE, "origin returned an incomplete pairing response");
            }
            return new PairingService.Redemption(mirrorId, credential);
        }
        String error = json.path("error").asText("");
        PairingFailure failure = PairingFailure.fromErrorCode(error);
        if (failure != null) {
            throw new PairingException(failure, json.path("message").asText(error));
        }
        if (response.statusCode() == 400) {
            throw new IllegalArgumentException(json.path("message").asText("origin rejected pairing request"));
        }
        throw new FetchException(FetchFailure.UNREACHABLE, "origin answered http " + response.statusCode());
    }

    public void heartbeat(String credential, HeartbeatReport report) {
        HttpResponse<byte[]> response = postJson("/api/mirrors/heartbeat", credential, report);
        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new FetchException(FetchFailure.UNAUTHORIZED, "origin rejected credential (http " + status + ")");
        }
        if (status / 100 != 2) {
            throw new FetchException(FetchFailure.UNREACHABLE, "origin answered http " + status);
        }
    }

    /**
     * Downloads an entry's content into {@code target}, then feeds the stored bytes through
     * {@code digest}. The whole exchange, body included, must finish within the fetch timeout;
     * a stalled transfer is cancelled and reported as unreachable. Returns the number of bytes.
     */
    public long fetchContent(String credential, String entryId, Path target, MessageDigest digest) {
        URI uri = uri("/api/mirrors/content/" + URLEncoder.encode(entryId, StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(fetchTimeout)
                .header("Authorization", "Bearer " + credential)
                .GET()
                .build();
        HttpResponse.BodyHandler<Path> handler = info -> info.statusCode() / 100 == 2
                ? HttpResponse.BodySubscribers.ofFile(target)
                : HttpResponse.BodySubscribers.replacing(target);
        CompletableFuture<HttpResponse<Path>> pending = client.sendAsync(request, handler);
        HttpResponse<Path> response;
        try {
            response = pending.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new FetchException(FetchFailure.UNREACHABLE,
                    "fetch of " + entryId + " timed out after " + fetchTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new FetchException(FetchFailure.UNREACHABLE, "fetch of " + entryId + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new FetchException(FetchFailure.UNREACHABLE, "fetch of " + entryId + " interrupted", e);
        }
        int status = response.statusCode();
        if (status == 404) {
            throw new FetchException(FetchFailure.NOT_FOUND, "origin has no content for " + entryId);
        }
        if (status == 401 || status == 403) {
            throw new FetchException(FetchFailure.UNAUTHORIZED, "origin rejected credential (http " + status + ")");
        }
        if (status / 100 != 2) {
            throw new FetchException(FetchFailure.UNREACHABLE, "origin answered http " + status);
        }
        try (InputStream in = new DigestInputStream(Files.newInputStream(target), digest)) {
            return in.transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            throw new FetchException(FetchFailure.UNREACHABLE, "reading fetched " + entryId + " failed: " + e.getMessage(), e);
        }
    }

    private HttpResponse<byte[]> postJson(String path, String credential, Object body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(Jsons.toCompactBytes(body)));
        if (credential != null && !credential.isBlank()) {
            builder.header("Authorization", "Bearer " + credential);
        }
        try {
            return client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new FetchException(FetchFailure.UNREACHABLE, "origin unreachable at " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchFailure.UNREACHABLE, "interrupted contacting origin", e);
        }
    }

    private URI uri(String path) {
        try {
            return URI.create(baseUrl + path);
        } catch (IllegalArgumentException e) {
            throw new FetchException(FetchFailure.UNREACHABLE, "invalid origin url " + baseUrl, e);
        }
    }

    private static JsonNode readJson(byte[] body) {
        if (body == null || body.length == 0) {
            return Jsons.mapper().createObjectNode();
        }
        try {
            return Jsons.mapper().readTree(body);
        } catch (IOException e) {
            throw new FetchException(FetchFailure.UNREACHABLE, "origin returned malformed JSON", e);
        }
    }
}
