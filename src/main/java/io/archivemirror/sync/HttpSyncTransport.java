package io.archivemirror.sync;

import io.archivemirror.model.Mirror;
import io.archivemirror.model.SyncInstruction;
import io.archivemirror.model.SyncReport;
import io.archivemirror.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts instructions to {@code <mirror>/sync}, authenticated with the mirror's own credential.
 */
public final class HttpSyncTransport implements SyncTransport {
    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpSyncTransport(long connectTimeoutMs, long requestTimeoutMs) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1L, connectTimeoutMs)))
                .build();
        this.requestTimeout = Duration.ofMillis(Math.max(1L, requestTimeoutMs));
    }

    @Override
    public SyncReport deliver(Mirror mirror, SyncInstruction instruction) {
        String url = mirror.effectiveAddress().resolve("/sync");
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + mirror.credential())
                    .POST(HttpRequest.BodyPublishers.ofByteArray(Jsons.toCompactBytes(instruction)))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new MirrorUnreachableException("bad mirror address " + url, e);
        }
        HttpResponse<byte[]> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new MirrorUnreachableException(e.getClass().getSimpleName() + " contacting " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MirrorUnreachableException("interrupted contacting " + url, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new MirrorUnreachableException("mirror answered http " + response.statusCode());
        }
        try {
            SyncReport report = Jsons.mapper().readValue(response.body(), SyncReport.class);
            if (report == null) {
                throw new MirrorUnreachableException("mirror returned an empty report");
            }
            return report;
        } catch (IOException e) {
            throw new MirrorUnreachableException("mirror returned a malformed report", e);
        }
    }
}
