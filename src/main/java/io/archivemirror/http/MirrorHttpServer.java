package io.archivemirror.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.archivemirror.agent.MirrorAgent;
import io.archivemirror.model.SyncAction;
import io.archivemirror.model.SyncInstruction;
import io.archivemirror.model.SyncReport;
import io.archivemirror.observability.PrometheusFormatter;
import io.archivemirror.pairing.PairingService;
import io.archivemirror.storage.LocalFileIndex;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mirror-side HTTP API: health, pairing, public downloads and the origin's sync push.
 */
public final class MirrorHttpServer implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(MirrorHttpServer.class);

    private final MirrorAgent agent;
    private HttpServer server;
    private ExecutorService executor;

    public MirrorHttpServer(MirrorAgent agent) {
        this.agent = agent;
    }

    public synchronized InetSocketAddress start(String bindAddress, int port) throws IOException {
        if (server != null) {
            return server.getAddress();
        }
        HttpServer created = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        created.createContext("/health", HttpSupport.guarded("/health", this::health));
        created.createContext("/pair", HttpSupport.guarded("/pair", this::pair));
        created.createContext("/download/", HttpSupport.guarded("/download", this::download));
        created.createContext("/sync", HttpSupport.guarded("/sync", this::sync));
        created.createContext("/metrics", HttpSupport.guarded("/metrics", this::metrics));
        AtomicInteger seq = new AtomicInteger();
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mirror-http-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        created.setExecutor(executor);
        created.start();
        server = created;
        LOG.infof("Mirror API listening on %s", created.getAddress());
        return created.getAddress();
    }

    public int port() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    private void health(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        HttpSupport.writeJson(exchange, agent.health(), 200);
    }

    private void pair(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "POST")) return;
        Map<String, String> q = HttpSupport.parseParams(exchange);
        if (agent.isPaired()) {
            HttpSupport.writeError(exchange, 409, "already_paired", "mirror is already paired as " + agent.mirrorId().orElse(""));
            return;
        }
        String code = q.getOrDefault("pairing_code", q.get("code"));
        if (code == null || code.isBlank()) {
            throw new BadRequestException("missing_code", "pairing_code is required");
        }
        String tunnel = q.getOrDefault("cloudflare_url", q.get("tunnel_url"));
        PairingService.Redemption redemption = agent.pair(code, q.get("direct_url"), tunnel);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("mirror_id", redemption.mirrorId());
        body.put("credential", redemption.credential());
        body.put("status", "pending");
        HttpSupport.writeJson(exchange, body, 200);
    }

    private void download(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        List<String> segments = HttpSupport.segmentsAfter(exchange, "/download");
        if (segments.size() != 1) {
            HttpSupport.notFound(exchange);
            return;
        }
        String entryId = segments.get(0);
        Optional<LocalFileIndex.LocalFile> file = agent.findServable(entryId);
        if (file.isEmpty()) {
            HttpSupport.writeError(exchange, 404, "entry_not_found", "not held by this mirror: " + entryId);
            return;
        }
        long size = agent.storedSize(entryId);
        String fileName = file.get().entry().fileName();
        exchange.getResponseHeaders().set("Content-Type", "application/octet-stream");
        if (fileName != null && !fileName.isBlank()) {
            exchange.getResponseHeaders().set("Content-Disposition", "attachment; filename=\"" + fileName.replace("\"", "") + "\"");
        }
        exchange.sendResponseHeaders(200, size == 0L ? -1L : size);
        try (OutputStream out = exchange.getResponseBody()) {
            agent.serveDownload(entryId, out);
        }
    }

    private void sync(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "POST")) return;
        String token = HttpSupport.extractToken(exchange, Map.of());
        if (token == null) {
            HttpSupport.writeError(exchange, 401, "missing_token", "origin credential required");
            return;
        }
        if (!agent.acceptsCredential(token)) {
            HttpSupport.writeError(exchange, 403, "forbidden_token", "credential does not match this mirror");
            return;
        }
        SyncInstruction instruction = HttpSupport.readJsonBody(exchange, SyncInstruction.class);
        if (instruction == null) {
            throw new BadRequestException("invalid_json", "sync instruction body required");
        }
        SyncReport report = agent.acceptSyncInstruction(instruction);
        HttpSupport.writeJson(exchange, report, 200);
    }

    private void metrics(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        Map<String, Long> outcomes = new LinkedHashMap<>();
        for (Map.Entry<SyncAction, Long> e : agent.outcomeCounts().entrySet()) {
            outcomes.put(e.getKey().wireName(), e.getValue());
        }
        HttpSupport.writeText(exchange, PrometheusFormatter.formatMirror(agent.health(), outcomes),
                "text/plain; version=0.0.4; charset=utf-8", 200);
    }

    @Override
    public synchronized void close() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }
}
