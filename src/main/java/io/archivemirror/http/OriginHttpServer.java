package io.archivemirror.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.archivemirror.heartbeat.HeartbeatReport;
import io.archivemirror.model.CatalogEntry;
import io.archivemirror.model.Mirror;
import io.archivemirror.model.MirrorStatus;
import io.archivemirror.model.PairingCode;
import io.archivemirror.observability.PrometheusFormatter;
import io.archivemirror.origin.OriginNode;
import io.archivemirror.pairing.PairingService;
import io.archivemirror.security.SensitiveDataMasker;
import io.archivemirror.storage.MirrorStore;
import io.archivemirror.sync.DownloadRouter;
import io.archivemirror.sync.SyncResult;
import io.archivemirror.util.Hashing;
import io.archivemirror.util.Jsons;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
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
 * Origin-side HTTP API: pairing, heartbeats, content for mirrors, operator endpoints,
 * download routing and metrics.
 */
public final class OriginHttpServer implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(OriginHttpServer.class);
    private static final String MIRRORS = "/api/mirrors";

    private final OriginNode node;
    private final AdminAuth auth;
    private HttpServer server;
    private ExecutorService executor;

    public OriginHttpServer(OriginNode node, AdminAuth auth) {
        this.node = node;
        this.auth = auth == null ? AdminAuth.disabled() : auth;
    }

    public synchronized InetSocketAddress start(String bindAddress, int port) throws IOException {
        if (server != null) {
            return server.getAddress();
        }
        HttpServer created = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        created.createContext("/health", HttpSupport.guarded("/health", this::health));
        created.createContext("/api/pairing/redeem", HttpSupport.guarded("/api/pairing/redeem", this::redeem));
        created.createContext("/api/pairing-codes", HttpSupport.guarded("/api/pairing-codes", this::issueCode));
        created.createContext(MIRRORS, HttpSupport.guarded(MIRRORS, this::mirrors));
        created.createContext("/api/route/", HttpSupport.guarded("/api/route", this::route));
        created.createContext("/download/", HttpSupport.guarded("/download", this::download));
        created.createContext("/metrics", HttpSupport.guarded("/metrics", this::metrics));
        AtomicInteger seq = new AtomicInteger();
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "origin-http-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        created.setExecutor(executor);
        created.start();
        server = created;
        if (!auth.enabled()) {
            LOG.warn("No admin token configured; operator endpoints are unauthenticated");
        }
        LOG.infof("Origin API listening on %s", created.getAddress());
        return created.getAddress();
    }

    public int port() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    private void health(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        HttpSupport.writeJson(exchange, Map.of("status", "ok", "role", "origin"), 200);
    }

    private void redeem(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "POST")) return;
        Map<String, String> q = HttpSupport.parseParams(exchange);
        String code = firstNonBlank(q.get("pairing_code"), q.get("code"));
        String tunnel = firstNonBlank(q.get("cloudflare_url"), q.get("tunnel_url"));
        int capacity = HttpSupport.parseIntOrDefault(q.get("capacity"), node.config().settings().maxFiles());
        PairingService.Redemption redemption = node.pairing().redeem(new PairingService.RedeemRequest(
                code, q.get("mirror_name"), q.get("direct_url"), tunnel, capacity));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("mirror_id", redemption.mirrorId());
        body.put("credential", redemption.credential());
        body.put("status", MirrorStatus.PENDING.wireName());
        HttpSupport.writeJson(exchange, body, 200);
    }

    private void issueCode(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "POST")) return;
        Map<String, String> q = HttpSupport.parseParams(exchange);
        if (!auth.authorize(exchange, q)) return;
        PairingCode code = node.pairing().issueCode();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code.code());
        body.put("issued_at_ms", code.issuedAtMs());
        body.put("expires_at_ms", code.expiresAtMs());
        HttpSupport.writeJson(exchange, body, 201);
    }

    private void mirrors(HttpExchange exchange) throws IOException {
        List<String> segments = HttpSupport.segmentsAfter(exchange, MIRRORS);
        if (!exchange.getRequestURI().getPath().equals(MIRRORS) && !exchange.getRequestURI().getPath().startsWith(MIRRORS + "/")) {
            HttpSupport.notFound(exchange);
            return;
        }
        if (segments.isEmpty()) {
            listMirrors(exchange);
            return;
        }
        String first = segments.get(0);
        if (segments.size() == 1 && "heartbeat".equals(first)) {
            heartbeat(exchange);
            return;
        }
        if (segments.size() == 2 && "content".equals(first)) {
            content(exchange, segments.get(1));
            return;
        }
        if (segments.size() == 2) {
            switch (segments.get(1)) {
                case "status" -> status(exchange, first);
                case "trigger-sync" -> triggerSync(exchange, first);
                case "approve" -> transition(exchange, first, MirrorStatus.APPROVED);
                case "reject" -> transition(exchange, first, MirrorStatus.REJECTED);
                case "sync-log" -> syncLog(exchange, first);
                default -> HttpSupport.notFound(exchange);
            }
            return;
        }
        HttpSupport.notFound(exchange);
    }

    private void listMirrors(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        Map<String, String> q = HttpSupport.parseParams(exchange);
        if (!auth.authorize(exchange, q)) return;
        List<Mirror> all = q.containsKey("status")
                ? node.mirrors().listMirrors(MirrorStatus.fromString(q.get("status")))
                : node.mirrors().listMirrors();
        HttpSupport.writeJson(exchange, Map.of("mirrors", SensitiveDataMasker.masked(all)), 200);
    }

    private void heartbeat(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "POST")) return;
        Optional<Mirror> mirror = authenticateMirror(exchange, Map.of());
        if (mirror.isEmpty()) return;
        byte[] raw = exchange.getRequestBody().readAllBytes();
        HeartbeatReport report = raw.length == 0
                ? HeartbeatReport.empty()
                : parseReport(raw);
        MirrorStore.HeartbeatOutcome outcome = node.heartbeat().recordHeartbeat(
                mirror.get().mirrorId(), report, System.currentTimeMillis());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("mirror_id", mirror.get().mirrorId());
        body.put("tracked", outcome.tracked());
        body.put("status", outcome.current() == null ? null : outcome.current().wireName());
        HttpSupport.writeJson(exchange, body, 200);
    }

    private static HeartbeatReport parseReport(byte[] raw) {
        try {
            HeartbeatReport report = Jsons.mapper().readValue(raw, HeartbeatReport.class);
            return report == null ? HeartbeatReport.empty() : report;
        } catch (IOException e) {
            throw new BadRequestException("invalid_json", "malformed heartbeat report");
        }
    }

    private void content(HttpExchange exchange, String entryId) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        Optional<Mirror> mirror = authenticateMirror(exchange, HttpSupport.parseQuery(exchange.getRequestURI()));
        if (mirror.isEmpty()) return;
        if (!mirror.get().status().isTracked()) {
            HttpSupport.writeJson(exchange, Map.of("error", "mirror_not_approved"), 403);
            return;
        }
        Optional<CatalogEntry> entry = node.catalog().find(entryId).filter(CatalogEntry::approved);
        if (entry.isEmpty() || !node.content().exists(entryId)) {
            HttpSupport.writeJson(exchange, Map.of("error", "entry_not_found", "entry_id", entryId), 404);
            return;
        }
        streamFile(exchange, entryId);
    }

    private void streamFile(HttpExchange exchange, String entryId) throws IOException {
        long size = node.content().size(entryId);
        exchange.getResponseHeaders().set("Content-Type", "application/octet-stream");
        exchange.sendResponseHeaders(200, size == 0L ? -1L : size);
        try (InputStream in = node.content().open(entryId); OutputStream out = exchange.getResponseBody()) {
            in.transferTo(out);
        }
    }

    private void status(HttpExchange exchange, String mirrorId) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        Map<String, String> q = HttpSupport.parseParams(exchange);
        Optional<Mirror> found = node.mirrors().findMirror(mirrorId);
        String token = HttpSupport.extractToken(exchange, q);
        boolean ownCredential = found.isPresent() && token != null
                && Hashing.constantTimeEquals(found.get().credential(), token);
        if (!ownCredential && !auth.authorize(exchange, q)) return;
        if (found.isEmpty()) {
            HttpSupport.writeJson(exchange, Map.of("error", "mirror_not_found", "mirror_id", mirrorId), 404);
            return;
        }
        Mirror mirror = found.get();
        long nowMs = System.currentTimeMillis();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("mirror", SensitiveDataMasker.masked(mirror));
        body.put("status", mirror.status().wireName());
        body.put("effective_url", mirror.effectiveAddress().url());
        body.put("verified_files", node.mirrorFiles().verifiedEntryIds(mirrorId).size());
        body.put("last_heartbeat_age_ms", mirror.lastHeartbeatMs() == 0L ? null : Math.max(0L, nowMs - mirror.lastHeartbeatMs()));
        body.put("heartbeat_timeout_ms", node.heartbeat().timeoutMs());
        body.put("sync_in_flight", node.orchestrator().isInFlight(mirrorId));
        HttpSupport.writeJson(exchange, body, 200);
    }

    private void triggerSync(HttpExchange exchange, String mirrorId) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "POST")) return;
        Map<String, String> q = HttpSupport.parseParams(exchange);
        if (!auth.authorize(exchange, q)) return;
        SyncResult result = node.orchestrator().syncMirror(mirrorId);
        int status = switch (result.outcome()) {
            case UNKNOWN_MIRROR -> 404;
            case SKIPPED_NOT_TARGET -> 409;
            case SKIPPED_IN_FLIGHT -> 202;
            case UNREACHABLE -> 502;
            case FAILED -> 500;
            case COMPLETED, NOTHING_TO_DO -> 200;
        };
        HttpSupport.writeJson(exchange, result, status);
    }

    private void transition(HttpExchange exchange, String mirrorId, MirrorStatus next) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "POST")) return;
        Map<String, String> q = HttpSupport.parseParams(exchange);
        if (!auth.authorize(exchange, q)) return;
        if (node.mirrors().findMirror(mirrorId).isEmpty()) {
            HttpSupport.writeJson(exchange, Map.of("error", "mirror_not_found", "mirror_id", mirrorId), 404);
            return;
        }
        Mirror updated = next == MirrorStatus.APPROVED ? node.approve(mirrorId) : node.reject(mirrorId);
        HttpSupport.writeJson(exchange, SensitiveDataMasker.masked(updated), 200);
    }

    private void syncLog(HttpExchange exchange, String mirrorId) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        Map<String, String> q = HttpSupport.parseParams(exchange);
        if (!auth.authorize(exchange, q)) return;
        int limit = HttpSupport.clamp(HttpSupport.parseIntOrDefault(q.get("limit"), 50), 1, 1000);
        HttpSupport.writeJson(exchange, Map.of(
                "mirror_id", mirrorId,
                "entries", node.syncLog().listForMirror(mirrorId, limit)
        ), 200);
    }

    private void route(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        List<String> segments = HttpSupport.segmentsAfter(exchange, "/api/route");
        if (segments.size() != 1) {
            HttpSupport.notFound(exchange);
            return;
        }
        String entryId = segments.get(0);
        Optional<DownloadRouter.Route> route = node.router().route(entryId);
        if (route.isEmpty()) {
            HttpSupport.writeJson(exchange, Map.of("error", "entry_not_found", "entry_id", entryId), 404);
            return;
        }
        node.catalog().incrementPopularity(entryId);
        Map<String, String> q = HttpSupport.parseQuery(exchange.getRequestURI());
        if ("true".equalsIgnoreCase(q.get("redirect"))) {
            exchange.getResponseHeaders().set("Location", route.get().url());
            exchange.sendResponseHeaders(302, -1L);
            return;
        }
        HttpSupport.writeJson(exchange, route.get(), 200);
    }

    private void download(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        List<String> segments = HttpSupport.segmentsAfter(exchange, "/download");
        if (segments.size() != 1) {
            HttpSupport.notFound(exchange);
            return;
        }
        String entryId = segments.get(0);
        Optional<CatalogEntry> entry = node.catalog().find(entryId).filter(CatalogEntry::approved);
        if (entry.isEmpty() || !node.content().exists(entryId)) {
            HttpSupport.writeJson(exchange, Map.of("error", "entry_not_found", "entry_id", entryId), 404);
            return;
        }
        exchange.getResponseHeaders().set("Content-Disposition", "attachment; filename=\"" + entry.get().fileName().replace("\"", "") + "\"");
        streamFile(exchange, entryId);
    }

    private void metrics(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) return;
        HttpSupport.writeText(exchange, PrometheusFormatter.formatOrigin(node.stats()), "text/plain; version=0.0.4; charset=utf-8", 200);
    }

    /**
     * Resolves the calling mirror from its bearer credential, writing 401/403 otherwise.
     */
    private Optional<Mirror> authenticateMirror(HttpExchange exchange, Map<String, String> query) throws IOException {
        String token = HttpSupport.extractToken(exchange, query);
        if (token == null) {
            HttpSupport.writeJson(exchange, Map.of("error", "missing_token"), 401);
            return Optional.empty();
        }
        Optional<Mirror> mirror = node.mirrors().findMirrorByCredential(token);
        if (mirror.isEmpty()) {
            HttpSupport.writeJson(exchange, Map.of("error", "forbidden_token"), 403);
            return Optional.empty();
        }
        if (mirror.get().status() == MirrorStatus.REJECTED) {
            HttpSupport.writeJson(exchange, Map.of("error", "mirror_rejected"), 403);
            return Optional.empty();
        }
        return mirror;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
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
