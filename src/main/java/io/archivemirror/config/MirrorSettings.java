package io.archivemirror.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.archivemirror.util.Jsons;

import java.util.List;
import java.util.Map;

/**
 * Tunable options for both the origin and the mirror processes.
 *
 * <p>Values come from {@link #defaults()}, then an optional JSON settings file, then
 * command-line options; each layer is applied with {@link #overlay(JsonNode)}.
 */
public record MirrorSettings(
        String originUrl,
        String mirrorName,
        String bindAddress,
        int listenPort,
        int originListenPort,
        String advertisedUrl,
        String tunnelUrl,
        String storagePath,
        int maxFiles,
        long syncIntervalMs,
        long heartbeatIntervalMs,
        int heartbeatTimeoutMultiplier,
        long downloadBytesPerSecond,
        long pairingCodeTtlMs,
        int maxOutstandingCodes,
        long httpConnectTimeoutMs,
        long httpRequestTimeoutMs,
        long syncRequestTimeoutMs,
        int syncWorkers,
        List<String> adminTokens
) {
    public static final String DEFAULT_ORIGIN_URL = "http://127.0.0.1:8080";
    public static final int DEFAULT_LISTEN_PORT = 8000;
    public static final int DEFAULT_ORIGIN_LISTEN_PORT = 8080;
    public static final int DEFAULT_MAX_FILES = 1000;
    public static final long DEFAULT_SYNC_INTERVAL_MS = 300_000L;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 60_000L;
    public static final int DEFAULT_HEARTBEAT_TIMEOUT_MULTIPLIER = 3;
    public static final long DEFAULT_DOWNLOAD_BYTES_PER_SECOND = 5L * 1024L * 1024L;
    public static final long DEFAULT_PAIRING_CODE_TTL_MS = 15L * 60L * 1_000L;
    public static final int DEFAULT_MAX_OUTSTANDING_CODES = 5;
    public static final long DEFAULT_HTTP_CONNECT_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_HTTP_REQUEST_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_SYNC_REQUEST_TIMEOUT_MS = 30L * 60L * 1_000L;
    public static final int DEFAULT_SYNC_WORKERS = 4;

    public MirrorSettings {
        adminTokens = adminTokens == null ? List.of() : List.copyOf(adminTokens);
    }

    public static MirrorSettings defaults() {
        return new MirrorSettings(
                DEFAULT_ORIGIN_URL,
                "mirror",
                "0.0.0.0",
                DEFAULT_LISTEN_PORT,
                DEFAULT_ORIGIN_LISTEN_PORT,
                null,
                null,
                null,
                DEFAULT_MAX_FILES,
                DEFAULT_SYNC_INTERVAL_MS,
                DEFAULT_HEARTBEAT_INTERVAL_MS,
                DEFAULT_HEARTBEAT_TIMEOUT_MULTIPLIER,
                DEFAULT_DOWNLOAD_BYTES_PER_SECOND,
                DEFAULT_PAIRING_CODE_TTL_MS,
                DEFAULT_MAX_OUTSTANDING_CODES,
                DEFAULT_HTTP_CONNECT_TIMEOUT_MS,
                DEFAULT_HTTP_REQUEST_TIMEOUT_MS,
                DEFAULT_SYNC_REQUEST_TIMEOUT_MS,
                DEFAULT_SYNC_WORKERS,
                List.of()
        );
    }

    /**
     * Returns a copy with every non-null field of {@code patch} applied on top.
     */
    public MirrorSettings overlay(JsonNode patch) {
        if (patch == null || patch.isNull() || !patch.isObject()) {
            return this;
        }
        ObjectNode merged = Jsons.mapper().valueToTree(this);
        patch.fields().forEachRemaining(field -> {
            if (field.getValue() != null && !field.getValue().isNull()) {
                merged.set(field.getKey(), field.getValue());
            }
        });
        try {
            return Jsons.mapper().treeToValue(merged, MirrorSettings.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid settings: " + e.getMessage(), e);
        }
    }

    public MirrorSettings overlay(Map<String, ?> patch) {
        if (patch == null || patch.isEmpty()) {
            return this;
        }
        return overlay((JsonNode) Jsons.mapper().valueToTree(patch));
    }
}
