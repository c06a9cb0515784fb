package io.archivemirror.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.archivemirror.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public final class MirrorSyncConfig {
    public static final String SETTINGS_FILE = "mirror-settings.json";

    private final Path rootDir;
    private final MirrorSettings settings;

    public MirrorSyncConfig(Path rootDir, MirrorSettings settings) {
        this.rootDir = rootDir;
        this.settings = settings == null ? MirrorSettings.defaults() : settings;
    }

    public static MirrorSyncConfig fromRoot(String root) {
        return new MirrorSyncConfig(resolveRoot(root), MirrorSettings.defaults());
    }

    /**
     * Loads defaults, then {@code settingsFile} (or {@code <root>/mirror-settings.json} when
     * it exists and no file is given).
     */
    public static MirrorSyncConfig load(String root, String settingsFile) {
        Path rootDir = resolveRoot(root);
        MirrorSettings settings = MirrorSettings.defaults();
        Path file = settingsFile == null || settingsFile.isBlank()
                ? rootDir.resolve(SETTINGS_FILE)
                : Paths.get(settingsFile.trim());
        if (Files.exists(file)) {
            try {
                JsonNode node = Jsons.mapper().readTree(file.toFile());
                settings = settings.overlay(node);
            } catch (IOException e) {
                throw new IllegalArgumentException("Failed to read settings file: " + file, e);
            }
        } else if (settingsFile != null && !settingsFile.isBlank()) {
            throw new IllegalArgumentException("Settings file not found: " + file);
        }
        return new MirrorSyncConfig(rootDir, settings);
    }

    public MirrorSyncConfig withSettings(MirrorSettings next) {
        return new MirrorSyncConfig(rootDir, next);
    }

    private static Path resolveRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return resolved.toAbsolutePath().normalize();
    }

    public Path rootDir() {
        return rootDir;
    }

    public MirrorSettings settings() {
        return settings;
    }

    public Path dbFile() {
        return rootDir.resolve("archive-mirror.db");
    }

    /**
     * Origin-side authoritative content, one file per catalog entry.
     */
    public Path contentDir() {
        return rootDir.resolve("content");
    }

    /**
     * Mirror-side local storage for replicated files.
     */
    public Path storageDir() {
        String configured = settings.storagePath();
        if (configured == null || configured.isBlank()) {
            return rootDir.resolve("storage");
        }
        Path path = Paths.get(configured.trim());
        return path.isAbsolute() ? path.normalize() : rootDir.resolve(path).normalize();
    }

    public Path partialDir() {
        return storageDir().resolve(".partial");
    }

    /**
     * Startup checks shared by both roles. Any failure here is fatal.
     */
    public void validate() {
        if (settings.maxFiles() < 1) {
            throw new IllegalArgumentException("maxFiles must be >= 1, got " + settings.maxFiles());
        }
        if (settings.syncIntervalMs() <= 0L) {
            throw new IllegalArgumentException("syncIntervalMs must be > 0");
        }
        if (settings.heartbeatIntervalMs() <= 0L) {
            throw new IllegalArgumentException("heartbeatIntervalMs must be > 0");
        }
        if (settings.heartbeatTimeoutMultiplier() < 1) {
            throw new IllegalArgumentException("heartbeatTimeoutMultiplier must be >= 1");
        }
        if (settings.downloadBytesPerSecond() < 0L) {
            throw new IllegalArgumentException("downloadBytesPerSecond must be >= 0 (0 disables the cap)");
        }
        if (settings.pairingCodeTtlMs() <= 0L) {
            throw new IllegalArgumentException("pairingCodeTtlMs must be > 0");
        }
        if (settings.maxOutstandingCodes() < 1) {
            throw new IllegalArgumentException("maxOutstandingCodes must be >= 1");
        }
        if (settings.listenPort() < 0 || settings.listenPort() > 65_535) {
            throw new IllegalArgumentException("listenPort out of range: " + settings.listenPort());
        }
        if (settings.originListenPort() < 0 || settings.originListenPort() > 65_535) {
            throw new IllegalArgumentException("originListenPort out of range: " + settings.originListenPort());
        }
        if (settings.syncWorkers() < 1) {
            throw new IllegalArgumentException("syncWorkers must be >= 1");
        }
        ensureWritableDirectory(rootDir, "data root");
    }

    /**
     * Mirror role additionally needs a reachable origin and writable storage.
     */
    public void validateMirror() {
        validate();
        requireHttpUrl(settings.originUrl(), "originUrl");
        if (settings.tunnelUrl() != null && !settings.tunnelUrl().isBlank()) {
            requireHttpUrl(settings.tunnelUrl(), "tunnelUrl");
        }
        if (storageDir().equals(dbFile().getParent())) {
            throw new IllegalArgumentException("storage path must not be the directory holding the database: " + storageDir());
        }
        ensureWritableDirectory(storageDir(), "storage path");
        ensureWritableDirectory(partialDir(), "partial download directory");
    }

    public void validateOrigin() {
        validate();
        ensureWritableDirectory(contentDir(), "content directory");
    }

    private static void ensureWritableDirectory(Path dir, String label) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot create " + label + ": " + dir, e);
        }
        if (!Files.isDirectory(dir) || !Files.isWritable(dir)) {
            throw new IllegalArgumentException("The " + label + " is not writable: " + dir);
        }
    }

    private static void requireHttpUrl(String raw, String label) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(label + " must not be blank");
        }
        try {
            URI uri = URI.create(raw.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!("http".equals(scheme) || "https".equals(scheme)) || uri.getHost() == null) {
                throw new IllegalArgumentException(label + " must be an http(s) URL: " + raw);
            }
        } catch (IllegalArgumentException e) {
            if (e.getMessage() != null && e.getMessage().startsWith(label)) {
                throw e;
            }
            throw new IllegalArgumentException(label + " is not a valid URL: " + raw, e);
        }
    }
}
