package io.archivemirror.storage;

import io.archivemirror.util.Hashing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.util.regex.Pattern;

/**
 * Flat directory of blobs keyed by entry id. The origin keeps its authoritative copies here;
 * the mirror agent uses the same layout for its storage directory.
 */
public final class ContentStore {
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final Path dir;

    public ContentStore(Path dir) {
        this.dir = dir;
    }

    public Path dir() {
        return dir;
    }

    public static String requireSafeId(String entryId) {
        if (entryId == null || !SAFE_ID.matcher(entryId).matches() || entryId.contains("..")) {
            throw new IllegalArgumentException("Invalid entry id: " + entryId);
        }
        return entryId;
    }

    public static boolean isSafeId(String entryId) {
        return entryId != null && SAFE_ID.matcher(entryId).matches() && !entryId.contains("..");
    }

    public Path path(String entryId) {
        return dir.resolve(requireSafeId(entryId));
    }

    public boolean exists(String entryId) {
        return Files.isRegularFile(path(entryId));
    }

    public long size(String entryId) {
        try {
            return Files.size(path(entryId));
        } catch (IOException e) {
            throw new RuntimeException("Failed to stat content: " + entryId, e);
        }
    }

    public InputStream open(String entryId) throws IOException {
        return Files.newInputStream(path(entryId));
    }

    /**
     * Copies {@code in} into place through a temp file and returns the digest and size.
     */
    public Stored put(String entryId, InputStream in) {
        Path target = path(entryId);
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + entryId, ".tmp");
            MessageDigest md = Hashing.contentDigest();
            long size;
            try (DigestInputStream digesting = new DigestInputStream(in, md)) {
                size = Files.copy(digesting, tmp, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return new Stored(entryId, Hashing.hex(md), size);
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new RuntimeException("Failed to store content: " + entryId, e);
        }
    }

    public boolean delete(String entryId) {
        try {
            return Files.deleteIfExists(path(entryId));
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete content: " + entryId, e);
        }
    }

    public record Stored(String entryId, String contentHash, long sizeBytes) {}
}
