package io.archivemirror.model;

import java.util.Locale;

/**
 * A reachable base URL for a mirror, tagged with how it is reached.
 */
public record MirrorAddress(AddressKind kind, String url) {
    public MirrorAddress {
        if (kind == null) {
            throw new IllegalArgumentException("address kind must not be null");
        }
        url = normalize(url);
        if (url.isEmpty()) {
            throw new IllegalArgumentException("address url must not be blank");
        }
    }

    public static MirrorAddress direct(String url) {
        return new MirrorAddress(AddressKind.DIRECT, url);
    }

    public static MirrorAddress tunneled(String url) {
        return new MirrorAddress(AddressKind.TUNNELED, url);
    }

    /**
     * Returns a tunneled address, or null when the raw value is blank (the tunnel is optional).
     */
    public static MirrorAddress optionalTunnel(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        return tunneled(url);
    }

    public String resolve(String path) {
        if (path == null || path.isEmpty()) {
            return url;
        }
        return path.startsWith("/") ? url + path : url + "/" + path;
    }

    static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return "";
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            value = "http://" + value;
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
