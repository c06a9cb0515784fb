package io.archivemirror.sync;

import io.archivemirror.model.AddressKind;
import io.archivemirror.model.CatalogEntry;
import io.archivemirror.model.Mirror;
import io.archivemirror.model.MirrorStatus;
import io.archivemirror.storage.CatalogSource;
import io.archivemirror.storage.MirrorFileStore;
import io.archivemirror.storage.MirrorStore;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks where a client should download an entry from: an ONLINE mirror with a verified copy,
 * or the origin itself.
 */
public final class DownloadRouter {
    private static final Comparator<Mirror> PREFERENCE = Comparator
            .comparingLong(DownloadRouter::headroom).reversed()
            .thenComparing(m -> m.effectiveAddress().kind() == AddressKind.TUNNELED ? 0 : 1)
            .thenComparing(Mirror::mirrorId);

    private final CatalogSource catalog;
    private final MirrorStore mirrors;
    private final MirrorFileStore mirrorFiles;
    private final String originBaseUrl;

    public DownloadRouter(CatalogSource catalog, MirrorStore mirrors, MirrorFileStore mirrorFiles, String originBaseUrl) {
        this.catalog = catalog;
        this.mirrors = mirrors;
        this.mirrorFiles = mirrorFiles;
        this.originBaseUrl = trimSlash(originBaseUrl);
    }

    /**
     * Empty when the entry is unknown or not approved.
     */
    public Optional<Route> route(String entryId) {
        Optional<CatalogEntry> entry = catalog.find(entryId);
        if (entry.isEmpty() || !entry.get().approved()) {
            return Optional.empty();
        }
        List<Mirror> candidates = new ArrayList<>();
        for (String mirrorId : mirrorFiles.mirrorsHolding(entryId)) {
            mirrors.findMirror(mirrorId)
                    .filter(m -> m.status() == MirrorStatus.ONLINE)
                    .ifPresent(candidates::add);
        }
        if (candidates.isEmpty()) {
            return Optional.of(new Route(entryId, originBaseUrl + downloadPath(entryId), null, true));
        }
        candidates.sort(PREFERENCE);
        Mirror best = candidates.get(0);
        return Optional.of(new Route(entryId, best.effectiveAddress().resolve(downloadPath(entryId)), best.mirrorId(), false));
    }

    static String downloadPath(String entryId) {
        return "/download/" + URLEncoder.encode(entryId, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static long headroom(Mirror mirror) {
        return (long) mirror.capacity() - mirror.reportedFileCount();
    }

    private static String trimSlash(String url) {
        String value = url == null ? "" : url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    public record Route(String entryId, String url, String mirrorId, boolean origin) {}
}
