package io.archivemirror.storage;

import io.archivemirror.model.CatalogEntry;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the archive catalog. The catalog is owned by the archive itself; this
 * subsystem only reads it.
 */
public interface CatalogSource {
    List<CatalogEntry> approvedEntries();

    Optional<CatalogEntry> find(String entryId);
}
