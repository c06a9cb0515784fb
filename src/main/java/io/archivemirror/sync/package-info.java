/**
 * Origin-side replication.
 *
 * <p>{@link io.archivemirror.sync.SyncOrchestrator} diffs each mirror's desired set against
 * its verified holdings and pushes the difference through a
 * {@link io.archivemirror.sync.SyncTransport}; {@link io.archivemirror.sync.DownloadRouter}
 * sends clients to an online mirror holding a verified copy.
 */
package io.archivemirror.sync;
