/**
 * Archive mirror source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.archivemirror.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.archivemirror.origin.OriginNode} wires the origin: registry, pairing, heartbeat sweep and sync orchestration.</li>
 *   <li>{@code io.archivemirror.agent.MirrorAgent} is the mirror side: fetch, verify, evict and serve.</li>
 *   <li>{@code io.archivemirror.storage.MirrorStore} is the authoritative registry persistence layer.</li>
 * </ul>
 */
package io.archivemirror;
