package io.archivemirror.sync;

import io.archivemirror.model.Mirror;
import io.archivemirror.model.SyncInstruction;
import io.archivemirror.model.SyncReport;

/**
 * Delivers an instruction to a mirror and waits for its report.
 */
public interface SyncTransport {
    SyncReport deliver(Mirror mirror, SyncInstruction instruction);
}
