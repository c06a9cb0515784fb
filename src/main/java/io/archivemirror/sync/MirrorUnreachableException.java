package io.archivemirror.sync;

/**
 * The mirror could not be reached or did not answer a sync instruction properly.
 * Always transient from the orchestrator's point of view: the next pass retries.
 */
public final class MirrorUnreachableException extends RuntimeException {
    public MirrorUnreachableException(String message) {
        super(message);
    }

    public MirrorUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
