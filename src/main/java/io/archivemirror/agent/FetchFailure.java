package io.archivemirror.agent;

public enum FetchFailure {
    UNREACHABLE,
    NOT_FOUND,
    UNAUTHORIZED,
    HASH_MISMATCH
}
