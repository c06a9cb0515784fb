package io.archivemirror.model;

public enum VerificationState {
    VERIFIED,
    UNVERIFIED,
    FAILED
}
