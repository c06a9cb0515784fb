package io.archivemirror.model;

public enum AddressKind {
    DIRECT,
    TUNNELED
}
