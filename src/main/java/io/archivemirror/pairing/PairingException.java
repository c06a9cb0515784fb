package io.archivemirror.pairing;

public final class PairingException extends RuntimeException {
    private final PairingFailure failure;

    public PairingException(PairingFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public PairingFailure failure() {
        return failure;
    }
}
