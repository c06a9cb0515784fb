package io.archivemirror.http;

public final class BadRequestException extends RuntimeException {
    private final String error;

    public BadRequestException(String error, String message) {
        super(message);
        this.error = error;
    }

    public String error() {
        return error;
    }
}
