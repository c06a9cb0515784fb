package io.archivemirror.pairing;

public enum PairingFailure {
    INVALID_CODE("invalid_code", 404),
    EXPIRED_CODE("expired_code", 410),
    ALREADY_CONSUMED("already_consumed", 409),
    RATE_LIMITED("rate_limited", 429);

    private final String errorCode;
    private final int httpStatus;

    PairingFailure(String errorCode, int httpStatus) {
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public String errorCode() {
        return errorCode;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public static PairingFailure fromErrorCode(String raw) {
        if (raw == null) {
            return null;
        }
        for (PairingFailure failure : values()) {
            if (failure.errorCode.equalsIgnoreCase(raw.trim())) {
                return failure;
            }
        }
        return null;
    }
}
