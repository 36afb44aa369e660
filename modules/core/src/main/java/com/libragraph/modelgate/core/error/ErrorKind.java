package com.libragraph.modelgate.core.error;

/**
 * Error taxonomy shared by the core and the HTTP layer. Each kind carries the
 * status code the API renders it with and a stable label for clients.
 */
public enum ErrorKind {
    VALIDATION(400, "validation_error"),
    AUTH(401, "auth_error"),
    PERMISSION(403, "permission_error"),
    NOT_FOUND(404, "not_found"),
    INVALID_STATE(409, "invalid_state"),
    PROVIDER(502, "provider_error"),
    INTERNAL(500, "internal_error");

    private final int httpStatus;
    private final String label;

    ErrorKind(int httpStatus, String label) {
        this.httpStatus = httpStatus;
        this.label = label;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String label() {
        return label;
    }
}
