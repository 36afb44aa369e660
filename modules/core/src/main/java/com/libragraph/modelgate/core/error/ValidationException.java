package com.libragraph.modelgate.core.error;

/**
 * Request rejected before anything was persisted or queued: unknown provider
 * or model, or parameters of the wrong shape.
 */
public class ValidationException extends ModelGateException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
