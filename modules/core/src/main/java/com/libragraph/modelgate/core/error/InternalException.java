package com.libragraph.modelgate.core.error;

/**
 * Wraps unexpected failures (serialization, storage) that callers cannot fix.
 */
public class InternalException extends ModelGateException {

    public InternalException(String message) {
        super(message);
    }

    public InternalException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INTERNAL;
    }
}
