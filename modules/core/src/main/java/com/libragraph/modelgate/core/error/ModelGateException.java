package com.libragraph.modelgate.core.error;

/**
 * Root of all errors raised by the orchestration core.
 */
public abstract class ModelGateException extends RuntimeException {

    protected ModelGateException(String message) {
        super(message);
    }

    protected ModelGateException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
