package com.libragraph.modelgate.core.error;

/**
 * Illegal lifecycle transition, e.g. cancelling a task that already finished.
 */
public class InvalidStateException extends ModelGateException {

    public InvalidStateException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_STATE;
    }
}
