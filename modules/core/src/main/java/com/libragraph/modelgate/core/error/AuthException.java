package com.libragraph.modelgate.core.error;

/**
 * Missing or invalid credential, or the auth gateway could not be consulted.
 */
public class AuthException extends ModelGateException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.AUTH;
    }
}
