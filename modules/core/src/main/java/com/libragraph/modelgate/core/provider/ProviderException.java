package com.libragraph.modelgate.core.provider;

import com.libragraph.modelgate.core.error.ErrorKind;
import com.libragraph.modelgate.core.error.ModelGateException;
import com.libragraph.modelgate.core.error.ValidationException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Categorized upstream failure. Recorded on the task rather than surfaced to
 * the HTTP caller.
 */
public class ProviderException extends ModelGateException {

    private final FailureCategory category;

    public ProviderException(FailureCategory category, String message) {
        super(message);
        this.category = category;
    }

    public ProviderException(FailureCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public static ProviderException forHttpStatus(String provider, int status, String body) {
        return new ProviderException(FailureCategory.forHttpStatus(status),
                provider + " API HTTP error: " + status + ", " + body);
    }

    /**
     * Maps any throwable raised while invoking a provider onto a category.
     * Timeouts and I/O errors are transient; everything unrecognized is internal.
     */
    public static ProviderException classify(Throwable t) {
        if (t instanceof ProviderException pe) {
            return pe;
        }
        if (t instanceof ExecutionException && t.getCause() != null) {
            return classify(t.getCause());
        }
        if (t instanceof TimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof InterruptedIOException) {
            return new ProviderException(FailureCategory.TIMEOUT, "Provider call timed out", t);
        }
        if (t instanceof IOException) {
            return new ProviderException(FailureCategory.NETWORK, "Network error: " + t.getMessage(), t);
        }
        if (t instanceof ValidationException) {
            return new ProviderException(FailureCategory.MALFORMED_REQUEST, t.getMessage(), t);
        }
        return new ProviderException(FailureCategory.INTERNAL,
                t.getClass().getSimpleName() + ": " + t.getMessage(), t);
    }

    public FailureCategory category() {
        return category;
    }

    public boolean isTransient() {
        return category.isTransient();
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROVIDER;
    }
}
