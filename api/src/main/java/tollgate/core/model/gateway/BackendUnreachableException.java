package tollgate.core.model.gateway;

import java.net.URI;

/**
 * A transport failure talking to the backend.
 *
 * <p>{@code retryable} is true only when the failure happened while connecting,
 * before any part of the request was sent.
 */
public class BackendUnreachableException extends RuntimeException {

    private final URI target;
    private final boolean retryable;

    public BackendUnreachableException(URI target, boolean retryable, Throwable cause) {
        super("Backend " + target + " unreachable: " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.target = target;
        this.retryable = retryable;
    }

    public URI getTarget() {
        return target;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
