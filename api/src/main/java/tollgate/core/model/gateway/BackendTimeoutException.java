package tollgate.core.model.gateway;

import java.net.URI;
import java.time.Duration;

/**
 * The backend did not answer within the route's timeout.
 */
public class BackendTimeoutException extends RuntimeException {

    private final URI target;
    private final Duration timeout;

    public BackendTimeoutException(URI target, Duration timeout) {
        super("Backend " + target + " did not respond within " + timeout.toMillis() + "ms");
        this.target = target;
        this.timeout = timeout;
    }

    public URI getTarget() {
        return target;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
