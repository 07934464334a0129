package tollgate.core.model.routing;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * A static route: requests whose path starts with {@code prefix} are forwarded to
 * {@code baseUrl}.
 *
 * <p>Prefixes are normalized to start with {@code /} and carry no trailing slash
 * (except the root prefix {@code /} itself).
 *
 * @param prefix      the public path prefix
 * @param baseUrl     the backend base URL (scheme, host, port and optional base path)
 * @param timeout     per-route timeout, empty to use the gateway default
 * @param stripPrefix whether the prefix is removed from the forwarded path
 */
public record RouteEntry(String prefix, URI baseUrl, Optional<Duration> timeout, boolean stripPrefix) {

    public RouteEntry {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Route prefix is required");
        }
        if (baseUrl == null) {
            throw new IllegalArgumentException("Route base URL is required");
        }
        if (!"http".equalsIgnoreCase(baseUrl.getScheme()) && !"https".equalsIgnoreCase(baseUrl.getScheme())) {
            throw new IllegalArgumentException("Route base URL must be http or https: " + baseUrl);
        }
        if (baseUrl.getHost() == null) {
            throw new IllegalArgumentException("Route base URL must have a host: " + baseUrl);
        }
        if (timeout == null) {
            timeout = Optional.empty();
        }
        timeout.ifPresent(t -> {
            if (t.isZero() || t.isNegative()) {
                throw new IllegalArgumentException("Route timeout must be positive");
            }
        });
        prefix = normalizePrefix(prefix);
    }

    /**
     * Whether this route's prefix matches the path on a segment boundary.
     *
     * <p>{@code /api} matches {@code /api} and {@code /api/users} but not {@code /apix}.
     *
     * @param path the normalized request path
     * @return true if the route applies
     */
    public boolean matches(String path) {
        if ("/".equals(prefix)) {
            return true;
        }
        if (!path.startsWith(prefix)) {
            return false;
        }
        return path.length() == prefix.length() || path.charAt(prefix.length()) == '/';
    }

    private static String normalizePrefix(String raw) {
        var normalized = raw.trim();
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
