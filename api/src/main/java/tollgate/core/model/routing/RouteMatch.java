package tollgate.core.model.routing;

import java.net.URI;
import java.util.Objects;

/**
 * Result of resolving a request path against the route table.
 *
 * @param route      the matched route
 * @param targetPath the path to request on the backend, relative to the base URL
 */
public record RouteMatch(RouteEntry route, String targetPath) {

    public RouteMatch {
        Objects.requireNonNull(route, "route must not be null");
        if (targetPath == null || targetPath.isEmpty()) {
            targetPath = "/";
        }
    }

    /**
     * Builds the absolute backend URI for this match.
     *
     * @param query the raw query string, without {@code ?} (may be null)
     * @return the backend URI
     */
    public URI targetUri(String query) {
        final var base = route.baseUrl().toString();
        final var trimmedBase = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        final var sb = new StringBuilder(trimmedBase).append(targetPath);
        if (query != null && !query.isEmpty()) {
            sb.append('?').append(query);
        }
        return URI.create(sb.toString());
    }
}
