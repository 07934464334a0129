package tollgate.core.service.routing;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tollgate.config.RoutingConfig;
import tollgate.core.model.routing.RouteEntry;
import tollgate.core.model.routing.RouteMatch;

/**
 * Static table mapping public path prefixes to backend base URLs.
 *
 * <p>Loaded once at startup and never modified, so lookups need no locking.
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>Prefixes match on path segment boundaries</li>
 *   <li>The longest matching prefix wins</li>
 *   <li>Among equally long prefixes, the first configured route wins</li>
 *   <li>{@code .} and {@code ..} segments are removed before matching; a path that
 *       climbs above the root, or hides a dot, slash or backslash behind
 *       percent-encoding, matches no route</li>
 * </ul>
 */
@ApplicationScoped
public class RouteTable {

    private static final Logger LOG = Logger.getLogger(RouteTable.class);

    private static final Pattern ENCODED_SEPARATOR = Pattern.compile("%2e|%2f|%5c", Pattern.CASE_INSENSITIVE);

    private final List<RouteEntry> routes;
    // Longest prefix first; the stable sort keeps configuration order among equal lengths
    private final List<RouteEntry> byPriority;

    @Inject
    public RouteTable(RoutingConfig config) {
        this(fromConfig(config));
    }

    public RouteTable(List<RouteEntry> routes) {
        this.routes = List.copyOf(routes);
        var sorted = new ArrayList<>(this.routes);
        sorted.sort(Comparator.comparingInt((RouteEntry r) -> r.prefix().length()).reversed());
        this.byPriority = List.copyOf(sorted);

        for (var route : this.routes) {
            LOG.infov(
                    "Route {0} -> {1}{2}",
                    route.prefix(),
                    route.baseUrl(),
                    route.timeout().map(t -> " (timeout " + t + ")").orElse(""));
        }
        if (this.routes.isEmpty()) {
            LOG.warn("No routes configured - every request will be answered with 404");
        }
    }

    /**
     * Resolve a request path to a route.
     *
     * @param path the raw request path (without query string)
     * @return the match, or empty if no route applies or the path is unsafe
     */
    public Optional<RouteMatch> resolve(String path) {
        final var safePath = normalizePath(path == null || path.isEmpty() ? "/" : path);
        if (safePath.isEmpty()) {
            LOG.debugv("Rejected unsafe request path {0}", path);
            return Optional.empty();
        }
        final var normalized = safePath.get();
        for (var route : byPriority) {
            if (route.matches(normalized)) {
                return Optional.of(new RouteMatch(route, targetPath(route, normalized)));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the routes in configuration order.
     *
     * @return the configured routes
     */
    public List<RouteEntry> routes() {
        return routes;
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }

    /**
     * Removes {@code .} and {@code ..} segments from a raw request path.
     *
     * @param rawPath the raw path, starting with {@code /}
     * @return the normalized path, or empty if it escapes the root or contains
     *         encoded separators
     */
    static Optional<String> normalizePath(String rawPath) {
        if (!rawPath.startsWith("/") || rawPath.indexOf('\\') >= 0 || ENCODED_SEPARATOR.matcher(rawPath).find()) {
            return Optional.empty();
        }
        final var segments = new ArrayDeque<String>();
        final var parts = rawPath.substring(1).split("/", -1);
        for (var i = 0; i < parts.length; i++) {
            final var part = parts[i];
            final var last = i == parts.length - 1;
            if (".".equals(part)) {
                if (last) {
                    segments.addLast("");
                }
            } else if ("..".equals(part)) {
                if (segments.isEmpty()) {
                    return Optional.empty();
                }
                segments.removeLast();
                if (last) {
                    segments.addLast("");
                }
            } else {
                segments.addLast(part);
            }
        }
        return Optional.of("/" + String.join("/", segments));
    }

    private static String targetPath(RouteEntry route, String path) {
        if (!route.stripPrefix() || "/".equals(route.prefix())) {
            return path;
        }
        final var rest = path.substring(route.prefix().length());
        return rest.isEmpty() ? "/" : rest;
    }

    private static List<RouteEntry> fromConfig(RoutingConfig config) {
        final var configured = config.routes().orElse(List.of());
        final var entries = new ArrayList<RouteEntry>(configured.size());
        for (var route : configured) {
            try {
                entries.add(new RouteEntry(route.prefix(), new URI(route.url()), route.timeout(), route.stripPrefix()));
            } catch (URISyntaxException | IllegalArgumentException e) {
                throw new IllegalStateException("Invalid route " + route.prefix() + ": " + e.getMessage(), e);
            }
        }
        return entries;
    }
}
