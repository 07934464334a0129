package tollgate.core.service.gateway;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import tollgate.config.ForwardingConfig;
import tollgate.core.model.auth.TokenClaims;
import tollgate.core.model.gateway.GatewayRequest;
import tollgate.core.model.gateway.PreparedProxyRequest;
import tollgate.core.model.routing.RouteMatch;

/**
 * Prepares backend requests by applying header filtering and forwarding rules.
 * This encapsulates the forwarding policy for:
 * - Filtering hop-by-hop headers (RFC 7230 Section 6.1), including those named by Connection
 * - Removing the client's credentials unless forwarding them is enabled
 * - Removing client-supplied identity headers, and adding verified ones when enabled
 * - Adding X-Forwarded-*, Via and X-Request-ID headers
 */
@ApplicationScoped
public class ProxyRequestPreparer {

    public static final String SUBJECT_HEADER = "X-Authenticated-Subject";
    public static final String SCOPES_HEADER = "X-Authenticated-Scopes";
    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    /**
     * HTTP hop-by-hop headers that must not be forwarded in either direction.
     */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "proxy-connection",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade");

    private static final Set<String> IDENTITY_HEADERS =
            Set.of(SUBJECT_HEADER.toLowerCase(Locale.ROOT), SCOPES_HEADER.toLowerCase(Locale.ROOT));

    private final ForwardingConfig config;

    @Inject
    public ProxyRequestPreparer(ForwardingConfig config) {
        this.config = config;
    }

    /**
     * Prepare the backend request for a routed gateway request.
     *
     * @param request the gateway request
     * @param match   the resolved route
     * @param claims  verified token claims, if the request was authenticated
     * @return prepared proxy request
     */
    public PreparedProxyRequest prepare(GatewayRequest request, RouteMatch match, Optional<TokenClaims> claims) {
        final var targetUri = match.targetUri(request.query());
        final var headers = new LinkedHashMap<String, List<String>>();

        copyFilteredHeaders(request, headers);
        addForwardingHeaders(request, headers);
        addViaHeader(request, headers);
        if (request.requestId() != null) {
            headers.put(REQUEST_ID_HEADER, List.of(request.requestId()));
        }
        if (config.identityHeaders()) {
            claims.ifPresent(c -> addIdentityHeaders(c, headers));
        }

        return new PreparedProxyRequest(request.method(), targetUri, headers, request.body());
    }

    private void copyFilteredHeaders(GatewayRequest request, Map<String, List<String>> headers) {
        final var connectionTokens = connectionTokens(request.headers());
        for (var entry : request.headers().entrySet()) {
            final var lowerName = entry.getKey().toLowerCase(Locale.ROOT);

            if (shouldSkipHeader(lowerName) || connectionTokens.contains(lowerName)) {
                continue;
            }

            headers.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
    }

    private boolean shouldSkipHeader(String lowerName) {
        if (HOP_BY_HOP_HEADERS.contains(lowerName)) {
            return true;
        }
        // Set by the HTTP client for the target
        if ("host".equals(lowerName) || "content-length".equals(lowerName)) {
            return true;
        }
        if ("authorization".equals(lowerName)) {
            return !config.forwardAuthorization();
        }
        if (IDENTITY_HEADERS.contains(lowerName)) {
            return true;
        }
        // Replaced below
        return "x-request-id".equals(lowerName)
                || "via".equals(lowerName)
                || lowerName.startsWith("x-forwarded-");
    }

    private void addForwardingHeaders(GatewayRequest request, Map<String, List<String>> headers) {
        final var existingXff = request.getHeaderString("X-Forwarded-For");
        if (existingXff != null && !existingXff.isBlank()) {
            headers.put("X-Forwarded-For", List.of(existingXff + ", " + request.clientIp()));
        } else {
            headers.put("X-Forwarded-For", List.of(request.clientIp()));
        }

        final var host = request.getHeaderString("Host");
        if (host != null && !host.isBlank()) {
            headers.put("X-Forwarded-Host", List.of(host));
        } else if (request.requestUri() != null && request.requestUri().getAuthority() != null) {
            headers.put("X-Forwarded-Host", List.of(request.requestUri().getAuthority()));
        }

        var proto = "http";
        if (request.requestUri() != null && request.requestUri().getScheme() != null) {
            proto = request.requestUri().getScheme();
        }
        headers.put("X-Forwarded-Proto", List.of(proto));
    }

    /**
     * Adds the Via header per RFC 7230 to indicate the request passed through this proxy.
     */
    private void addViaHeader(GatewayRequest request, Map<String, List<String>> headers) {
        var viaValue = "1.1 " + config.viaPseudonym();

        final var existingVia = request.getHeaderString("Via");
        if (existingVia != null && !existingVia.isBlank()) {
            viaValue = existingVia + ", " + viaValue;
        }

        headers.put("Via", List.of(viaValue));
    }

    private void addIdentityHeaders(TokenClaims claims, Map<String, List<String>> headers) {
        headers.put(SUBJECT_HEADER, List.of(claims.subject()));
        if (!claims.scopes().isEmpty()) {
            headers.put(SCOPES_HEADER, List.of(String.join(" ", claims.scopes().stream().sorted().toList())));
        }
    }

    /**
     * Filters hop-by-hop headers from a backend response before it is relayed.
     *
     * @param responseHeaders the backend response headers
     * @return the headers safe to relay to the client
     */
    public Map<String, List<String>> filterResponseHeaders(Map<String, List<String>> responseHeaders) {
        final var connectionTokens = connectionTokens(responseHeaders);
        final Map<String, List<String>> filtered = new LinkedHashMap<>();
        for (var entry : responseHeaders.entrySet()) {
            final var lowerName = entry.getKey().toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP_HEADERS.contains(lowerName)
                    || connectionTokens.contains(lowerName)
                    || "content-length".equals(lowerName)) {
                continue;
            }
            filtered.put(entry.getKey(), entry.getValue());
        }
        return filtered;
    }

    private static Set<String> connectionTokens(Map<String, List<String>> headers) {
        final Set<String> tokens = new HashSet<>();
        for (var entry : headers.entrySet()) {
            if (!"connection".equalsIgnoreCase(entry.getKey())) {
                continue;
            }
            for (var value : entry.getValue()) {
                for (var token : value.split(",")) {
                    final var trimmed = token.trim().toLowerCase(Locale.ROOT);
                    if (!trimmed.isEmpty()) {
                        tokens.add(trimmed);
                    }
                }
            }
        }
        return tokens;
    }
}
