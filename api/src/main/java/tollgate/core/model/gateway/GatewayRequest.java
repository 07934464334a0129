package tollgate.core.model.gateway;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * An inbound request as seen by the gateway pipeline.
 *
 * @param method     the HTTP method
 * @param path       the raw (still percent-encoded) request path, starting with {@code /}
 * @param query      the raw query string without {@code ?}, or null
 * @param headers    the request headers
 * @param requestUri the full request URI as received
 * @param body       the request body
 * @param clientIp   the resolved client address
 * @param requestId  the correlation id for this request
 */
public record GatewayRequest(
        String method,
        String path,
        String query,
        Map<String, List<String>> headers,
        URI requestUri,
        byte[] body,
        String clientIp,
        String requestId) {

    public GatewayRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (path == null || path.isEmpty()) {
            path = "/";
        } else if (!path.startsWith("/")) {
            path = "/" + path;
        }
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
        if (clientIp == null || clientIp.isBlank()) {
            clientIp = "unknown";
        }
    }

    /**
     * Returns the first value of a header, matching the name case-insensitively.
     *
     * @param name the header name
     * @return the first value, or null if absent
     */
    public String getHeaderString(String name) {
        var values = headers.get(name);
        if (values == null) {
            for (var entry : headers.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(name)) {
                    values = entry.getValue();
                    break;
                }
            }
        }
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }
}
