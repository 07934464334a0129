package tollgate.core.model.gateway;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * A fully prepared backend request with all headers processed according to the
 * forwarding policy. This includes:
 * - Original headers with hop-by-hop and credential headers removed
 * - Forwarding headers (X-Forwarded-*, Via, X-Request-ID) added
 * - Identity headers added when enabled
 */
public record PreparedProxyRequest(String method, URI targetUri, Map<String, List<String>> headers, byte[] body) {

    public PreparedProxyRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (targetUri == null) {
            throw new IllegalArgumentException("targetUri is required");
        }
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }
}
