package tollgate.core.service.common;

import tollgate.core.model.gateway.GatewayRequest;

/**
 * Utility for extracting the client address from gateway requests.
 *
 * <p>When forwarding headers are trusted, checks in the following order:
 * <ol>
 *   <li>RFC 7239 {@code Forwarded} header's {@code for} parameter</li>
 *   <li>Legacy {@code X-Forwarded-For} header (first IP in chain)</li>
 *   <li>{@code X-Real-IP} header</li>
 *   <li>Socket connection's remote address ({@code clientIp})</li>
 * </ol>
 *
 * <p>Otherwise only the socket address is used, since clients can put anything
 * in these headers.
 */
public final class ClientIpExtractor {

    private ClientIpExtractor() {}

    /**
     * Extract the client address from a gateway request.
     *
     * @param request the gateway request
     * @param trustForwardedHeaders whether forwarding headers may be used
     * @return the client address
     */
    public static String extract(GatewayRequest request, boolean trustForwardedHeaders) {
        if (!trustForwardedHeaders) {
            return request.clientIp();
        }

        var forwarded = request.getHeaderString("Forwarded");
        if (forwarded != null) {
            var forMatch = extractForwardedParam(forwarded, "for");
            if (forMatch != null && !forMatch.isBlank()) {
                return forMatch;
            }
        }

        var xForwardedFor = request.getHeaderString("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }

        var xRealIp = request.getHeaderString("X-Real-IP");
        if (xRealIp != null && !xRealIp.isBlank()) {
            return xRealIp.trim();
        }

        return request.clientIp();
    }

    /**
     * Extract a parameter value from an RFC 7239 Forwarded header.
     *
     * <p>Reads the first entry, which names the originating client.
     *
     * @param forwarded the Forwarded header value
     * @param param the parameter name to extract (e.g., "for", "proto", "host")
     * @return the parameter value, or null if not found
     */
    public static String extractForwardedParam(String forwarded, String param) {
        var entries = forwarded.split(",");
        if (entries.length == 0) {
            return null;
        }

        var parts = entries[0].trim().split(";");
        for (var part : parts) {
            var keyValue = part.trim().split("=", 2);
            if (keyValue.length == 2 && keyValue[0].trim().equalsIgnoreCase(param)) {
                var value = keyValue[1].trim();
                if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                    value = value.substring(1, value.length() - 1);
                }
                return value;
            }
        }

        return null;
    }
}
