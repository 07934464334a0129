package tollgate.adapter.out.telemetry;

/**
 * Constants for span attributes used in distributed tracing.
 *
 * <p>They follow OpenTelemetry semantic conventions where applicable.
 *
 * @see <a href="https://opentelemetry.io/docs/specs/semconv/">OpenTelemetry Semantic Conventions</a>
 */
public final class SpanAttributes {

    private SpanAttributes() {}

    /** HTTP method (GET, POST, etc.). */
    public static final String HTTP_METHOD = "http.method";

    /** Full URL of the HTTP request. */
    public static final String HTTP_URL = "http.url";

    /** HTTP response status code. */
    public static final String HTTP_STATUS_CODE = "http.status_code";

    /** Remote host name. */
    public static final String NET_PEER_NAME = "net.peer.name";

    /** Remote port number. */
    public static final String NET_PEER_PORT = "net.peer.port";

    /** Correlation id of the gateway request. */
    public static final String REQUEST_ID = "tollgate.request.id";
}
