package tollgate.adapter.out.telemetry;

import tollgate.core.model.gateway.RequestOutcome;
import tollgate.core.model.gateway.RequestRecord;
import tollgate.core.port.out.Metrics;
import tollgate.spi.RequestRecordHandler;

/**
 * Request record handler that turns records into gateway metrics.
 *
 * <p>This is a built-in handler with priority 10. The {@link Metrics} port is set by
 * {@link AsyncObservabilitySink} after ServiceLoader instantiation.
 */
public class MetricsRequestRecordHandler implements RequestRecordHandler {

    private Metrics metrics;

    public MetricsRequestRecordHandler() {
        // Default constructor for ServiceLoader
    }

    public MetricsRequestRecordHandler(Metrics metrics) {
        this.metrics = metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return metrics != null && metrics.isEnabled();
    }

    @Override
    public void handle(RequestRecord record) {
        if (metrics == null) {
            return;
        }

        final var route = record.routeTag();
        metrics.recordRequest(route, record.method(), record.outcome(), record.statusCode());
        metrics.recordLatency(route, record.method(), record.outcome(), record.latency());
        metrics.recordTraffic(route, record.requestBytes(), record.responseBytes());

        if (record.outcome() == RequestOutcome.UNAUTHORIZED) {
            metrics.recordAuthFailure(record.reason().orElse("unknown"));
        } else if (record.outcome() == RequestOutcome.RATE_LIMITED) {
            metrics.recordRateLimitExceeded(identityKind(record.clientId()));
        }
    }

    private static String identityKind(String clientId) {
        if (clientId == null) {
            return "unknown";
        }
        final var colon = clientId.indexOf(':');
        return colon > 0 ? clientId.substring(0, colon) : "unknown";
    }
}
