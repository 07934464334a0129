package tollgate.adapter.out.telemetry;

import java.time.Duration;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import tollgate.config.TelemetryConfigMapping;
import tollgate.core.model.gateway.RequestOutcome;
import tollgate.core.port.out.Metrics;
import tollgate.core.port.out.RateLimiter;

/**
 * Central service for recording gateway metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tollgate.requests.total} - Request count by outcome, method, status, route</li>
 *   <li>{@code tollgate.request.latency} - End-to-end latency histogram</li>
 *   <li>{@code tollgate.ratelimit.rejections.total} - Rate limit rejections by identity kind</li>
 *   <li>{@code tollgate.ratelimit.active.keys} - Clients currently tracked by the rate limiter</li>
 *   <li>{@code tollgate.auth.failures.total} - Authentication failures by reason</li>
 *   <li>{@code tollgate.traffic.bytes.total} - Traffic volume by route and direction</li>
 *   <li>{@code tollgate.observability.dropped.total} - Request records dropped on overflow</li>
 * </ul>
 */
@ApplicationScoped
public class GatewayMetrics implements Metrics {

    private final MeterRegistry registry;
    private final RateLimiter rateLimiter;
    private final boolean enabled;

    @Inject
    public GatewayMetrics(MeterRegistry registry, TelemetryConfigMapping config, RateLimiter rateLimiter) {
        this(registry, rateLimiter, config != null && config.enabled() && config.metrics().enabled());
    }

    GatewayMetrics(MeterRegistry registry, RateLimiter rateLimiter, boolean enabled) {
        this.registry = registry;
        this.rateLimiter = rateLimiter;
        this.enabled = enabled;
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }

        Gauge.builder("tollgate.ratelimit.active.keys", rateLimiter, RateLimiter::activeKeyCount)
                .description("Number of clients currently tracked by the rate limiter")
                .register(registry);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    // -------------------------------------------------------------------------
    // Request Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordRequest(String route, String method, RequestOutcome outcome, int statusCode) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.requests.total")
                .description("Total number of requests processed")
                .tag("route", nullSafe(route))
                .tag("method", nullSafe(method))
                .tag("outcome", outcomeTag(outcome))
                .tag("status", String.valueOf(statusCode))
                .tag("status_class", statusClass(statusCode))
                .register(registry)
                .increment();
    }

    @Override
    public void recordLatency(String route, String method, RequestOutcome outcome, Duration latency) {
        if (!enabled) {
            return;
        }

        Timer.builder("tollgate.request.latency")
                .description("Time from receiving a request to completing it")
                .tag("route", nullSafe(route))
                .tag("method", nullSafe(method))
                .tag("outcome", outcomeTag(outcome))
                .publishPercentileHistogram()
                .register(registry)
                .record(latency);
    }

    // -------------------------------------------------------------------------
    // Traffic Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordTraffic(String route, long requestBytes, long responseBytes) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.traffic.bytes.total")
                .description("Traffic volume in bytes")
                .tag("route", nullSafe(route))
                .tag("direction", "inbound")
                .register(registry)
                .increment(requestBytes);

        Counter.builder("tollgate.traffic.bytes.total")
                .description("Traffic volume in bytes")
                .tag("route", nullSafe(route))
                .tag("direction", "outbound")
                .register(registry)
                .increment(responseBytes);
    }

    // -------------------------------------------------------------------------
    // Security Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordAuthFailure(String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.auth.failures.total")
                .description("Authentication failures")
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRateLimitExceeded(String identityKind) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.ratelimit.rejections.total")
                .description("Requests rejected by the rate limiter")
                .tag("identity", nullSafe(identityKind))
                .register(registry)
                .increment();
    }

    @Override
    public void recordObservabilityDropped() {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.observability.dropped.total")
                .description("Request records dropped because the record queue was full")
                .register(registry)
                .increment();
    }

    // -------------------------------------------------------------------------
    // Helper Methods
    // -------------------------------------------------------------------------

    private String outcomeTag(RequestOutcome outcome) {
        return outcome != null ? outcome.name().toLowerCase() : "unknown";
    }

    private String statusClass(int statusCode) {
        return switch (statusCode / 100) {
            case 1 -> "1xx";
            case 2 -> "2xx";
            case 3 -> "3xx";
            case 4 -> "4xx";
            case 5 -> "5xx";
            default -> "unknown";
        };
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
