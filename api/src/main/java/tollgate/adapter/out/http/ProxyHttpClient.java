package tollgate.adapter.out.http;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.netty.channel.ConnectTimeoutException;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.core.http.HttpClient;
import io.vertx.mutiny.core.http.HttpClientRequest;
import io.vertx.mutiny.core.http.HttpClientResponse;
import org.jboss.logging.Logger;

import tollgate.adapter.out.telemetry.SpanAttributes;
import tollgate.config.ForwardingConfig;
import tollgate.config.TelemetryConfigMapping;
import tollgate.core.model.gateway.BackendTimeoutException;
import tollgate.core.model.gateway.BackendUnreachableException;
import tollgate.core.model.gateway.PreparedProxyRequest;
import tollgate.core.model.gateway.ProxyResponse;
import tollgate.core.port.out.ProxyClient;

/**
 * HTTP adapter for forwarding prepared proxy requests using the Vert.x HTTP client.
 * All header preparation logic is handled by
 * {@link tollgate.core.service.gateway.ProxyRequestPreparer} in core.
 *
 * <p>The whole exchange (connect, send, receive body) must finish within the
 * route timeout. On timeout or cancellation the backend request is reset so the
 * connection is not left busy.
 *
 * <p>Failures while obtaining a connection are reported as retryable; failures
 * after the request started are not, since the backend may already have acted on it.
 *
 * <p>When tracing is enabled, each backend call gets a client span and W3C Trace
 * Context headers (traceparent, tracestate) are propagated to the backend.
 */
@ApplicationScoped
public class ProxyHttpClient implements ProxyClient {

    private static final Logger LOG = Logger.getLogger(ProxyHttpClient.class);

    private static final OpenTelemetry NOOP = OpenTelemetry.noop();

    private static final TextMapSetter<HttpClientRequest> HEADER_SETTER =
            (carrier, key, value) -> carrier.headers().set(key, value);

    private final Vertx vertx;
    private final ForwardingConfig config;
    private final Tracer tracer;
    private final TextMapPropagator propagator;
    private HttpClient httpClient;

    @Inject
    public ProxyHttpClient(
            Vertx vertx,
            ForwardingConfig config,
            TelemetryConfigMapping telemetryConfig,
            Tracer tracer,
            TextMapPropagator propagator) {
        this(
                vertx,
                config,
                tracingEnabled(telemetryConfig) ? tracer : NOOP.getTracer("tollgate-noop"),
                tracingEnabled(telemetryConfig) ? propagator : NOOP.getPropagators().getTextMapPropagator());
    }

    ProxyHttpClient(Vertx vertx, ForwardingConfig config, Tracer tracer, TextMapPropagator propagator) {
        this.vertx = vertx;
        this.config = config;
        this.tracer = tracer;
        this.propagator = propagator;
    }

    private static boolean tracingEnabled(TelemetryConfigMapping telemetryConfig) {
        return telemetryConfig.enabled() && telemetryConfig.tracing().enabled();
    }

    @PostConstruct
    void init() {
        final var options = new HttpClientOptions()
                .setConnectTimeout((int) config.connectTimeout().toMillis())
                .setKeepAlive(true);
        this.httpClient = vertx.createHttpClient(options);
    }

    @PreDestroy
    void close() {
        if (httpClient != null) {
            httpClient.closeAndAwait();
        }
    }

    @Override
    public Uni<ProxyResponse> forward(PreparedProxyRequest preparedRequest, Duration timeout) {
        // Each subscription, including a retry, is a separate backend call with its own span
        return Uni.createFrom().deferred(() -> exchange(preparedRequest, timeout));
    }

    private Uni<ProxyResponse> exchange(PreparedProxyRequest preparedRequest, Duration timeout) {
        final var targetUri = preparedRequest.targetUri();
        final var inFlight = new AtomicReference<HttpClientRequest>();

        final var span = tracer.spanBuilder("HTTP " + preparedRequest.method())
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(SpanAttributes.HTTP_METHOD, preparedRequest.method())
                .setAttribute(SpanAttributes.HTTP_URL, targetUri.toString())
                .setAttribute(SpanAttributes.NET_PEER_NAME, targetUri.getHost())
                .setAttribute(SpanAttributes.NET_PEER_PORT, (long) getPort(targetUri))
                .startSpan();

        final var options = new RequestOptions()
                .setMethod(HttpMethod.valueOf(preparedRequest.method()))
                .setAbsoluteURI(targetUri.toString());

        return httpClient
                .request(options)
                .onFailure()
                .transform(error -> new BackendUnreachableException(targetUri, isConnectFailure(error), error))
                .flatMap(request -> {
                    inFlight.set(request);
                    applyHeaders(preparedRequest, request);
                    propagator.inject(Context.current().with(span), request, HEADER_SETTER);
                    return send(request, preparedRequest.body())
                            .onFailure()
                            .transform(error -> new BackendUnreachableException(targetUri, false, error));
                })
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new BackendTimeoutException(targetUri, timeout))
                .onFailure(BackendTimeoutException.class)
                .invoke(() -> reset(inFlight, "timeout"))
                .onCancellation()
                .invoke(() -> {
                    reset(inFlight, "cancelled");
                    span.setStatus(StatusCode.ERROR, "cancelled");
                    span.end();
                })
                .invoke(response -> {
                    span.setAttribute(SpanAttributes.HTTP_STATUS_CODE, (long) response.statusCode());
                    if (response.statusCode() >= 500) {
                        span.setStatus(StatusCode.ERROR, "HTTP " + response.statusCode());
                    }
                    span.end();
                })
                .onFailure()
                .invoke(error -> {
                    span.setStatus(StatusCode.ERROR, error.getMessage());
                    span.recordException(error);
                    span.end();
                });
    }

    private Uni<ProxyResponse> send(HttpClientRequest request, byte[] body) {
        final Uni<HttpClientResponse> sent =
                body.length > 0 ? request.send(Buffer.buffer(body)) : request.send();
        return sent.flatMap(response -> response.body().map(buffer -> toProxyResponse(response, buffer)));
    }

    private void applyHeaders(PreparedProxyRequest preparedRequest, HttpClientRequest httpRequest) {
        for (var entry : preparedRequest.headers().entrySet()) {
            for (var value : entry.getValue()) {
                httpRequest.headers().add(entry.getKey(), value);
            }
        }
    }

    private ProxyResponse toProxyResponse(HttpClientResponse response, Buffer body) {
        final Map<String, List<String>> headers = new LinkedHashMap<>();

        for (var name : response.headers().names()) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).addAll(response.headers().getAll(name));
        }

        final var responseBody = body != null ? body.getBytes() : new byte[0];
        return new ProxyResponse(response.statusCode(), headers, responseBody);
    }

    private static void reset(AtomicReference<HttpClientRequest> inFlight, String reason) {
        final var request = inFlight.get();
        if (request != null && request.reset()) {
            LOG.debugv("Reset backend request ({0})", reason);
        }
    }

    private static boolean isConnectFailure(Throwable error) {
        var cause = error;
        while (cause != null) {
            if (cause instanceof ConnectException
                    || cause instanceof ConnectTimeoutException
                    || cause instanceof UnknownHostException
                    || cause instanceof NoRouteToHostException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static int getPort(URI uri) {
        var port = uri.getPort();
        if (port == -1) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return port;
    }
}
