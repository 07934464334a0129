package tollgate.adapter.out.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tollgate.config.ForwardingConfig;
import tollgate.core.model.gateway.BackendTimeoutException;
import tollgate.core.model.gateway.BackendUnreachableException;
import tollgate.core.model.gateway.PreparedProxyRequest;

@DisplayName("ProxyHttpClient")
class ProxyHttpClientTest {

    private static final Duration AWAIT = Duration.ofSeconds(10);

    private WireMockServer backendServer;
    private ForwardingConfig config;
    private Vertx vertx;
    private ProxyHttpClient client;

    @BeforeEach
    void setUp() {
        backendServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        backendServer.start();

        config = mock(ForwardingConfig.class);
        when(config.connectTimeout()).thenReturn(Duration.ofSeconds(1));

        var noop = OpenTelemetry.noop();
        vertx = Vertx.vertx();
        client = new ProxyHttpClient(
                vertx, config, noop.getTracer("test"), noop.getPropagators().getTextMapPropagator());
        client.init();
    }

    @AfterEach
    void tearDown() {
        client.close();
        vertx.closeAndAwait();
        if (backendServer != null) {
            backendServer.stop();
        }
    }

    private URI backend(String path) {
        return URI.create("http://localhost:" + backendServer.port() + path);
    }

    private static void readRequestHead(InputStream in) throws IOException {
        var matched = 0;
        var terminator = new byte[] {'\r', '\n', '\r', '\n'};
        while (matched < terminator.length) {
            var next = in.read();
            if (next == -1) {
                throw new IOException("Connection closed before the request head was read");
            }
            matched = next == terminator[matched] ? matched + 1 : (next == '\r' ? 1 : 0);
        }
    }

    private static boolean closedByPeer(InputStream in) throws IOException {
        try {
            while (in.read() != -1) {
                // discard anything still in flight
            }
            return true;
        } catch (SocketTimeoutException e) {
            return false;
        } catch (SocketException e) {
            return true;
        }
    }

    @Nested
    @DisplayName("Exchange")
    class ExchangeTests {

        @Test
        @DisplayName("should send method, headers and body and return the backend response")
        void shouldExchange() {
            backendServer.stubFor(post(urlEqualTo("/orders?dry=true"))
                    .willReturn(aResponse()
                            .withStatus(201)
                            .withHeader("Content-Type", "application/json")
                            .withBody("{\"id\":7}")));

            var request = new PreparedProxyRequest(
                    "POST",
                    backend("/orders?dry=true"),
                    Map.of("X-Request-ID", List.of("req-9"), "Content-Type", List.of("application/json")),
                    "{\"qty\":1}".getBytes());

            var response = client.forward(request, Duration.ofSeconds(5)).await().atMost(AWAIT);

            assertEquals(201, response.statusCode());
            assertEquals("{\"id\":7}", new String(response.body()));
            assertTrue(response.headers().keySet().stream().anyMatch("Content-Type"::equalsIgnoreCase));
            backendServer.verify(postRequestedFor(urlEqualTo("/orders?dry=true"))
                    .withHeader("X-Request-ID", equalTo("req-9"))
                    .withRequestBody(equalTo("{\"qty\":1}")));
        }

        @Test
        @DisplayName("should return backend error statuses as responses")
        void shouldReturnErrorStatus() {
            backendServer.stubFor(get(urlEqualTo("/broken")).willReturn(aResponse().withStatus(503)));

            var response = client.forward(new PreparedProxyRequest("GET", backend("/broken"), Map.of(), null),
                            Duration.ofSeconds(5))
                    .await()
                    .atMost(AWAIT);

            assertEquals(503, response.statusCode());
        }

        @Test
        @DisplayName("should make a separate backend call per subscription")
        void shouldCallPerSubscription() {
            backendServer.stubFor(get(urlEqualTo("/twice")).willReturn(aResponse().withStatus(200)));
            var uni = client.forward(
                    new PreparedProxyRequest("GET", backend("/twice"), Map.of(), null), Duration.ofSeconds(5));

            uni.await().atMost(AWAIT);
            uni.await().atMost(AWAIT);

            backendServer.verify(2, getRequestedFor(urlEqualTo("/twice")));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should fail with BackendTimeoutException when the backend is too slow")
        void shouldTimeOut() {
            backendServer.stubFor(
                    get(urlEqualTo("/slow")).willReturn(aResponse().withStatus(200).withFixedDelay(2_000)));

            var failure = assertThrows(BackendTimeoutException.class, () -> client.forward(
                            new PreparedProxyRequest("GET", backend("/slow"), Map.of(), null), Duration.ofMillis(200))
                    .await()
                    .atMost(AWAIT));

            assertEquals(Duration.ofMillis(200), failure.getTimeout());
        }

        @Test
        @DisplayName("should report a refused connection as retryable")
        void shouldReportRefusedConnection() {
            var target = URI.create("http://127.0.0.1:1/nothing");

            var failure = assertThrows(BackendUnreachableException.class, () -> client.forward(
                            new PreparedProxyRequest("GET", target, Map.of(), null), Duration.ofSeconds(5))
                    .await()
                    .atMost(AWAIT));

            assertEquals(target, failure.getTarget());
            assertTrue(failure.isRetryable());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("should reset the in-flight backend request when the caller cancels")
        void shouldResetOnCancellation() throws Exception {
            var span = mock(Span.class);
            var spanBuilder = mock(SpanBuilder.class, RETURNS_SELF);
            when(spanBuilder.startSpan()).thenReturn(span);
            var tracer = mock(Tracer.class);
            when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);

            var tracedClient = new ProxyHttpClient(
                    vertx, config, tracer, OpenTelemetry.noop().getPropagators().getTextMapPropagator());
            tracedClient.init();

            try (var backend = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
                backend.setSoTimeout(5_000);
                var target = URI.create("http://127.0.0.1:" + backend.getLocalPort() + "/hanging");

                var subscription = tracedClient
                        .forward(new PreparedProxyRequest("GET", target, Map.of(), null), Duration.ofSeconds(30))
                        .subscribe()
                        .with(response -> {}, failure -> {});

                try (var connection = backend.accept()) {
                    connection.setSoTimeout(5_000);
                    var in = connection.getInputStream();
                    readRequestHead(in);

                    subscription.cancel();

                    assertTrue(closedByPeer(in), "backend connection should be closed after cancellation");
                }
            } finally {
                tracedClient.close();
            }

            verify(span).setStatus(StatusCode.ERROR, "cancelled");
            verify(span).end();
        }
    }
}
