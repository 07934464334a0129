package tollgate.core.service.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tollgate.config.ForwardingConfig;
import tollgate.core.model.gateway.BackendTimeoutException;
import tollgate.core.model.gateway.BackendUnreachableException;
import tollgate.core.model.gateway.GatewayRequest;
import tollgate.core.model.gateway.GatewayResult;
import tollgate.core.model.gateway.ProxyResponse;
import tollgate.core.model.routing.RouteEntry;
import tollgate.core.model.routing.RouteMatch;
import tollgate.core.port.out.ProxyClient;

@DisplayName("ProxyForwarder")
class ProxyForwarderTest {

    private static final URI BACKEND = URI.create("http://backend:9000");
    private static final Duration AWAIT = Duration.ofSeconds(5);

    private ProxyClient proxyClient;
    private ForwardingConfig config;
    private ProxyForwarder forwarder;
    private GatewayRequest request;

    @BeforeEach
    void setUp() {
        proxyClient = mock(ProxyClient.class);
        config = mock(ForwardingConfig.class);
        when(config.viaPseudonym()).thenReturn("tollgate");
        when(config.defaultTimeout()).thenReturn(Duration.ofSeconds(30));
        when(config.connectRetryBackoff()).thenReturn(Duration.ofMillis(1));
        forwarder = new ProxyForwarder(proxyClient, new ProxyRequestPreparer(config), config);
        request = new GatewayRequest(
                "GET", "/api/items", null, Map.of(), URI.create("http://gw/api/items"), null, "10.0.0.1", "req-7");
    }

    private static RouteMatch match(Optional<Duration> timeout) {
        return new RouteMatch(new RouteEntry("/api", BACKEND, timeout, false), "/api/items");
    }

    private Uni<ProxyResponse> counting(AtomicInteger calls, Supplier<Uni<ProxyResponse>> attempt) {
        return Uni.createFrom().deferred(() -> {
            calls.incrementAndGet();
            return attempt.get();
        });
    }

    @Nested
    @DisplayName("Relaying")
    class RelayTests {

        @Test
        @DisplayName("should relay backend status, headers and body")
        void shouldRelayResponse() {
            var response = new ProxyResponse(
                    201,
                    Map.of("Content-Type", List.of("text/plain"), "Connection", List.of("close")),
                    "created".getBytes());
            when(proxyClient.forward(any(), any())).thenReturn(Uni.createFrom().item(response));

            var result = forwarder.forward(request, match(Optional.empty()), Optional.empty())
                    .await()
                    .atMost(AWAIT);

            var success = assertInstanceOf(GatewayResult.Success.class, result);
            assertEquals(201, success.statusCode());
            assertEquals("created", new String(success.body()));
            assertEquals(List.of("text/plain"), success.headers().get("Content-Type"));
            assertFalse(success.headers().containsKey("Connection"));
        }

        @Test
        @DisplayName("should relay backend error statuses as normal responses")
        void shouldRelayBackendErrors() {
            when(proxyClient.forward(any(), any()))
                    .thenReturn(Uni.createFrom().item(new ProxyResponse(503, Map.of(), null)));

            var result = forwarder.forward(request, match(Optional.empty()), Optional.empty())
                    .await()
                    .atMost(AWAIT);

            assertEquals(503, assertInstanceOf(GatewayResult.Success.class, result).statusCode());
        }

        @Test
        @DisplayName("should use the route timeout when one is configured")
        void shouldUseRouteTimeout() {
            when(proxyClient.forward(any(), any()))
                    .thenReturn(Uni.createFrom().item(new ProxyResponse(200, Map.of(), null)));

            forwarder.forward(request, match(Optional.of(Duration.ofSeconds(2))), Optional.empty())
                    .await()
                    .atMost(AWAIT);

            verify(proxyClient).forward(any(), eq(Duration.ofSeconds(2)));
        }

        @Test
        @DisplayName("should fall back to the default timeout")
        void shouldUseDefaultTimeout() {
            when(proxyClient.forward(any(), any()))
                    .thenReturn(Uni.createFrom().item(new ProxyResponse(200, Map.of(), null)));

            forwarder.forward(request, match(Optional.empty()), Optional.empty())
                    .await()
                    .atMost(AWAIT);

            verify(proxyClient).forward(any(), eq(Duration.ofSeconds(30)));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should map a timeout to BackendTimeout without retrying")
        void shouldMapTimeout() {
            var calls = new AtomicInteger();
            when(proxyClient.forward(any(), any())).thenReturn(counting(calls, () -> Uni.createFrom()
                    .failure(new BackendTimeoutException(BACKEND, Duration.ofSeconds(30)))));

            var result = forwarder.forward(request, match(Optional.empty()), Optional.empty())
                    .await()
                    .atMost(AWAIT);

            var timeout = assertInstanceOf(GatewayResult.BackendTimeout.class, result);
            assertEquals(504, timeout.statusCode());
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("should retry a connect failure once and relay the second attempt")
        void shouldRetryConnectFailureOnce() {
            var calls = new AtomicInteger();
            when(proxyClient.forward(any(), any())).thenReturn(counting(calls, () -> calls.get() == 1
                    ? Uni.createFrom().failure(new BackendUnreachableException(BACKEND, true, new ConnectException()))
                    : Uni.createFrom().item(new ProxyResponse(200, Map.of(), "ok".getBytes()))));

            var result = forwarder.forward(request, match(Optional.empty()), Optional.empty())
                    .await()
                    .atMost(AWAIT);

            assertInstanceOf(GatewayResult.Success.class, result);
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("should give up after one retry and report BackendUnreachable")
        void shouldGiveUpAfterOneRetry() {
            var calls = new AtomicInteger();
            when(proxyClient.forward(any(), any())).thenReturn(counting(calls, () -> Uni.createFrom()
                    .failure(new BackendUnreachableException(BACKEND, true, new ConnectException("refused")))));

            var result = forwarder.forward(request, match(Optional.empty()), Optional.empty())
                    .await()
                    .atMost(AWAIT);

            var unreachable = assertInstanceOf(GatewayResult.BackendUnreachable.class, result);
            assertEquals(502, unreachable.statusCode());
            assertEquals(BACKEND, unreachable.target());
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("should not retry failures after the request was sent")
        void shouldNotRetryAfterSend() {
            var calls = new AtomicInteger();
            when(proxyClient.forward(any(), any())).thenReturn(counting(calls, () -> Uni.createFrom()
                    .failure(new BackendUnreachableException(BACKEND, false, new IOException("reset")))));

            var result = forwarder.forward(request, match(Optional.empty()), Optional.empty())
                    .await()
                    .atMost(AWAIT);

            assertInstanceOf(GatewayResult.BackendUnreachable.class, result);
            assertEquals(1, calls.get());
        }
    }
}
