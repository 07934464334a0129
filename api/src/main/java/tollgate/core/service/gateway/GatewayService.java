package tollgate.core.service.gateway;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.config.ForwardingConfig;
import tollgate.core.model.gateway.ClientIdentity;
import tollgate.core.model.gateway.GatewayExchange;
import tollgate.core.model.gateway.GatewayRequest;
import tollgate.core.model.gateway.GatewayResult;
import tollgate.core.model.gateway.RequestRecord;
import tollgate.core.port.in.GatewayUseCase;
import tollgate.core.port.out.ObservabilitySink;
import tollgate.core.service.common.ClientIpExtractor;
import tollgate.core.service.pipeline.GatewayPipeline;

/**
 * Handle gateway requests by running them through the pipeline and recording
 * exactly one {@link RequestRecord} per request.
 *
 * <p>A record is written on every path: forwarded, rejected, failed, or abandoned
 * by the client. Unexpected errors become {@link GatewayResult.InternalError};
 * their detail is logged and never returned to the client.
 *
 * <p>All operations are fully reactive and never block.
 */
@ApplicationScoped
public class GatewayService implements GatewayUseCase {

    private static final Logger LOG = Logger.getLogger(GatewayService.class);

    private final GatewayPipeline pipeline;
    private final ObservabilitySink observabilitySink;
    private final ForwardingConfig forwardingConfig;

    @Inject
    public GatewayService(
            GatewayPipeline pipeline, ObservabilitySink observabilitySink, ForwardingConfig forwardingConfig) {
        this.pipeline = pipeline;
        this.observabilitySink = observabilitySink;
        this.forwardingConfig = forwardingConfig;
    }

    @Override
    public Uni<GatewayResult> forward(GatewayRequest request) {
        return Uni.createFrom().deferred(() -> {
            final long startTime = System.nanoTime();
            final var receivedAt = Instant.now();
            final var clientAddress = ClientIpExtractor.extract(request, forwardingConfig.trustForwardedHeaders());
            final var exchange = new GatewayExchange(request, ClientIdentity.address(clientAddress), startTime);
            final var recorded = new AtomicBoolean(false);

            LOG.debugv(
                    "Incoming request: request={0} method={1} path={2} client={3}",
                    request.requestId(),
                    request.method(),
                    request.path(),
                    clientAddress);

            return pipeline.run(exchange)
                    .onFailure()
                    .recoverWithItem(error -> {
                        LOG.errorv(error, "Unexpected gateway failure: request={0}", request.requestId());
                        return new GatewayResult.InternalError(describe(error));
                    })
                    .invoke(result -> record(exchange, result, receivedAt, recorded))
                    .onCancellation()
                    .invoke(() -> record(exchange, new GatewayResult.ClientDisconnected(), receivedAt, recorded));
        });
    }

    private void record(GatewayExchange exchange, GatewayResult result, Instant receivedAt, AtomicBoolean recorded) {
        if (!recorded.compareAndSet(false, true)) {
            return;
        }
        final var lastState = exchange.lastStageReached();
        exchange.complete();

        final var request = exchange.request();
        final long responseBytes =
                result instanceof GatewayResult.Success success ? success.body().length : 0L;

        final var record = new RequestRecord(
                request.requestId(),
                receivedAt,
                exchange.identity().key(),
                request.method(),
                request.path(),
                exchange.routeMatch().map(match -> match.route().prefix()),
                result.outcome(),
                result.statusCode(),
                Duration.ofNanos(System.nanoTime() - exchange.startNanos()),
                request.body().length,
                responseBytes,
                lastState,
                reasonOf(result));

        try {
            observabilitySink.record(record);
        } catch (RuntimeException e) {
            LOG.warnv("Failed to record request {0}: {1}", request.requestId(), e.getMessage());
        }
    }

    private static Optional<String> reasonOf(GatewayResult result) {
        if (result instanceof GatewayResult.Unauthorized unauthorized) {
            return Optional.of(unauthorized.failure().reason());
        }
        if (result instanceof GatewayResult.RateLimited limited) {
            return Optional.of("retry_after=" + limited.decision().retryAfterSeconds() + "s");
        }
        if (result instanceof GatewayResult.BackendTimeout timeout) {
            return Optional.of("timeout=" + timeout.timeout().toMillis() + "ms");
        }
        if (result instanceof GatewayResult.BackendUnreachable unreachable) {
            return Optional.of(unreachable.detail());
        }
        if (result instanceof GatewayResult.InternalError error) {
            return Optional.of(error.detail());
        }
        return Optional.empty();
    }

    private static String describe(Throwable error) {
        return error.getClass().getSimpleName() + (error.getMessage() != null ? ": " + error.getMessage() : "");
    }
}
