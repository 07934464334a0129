package tollgate.core.service.pipeline;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.gateway.GatewayExchange;
import tollgate.core.model.gateway.GatewayResult;
import tollgate.core.model.gateway.StageOutcome;
import tollgate.core.service.gateway.ProxyForwarder;

/**
 * Runs a request through authentication, rate limiting and routing, in that
 * order, and forwards it when every stage lets it continue.
 *
 * <p>The first rejecting stage decides the result. Later stages never evaluate
 * the request; they are only told about the rejection.
 */
@ApplicationScoped
public class GatewayPipeline {

    private final List<PipelineStage> stages;
    private final ProxyForwarder forwarder;

    @Inject
    public GatewayPipeline(
            AuthenticationStage authentication,
            RateLimitStage rateLimit,
            RouteResolutionStage routing,
            ProxyForwarder forwarder) {
        this(List.of(authentication, rateLimit, routing), forwarder);
    }

    public GatewayPipeline(List<PipelineStage> stages, ProxyForwarder forwarder) {
        this.stages = List.copyOf(stages);
        this.forwarder = forwarder;
    }

    /**
     * Run the pipeline for one request.
     *
     * @param exchange the per-request context
     * @return the result; fails only on unexpected errors
     */
    public Uni<GatewayResult> run(GatewayExchange exchange) {
        return evaluateFrom(exchange, 0);
    }

    public List<PipelineStage> stages() {
        return stages;
    }

    private Uni<GatewayResult> evaluateFrom(GatewayExchange exchange, int index) {
        if (index == stages.size()) {
            return forward(exchange);
        }

        return stages.get(index).evaluate(exchange).onItem().transformToUni(outcome -> {
            if (outcome instanceof StageOutcome.Reject reject) {
                return notifyRemaining(exchange, index + 1, reject.result()).replaceWith(reject.result());
            }
            return evaluateFrom(exchange, index + 1);
        });
    }

    private Uni<Void> notifyRemaining(GatewayExchange exchange, int from, GatewayResult rejection) {
        Uni<Void> chain = Uni.createFrom().voidItem();
        for (var stage : stages.subList(from, stages.size())) {
            chain = chain.chain(() -> stage.observeRejection(exchange, rejection));
        }
        return chain;
    }

    private Uni<GatewayResult> forward(GatewayExchange exchange) {
        final var match = exchange.routeMatch()
                .orElseThrow(() -> new IllegalStateException("Forwarding without a resolved route"));

        return forwarder.forward(exchange.request(), match, exchange.claims()).map(result -> {
            if (result instanceof GatewayResult.Success success) {
                exchange.forwarded();
                return success.withRateLimit(exchange.rateLimitDecision());
            }
            return result;
        });
    }
}
