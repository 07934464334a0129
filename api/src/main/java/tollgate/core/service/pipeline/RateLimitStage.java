package tollgate.core.service.pipeline;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.config.RateLimitingConfig;
import tollgate.core.model.gateway.GatewayExchange;
import tollgate.core.model.gateway.GatewayResult;
import tollgate.core.model.gateway.StageOutcome;
import tollgate.core.model.ratelimit.EffectiveRateLimit;
import tollgate.core.model.ratelimit.RateLimitDecision;
import tollgate.core.model.ratelimit.RateLimitKey;
import tollgate.core.port.out.RateLimiter;

/**
 * Applies the per-client rate limit.
 *
 * <p>Authenticated requests are counted under their subject. Requests that failed
 * authentication are counted under their address, so unauthenticated floods are
 * throttled too; their response stays 401.
 */
@ApplicationScoped
public class RateLimitStage implements PipelineStage {

    private static final Logger LOG = Logger.getLogger(RateLimitStage.class);

    private final RateLimiter rateLimiter;
    private final EffectiveRateLimit limit;

    @Inject
    public RateLimitStage(RateLimiter rateLimiter, RateLimitingConfig config) {
        this(rateLimiter, EffectiveRateLimit.of(config.requestsPerWindow(), config.windowSeconds()));
    }

    public RateLimitStage(RateLimiter rateLimiter, EffectiveRateLimit limit) {
        this.rateLimiter = rateLimiter;
        this.limit = limit;
    }

    @Override
    public String name() {
        return "rate-limit";
    }

    @Override
    public Uni<StageOutcome> evaluate(GatewayExchange exchange) {
        if (!rateLimiter.isEnabled()) {
            exchange.rateLimitChecked(RateLimitDecision.allow());
            return Uni.createFrom().item(StageOutcome.proceed());
        }

        return rateLimiter
                .checkAndConsume(RateLimitKey.of(exchange.identity()), limit)
                .map(decision -> {
                    if (decision.allowed()) {
                        exchange.rateLimitChecked(decision);
                        return StageOutcome.proceed();
                    }
                    exchange.rateLimitRecorded(decision);
                    LOG.debugv(
                            "Rate limit exceeded: request={0} client={1} count={2} limit={3} retryAfter={4}s",
                            exchange.request().requestId(),
                            exchange.identity().key(),
                            decision.requestCount(),
                            decision.limit(),
                            decision.retryAfterSeconds());
                    return StageOutcome.reject(new GatewayResult.RateLimited(decision));
                });
    }

    @Override
    public Uni<Void> observeRejection(GatewayExchange exchange, GatewayResult rejection) {
        if (!rateLimiter.isEnabled() || !(rejection instanceof GatewayResult.Unauthorized)) {
            return Uni.createFrom().voidItem();
        }

        return rateLimiter
                .checkAndConsume(RateLimitKey.of(exchange.identity()), limit)
                .invoke(decision -> {
                    exchange.rateLimitRecorded(decision);
                    if (!decision.allowed()) {
                        LOG.debugv(
                                "Unauthenticated client over limit: client={0} count={1}",
                                exchange.identity().key(),
                                decision.requestCount());
                    }
                })
                .onFailure()
                .invoke(e -> LOG.warnv(
                        "Could not count rejected request for {0}: {1}", exchange.identity().key(), e.getMessage()))
                .onFailure()
                .recoverWithNull()
                .replaceWithVoid();
    }

    /**
     * Returns the limit applied to every client.
     *
     * @return the effective limit
     */
    public EffectiveRateLimit limit() {
        return limit;
    }
}
