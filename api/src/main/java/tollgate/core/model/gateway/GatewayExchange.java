package tollgate.core.model.gateway;

import java.util.Objects;
import java.util.Optional;

import tollgate.core.model.auth.TokenClaims;
import tollgate.core.model.ratelimit.RateLimitDecision;
import tollgate.core.model.routing.RouteMatch;

/**
 * Per-request pipeline context.
 *
 * <p>Owned by exactly one request. Stages run one after another, so no field is
 * written concurrently. State changes are validated against {@link PipelineState}
 * ordering; an out-of-order transition is a programming error.
 */
public final class GatewayExchange {

    private final GatewayRequest request;
    private final long startNanos;

    private PipelineState state = PipelineState.RECEIVED;
    private PipelineState lastStageReached = PipelineState.RECEIVED;
    private ClientIdentity identity;
    private TokenClaims claims;
    private RateLimitDecision rateLimitDecision;
    private RouteMatch routeMatch;

    public GatewayExchange(GatewayRequest request, ClientIdentity addressIdentity, long startNanos) {
        this.request = Objects.requireNonNull(request, "request must not be null");
        this.identity = Objects.requireNonNull(addressIdentity, "addressIdentity must not be null");
        this.startNanos = startNanos;
    }

    public GatewayRequest request() {
        return request;
    }

    public long startNanos() {
        return startNanos;
    }

    public PipelineState state() {
        return state;
    }

    /**
     * Returns the last state reached before completion.
     *
     * @return the furthest non-terminal state
     */
    public PipelineState lastStageReached() {
        return lastStageReached;
    }

    /**
     * The identity the request is attributed to: the token subject once
     * authenticated, the client address before that.
     *
     * @return the current client identity
     */
    public ClientIdentity identity() {
        return identity;
    }

    public Optional<TokenClaims> claims() {
        return Optional.ofNullable(claims);
    }

    public Optional<RateLimitDecision> rateLimitDecision() {
        return Optional.ofNullable(rateLimitDecision);
    }

    public Optional<RouteMatch> routeMatch() {
        return Optional.ofNullable(routeMatch);
    }

    /**
     * Moves to the next state.
     *
     * @param next the state to move to
     * @throws IllegalStateException if {@code next} does not come after the current state
     */
    public void advanceTo(PipelineState next) {
        if (!state.canAdvanceTo(next)) {
            throw new IllegalStateException("Illegal pipeline transition " + state + " -> " + next);
        }
        state = next;
        if (next != PipelineState.COMPLETED) {
            lastStageReached = next;
        }
    }

    /**
     * Marks the request completed. Idempotent.
     */
    public void complete() {
        if (state != PipelineState.COMPLETED) {
            advanceTo(PipelineState.COMPLETED);
        }
    }

    public void authenticated(TokenClaims verified) {
        this.claims = Objects.requireNonNull(verified, "claims must not be null");
        this.identity = ClientIdentity.subject(verified.subject());
        advanceTo(PipelineState.TOKEN_VALIDATED);
    }

    public void rateLimitChecked(RateLimitDecision decision) {
        this.rateLimitDecision = decision;
        advanceTo(PipelineState.RATE_LIMIT_CHECKED);
    }

    /**
     * Records the rate limit decision of a request that will not proceed.
     *
     * @param decision the decision, kept for response headers
     */
    public void rateLimitRecorded(RateLimitDecision decision) {
        this.rateLimitDecision = decision;
    }

    public void routeResolved(RouteMatch match) {
        this.routeMatch = Objects.requireNonNull(match, "match must not be null");
        advanceTo(PipelineState.ROUTE_RESOLVED);
    }

    public void forwarded() {
        advanceTo(PipelineState.FORWARDED);
    }
}
