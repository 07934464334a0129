package tollgate.core.model.gateway;

/**
 * States a request moves through, strictly in declaration order.
 *
 * <p>A failing stage moves the request directly to {@link #COMPLETED}.
 */
public enum PipelineState {
    RECEIVED,
    TOKEN_VALIDATED,
    RATE_LIMIT_CHECKED,
    ROUTE_RESOLVED,
    FORWARDED,
    COMPLETED;

    /**
     * Whether moving from this state to {@code next} keeps the order.
     *
     * @param next the proposed next state
     * @return true if {@code next} comes later than this state
     */
    public boolean canAdvanceTo(PipelineState next) {
        return next.ordinal() > ordinal();
    }
}
