package tollgate.core.service.pipeline;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.gateway.GatewayExchange;
import tollgate.core.model.gateway.GatewayResult;
import tollgate.core.model.gateway.StageOutcome;

/**
 * One step of the gateway pipeline.
 *
 * <p>Stages run in a fixed order. Each either lets the request continue or
 * rejects it with a final result; no stage runs twice for the same request.
 */
public interface PipelineStage {

    /**
     * Short stage name for logs.
     *
     * @return the stage name
     */
    String name();

    /**
     * Evaluate the request.
     *
     * @param exchange the per-request context
     * @return continue, or reject with a result
     */
    Uni<StageOutcome> evaluate(GatewayExchange exchange);

    /**
     * Called instead of {@link #evaluate} when an earlier stage rejected the request.
     *
     * <p>Lets a stage account for traffic it never admitted. The rejection stands
     * whatever this stage does.
     *
     * @param exchange the per-request context
     * @param rejection the result the request was rejected with
     * @return completion signal
     */
    default Uni<Void> observeRejection(GatewayExchange exchange, GatewayResult rejection) {
        return Uni.createFrom().voidItem();
    }
}
