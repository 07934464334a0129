package tollgate.core.service.pipeline;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.model.gateway.GatewayExchange;
import tollgate.core.model.gateway.GatewayResult;
import tollgate.core.model.gateway.StageOutcome;
import tollgate.core.service.routing.RouteTable;

/**
 * Resolves the backend route for the request path.
 */
@ApplicationScoped
public class RouteResolutionStage implements PipelineStage {

    private static final Logger LOG = Logger.getLogger(RouteResolutionStage.class);

    private final RouteTable routeTable;

    @Inject
    public RouteResolutionStage(RouteTable routeTable) {
        this.routeTable = routeTable;
    }

    @Override
    public String name() {
        return "routing";
    }

    @Override
    public Uni<StageOutcome> evaluate(GatewayExchange exchange) {
        final var path = exchange.request().path();
        final var match = routeTable.resolve(path);
        if (match.isPresent()) {
            exchange.routeResolved(match.get());
            return Uni.createFrom().item(StageOutcome.proceed());
        }

        LOG.infov("No route for {0} {1} (request={2})", exchange.request().method(), path, exchange.request().requestId());
        return Uni.createFrom().item(StageOutcome.reject(new GatewayResult.RouteNotFound(path)));
    }
}
