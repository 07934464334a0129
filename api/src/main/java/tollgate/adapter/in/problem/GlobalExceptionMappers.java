package tollgate.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Global exception mappers for converting unexpected exceptions to RFC 7807 Problem Details.
 *
 * <p>{@link HttpProblem} and other web exceptions keep their more specific mappers.
 * Exception text is logged and never returned to the client.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapRuntimeException(RuntimeException e) {
        LOG.errorv(e, "Unhandled exception at the gateway boundary: {0}", e.getClass().getName());
        return toResponse(GatewayProblem.internalError("The gateway failed to process the request"));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
