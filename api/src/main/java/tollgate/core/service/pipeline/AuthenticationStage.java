package tollgate.core.service.pipeline;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.model.auth.TokenValidationResult;
import tollgate.core.model.gateway.GatewayExchange;
import tollgate.core.model.gateway.GatewayResult;
import tollgate.core.model.gateway.StageOutcome;
import tollgate.core.port.out.TokenValidator;

/**
 * Validates the bearer credential and attributes the request to the token subject.
 *
 * <p>Fails closed: any failure, including a validator error, rejects the request.
 */
@ApplicationScoped
public class AuthenticationStage implements PipelineStage {

    private static final Logger LOG = Logger.getLogger(AuthenticationStage.class);

    private final TokenValidator tokenValidator;

    @Inject
    public AuthenticationStage(TokenValidator tokenValidator) {
        this.tokenValidator = tokenValidator;
    }

    @Override
    public String name() {
        return "authentication";
    }

    @Override
    public Uni<StageOutcome> evaluate(GatewayExchange exchange) {
        return Uni.createFrom().item(() -> {
            final var header = exchange.request().getHeaderString("Authorization");
            final var result = tokenValidator.validate(header);

            if (result instanceof TokenValidationResult.Valid valid) {
                exchange.authenticated(valid.claims());
                return StageOutcome.proceed();
            }

            final var invalid = (TokenValidationResult.Invalid) result;
            LOG.debugv(
                    "Token rejected: request={0} client={1} failure={2} detail={3}",
                    exchange.request().requestId(),
                    exchange.identity().key(),
                    invalid.failure(),
                    invalid.detail());
            return StageOutcome.reject(new GatewayResult.Unauthorized(invalid.failure(), invalid.detail()));
        });
    }
}
