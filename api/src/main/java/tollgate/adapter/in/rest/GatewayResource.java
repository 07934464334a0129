package tollgate.adapter.in.rest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HEAD;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import tollgate.adapter.in.http.RequestIdFilter;
import tollgate.adapter.in.problem.GatewayProblem;
import tollgate.config.RateLimitingConfig;
import tollgate.core.model.gateway.GatewayRequest;
import tollgate.core.model.gateway.GatewayResult;
import tollgate.core.model.ratelimit.RateLimitDecision;
import tollgate.core.port.in.GatewayUseCase;

/**
 * Single entry point for all proxied traffic. Every path and method not claimed by
 * the management endpoints under {@code /q} goes through the gateway pipeline.
 */
@Path("/")
@ApplicationScoped
public class GatewayResource {

    private final GatewayUseCase gatewayUseCase;
    private final RateLimitingConfig rateLimitingConfig;

    @Inject
    public GatewayResource(GatewayUseCase gatewayUseCase, RateLimitingConfig rateLimitingConfig) {
        this.gatewayUseCase = gatewayUseCase;
        this.rateLimitingConfig = rateLimitingConfig;
    }

    @GET
    @Path("{path:.*}")
    public Uni<Response> proxyGet(@Context ContainerRequestContext requestContext, @Context HttpServerRequest request) {
        return proxyRequest(requestContext, request, null);
    }

    @POST
    @Path("{path:.*}")
    public Uni<Response> proxyPost(
            @Context ContainerRequestContext requestContext, @Context HttpServerRequest request, byte[] body) {
        return proxyRequest(requestContext, request, body);
    }

    @PUT
    @Path("{path:.*}")
    public Uni<Response> proxyPut(
            @Context ContainerRequestContext requestContext, @Context HttpServerRequest request, byte[] body) {
        return proxyRequest(requestContext, request, body);
    }

    @DELETE
    @Path("{path:.*}")
    public Uni<Response> proxyDelete(
            @Context ContainerRequestContext requestContext, @Context HttpServerRequest request, byte[] body) {
        return proxyRequest(requestContext, request, body);
    }

    @PATCH
    @Path("{path:.*}")
    public Uni<Response> proxyPatch(
            @Context ContainerRequestContext requestContext, @Context HttpServerRequest request, byte[] body) {
        return proxyRequest(requestContext, request, body);
    }

    @HEAD
    @Path("{path:.*}")
    public Uni<Response> proxyHead(@Context ContainerRequestContext requestContext, @Context HttpServerRequest request) {
        return proxyRequest(requestContext, request, null);
    }

    @OPTIONS
    @Path("{path:.*}")
    public Uni<Response> proxyOptions(
            @Context ContainerRequestContext requestContext, @Context HttpServerRequest request) {
        return proxyRequest(requestContext, request, null);
    }

    private Uni<Response> proxyRequest(
            ContainerRequestContext requestContext, HttpServerRequest request, byte[] body) {
        final var gatewayRequest = toGatewayRequest(requestContext, request, body);
        return gatewayUseCase.forward(gatewayRequest).map(this::toResponse);
    }

    private GatewayRequest toGatewayRequest(
            ContainerRequestContext requestContext, HttpServerRequest request, byte[] body) {
        final Map<String, List<String>> headers = new LinkedHashMap<>();
        for (var entry : requestContext.getHeaders().entrySet()) {
            headers.put(entry.getKey(), List.copyOf(entry.getValue()));
        }

        // Raw path: percent-encoding is forwarded exactly as the client sent it
        final var requestUri = requestContext.getUriInfo().getRequestUri();
        final var path = requestUri.getRawPath() == null || requestUri.getRawPath().isEmpty()
                ? "/"
                : requestUri.getRawPath();

        return new GatewayRequest(
                requestContext.getMethod(),
                path,
                requestUri.getRawQuery(),
                headers,
                requestUri,
                body,
                remoteHost(request),
                RequestIdFilter.requestId(requestContext));
    }

    private Response toResponse(GatewayResult result) {
        if (result instanceof GatewayResult.Success success) {
            final var responseBuilder = Response.status(success.statusCode());
            for (var entry : success.headers().entrySet()) {
                for (var value : entry.getValue()) {
                    responseBuilder.header(entry.getKey(), value);
                }
            }
            success.rateLimit().filter(this::reportsQuota).ifPresent(decision -> responseBuilder
                    .header("X-RateLimit-Limit", decision.limit())
                    .header("X-RateLimit-Remaining", decision.remaining())
                    .header("X-RateLimit-Reset", decision.resetAtEpochSeconds()));
            if (success.body().length > 0) {
                responseBuilder.entity(success.body());
            }
            return responseBuilder.build();
        }
        if (result instanceof GatewayResult.Unauthorized unauthorized) {
            throw GatewayProblem.unauthorized(unauthorized.failure().clientMessage());
        }
        if (result instanceof GatewayResult.RateLimited limited) {
            final var decision = limited.decision();
            throw GatewayProblem.tooManyRequests(
                    decision.retryAfterSeconds(),
                    decision.limit(),
                    decision.resetAtEpochSeconds(),
                    rateLimitingConfig.includeHeaders());
        }
        if (result instanceof GatewayResult.RouteNotFound notFound) {
            throw GatewayProblem.routeNotFound(notFound.path());
        }
        if (result instanceof GatewayResult.BackendTimeout) {
            throw GatewayProblem.gatewayTimeout("The backend did not respond in time");
        }
        if (result instanceof GatewayResult.BackendUnreachable) {
            throw GatewayProblem.badGateway("The backend could not be reached");
        }
        throw GatewayProblem.internalError("The gateway failed to process the request");
    }

    private boolean reportsQuota(RateLimitDecision decision) {
        return rateLimitingConfig.enabled() && rateLimitingConfig.includeHeaders() && decision.limit() != Long.MAX_VALUE;
    }

    private static String remoteHost(HttpServerRequest request) {
        if (request == null || request.remoteAddress() == null) {
            return null;
        }
        return request.remoteAddress().host();
    }
}
