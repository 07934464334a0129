package tollgate.core.model.gateway;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import tollgate.core.model.auth.TokenFailure;
import tollgate.core.model.ratelimit.RateLimitDecision;

/**
 * Final result of running a request through the gateway pipeline.
 *
 * <p>Every result maps to exactly one {@link RequestOutcome} and one HTTP status.
 */
public sealed interface GatewayResult {

    RequestOutcome outcome();

    int statusCode();

    /**
     * The backend answered; its status, headers and body are relayed unchanged.
     * {@code rateLimit} carries the admitting decision so quota headers can be added.
     */
    record Success(
            int statusCode,
            Map<String, List<String>> headers,
            byte[] body,
            Optional<RateLimitDecision> rateLimit)
            implements GatewayResult {
        public Success {
            if (headers == null) {
                headers = Map.of();
            }
            if (body == null) {
                body = new byte[0];
            }
            if (rateLimit == null) {
                rateLimit = Optional.empty();
            }
        }

        public Success(int statusCode, Map<String, List<String>> headers, byte[] body) {
            this(statusCode, headers, body, Optional.empty());
        }

        public static Success from(ProxyResponse response) {
            return new Success(response.statusCode(), response.headers(), response.body());
        }

        public Success withRateLimit(Optional<RateLimitDecision> decision) {
            return new Success(statusCode, headers, body, decision);
        }

        @Override
        public RequestOutcome outcome() {
            return RequestOutcome.FORWARDED;
        }
    }

    record Unauthorized(TokenFailure failure, String detail) implements GatewayResult {
        @Override
        public RequestOutcome outcome() {
            return RequestOutcome.UNAUTHORIZED;
        }

        @Override
        public int statusCode() {
            return outcome().defaultStatus();
        }
    }

    record RateLimited(RateLimitDecision decision) implements GatewayResult {
        @Override
        public RequestOutcome outcome() {
            return RequestOutcome.RATE_LIMITED;
        }

        @Override
        public int statusCode() {
            return outcome().defaultStatus();
        }
    }

    record RouteNotFound(String path) implements GatewayResult {
        @Override
        public RequestOutcome outcome() {
            return RequestOutcome.ROUTE_NOT_FOUND;
        }

        @Override
        public int statusCode() {
            return outcome().defaultStatus();
        }
    }

    record BackendTimeout(URI target, Duration timeout) implements GatewayResult {
        @Override
        public RequestOutcome outcome() {
            return RequestOutcome.BACKEND_TIMEOUT;
        }

        @Override
        public int statusCode() {
            return outcome().defaultStatus();
        }
    }

    record BackendUnreachable(URI target, String detail) implements GatewayResult {
        @Override
        public RequestOutcome outcome() {
            return RequestOutcome.BACKEND_UNREACHABLE;
        }

        @Override
        public int statusCode() {
            return outcome().defaultStatus();
        }
    }

    record ClientDisconnected() implements GatewayResult {
        @Override
        public RequestOutcome outcome() {
            return RequestOutcome.CLIENT_DISCONNECTED;
        }

        @Override
        public int statusCode() {
            return outcome().defaultStatus();
        }
    }

    record InternalError(String detail) implements GatewayResult {
        @Override
        public RequestOutcome outcome() {
            return RequestOutcome.INTERNAL_ERROR;
        }

        @Override
        public int statusCode() {
            return outcome().defaultStatus();
        }
    }
}
