package tollgate.core.model.auth;

import java.util.Objects;

/**
 * Result of validating an incoming bearer credential.
 */
public sealed interface TokenValidationResult {

    /**
     * Token was successfully validated.
     *
     * @param claims the verified claims
     */
    record Valid(TokenClaims claims) implements TokenValidationResult {
        public Valid {
            Objects.requireNonNull(claims, "claims must not be null");
        }
    }

    /**
     * Token validation failed.
     *
     * @param failure the failure category
     * @param detail  operator-facing description, never sent to clients
     */
    record Invalid(TokenFailure failure, String detail) implements TokenValidationResult {
        public Invalid {
            Objects.requireNonNull(failure, "failure must not be null");
            if (detail == null) {
                detail = failure.reason();
            }
        }
    }
}
