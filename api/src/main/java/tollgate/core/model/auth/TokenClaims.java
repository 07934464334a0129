package tollgate.core.model.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Claims of a bearer token whose signature has been verified.
 *
 * <p>Instances are created only by a token validator after signature verification
 * and are scoped to a single request.
 *
 * @param subject   the token subject (sub claim)
 * @param issuedAt  when the token was issued (iat claim), if present
 * @param expiresAt when the token expires (exp claim)
 * @param notBefore the earliest time the token may be used (nbf claim), if present
 * @param scopes    scopes granted by the token (scope or scp claim)
 * @param claims    all claims from the token
 */
public record TokenClaims(
        String subject,
        Optional<Instant> issuedAt,
        Instant expiresAt,
        Optional<Instant> notBefore,
        Set<String> scopes,
        Map<String, Object> claims) {

    public TokenClaims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry is required");
        }
        issuedAt = issuedAt == null ? Optional.empty() : issuedAt;
        notBefore = notBefore == null ? Optional.empty() : notBefore;
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        // Claim values may be JSON null
        claims = claims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    /**
     * Whether the token has expired at the given instant.
     *
     * @param now the current time
     * @return true if {@code expiresAt <= now}
     */
    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
