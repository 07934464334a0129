package tollgate.support;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

/**
 * Mints signed tokens for tests.
 */
public final class TestTokens {

    /** Matches {@code %test.tollgate.auth.secret}. */
    public static final String SECRET = "test-secret-for-integration-tests-0123456789";

    /** Matches {@code %test.tollgate.auth.issuer}. */
    public static final String ISSUER = "tollgate-test";

    private TestTokens() {}

    public static Builder forSubject(String subject) {
        return new Builder(subject);
    }

    public static HmacKey key() {
        return new HmacKey(SECRET.getBytes(StandardCharsets.UTF_8));
    }

    public static final class Builder {

        private final String subject;
        private String algorithm = AlgorithmIdentifiers.HMAC_SHA256;
        private String secret = SECRET;
        private String issuer = ISSUER;
        private Instant issuedAt = Instant.now();
        private Instant expiresAt = Instant.now().plusSeconds(300);
        private Instant notBefore;
        private List<String> scopes = List.of();
        private boolean includeExpiry = true;

        private Builder(String subject) {
            this.subject = subject;
        }

        public Builder algorithm(String algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder secret(String secret) {
            this.secret = secret;
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder issuedAt(Instant issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder notBefore(Instant notBefore) {
            this.notBefore = notBefore;
            return this;
        }

        public Builder scopes(String... scopes) {
            this.scopes = List.of(scopes);
            return this;
        }

        public Builder withoutExpiry() {
            this.includeExpiry = false;
            return this;
        }

        public String sign() {
            final var claims = new JwtClaims();
            if (subject != null) {
                claims.setSubject(subject);
            }
            if (issuer != null) {
                claims.setIssuer(issuer);
            }
            if (issuedAt != null) {
                claims.setIssuedAt(NumericDate.fromMilliseconds(issuedAt.toEpochMilli()));
            }
            if (includeExpiry && expiresAt != null) {
                claims.setExpirationTime(NumericDate.fromMilliseconds(expiresAt.toEpochMilli()));
            }
            if (notBefore != null) {
                claims.setNotBefore(NumericDate.fromMilliseconds(notBefore.toEpochMilli()));
            }
            if (!scopes.isEmpty()) {
                claims.setClaim("scope", String.join(" ", scopes));
            }

            final var jws = new JsonWebSignature();
            jws.setPayload(claims.toJson());
            jws.setAlgorithmHeaderValue(algorithm);
            if (AlgorithmIdentifiers.NONE.equals(algorithm)) {
                jws.setAlgorithmConstraints(AlgorithmConstraints.NO_CONSTRAINTS);
            } else {
                jws.setKey(new HmacKey(secret.getBytes(StandardCharsets.UTF_8)));
                jws.setDoKeyValidation(false);
            }
            try {
                return jws.getCompactSerialization();
            } catch (JoseException e) {
                throw new IllegalStateException("Failed to sign test token", e);
            }
        }

        public String bearer() {
            return "Bearer " + sign();
        }
    }
}
