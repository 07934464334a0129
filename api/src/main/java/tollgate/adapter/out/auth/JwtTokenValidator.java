package tollgate.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.KeyFactory;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmFactoryFactory;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import tollgate.config.TokenConfig;
import tollgate.core.model.auth.TokenClaims;
import tollgate.core.model.auth.TokenFailure;
import tollgate.core.model.auth.TokenValidationResult;
import tollgate.core.port.out.TokenValidator;

/**
 * Validates signed JWT bearer tokens against a single configured key and algorithm.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>An {@code Authorization: Bearer <token>} header is present and well formed</li>
 *   <li>The token parses as a compact JWS</li>
 *   <li>The {@code alg} header equals the configured algorithm and the signature verifies</li>
 *   <li>The payload carries {@code sub} and {@code exp}, and the issuer matches when configured</li>
 *   <li>{@code exp} is in the future</li>
 *   <li>{@code iat} and {@code nbf} are not later than now plus the allowed clock skew</li>
 * </ol>
 *
 * <p>Claims are never cached; every call re-checks expiry against the clock.
 */
@ApplicationScoped
public class JwtTokenValidator implements TokenValidator {

    private static final Logger LOG = Logger.getLogger(JwtTokenValidator.class);

    private static final String BEARER_SCHEME = "Bearer";

    private final String algorithm;
    private final Key verificationKey;
    private final Optional<String> expectedIssuer;
    private final Duration clockSkew;
    private final Clock clock;

    @Inject
    public JwtTokenValidator(TokenConfig config) {
        this(
                config.algorithm(),
                resolveKey(config.algorithm(), config.secret(), config.publicKey()),
                config.issuer(),
                config.clockSkew(),
                Clock.systemUTC());
    }

    public JwtTokenValidator(
            String algorithm, Key verificationKey, Optional<String> expectedIssuer, Duration clockSkew, Clock clock) {
        this.algorithm = requireSupported(algorithm);
        this.verificationKey = verificationKey;
        this.expectedIssuer = expectedIssuer.filter(issuer -> !issuer.isBlank());
        this.clockSkew = clockSkew == null ? Duration.ZERO : clockSkew;
        this.clock = clock;

        if (verificationKey == null) {
            LOG.error("No token verification key configured - every request will be rejected with 401");
        } else {
            LOG.infov("Token validation: algorithm={0} issuer={1}", algorithm, this.expectedIssuer.orElse("(any)"));
        }
    }

    @Override
    public TokenValidationResult validate(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return invalid(TokenFailure.MISSING_CREDENTIAL, "No Authorization header");
        }

        final var parts = authorizationHeader.trim().split("\\s+");
        if (parts.length != 2 || !BEARER_SCHEME.equalsIgnoreCase(parts[0])) {
            return invalid(TokenFailure.MALFORMED_CREDENTIAL, "Authorization header is not a Bearer credential");
        }

        final var jws = new JsonWebSignature();
        try {
            jws.setCompactSerialization(parts[1]);
        } catch (JoseException e) {
            return invalid(TokenFailure.MALFORMED_CREDENTIAL, "Not a compact JWS: " + e.getMessage());
        }

        final var payload = verify(jws);
        if (payload.isEmpty()) {
            return invalid(TokenFailure.INVALID_SIGNATURE, "Signature verification failed");
        }

        final JwtClaims claims;
        try {
            claims = JwtClaims.parse(payload.get());
        } catch (InvalidJwtException e) {
            return invalid(TokenFailure.MALFORMED_CREDENTIAL, "Payload is not a JWT claim set");
        }

        return checkClaims(claims);
    }

    @Override
    public boolean isReady() {
        return verificationKey != null;
    }

    private Optional<String> verify(JsonWebSignature jws) {
        if (verificationKey == null) {
            return Optional.empty();
        }

        final var headerAlgorithm = jws.getAlgorithmHeaderValue();
        if (!algorithm.equals(headerAlgorithm)) {
            LOG.debugv("Rejected token with alg={0}, expected {1}", headerAlgorithm, algorithm);
            return Optional.empty();
        }

        try {
            jws.setAlgorithmConstraints(
                    new AlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT, algorithm));
            jws.setKey(verificationKey);
            if (!jws.verifySignature()) {
                return Optional.empty();
            }
            return Optional.of(jws.getPayload());
        } catch (JoseException e) {
            LOG.debugv("Signature verification error: {0}", e.getMessage());
            return Optional.empty();
        }
    }

    private TokenValidationResult checkClaims(JwtClaims claims) {
        try {
            final var subject = claims.getSubject();
            final var expiration = claims.getExpirationTime();
            if (subject == null || subject.isBlank() || expiration == null) {
                return invalid(TokenFailure.MALFORMED_CREDENTIAL, "Token lacks sub or exp");
            }

            if (expectedIssuer.isPresent() && !expectedIssuer.get().equals(claims.getIssuer())) {
                return invalid(TokenFailure.INVALID_SIGNATURE, "Untrusted issuer " + claims.getIssuer());
            }

            final var now = clock.instant();
            final var expiresAt = toInstant(expiration);
            if (!expiresAt.isAfter(now)) {
                return invalid(TokenFailure.EXPIRED, "Token expired at " + expiresAt);
            }

            final var latestAcceptable = now.plus(clockSkew);
            final var issuedAt = Optional.ofNullable(claims.getIssuedAt()).map(JwtTokenValidator::toInstant);
            if (issuedAt.isPresent() && issuedAt.get().isAfter(latestAcceptable)) {
                return invalid(TokenFailure.NOT_YET_VALID, "Token issued in the future at " + issuedAt.get());
            }
            final var notBefore = Optional.ofNullable(claims.getNotBefore()).map(JwtTokenValidator::toInstant);
            if (notBefore.isPresent() && notBefore.get().isAfter(latestAcceptable)) {
                return invalid(TokenFailure.NOT_YET_VALID, "Token not valid before " + notBefore.get());
            }

            return new TokenValidationResult.Valid(
                    new TokenClaims(subject, issuedAt, expiresAt, notBefore, scopes(claims), claims.getClaimsMap()));
        } catch (MalformedClaimException e) {
            return invalid(TokenFailure.MALFORMED_CREDENTIAL, "Malformed claims: " + e.getMessage());
        }
    }

    private static Set<String> scopes(JwtClaims claims) {
        final var scopes = new LinkedHashSet<String>();
        for (var name : new String[] {"scope", "scp"}) {
            final var value = claims.getClaimValue(name);
            if (value instanceof String text) {
                for (var scope : text.trim().split("\\s+")) {
                    if (!scope.isEmpty()) {
                        scopes.add(scope);
                    }
                }
            } else if (value instanceof Collection<?> values) {
                values.forEach(v -> scopes.add(String.valueOf(v)));
            }
        }
        return scopes;
    }

    private static Instant toInstant(NumericDate date) {
        return Instant.ofEpochMilli(date.getValueInMillis());
    }

    private static TokenValidationResult invalid(TokenFailure failure, String detail) {
        return new TokenValidationResult.Invalid(failure, detail);
    }

    private static String requireSupported(String algorithm) {
        if (algorithm == null || algorithm.isBlank() || AlgorithmIdentifiers.NONE.equals(algorithm)) {
            throw new IllegalStateException("tollgate.auth.algorithm must name a signing algorithm");
        }
        final var supported =
                AlgorithmFactoryFactory.getInstance().getJwsAlgorithmFactory().getSupportedAlgorithms();
        if (!supported.contains(algorithm)) {
            throw new IllegalStateException("Unsupported token algorithm: " + algorithm);
        }
        return algorithm;
    }

    /**
     * Build the verification key for the configured algorithm.
     *
     * @param algorithm the JWS algorithm
     * @param secret HMAC secret, for HS* algorithms
     * @param publicKeyPem PEM public key, for RS*, PS* and ES* algorithms
     * @return the key, or null when none is configured
     * @throws IllegalStateException if the configured key is unusable
     */
    static Key resolveKey(String algorithm, Optional<String> secret, Optional<String> publicKeyPem) {
        if (algorithm != null && algorithm.startsWith("HS")) {
            if (secret.isEmpty() || secret.get().isBlank()) {
                return null;
            }
            final var bytes = secret.get().getBytes(StandardCharsets.UTF_8);
            // The key must be at least as long as the hash output
            final var minBytes = switch (algorithm) {
                case AlgorithmIdentifiers.HMAC_SHA384 -> 48;
                case AlgorithmIdentifiers.HMAC_SHA512 -> 64;
                default -> 32;
            };
            if (bytes.length < minBytes) {
                throw new IllegalStateException(
                        "tollgate.auth.secret must be at least " + minBytes + " bytes for " + algorithm);
            }
            return new HmacKey(bytes);
        }

        if (publicKeyPem.isEmpty() || publicKeyPem.get().isBlank()) {
            return null;
        }
        final var keyType = algorithm != null && algorithm.startsWith("ES") ? "EC" : "RSA";
        try {
            final var keyContent = publicKeyPem.get()
                    .replace("-----BEGIN PUBLIC KEY-----", "")
                    .replace("-----END PUBLIC KEY-----", "")
                    .replaceAll("\\s", "");
            final var keySpec = new X509EncodedKeySpec(Base64.getDecoder().decode(keyContent));
            return KeyFactory.getInstance(keyType).generatePublic(keySpec);
        } catch (Exception e) {
            throw new IllegalStateException("tollgate.auth.public-key is not a valid " + keyType + " public key", e);
        }
    }
}
