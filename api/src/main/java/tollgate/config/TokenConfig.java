package tollgate.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for bearer token verification.
 *
 * <p>Configuration prefix: {@code tollgate.auth}
 *
 * <p>Exactly one key source is used: {@code secret} for HMAC algorithms
 * ({@code HS256}, {@code HS384}, {@code HS512}) or {@code public-key} for
 * RSA and EC algorithms.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TOLLGATE_AUTH_ALGORITHM} - JWS algorithm, e.g. HS256 or RS256</li>
 *   <li>{@code TOLLGATE_AUTH_SECRET} - HMAC shared secret (at least 32 bytes)</li>
 *   <li>{@code TOLLGATE_AUTH_PUBLIC_KEY} - PEM encoded public key</li>
 * </ul>
 */
@ConfigMapping(prefix = "tollgate.auth")
public interface TokenConfig {

    /**
     * The only JWS algorithm accepted.
     *
     * @return the algorithm identifier (default: HS256)
     */
    @WithDefault("HS256")
    String algorithm();

    /**
     * HMAC shared secret.
     *
     * @return the secret, if configured
     */
    Optional<String> secret();

    /**
     * PEM encoded public key ({@code -----BEGIN PUBLIC KEY-----}).
     *
     * @return the public key, if configured
     */
    Optional<String> publicKey();

    /**
     * Expected issuer. When set, tokens with a different {@code iss} are rejected.
     *
     * @return the issuer, if configured
     */
    Optional<String> issuer();

    /**
     * Tolerance for {@code iat} and {@code nbf} claims in the future.
     *
     * <p>Not applied to {@code exp}.
     *
     * @return the clock skew (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration clockSkew();
}
