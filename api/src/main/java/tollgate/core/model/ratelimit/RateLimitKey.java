package tollgate.core.model.ratelimit;

import java.util.Objects;

import tollgate.core.model.gateway.ClientIdentity;

/**
 * Identifies the rate limit state of one client.
 *
 * <p>Key format: {@code tollgate:ratelimit:{kind}:{value}}, for example
 * {@code tollgate:ratelimit:subject:alice} or {@code tollgate:ratelimit:address:10.0.0.1}.
 *
 * @param identity the client the state belongs to
 */
public record RateLimitKey(ClientIdentity identity) {

    /**
     * Creates a rate limit key with validation.
     */
    public RateLimitKey {
        Objects.requireNonNull(identity, "identity must not be null");
    }

    /**
     * Creates a key for a client identity.
     *
     * @param identity the client identity
     * @return the rate limit key
     */
    public static RateLimitKey of(ClientIdentity identity) {
        return new RateLimitKey(identity);
    }

    /**
     * Converts this key to a cache key string.
     *
     * @return the cache key string
     */
    public String toCacheKey() {
        return "tollgate:ratelimit:" + identity.key();
    }
}
