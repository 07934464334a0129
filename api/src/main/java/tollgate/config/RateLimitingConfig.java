package tollgate.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import tollgate.core.model.ratelimit.RateLimitAlgorithm;

/**
 * Configuration mapping for rate limiting.
 *
 * <p>Configuration prefix: {@code tollgate.rate-limiting}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TOLLGATE_RATE_LIMITING_ENABLED} - Enable/disable rate limiting</li>
 *   <li>{@code TOLLGATE_RATE_LIMITING_ALGORITHM} - Algorithm: SLIDING_WINDOW, FIXED_WINDOW</li>
 *   <li>{@code TOLLGATE_RATE_LIMITING_REQUESTS_PER_WINDOW} - Requests allowed per window</li>
 *   <li>{@code TOLLGATE_RATE_LIMITING_WINDOW_SECONDS} - Window length</li>
 * </ul>
 */
@ConfigMapping(prefix = "tollgate.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Rate limiting algorithm.
     *
     * @return the algorithm (default: SLIDING_WINDOW)
     */
    @WithDefault("SLIDING_WINDOW")
    RateLimitAlgorithm algorithm();

    /**
     * Requests allowed per client within one window.
     *
     * @return requests per window (default: 5)
     */
    @WithDefault("5")
    long requestsPerWindow();

    /**
     * Window duration in seconds.
     *
     * @return window duration in seconds (default: 60)
     */
    @WithDefault("60")
    long windowSeconds();

    /**
     * Include X-RateLimit-* headers in responses.
     *
     * @return true to include headers (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Number of idle windows after which a client's state is evicted.
     *
     * @return idle windows before eviction (default: 2)
     */
    @WithDefault("2")
    int idleEvictionWindows();

    /**
     * Upper bound on the number of clients tracked at once.
     *
     * @return maximum tracked clients (default: 100000)
     */
    @WithDefault("100000")
    long maxTrackedClients();
}
