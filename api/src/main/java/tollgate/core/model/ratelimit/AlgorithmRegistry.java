package tollgate.core.model.ratelimit;

import java.util.EnumMap;
import java.util.Map;

import org.jboss.logging.Logger;

/**
 * Registry for rate limiting algorithm handlers.
 *
 * <p>Provides lookup of algorithm handlers by type. Falls back to the sliding
 * window algorithm if the requested algorithm is not available.
 *
 * <p>Supported algorithms:
 * <ul>
 *   <li>{@link RateLimitAlgorithm#SLIDING_WINDOW} - Sliding window log (default)</li>
 *   <li>{@link RateLimitAlgorithm#FIXED_WINDOW} - Fixed time windows</li>
 * </ul>
 */
public class AlgorithmRegistry {

    private static final Logger LOG = Logger.getLogger(AlgorithmRegistry.class);

    private final Map<RateLimitAlgorithm, RateLimitAlgorithmHandler> handlers;
    private final RateLimitAlgorithmHandler defaultHandler;

    /**
     * Create a new algorithm registry with all available handlers.
     */
    public AlgorithmRegistry() {
        this.handlers = new EnumMap<>(RateLimitAlgorithm.class);
        this.defaultHandler = SlidingWindowAlgorithm.getInstance();

        registerHandler(SlidingWindowAlgorithm.getInstance());
        registerHandler(FixedWindowAlgorithm.getInstance());

        LOG.debugv("Initialized algorithm registry with {0} handler(s)", handlers.size());
    }

    /**
     * Get the handler for the specified algorithm.
     *
     * @param algorithm the algorithm type
     * @return the algorithm handler, or the default handler if none is registered
     */
    public RateLimitAlgorithmHandler getHandler(RateLimitAlgorithm algorithm) {
        final var handler = handlers.get(algorithm);
        if (handler != null) {
            return handler;
        }

        LOG.warnv("Algorithm {0} not available, falling back to {1}", algorithm, defaultHandler.algorithm());
        return defaultHandler;
    }

    private void registerHandler(RateLimitAlgorithmHandler handler) {
        handlers.put(handler.algorithm(), handler);
    }
}
