package tollgate.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry: metrics, tracing and request records.
 *
 * <p>Example configuration:
 * <pre>{@code
 * tollgate.telemetry.enabled=true
 * tollgate.telemetry.metrics.enabled=true
 * tollgate.telemetry.tracing.enabled=false
 * tollgate.telemetry.records.queue-capacity=10000
 * }</pre>
 */
@ConfigMapping(prefix = "tollgate.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle for all telemetry features.
     * When disabled, all sub-features are also disabled regardless of their individual settings.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Tracing configuration.
     */
    TracingConfig tracing();

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    /**
     * Request record configuration.
     */
    RecordsConfig records();

    interface TracingConfig {
        /**
         * Create client spans around backend calls.
         */
        @WithDefault("false")
        boolean enabled();
    }

    interface MetricsConfig {
        /**
         * Enable metrics collection with Micrometer.
         */
        @WithDefault("true")
        boolean enabled();
    }

    interface RecordsConfig {
        /**
         * Records waiting to be handled beyond this many are dropped.
         */
        @WithDefault("10000")
        int queueCapacity();
    }
}
