package tollgate.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Default;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.quarkus.arc.DefaultBean;

/**
 * Provides fallback telemetry beans for when the Quarkus Micrometer and OpenTelemetry
 * extensions do not contribute their own.
 */
@ApplicationScoped
public class TelemetryFallbackProducer {

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Provides a no-op tracer. Backend calls still open spans, which are discarded.
     *
     * @return a no-op tracer
     */
    @Produces
    @Singleton
    @DefaultBean
    @Default
    public Tracer tracer() {
        return OpenTelemetry.noop().getTracer("tollgate-noop");
    }

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public TextMapPropagator textMapPropagator() {
        return OpenTelemetry.noop().getPropagators().getTextMapPropagator();
    }
}
