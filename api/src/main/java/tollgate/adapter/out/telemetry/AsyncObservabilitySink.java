package tollgate.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tollgate.config.TelemetryConfigMapping;
import tollgate.core.model.gateway.RequestRecord;
import tollgate.core.port.out.Metrics;
import tollgate.core.port.out.ObservabilitySink;
import tollgate.spi.RequestRecordHandler;

/**
 * Dispatches request records to registered handlers.
 *
 * <p>Handlers are discovered via {@link ServiceLoader} and invoked in priority order
 * (highest priority first) on a single daemon thread fed by a bounded queue. When the
 * queue is full the record is dropped and counted; the request is never delayed.
 */
@ApplicationScoped
public class AsyncObservabilitySink implements ObservabilitySink {

    private static final Logger LOG = Logger.getLogger(AsyncObservabilitySink.class);

    private final Metrics metrics;
    private final int queueCapacity;
    private final AtomicBoolean overflowing = new AtomicBoolean(false);

    private List<RequestRecordHandler> handlers;
    private Executor executor;

    @Inject
    public AsyncObservabilitySink(TelemetryConfigMapping config, Metrics metrics) {
        this.metrics = metrics;
        this.queueCapacity = config.records().queueCapacity();
    }

    AsyncObservabilitySink(List<RequestRecordHandler> handlers, Executor executor, Metrics metrics) {
        this.metrics = metrics;
        this.queueCapacity = 0;
        this.handlers = sortByPriority(handlers);
        this.executor = executor;
    }

    @PostConstruct
    void init() {
        if (queueCapacity < 1) {
            throw new IllegalStateException("tollgate.telemetry.records.queue-capacity must be at least 1");
        }

        final var loadedHandlers = ServiceLoader.load(RequestRecordHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (final var handler : loadedHandlers) {
            if (handler instanceof MetricsRequestRecordHandler metricsHandler) {
                metricsHandler.setMetrics(metrics);
            }
        }

        handlers = sortByPriority(loadedHandlers);

        if (handlers.isEmpty()) {
            LOG.warn("No request record handlers found - records will not be processed");
        } else {
            LOG.infof(
                    "Loaded %d request record handler(s): %s",
                    handlers.size(),
                    handlers.stream()
                            .map(h -> h.name() + "(priority=" + h.priority() + ")")
                            .toList());
        }

        executor = new ThreadPoolExecutor(
                1, 1, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(queueCapacity), r -> {
                    final var thread = new Thread(r, "request-record-dispatcher");
                    thread.setDaemon(true);
                    return thread;
                });
    }

    @PreDestroy
    void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
        if (handlers != null) {
            handlers.forEach(handler -> {
                try {
                    handler.close();
                } catch (Exception e) {
                    LOG.warnf("Error closing handler %s: %s", handler.name(), e.getMessage());
                }
            });
        }
    }

    /**
     * Queue a record for the handlers. Never blocks and never throws.
     *
     * @param record the completed request
     */
    @Override
    public void record(RequestRecord record) {
        if (handlers == null || handlers.isEmpty()) {
            return;
        }

        try {
            executor.execute(() -> dispatch(record));
            if (overflowing.get()) {
                overflowing.set(false);
            }
        } catch (RejectedExecutionException e) {
            dropped(record);
        }
    }

    /**
     * Get the registered handlers.
     *
     * @return handlers in invocation order
     */
    public List<RequestRecordHandler> getHandlers() {
        return handlers != null ? handlers : List.of();
    }

    boolean isOverflowing() {
        return overflowing.get();
    }

    private void dispatch(RequestRecord record) {
        for (final var handler : handlers) {
            try {
                handler.handle(record);
            } catch (Exception e) {
                LOG.warnf(
                        "Handler %s failed to process record %s: %s", handler.name(), record.requestId(), e.getMessage());
            }
        }
    }

    private void dropped(RequestRecord record) {
        if (overflowing.compareAndSet(false, true)) {
            LOG.warnf("Request record queue is full, dropping records (first dropped: %s)", record.requestId());
        } else {
            LOG.debugf("Dropped request record %s", record.requestId());
        }
        metrics.recordObservabilityDropped();
    }

    private static List<RequestRecordHandler> sortByPriority(List<RequestRecordHandler> candidates) {
        return candidates.stream()
                .filter(RequestRecordHandler::isAvailable)
                .sorted(Comparator.comparingInt(RequestRecordHandler::priority).reversed())
                .toList();
    }
}
