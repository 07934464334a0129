package tollgate.spi;

import tollgate.core.model.gateway.RequestRecord;

/**
 * SPI for handling the record written for every completed gateway request.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and invoked
 * on the observability thread, never on the request path.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs records using JBoss Logging (priority 0)</li>
 *   <li>{@code metrics} - Records Micrometer metrics (priority 10)</li>
 * </ul>
 *
 * <p>Example implementation:
 * <pre>{@code
 * public class AuditTrailRecordHandler implements RequestRecordHandler {
 *     @Override
 *     public String name() { return "audit"; }
 *
 *     @Override
 *     public int priority() { return 100; }
 *
 *     @Override
 *     public void handle(RequestRecord record) {
 *         if (record.outcome().isSecurityRejection()) {
 *             auditClient.append(record);
 *         }
 *     }
 * }
 * }</pre>
 *
 * <p>Register implementations in:
 * {@code META-INF/services/tollgate.spi.RequestRecordHandler}
 */
public interface RequestRecordHandler {

    /**
     * Returns the unique name of this handler.
     *
     * @return handler name (e.g., "logging", "audit")
     */
    String name();

    /**
     * Returns the priority of this handler. Higher priority handlers are invoked first.
     *
     * @return priority value
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler should receive records.
     *
     * @return true if the handler is available
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle a request record.
     *
     * <p>A handler that throws does not prevent the other handlers from running.
     *
     * @param record the completed request
     */
    void handle(RequestRecord record);

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
