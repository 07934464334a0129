package tollgate.adapter.out.telemetry;

import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import tollgate.core.model.gateway.RequestOutcome;
import tollgate.core.model.gateway.RequestRecord;
import tollgate.spi.RequestRecordHandler;

/**
 * Request record handler that logs one line per completed request using JBoss Logging.
 *
 * <p>This is a built-in handler with priority 0. Security rejections and backend
 * failures are logged at WARN, everything else at INFO. The request id and client
 * identity are placed in the MDC so the JSON formatter emits them as fields.
 */
public class LoggingRequestRecordHandler implements RequestRecordHandler {

    private static final Logger LOG = Logger.getLogger("tollgate.requests");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(RequestRecord record) {
        MDC.put("request_id", record.requestId());
        MDC.put("client", record.clientId());
        try {
            if (isWarning(record.outcome())) {
                LOG.warnv(
                        "Request rejected: outcome={0} method={1} path={2} status={3} duration_ms={4} client={5} reason={6}",
                        record.outcome(),
                        record.method(),
                        record.path(),
                        record.statusCode(),
                        record.latency().toMillis(),
                        record.clientId(),
                        record.reason().orElse("-"));
            } else {
                LOG.infov(
                        "Request completed: outcome={0} method={1} path={2} route={3} status={4} duration_ms={5} client={6}",
                        record.outcome(),
                        record.method(),
                        record.path(),
                        record.routeTag(),
                        record.statusCode(),
                        record.latency().toMillis(),
                        record.clientId());
            }
        } finally {
            MDC.remove("request_id");
            MDC.remove("client");
        }
    }

    private static boolean isWarning(RequestOutcome outcome) {
        return outcome.isSecurityRejection()
                || outcome == RequestOutcome.BACKEND_TIMEOUT
                || outcome == RequestOutcome.BACKEND_UNREACHABLE
                || outcome == RequestOutcome.INTERNAL_ERROR;
    }
}
