package tollgate.core.port.out;

import tollgate.core.model.gateway.RequestRecord;

/**
 * Port interface for recording completed requests.
 *
 * <p>Implementations must not block and must not throw: a record that cannot be
 * handled is dropped.
 */
public interface ObservabilitySink {

    /**
     * Record a completed request.
     *
     * @param record the request record
     */
    void record(RequestRecord record);
}
