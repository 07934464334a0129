package tollgate.core.model.gateway;

import java.util.Objects;

/**
 * Outcome of one pipeline stage: continue with the next stage, or stop with a result.
 */
public sealed interface StageOutcome {

    static StageOutcome proceed() {
        return Continue.INSTANCE;
    }

    static StageOutcome reject(GatewayResult result) {
        return new Reject(result);
    }

    record Continue() implements StageOutcome {
        static final Continue INSTANCE = new Continue();
    }

    record Reject(GatewayResult result) implements StageOutcome {
        public Reject {
            Objects.requireNonNull(result, "result must not be null");
        }
    }
}
