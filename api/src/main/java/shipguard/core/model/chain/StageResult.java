package shipguard.core.model.chain;

import java.util.Objects;

/**
 * Outcome of one security stage.
 */
public sealed interface StageResult {

    /** The request proceeds to the next stage. */
    record Continue() implements StageResult {}

    /**
     * The request is answered immediately; later stages do not run.
     *
     * @param stage name of the stage that stopped the chain
     * @param rejection the response to send
     */
    record ShortCircuit(String stage, Rejection rejection) implements StageResult {
        public ShortCircuit {
            Objects.requireNonNull(stage, "stage must not be null");
            Objects.requireNonNull(rejection, "rejection must not be null");
        }
    }

    Continue CONTINUE = new Continue();

    static StageResult proceed() {
        return CONTINUE;
    }

    static StageResult reject(String stage, Rejection rejection) {
        return new ShortCircuit(stage, rejection);
    }

    default boolean isContinue() {
        return this instanceof Continue;
    }
}
