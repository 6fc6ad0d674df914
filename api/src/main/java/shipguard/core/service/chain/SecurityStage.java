package shipguard.core.service.chain;

import io.smallrye.mutiny.Uni;

import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;

/**
 * One interceptor of the request security chain.
 *
 * <p>A stage either lets the request continue or stops it with a response. A
 * stage that stops the request records the corresponding audit event before
 * returning.
 */
public interface SecurityStage {

    String name();

    Uni<StageResult> apply(SecurityRequest request);
}
