package shipguard.core.service.chain;

import java.util.List;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;
import shipguard.core.port.out.SecurityMetrics;

/**
 * Ordered list of stages run one after another until one stops the request.
 */
public final class SecurityChain {

    private static final Logger LOG = Logger.getLogger(SecurityChain.class);

    private final List<SecurityStage> stages;
    private final SecurityMetrics metrics;

    public SecurityChain(List<SecurityStage> stages, SecurityMetrics metrics) {
        this.stages = List.copyOf(stages);
        this.metrics = metrics;
    }

    /**
     * Run the stages in order.
     *
     * @param request the request
     * @return {@link StageResult.Continue} if every stage continued, otherwise the first short-circuit
     */
    public Uni<StageResult> execute(SecurityRequest request) {
        Uni<StageResult> result = Uni.createFrom().item(StageResult.proceed());
        for (var stage : stages) {
            result = result.flatMap(previous -> {
                if (!previous.isContinue()) {
                    return Uni.createFrom().item(previous);
                }
                return Uni.createFrom().deferred(() -> stage.apply(request));
            });
        }
        return result.invoke(outcome -> {
            if (outcome instanceof StageResult.ShortCircuit shortCircuit) {
                LOG.debugf(
                        "Request %s %s stopped by %s with status %d",
                        request.method(),
                        request.path(),
                        shortCircuit.stage(),
                        shortCircuit.rejection().status());
                metrics.recordShortCircuit(shortCircuit.stage(), shortCircuit.rejection().status());
            }
        });
    }

    public List<String> stageNames() {
        return stages.stream().map(SecurityStage::name).toList();
    }
}
