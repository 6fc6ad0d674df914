package shipguard.core.service.anomaly;

import java.time.Duration;
import java.util.Optional;

import shipguard.core.model.audit.AuditEvent;
import shipguard.core.service.audit.AuditEventLog;

/**
 * Window-based check over recent audit events.
 *
 * <p>Rules hold no state between evaluations: everything they decide is derived
 * from the log's current contents. Cool-down bookkeeping belongs to the detector.
 */
public interface AnomalyRule {

    /** Detail key marking events emitted by the detector. */
    String RULE_DETAIL = "rule";

    String name();

    default boolean isEnabled() {
        return true;
    }

    /**
     * How long a fired (rule, subject) pair stays quiet.
     *
     * @return the cool-down
     */
    Duration cooldown();

    /**
     * Evaluate the rule after {@code trigger} was recorded.
     *
     * @param trigger the event just recorded
     * @param log the audit log to count over
     * @return a finding if the rule's condition holds
     */
    Optional<AnomalyFinding> evaluate(AuditEvent trigger, AuditEventLog log);

    /**
     * Whether an event was emitted by the detector itself.
     *
     * @param event the event
     * @return true for derived violation events
     */
    static boolean isDerived(AuditEvent event) {
        return event.details().containsKey(RULE_DETAIL);
    }
}
