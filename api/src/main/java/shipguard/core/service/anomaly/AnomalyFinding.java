package shipguard.core.service.anomaly;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.NetworkOrigin;
import shipguard.core.model.audit.UserIdentity;

/**
 * A rule's conclusion that its condition holds for a subject.
 *
 * @param rule the rule name
 * @param subject what the condition holds for (account, IP, or the whole log)
 * @param level severity of the violation to emit
 * @param eventCount matching events in the window
 * @param window the rule window
 * @param action human readable summary
 * @param identity identity to attach to the violation, may be null
 * @param network network origin to attach to the violation, may be null
 * @param details rule specific details
 */
public record AnomalyFinding(
        String rule,
        String subject,
        AuditLevel level,
        int eventCount,
        Duration window,
        String action,
        UserIdentity identity,
        NetworkOrigin network,
        Map<String, Object> details) {

    public AnomalyFinding {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(window, "window must not be null");
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
