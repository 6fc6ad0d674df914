package shipguard.core.model.audit;

import java.time.Duration;
import java.util.Objects;

/**
 * Alert handed to alert channels when an anomaly rule fires at or above the
 * configured severity cutoff. The underlying event is already in the audit log.
 *
 * @param event the derived violation event
 * @param rule name of the rule that fired
 * @param eventCount number of matching events in the rule window
 * @param window the rule window
 */
public record SecurityAlert(AuditEvent event, String rule, int eventCount, Duration window) {

    public SecurityAlert {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(window, "window");
    }

    public AuditLevel level() {
        return event.level();
    }

    public String summary() {
        return "%s: %s (%d events in %d min)".formatted(rule, event.action(), eventCount, window.toMinutes());
    }
}
