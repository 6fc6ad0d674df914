package shipguard.core.service.anomaly;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import shipguard.core.model.audit.AuditEvent;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditQuery;
import shipguard.core.service.audit.AuditEventLog;

/**
 * Fires when one account accumulates failed logins.
 *
 * <p>The account is identified by user id, or by email when the failure was
 * reported without one (the login page only knows the email).
 */
public final class RepeatedLoginFailureRule implements AnomalyRule {

    public static final String NAME = "repeated-login-failure";

    private final RuleSettings settings;

    public RepeatedLoginFailureRule(RuleSettings settings) {
        this.settings = settings;
    }

    /**
     * Three failures in fifteen minutes.
     *
     * @return the rule with default settings
     */
    public static RepeatedLoginFailureRule defaults() {
        return new RepeatedLoginFailureRule(RuleSettings.of(3, Duration.ofMinutes(15)));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return settings.enabled();
    }

    @Override
    public Duration cooldown() {
        return settings.cooldown();
    }

    @Override
    public Optional<AnomalyFinding> evaluate(AuditEvent trigger, AuditEventLog log) {
        if (!trigger.isType(AuditEventType.LOGIN_FAILED) || trigger.identity() == null) {
            return Optional.empty();
        }
        final var subject = trigger.identity().subject();
        if (subject == null) {
            return Optional.empty();
        }

        final var query = AuditQuery.builder()
                .eventTypes(AuditEventType.LOGIN_FAILED)
                .from(trigger.timestamp().minus(settings.window()))
                .to(trigger.timestamp());
        trigger.userId()
                .filter(id -> !id.isBlank())
                .ifPresentOrElse(query::userId, () -> query.userEmail(subject));

        final var failures = log.count(query.build());
        if (failures < settings.threshold()) {
            return Optional.empty();
        }

        return Optional.of(new AnomalyFinding(
                NAME,
                subject,
                AuditLevel.ERROR,
                failures,
                settings.window(),
                "Repeated failed login attempts for " + subject,
                trigger.identity(),
                trigger.network(),
                Map.of("failedAttempts", failures, "subject", subject)));
    }
}
