package shipguard.core.service.anomaly;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import shipguard.core.model.audit.AuditEvent;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditQuery;
import shipguard.core.service.audit.AuditEventLog;

/**
 * Fires when high-risk events cluster across the whole log, regardless of identity.
 *
 * <p>Violations emitted by the detector do not count towards the cluster.
 */
public final class RiskClusterRule implements AnomalyRule {

    public static final String NAME = "risk-cluster";

    static final String SUBJECT = "system";

    private final RuleSettings settings;
    private final int minRiskScore;

    public RiskClusterRule(RuleSettings settings, int minRiskScore) {
        this.settings = settings;
        this.minRiskScore = minRiskScore;
    }

    /**
     * Five events scoring 6 or more in thirty minutes.
     *
     * @return the rule with default settings
     */
    public static RiskClusterRule defaults() {
        return new RiskClusterRule(RuleSettings.of(5, Duration.ofMinutes(30)), 6);
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
        if (trigger.riskScore() < minRiskScore) {
            return Optional.empty();
        }

        final var highRisk = (int) log.query(AuditQuery.builder()
                        .minRiskScore(minRiskScore)
                        .from(trigger.timestamp().minus(settings.window()))
                        .to(trigger.timestamp())
                        .build())
                .stream()
                .filter(e -> !AnomalyRule.isDerived(e))
                .count();
        if (highRisk < settings.threshold()) {
            return Optional.empty();
        }

        return Optional.of(new AnomalyFinding(
                NAME,
                SUBJECT,
                AuditLevel.CRITICAL,
                highRisk,
                settings.window(),
                "Cluster of high-risk security events detected",
                null,
                null,
                Map.of("highRiskEvents", highRisk, "minRiskScore", minRiskScore)));
    }
}
