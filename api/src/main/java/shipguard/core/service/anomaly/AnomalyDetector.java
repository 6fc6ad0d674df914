package shipguard.core.service.anomaly;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.runtime.Startup;
import org.jboss.logging.Logger;

import shipguard.core.config.AnomalyConfig;
import shipguard.core.model.audit.AuditEvent;
import shipguard.core.model.audit.AuditEventDraft;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditResult;
import shipguard.core.model.audit.SecurityAlert;
import shipguard.core.port.out.AlertPublisher;
import shipguard.core.port.out.SecurityMetrics;
import shipguard.core.service.audit.AuditEventListener;
import shipguard.core.service.audit.AuditEventLog;

/**
 * Evaluates anomaly rules after every recorded audit event.
 *
 * <p>Rules run synchronously on the recording thread, so a violation is in the
 * log before {@code record} returns. Each finding becomes a
 * {@code security_violation} event; findings at or above the alert threshold
 * are also published to the alert channels.
 *
 * <p>A (rule, subject) pair that fired stays quiet for the rule's cool-down,
 * even while its condition keeps holding. Events emitted here are never used as
 * triggers. A rule that throws is logged and skipped.
 */
@Startup
@ApplicationScoped
public class AnomalyDetector implements AuditEventListener {

    private static final Logger LOG = Logger.getLogger(AnomalyDetector.class);
    private static final Logger SECURITY_LOG = Logger.getLogger("shipguard.security");

    static final int COOLDOWN_PRUNE_THRESHOLD = 10_000;

    private final List<AnomalyRule> rules;
    private final AuditLevel alertThreshold;
    private final boolean enabled;
    private final AuditEventLog auditLog;
    private final AlertPublisher alertPublisher;
    private final SecurityMetrics metrics;

    // (rule, subject) -> end of its cool-down
    private final ConcurrentHashMap<String, Instant> quietUntil = new ConcurrentHashMap<>();

    @Inject
    public AnomalyDetector(
            AnomalyConfig config, AuditEventLog auditLog, AlertPublisher alertPublisher, SecurityMetrics metrics) {
        this(
                List.of(
                        new RepeatedLoginFailureRule(RuleSettings.from(config.repeatedLoginFailure())),
                        new SourceVolumeRule(RuleSettings.from(config.sourceVolume())),
                        new RiskClusterRule(
                                RuleSettings.from(config.riskCluster()),
                                config.riskCluster().minRiskScore())),
                AuditLevel.parse(config.alertThreshold()),
                config.enabled(),
                auditLog,
                alertPublisher,
                metrics);
    }

    public AnomalyDetector(
            List<AnomalyRule> rules,
            AuditLevel alertThreshold,
            boolean enabled,
            AuditEventLog auditLog,
            AlertPublisher alertPublisher,
            SecurityMetrics metrics) {
        this.rules = List.copyOf(rules);
        this.alertThreshold = alertThreshold;
        this.enabled = enabled;
        this.auditLog = auditLog;
        this.alertPublisher = alertPublisher;
        this.metrics = metrics;
    }

    /**
     * Start listening to the audit log.
     */
    @PostConstruct
    public void register() {
        if (!enabled) {
            LOG.info("Anomaly detection is disabled");
            return;
        }
        auditLog.addListener(this);
        LOG.infof(
                "Anomaly detection active with rules %s, alert threshold %s",
                rules.stream().filter(AnomalyRule::isEnabled).map(AnomalyRule::name).toList(),
                alertThreshold.wireName());
    }

    @PreDestroy
    void unregister() {
        auditLog.removeListener(this);
    }

    @Override
    public void onRecorded(AuditEvent event) {
        evaluate(event);
    }

    /**
     * Run every enabled rule against a newly recorded event.
     *
     * @param trigger the recorded event
     * @return the violation events emitted
     */
    public List<AuditEvent> evaluate(AuditEvent trigger) {
        if (!enabled || AnomalyRule.isDerived(trigger)) {
            return List.of();
        }

        final var emitted = new ArrayList<AuditEvent>();
        for (var rule : rules) {
            if (!rule.isEnabled()) {
                continue;
            }
            try {
                rule.evaluate(trigger, auditLog)
                        .filter(finding -> acquireCooldown(rule, finding, trigger.timestamp()))
                        .flatMap(finding -> emit(finding, trigger))
                        .ifPresent(emitted::add);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Anomaly rule %s failed on event %d", rule.name(), trigger.sequence());
            }
        }
        return emitted;
    }

    int cooldownEntries() {
        return quietUntil.size();
    }

    private boolean acquireCooldown(AnomalyRule rule, AnomalyFinding finding, Instant now) {
        final var key = rule.name() + "|" + finding.subject();
        final var acquired = new boolean[1];

        quietUntil.compute(key, (k, until) -> {
            if (until != null && now.isBefore(until)) {
                return until;
            }
            acquired[0] = true;
            return now.plus(rule.cooldown());
        });

        if (!acquired[0]) {
            LOG.debugf("Rule %s suppressed for %s during cool-down", rule.name(), finding.subject());
        }
        if (quietUntil.size() > COOLDOWN_PRUNE_THRESHOLD) {
            quietUntil.values().removeIf(until -> !now.isBefore(until));
        }
        return acquired[0];
    }

    private Optional<AuditEvent> emit(AnomalyFinding finding, AuditEvent trigger) {
        final var draft = AuditEventDraft.of(AuditEventType.SECURITY_VIOLATION)
                .level(finding.level())
                .result(AuditResult.FAILURE)
                .identity(finding.identity())
                .network(finding.network())
                .correlationId(trigger.correlationId())
                .action(finding.action())
                .details(finding.details())
                .detail(AnomalyRule.RULE_DETAIL, finding.rule())
                .detail("eventCount", finding.eventCount())
                .detail("windowMinutes", finding.window().toMinutes())
                .detail("triggerSequence", trigger.sequence());

        final var recorded = auditLog.record(draft);
        recorded.ifPresent(event -> {
            metrics.recordAnomaly(finding.rule());
            if (event.level().isAtLeast(alertThreshold)) {
                alertPublisher.publish(
                        new SecurityAlert(event, finding.rule(), finding.eventCount(), finding.window()));
            } else {
                SECURITY_LOG.warnf(
                        "Security anomaly: %s [rule=%s, events=%d]",
                        finding.action(), finding.rule(), finding.eventCount());
            }
        });
        return recorded;
    }
}
