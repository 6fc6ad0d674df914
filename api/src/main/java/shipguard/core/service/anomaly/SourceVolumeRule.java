package shipguard.core.service.anomaly;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import shipguard.core.model.audit.AuditEvent;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditQuery;
import shipguard.core.model.audit.NetworkOrigin;
import shipguard.core.service.audit.AuditEventLog;

/**
 * Fires when a single client IP produces a high volume of audit events.
 */
public final class SourceVolumeRule implements AnomalyRule {

    public static final String NAME = "source-volume";

    private static final String UNKNOWN_IP = "unknown";

    private final RuleSettings settings;

    public SourceVolumeRule(RuleSettings settings) {
        this.settings = settings;
    }

    /**
     * Twenty events in ten minutes.
     *
     * @return the rule with default settings
     */
    public static SourceVolumeRule defaults() {
        return new SourceVolumeRule(RuleSettings.of(20, Duration.ofMinutes(10)));
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
        final var ip = trigger.ipAddress().orElse(null);
        if (ip == null || ip.isBlank() || UNKNOWN_IP.equals(ip)) {
            return Optional.empty();
        }

        final var count = log.count(AuditQuery.builder()
                .ipAddress(ip)
                .from(trigger.timestamp().minus(settings.window()))
                .to(trigger.timestamp())
                .build());
        if (count < settings.threshold()) {
            return Optional.empty();
        }

        return Optional.of(new AnomalyFinding(
                NAME,
                ip,
                AuditLevel.WARN,
                count,
                settings.window(),
                "High event volume from " + ip,
                null,
                NetworkOrigin.ofIp(ip),
                Map.of("ipAddress", ip, "eventCount", count)));
    }
}
