package shipguard.core.model.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of one security-relevant occurrence.
 *
 * <p>Instances are created by the audit log only. Producers describe an event
 * with an {@link AuditEventDraft}; the log stamps the timestamp, sequence and
 * risk score.
 *
 * @param sequence position in recording order, unique per log
 * @param timestamp when the event was recorded
 * @param level severity tier
 * @param eventType event type string, normally an {@link AuditEventType} wire name
 * @param identity acting identity, or null for unauthenticated events
 * @param network network origin, or null
 * @param resource affected resource, or null
 * @param action free-text description of the operation
 * @param result operation outcome
 * @param details open context payload (unmodifiable)
 * @param riskScore score from {@link RiskScores}
 * @param correlationId groups events of one logical operation, or null
 */
public record AuditEvent(
        long sequence,
        Instant timestamp,
        AuditLevel level,
        String eventType,
        UserIdentity identity,
        NetworkOrigin network,
        ResourceRef resource,
        String action,
        AuditResult result,
        Map<String, Object> details,
        int riskScore,
        String correlationId) {

    public AuditEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(result, "result");
        if (riskScore < RiskScores.MIN_SCORE || riskScore > RiskScores.MAX_SCORE) {
            throw new IllegalArgumentException("riskScore must be between 1 and 10: " + riskScore);
        }
        action = action != null ? action : "";
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Optional<AuditEventType> knownType() {
        return AuditEventType.fromWireName(eventType);
    }

    public boolean isType(AuditEventType type) {
        return type.wireName().equals(eventType);
    }

    public Optional<String> userId() {
        return Optional.ofNullable(identity).map(UserIdentity::userId);
    }

    public Optional<String> userEmail() {
        return Optional.ofNullable(identity).map(UserIdentity::userEmail);
    }

    public Optional<String> ipAddress() {
        return Optional.ofNullable(network).map(NetworkOrigin::ipAddress);
    }
}
