package shipguard.core.model.audit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable description of an event about to be recorded.
 *
 * <p>Usage:
 * <pre>{@code
 * auditLog.record(AuditEventDraft.of(AuditEventType.ACCESS_DENIED)
 *         .level(AuditLevel.WARN)
 *         .result(AuditResult.FAILURE)
 *         .action("Invalid or expired token")
 *         .network(NetworkOrigin.ofIp(clientIp))
 *         .detail("path", path));
 * }</pre>
 */
public final class AuditEventDraft {

    private final String eventType;
    private AuditLevel level = AuditLevel.INFO;
    private UserIdentity identity;
    private NetworkOrigin network;
    private ResourceRef resource;
    private String action;
    private AuditResult result = AuditResult.SUCCESS;
    private final Map<String, Object> details = new LinkedHashMap<>();
    private String correlationId;

    private AuditEventDraft(String eventType) {
        this.eventType = Objects.requireNonNull(eventType, "eventType");
    }

    public static AuditEventDraft of(AuditEventType type) {
        return new AuditEventDraft(type.wireName());
    }

    /**
     * Start a draft for an event type string that may be outside the catalogue.
     * Catalogued types are stored under their wire name whatever their case.
     *
     * @param eventType the event type string
     * @return a new draft
     */
    public static AuditEventDraft of(String eventType) {
        return new AuditEventDraft(AuditEventType.canonical(Objects.requireNonNull(eventType, "eventType")));
    }

    public AuditEventDraft level(AuditLevel level) {
        this.level = Objects.requireNonNull(level, "level");
        return this;
    }

    public AuditEventDraft identity(UserIdentity identity) {
        this.identity = identity;
        return this;
    }

    public AuditEventDraft network(NetworkOrigin network) {
        this.network = network;
        return this;
    }

    public AuditEventDraft resource(ResourceRef resource) {
        this.resource = resource;
        return this;
    }

    public AuditEventDraft action(String action) {
        this.action = action;
        return this;
    }

    public AuditEventDraft result(AuditResult result) {
        this.result = Objects.requireNonNull(result, "result");
        return this;
    }

    public AuditEventDraft detail(String key, Object value) {
        details.put(key, value);
        return this;
    }

    public AuditEventDraft details(Map<String, ?> values) {
        if (values != null) {
            details.putAll(values);
        }
        return this;
    }

    public AuditEventDraft correlationId(String correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    public String eventType() {
        return eventType;
    }

    public Map<String, Object> details() {
        return details;
    }

    /**
     * Freeze this draft into an event. Called by the audit log while it holds
     * its write lock.
     *
     * @param sequence recording sequence number
     * @param timestamp record time
     * @return the immutable event
     */
    public AuditEvent toEvent(long sequence, Instant timestamp) {
        return new AuditEvent(
                sequence,
                timestamp,
                level,
                eventType,
                identity,
                network,
                resource,
                action,
                result,
                details,
                RiskScores.scoreOf(eventType),
                correlationId);
    }
}
