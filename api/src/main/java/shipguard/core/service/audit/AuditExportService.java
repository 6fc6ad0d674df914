package shipguard.core.service.audit;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import shipguard.core.model.audit.AuditEvent;
import shipguard.core.model.audit.AuditEventDraft;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditQuery;
import shipguard.core.model.audit.NetworkOrigin;
import shipguard.core.model.audit.ResourceRef;
import shipguard.core.model.audit.UserIdentity;

/**
 * Exports a date-bounded slice of the audit buffer as compliance CSV.
 *
 * <p>Columns, in order: timestamp, level, eventType, userId, userEmail, userRole,
 * ipAddress, resourceType, resourceId, action, result, riskScore, details. Every
 * field, header included, is double-quoted; embedded quotes are doubled. The
 * details column holds the JSON-encoded details map.
 *
 * <p>Only the in-memory buffer is read: events evicted before the export are
 * absent from it.
 */
@ApplicationScoped
public class AuditExportService {

    private static final Logger LOG = Logger.getLogger(AuditExportService.class);

    static final List<String> COLUMNS = List.of(
            "timestamp",
            "level",
            "eventType",
            "userId",
            "userEmail",
            "userRole",
            "ipAddress",
            "resourceType",
            "resourceId",
            "action",
            "result",
            "riskScore",
            "details");

    private static final String LINE_SEPARATOR = "\n";

    private final AuditEventLog auditLog;
    private final ObjectMapper objectMapper;

    @Inject
    public AuditExportService(AuditEventLog auditLog, ObjectMapper objectMapper) {
        this.auditLog = auditLog;
        this.objectMapper = objectMapper;
    }

    /**
     * Export events recorded in {@code [start, end]}, oldest first.
     *
     * @param start inclusive start
     * @param end inclusive end
     * @param eventTypes event types to include, null or empty for all
     * @return the CSV text, header first
     */
    public String export(Instant start, Instant end, Collection<String> eventTypes) {
        return toCsv(select(start, end, eventTypes));
    }

    /**
     * Export and record a {@code data_export} event for the actor.
     *
     * @param start inclusive start
     * @param end inclusive end
     * @param eventTypes event types to include, null or empty for all
     * @param actor who requested the export, may be null
     * @param origin where the request came from, may be null
     * @return the CSV text
     */
    public String exportAudited(
            Instant start, Instant end, Collection<String> eventTypes, UserIdentity actor, NetworkOrigin origin) {
        final var events = select(start, end, eventTypes);
        final var csv = toCsv(events);
        final var rows = events.size();

        auditLog.record(AuditEventDraft.of(AuditEventType.DATA_EXPORT)
                .level(AuditLevel.INFO)
                .identity(actor)
                .network(origin)
                .resource(new ResourceRef("audit_log", null))
                .action("Exported audit events")
                .detail("from", start.toString())
                .detail("to", end.toString())
                .detail("eventTypes", eventTypes == null ? List.of() : List.copyOf(eventTypes))
                .detail("rowCount", rows));

        LOG.infof("Exported %d audit events between %s and %s", rows, start, end);
        return csv;
    }

    private List<AuditEvent> select(Instant start, Instant end, Collection<String> eventTypes) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");

        final var query = AuditQuery.builder()
                .from(start)
                .to(end)
                .eventTypes(eventTypes)
                .build();
        return auditLog.queryChronological(query);
    }

    String toCsv(List<AuditEvent> events) {
        final var csv = new StringBuilder();
        appendRow(csv, COLUMNS);
        for (var event : events) {
            appendRow(csv, toRow(event));
        }
        return csv.toString();
    }

    private List<String> toRow(AuditEvent event) {
        final var identity = Optional.ofNullable(event.identity());
        final var network = Optional.ofNullable(event.network());
        final var resource = Optional.ofNullable(event.resource());

        return List.of(
                event.timestamp().toString(),
                event.level().wireName(),
                event.eventType(),
                identity.map(UserIdentity::userId).orElse(""),
                identity.map(UserIdentity::userEmail).orElse(""),
                identity.map(UserIdentity::userRole).orElse(""),
                network.map(NetworkOrigin::ipAddress).orElse(""),
                resource.map(ResourceRef::resourceType).orElse(""),
                resource.map(ResourceRef::resourceId).orElse(""),
                event.action(),
                event.result().wireName(),
                Integer.toString(event.riskScore()),
                encodeDetails(event));
    }

    private String encodeDetails(AuditEvent event) {
        try {
            return objectMapper.writeValueAsString(event.details());
        } catch (JsonProcessingException e) {
            LOG.warnf("Could not encode details of audit event %d: %s", event.sequence(), e.getMessage());
            return "{}";
        }
    }

    private static void appendRow(StringBuilder csv, List<String> fields) {
        for (var i = 0; i < fields.size(); i++) {
            if (i > 0) {
                csv.append(',');
            }
            csv.append('"').append(fields.get(i).replace("\"", "\"\"")).append('"');
        }
        csv.append(LINE_SEPARATOR);
    }
}
