package shipguard.adapter.in.rest;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.common.annotation.Blocking;

import shipguard.adapter.in.http.CurrentSecurityRequest;
import shipguard.core.model.audit.AuditEvent;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditQuery;
import shipguard.core.model.audit.AuditStatistics;
import shipguard.core.service.audit.AuditEventLog;
import shipguard.core.service.audit.AuditExportService;

/**
 * Administrative access to the audit buffer: querying, CSV export and
 * statistics. Authentication and the admin role are enforced by the security
 * chain.
 */
@Path("/admin/audit")
@ApplicationScoped
@Blocking
@Produces(MediaType.APPLICATION_JSON)
public class AuditResource {

    static final int DEFAULT_LIMIT = 100;
    static final String TEXT_CSV = "text/csv";

    private final AuditEventLog auditLog;
    private final AuditExportService exportService;
    private final CurrentSecurityRequest currentRequest;

    @Inject
    public AuditResource(
            AuditEventLog auditLog, AuditExportService exportService, CurrentSecurityRequest currentRequest) {
        this.auditLog = auditLog;
        this.exportService = exportService;
        this.currentRequest = currentRequest;
    }

    /**
     * Query recorded events, newest first.
     */
    @GET
    @Path("/events")
    public List<AuditEvent> events(
            @QueryParam("from") String from,
            @QueryParam("to") String to,
            @QueryParam("type") List<String> types,
            @QueryParam("userId") String userId,
            @QueryParam("email") String email,
            @QueryParam("ip") String ip,
            @QueryParam("level") String level,
            @QueryParam("correlationId") String correlationId,
            @QueryParam("minRisk") @DefaultValue("0") @Min(value = 0, message = "minRisk must not be negative")
                    @Max(value = 10, message = "minRisk must be at most 10")
                    int minRisk,
            @QueryParam("limit") @DefaultValue("100") @Min(value = 0, message = "limit must not be negative")
                    int limit) {
        final var query = AuditQuery.builder()
                .from(TimeParams.parseStart("from", from))
                .to(TimeParams.parseEnd("to", to))
                .eventTypes(types)
                .userId(userId)
                .userEmail(email)
                .ipAddress(ip)
                .minLevel(level != null ? AuditLevel.parse(level) : null)
                .correlationId(correlationId)
                .minRiskScore(minRisk)
                .limit(limit)
                .build();
        return auditLog.query(query);
    }

    /**
     * Export events in a date range as CSV. The export is itself audited.
     */
    @GET
    @Path("/export")
    @Produces(TEXT_CSV)
    public Response export(
            @QueryParam("from") String from, @QueryParam("to") String to, @QueryParam("type") List<String> types) {
        final var start = required("from", TimeParams.parseStart("from", from));
        final var end = required("to", TimeParams.parseEnd("to", to));

        final var csv = exportService.exportAudited(
                start, end, types, currentRequest.identity().orElse(null), currentRequest.origin());

        return Response.ok(csv, TEXT_CSV + "; charset=UTF-8")
                .header("Content-Disposition", "attachment; filename=\"" + fileName(start, end) + "\"")
                .build();
    }

    @GET
    @Path("/stats")
    public AuditStatistics stats() {
        return auditLog.statistics();
    }

    private static Instant required(String name, Instant value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private static String fileName(Instant start, Instant end) {
        final var format = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);
        return "audit-" + format.format(start) + "-" + format.format(end) + ".csv";
    }
}
