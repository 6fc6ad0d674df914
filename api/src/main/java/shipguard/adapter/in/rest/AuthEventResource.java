package shipguard.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.common.annotation.Blocking;

import shipguard.adapter.in.dto.AuthEventRequest;
import shipguard.adapter.in.http.CurrentSecurityRequest;
import shipguard.adapter.in.problem.ApiProblem;
import shipguard.core.model.audit.AuditEventDraft;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditResult;
import shipguard.core.model.audit.UserIdentity;
import shipguard.core.service.audit.AuditEventLog;

/**
 * Records login outcomes reported by the login page, feeding the repeated
 * login failure rule.
 */
@Path("/auth/events")
@ApplicationScoped
@Blocking
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthEventResource {

    private final AuditEventLog auditLog;
    private final CurrentSecurityRequest currentRequest;

    @Inject
    public AuthEventResource(AuditEventLog auditLog, CurrentSecurityRequest currentRequest) {
        this.auditLog = auditLog;
        this.currentRequest = currentRequest;
    }

    @POST
    public Response record(@NotNull(message = "Request body is required") @Valid AuthEventRequest request) {
        final var type = AuditEventType.fromWireName(request.eventType())
                .orElseThrow(() -> new IllegalArgumentException("Unknown eventType: " + request.eventType()));

        final var failed = type == AuditEventType.LOGIN_FAILED;
        final var draft = AuditEventDraft.of(type)
                .level(failed ? AuditLevel.WARN : AuditLevel.INFO)
                .result(failed ? AuditResult.FAILURE : AuditResult.SUCCESS)
                .identity(new UserIdentity(request.userId(), request.email().trim(), null))
                .network(currentRequest.origin())
                .correlationId(currentRequest.correlationId())
                .action(failed ? "Login failed" : "Login succeeded");
        if (failed && request.reason() != null) {
            draft.detail("reason", request.reason());
        }

        return auditLog.record(draft)
                .map(event -> Response.accepted(Map.of("sequence", event.sequence())).build())
                .orElseThrow(() -> ApiProblem.internalError("Event not recorded"));
    }
}
