package shipguard.adapter.in.rest;

import java.util.LinkedHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.common.annotation.Blocking;
import io.smallrye.mutiny.Uni;

import shipguard.adapter.in.http.CurrentSecurityRequest;
import shipguard.core.model.audit.AuditEventDraft;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.ResourceRef;
import shipguard.core.service.audit.AuditEventLog;
import shipguard.core.service.ratelimit.RateLimitService;

/**
 * Administrative view of rate-limit buckets. Resetting a bucket is recorded as
 * a configuration change.
 */
@Path("/admin/rate-limits/{policy}/{key}")
@ApplicationScoped
@Blocking
@Produces(MediaType.APPLICATION_JSON)
public class RateLimitResource {

    private final RateLimitService rateLimitService;
    private final AuditEventLog auditLog;
    private final CurrentSecurityRequest currentRequest;

    @Inject
    public RateLimitResource(
            RateLimitService rateLimitService, AuditEventLog auditLog, CurrentSecurityRequest currentRequest) {
        this.rateLimitService = rateLimitService;
        this.auditLog = auditLog;
        this.currentRequest = currentRequest;
    }

    @GET
    public Uni<Response> status(@PathParam("policy") String policy, @PathParam("key") String key) {
        return rateLimitService.status(policy, key).map(decision -> {
            final var body = new LinkedHashMap<String, Object>();
            body.put("policy", decision.policy());
            body.put("key", key);
            body.put("limit", decision.limit());
            body.put("remaining", decision.remaining());
            body.put("blocked", !decision.allowed());
            body.put("retryAfter", decision.retryAfterSeconds());
            return Response.ok(body).build();
        });
    }

    /**
     * Lift any block on the bucket and restore its points.
     */
    @DELETE
    public Uni<Response> reset(@PathParam("policy") String policy, @PathParam("key") String key) {
        return rateLimitService.reset(policy, key).invoke(() -> auditLog.record(
                        AuditEventDraft.of(AuditEventType.CONFIGURATION_CHANGE)
                                .level(AuditLevel.WARN)
                                .identity(currentRequest.identity().orElse(null))
                                .network(currentRequest.origin())
                                .correlationId(currentRequest.correlationId())
                                .resource(new ResourceRef("rate_limit_bucket", policy + ":" + key))
                                .action("Reset rate limit bucket")
                                .detail("policy", policy)
                                .detail("key", key)))
                .map(ignored -> Response.noContent().build());
    }
}
