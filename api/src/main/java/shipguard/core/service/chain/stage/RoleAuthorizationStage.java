package shipguard.core.service.chain.stage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditResult;
import shipguard.core.model.chain.Rejection;
import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;
import shipguard.core.service.audit.AuditEventLog;
import shipguard.core.service.chain.SecurityStage;

/**
 * Compares the authenticated role with the route's allow-list.
 *
 * <p>Routes without an allow-list accept any authenticated role.
 */
@ApplicationScoped
public class RoleAuthorizationStage implements SecurityStage {

    public static final String NAME = "role-authorization";

    private final AuditEventLog auditLog;

    @Inject
    public RoleAuthorizationStage(AuditEventLog auditLog) {
        this.auditLog = auditLog;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<StageResult> apply(SecurityRequest request) {
        final var principal = request.principal().orElse(null);
        if (principal == null) {
            auditLog.record(RequestAudit.draft(
                    AuditEventType.ACCESS_DENIED,
                    AuditLevel.WARN,
                    AuditResult.FAILURE,
                    request,
                    "Role check without authenticated user"));
            return Uni.createFrom().item(StageResult.reject(NAME, Rejection.of(401, "Authentication required")));
        }

        final Set<String> allowed = request.routeProfile() != null ? request.routeProfile().allowedRoles() : Set.of();
        if (allowed.isEmpty() || allowed.contains(principal.role())) {
            return Uni.createFrom().item(StageResult.proceed());
        }

        final var required = new ArrayList<>(allowed);
        required.sort(null);
        auditLog.record(RequestAudit.draft(
                        AuditEventType.ACCESS_DENIED,
                        AuditLevel.WARN,
                        AuditResult.FAILURE,
                        request,
                        "Insufficient privileges for " + request.method() + " " + request.path())
                .detail("userRole", principal.role())
                .detail("requiredRoles", required));

        final var body = new LinkedHashMap<String, Object>();
        body.put("error", "Insufficient privileges");
        body.put("required", required);
        body.put("current", principal.role());
        return Uni.createFrom().item(StageResult.reject(NAME, new Rejection(403, null, body)));
    }
}
