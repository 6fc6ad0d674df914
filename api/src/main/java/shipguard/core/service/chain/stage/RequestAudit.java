package shipguard.core.service.chain.stage;

import shipguard.core.model.audit.AuditEventDraft;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditResult;
import shipguard.core.model.auth.AuthenticatedPrincipal;
import shipguard.core.model.chain.SecurityRequest;

/**
 * Builds audit drafts pre-filled with the request's origin, correlation id,
 * method and path.
 */
final class RequestAudit {

    private RequestAudit() {}

    static AuditEventDraft draft(
            AuditEventType type, AuditLevel level, AuditResult result, SecurityRequest request, String action) {
        return AuditEventDraft.of(type)
                .level(level)
                .result(result)
                .network(request.origin())
                .identity(request.principal().map(AuthenticatedPrincipal::toIdentity).orElse(null))
                .correlationId(request.correlationId())
                .action(action)
                .detail("method", request.method())
                .detail("path", request.path());
    }

    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength) + "...";
    }
}
