package shipguard.core.service.chain.stage;

import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shipguard.core.config.SecurityChainConfig;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditResult;
import shipguard.core.model.chain.Rejection;
import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;
import shipguard.core.service.audit.AuditEventLog;
import shipguard.core.service.chain.SecurityStage;

/**
 * Requires authenticated requests to carry a well-formed session id, 32
 * lowercase hex characters. A missing or malformed id records a
 * {@code security_violation} and answers 401.
 *
 * <p>Only the format is checked; sessions are not looked up. Inactive unless
 * enabled, and requests without a principal pass through.
 */
@ApplicationScoped
public class SessionValidationStage implements SecurityStage {

    public static final String NAME = "session-validation";

    static final String INVALID_SESSION = "Invalid session";

    private static final Logger LOG = Logger.getLogger(SessionValidationStage.class);
    private static final Pattern SESSION_ID = Pattern.compile("^[a-f0-9]{32}$");

    private final boolean enabled;
    private final String headerName;
    private final AuditEventLog auditLog;

    @Inject
    public SessionValidationStage(SecurityChainConfig config, AuditEventLog auditLog) {
        this(config.sessionValidation().enabled(), config.sessionValidation().header(), auditLog);
    }

    public SessionValidationStage(boolean enabled, String headerName, AuditEventLog auditLog) {
        this.enabled = enabled;
        this.headerName = headerName;
        this.auditLog = auditLog;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<StageResult> apply(SecurityRequest request) {
        if (!enabled || request.principal().isEmpty()) {
            return Uni.createFrom().item(StageResult.proceed());
        }

        final var sessionId = request.header(headerName).map(String::trim).orElse("");
        if (sessionId.isEmpty()) {
            return reject(request, "Missing session ID", null);
        }
        if (!SESSION_ID.matcher(sessionId).matches()) {
            return reject(request, "Invalid session ID format", sessionId);
        }
        return Uni.createFrom().item(StageResult.proceed());
    }

    private Uni<StageResult> reject(SecurityRequest request, String reason, String sessionId) {
        LOG.debugf("%s on %s %s", reason, request.method(), request.path());
        final var draft = RequestAudit.draft(
                AuditEventType.SECURITY_VIOLATION, AuditLevel.ERROR, AuditResult.FAILURE, request, reason);
        if (sessionId != null) {
            draft.detail("sessionId", RequestAudit.truncate(sessionId, 64));
        }
        auditLog.record(draft);
        return Uni.createFrom().item(StageResult.reject(NAME, Rejection.of(401, INVALID_SESSION)));
    }
}
