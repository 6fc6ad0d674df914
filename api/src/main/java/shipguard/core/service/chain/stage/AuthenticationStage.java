package shipguard.core.service.chain.stage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditResult;
import shipguard.core.model.auth.InvalidTokenException;
import shipguard.core.model.chain.Rejection;
import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;
import shipguard.core.port.out.TokenVerifier;
import shipguard.core.service.audit.AuditEventLog;
import shipguard.core.service.chain.SecurityStage;

/**
 * Requires a valid bearer credential.
 *
 * <p>Missing, malformed and unverifiable credentials record {@code access_denied}
 * and answer 401. A verified credential attaches the principal to the request
 * and records a {@code permission_granted} event.
 */
@ApplicationScoped
public class AuthenticationStage implements SecurityStage {

    public static final String NAME = "authentication";

    static final String MISSING_CREDENTIALS = "Authentication required";
    static final String INVALID_CREDENTIALS = "Invalid or expired token";

    private static final Logger LOG = Logger.getLogger(AuthenticationStage.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenVerifier tokenVerifier;
    private final AuditEventLog auditLog;

    @Inject
    public AuthenticationStage(TokenVerifier tokenVerifier, AuditEventLog auditLog) {
        this.tokenVerifier = tokenVerifier;
        this.auditLog = auditLog;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<StageResult> apply(SecurityRequest request) {
        final var header = request.header("Authorization").orElse(null);
        if (header == null || !header.startsWith(BEARER_PREFIX) || header.substring(BEARER_PREFIX.length()).isBlank()) {
            auditLog.record(RequestAudit.draft(
                            AuditEventType.ACCESS_DENIED,
                            AuditLevel.WARN,
                            AuditResult.FAILURE,
                            request,
                            "Missing or invalid authorization header")
                    .detail("hasAuthHeader", header != null)
                    .detail("authHeaderFormat", header == null ? "missing" : "invalid"));
            return Uni.createFrom().item(StageResult.reject(NAME, Rejection.of(401, MISSING_CREDENTIALS)));
        }

        final var token = header.substring(BEARER_PREFIX.length()).trim();
        try {
            final var principal = tokenVerifier.verify(token);
            request.authenticate(principal);

            auditLog.record(RequestAudit.draft(
                            AuditEventType.PERMISSION_GRANTED,
                            AuditLevel.INFO,
                            AuditResult.SUCCESS,
                            request,
                            "Authenticated access to " + request.method() + " " + request.path())
                    .detail("tokenType", principal.tokenType()));
            return Uni.createFrom().item(StageResult.proceed());
        } catch (InvalidTokenException e) {
            LOG.debugf("Rejected bearer token for %s %s: %s", request.method(), request.path(), e.getMessage());
            auditLog.record(RequestAudit.draft(
                            AuditEventType.ACCESS_DENIED,
                            AuditLevel.WARN,
                            AuditResult.FAILURE,
                            request,
                            INVALID_CREDENTIALS)
                    .detail("reason", e.getMessage()));
            return Uni.createFrom().item(StageResult.reject(NAME, Rejection.of(401, INVALID_CREDENTIALS)));
        }
    }
}
