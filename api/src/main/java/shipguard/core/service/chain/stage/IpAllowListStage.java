package shipguard.core.service.chain.stage;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

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
 * Restricts administrative routes to configured client IPs. Inactive when no
 * IPs are configured.
 */
@ApplicationScoped
public class IpAllowListStage implements SecurityStage {

    public static final String NAME = "ip-allow-list";

    private static final Logger LOG = Logger.getLogger(IpAllowListStage.class);

    private final Set<String> allowedIps;
    private final AuditEventLog auditLog;

    @Inject
    public IpAllowListStage(SecurityChainConfig config, AuditEventLog auditLog) {
        this(config.adminAllowedIps().orElse(List.of()), auditLog);
    }

    public IpAllowListStage(List<String> allowedIps, AuditEventLog auditLog) {
        this.allowedIps = allowedIps.stream()
                .map(String::trim)
                .filter(ip -> !ip.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        this.auditLog = auditLog;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<StageResult> apply(SecurityRequest request) {
        if (allowedIps.isEmpty() || allowedIps.contains(request.clientIp())) {
            return Uni.createFrom().item(StageResult.proceed());
        }

        LOG.warnf("Blocked %s %s from non-allow-listed IP %s", request.method(), request.path(), request.clientIp());
        auditLog.record(RequestAudit.draft(
                        AuditEventType.SECURITY_VIOLATION,
                        AuditLevel.WARN,
                        AuditResult.FAILURE,
                        request,
                        "Access attempt from non-whitelisted IP")
                .detail("clientIp", request.clientIp()));
        return Uni.createFrom().item(StageResult.reject(NAME, Rejection.of(403, "Access denied")));
    }
}
