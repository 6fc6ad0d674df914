package shipguard.core.service.chain.stage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import shipguard.core.config.SecurityChainConfig;
import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;
import shipguard.core.service.chain.SecurityStage;

/**
 * Adds the standard security response headers. Always continues.
 */
@ApplicationScoped
public class SecurityHeadersStage implements SecurityStage {

    public static final String NAME = "security-headers";

    private final SecurityChainConfig.HeadersConfig headers;

    @Inject
    public SecurityHeadersStage(SecurityChainConfig config) {
        this(config.headers());
    }

    public SecurityHeadersStage(SecurityChainConfig.HeadersConfig headers) {
        this.headers = headers;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<StageResult> apply(SecurityRequest request) {
        request.addResponseHeader("X-Content-Type-Options", headers.contentTypeOptions());
        request.addResponseHeader("X-Frame-Options", headers.frameOptions());
        request.addResponseHeader("X-XSS-Protection", headers.xssProtection());
        request.addResponseHeader("Referrer-Policy", headers.referrerPolicy());
        request.addResponseHeader("Permissions-Policy", headers.permissionsPolicy());
        request.addResponseHeader("Strict-Transport-Security", headers.strictTransportSecurity());
        request.addResponseHeader("Content-Security-Policy", headers.contentSecurityPolicy());
        return Uni.createFrom().item(StageResult.proceed());
    }
}
