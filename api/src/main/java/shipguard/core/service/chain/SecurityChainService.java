package shipguard.core.service.chain;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shipguard.core.config.SecurityChainConfig;
import shipguard.core.model.chain.RouteClass;
import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;
import shipguard.core.port.out.SecurityMetrics;
import shipguard.core.service.chain.stage.AuthenticationStage;
import shipguard.core.service.chain.stage.InjectionDetectionStage;
import shipguard.core.service.chain.stage.InputSanitizationStage;
import shipguard.core.service.chain.stage.InputValidationStage;
import shipguard.core.service.chain.stage.IpAllowListStage;
import shipguard.core.service.chain.stage.RateLimitStage;
import shipguard.core.service.chain.stage.RoleAuthorizationStage;
import shipguard.core.service.chain.stage.SecurityHeadersStage;
import shipguard.core.service.chain.stage.SessionValidationStage;

/**
 * Entry point of the request security chain.
 *
 * <p>Every route class has a fixed stage list. All classes start with
 * headers, sanitization, injection detection and rate limiting; login routes
 * add credential validation, protected routes add authentication, session id
 * and role checks, and admin routes put the IP allow-list in front of those. Excluded
 * routes skip the chain.
 */
@ApplicationScoped
public class SecurityChainService {

    private static final Logger LOG = Logger.getLogger(SecurityChainService.class);

    private final RouteClassifier classifier;
    private final Map<RouteClass, SecurityChain> chains;
    private final boolean enabled;

    @Inject
    public SecurityChainService(
            SecurityChainConfig config,
            RouteClassifier classifier,
            SecurityMetrics metrics,
            SecurityHeadersStage headers,
            InputSanitizationStage sanitization,
            InjectionDetectionStage injection,
            RateLimitStage rateLimit,
            InputValidationStage validation,
            IpAllowListStage ipAllowList,
            AuthenticationStage authentication,
            SessionValidationStage session,
            RoleAuthorizationStage roles) {
        this(
                config.enabled(),
                classifier,
                buildChains(
                        metrics,
                        headers,
                        sanitization,
                        injection,
                        rateLimit,
                        validation,
                        ipAllowList,
                        authentication,
                        session,
                        roles));
    }

    public SecurityChainService(boolean enabled, RouteClassifier classifier, Map<RouteClass, SecurityChain> chains) {
        this.enabled = enabled;
        this.classifier = classifier;
        this.chains = new EnumMap<>(chains);
        if (enabled) {
            this.chains.forEach((routeClass, chain) ->
                    LOG.debugf("Security chain for %s routes: %s", routeClass, chain.stageNames()));
        } else {
            LOG.warn("Security chain is disabled; requests are not checked");
        }
    }

    /**
     * Build the per-class stage lists.
     */
    public static Map<RouteClass, SecurityChain> buildChains(
            SecurityMetrics metrics,
            SecurityStage headers,
            SecurityStage sanitization,
            SecurityStage injection,
            SecurityStage rateLimit,
            SecurityStage validation,
            SecurityStage ipAllowList,
            SecurityStage authentication,
            SecurityStage session,
            SecurityStage roles) {
        final var chains = new EnumMap<RouteClass, SecurityChain>(RouteClass.class);
        chains.put(RouteClass.PUBLIC, new SecurityChain(List.of(headers, sanitization, injection, rateLimit), metrics));
        chains.put(
                RouteClass.LOGIN,
                new SecurityChain(List.of(headers, sanitization, injection, rateLimit, validation), metrics));
        chains.put(
                RouteClass.PROTECTED,
                new SecurityChain(
                        List.of(headers, sanitization, injection, rateLimit, authentication, session, roles),
                        metrics));
        chains.put(
                RouteClass.ADMIN,
                new SecurityChain(
                        List.of(
                                headers,
                                sanitization,
                                injection,
                                rateLimit,
                                ipAllowList,
                                authentication,
                                session,
                                roles),
                        metrics));
        return chains;
    }

    /**
     * Classify the request and run its chain.
     *
     * @param request the request; its route profile is set as a side effect
     * @return continue, or the short-circuit of the stage that stopped the request
     */
    public Uni<StageResult> process(SecurityRequest request) {
        if (!enabled) {
            return Uni.createFrom().item(StageResult.proceed());
        }
        final var profile = classifier.classify(request.path());
        request.routeProfile(profile);

        final var chain = chains.get(profile.routeClass());
        if (chain == null) {
            return Uni.createFrom().item(StageResult.proceed());
        }
        return chain.execute(request);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<String> stageNames(RouteClass routeClass) {
        final var chain = chains.get(routeClass);
        return chain == null ? List.of() : chain.stageNames();
    }
}
