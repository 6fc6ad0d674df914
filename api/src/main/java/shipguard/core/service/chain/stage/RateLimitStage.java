package shipguard.core.service.chain.stage;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import shipguard.core.model.chain.Rejection;
import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;
import shipguard.core.model.ratelimit.RateLimitContext;
import shipguard.core.model.ratelimit.RateLimitDecision;
import shipguard.core.model.ratelimit.RateLimitPolicy;
import shipguard.core.service.chain.SecurityStage;
import shipguard.core.service.ratelimit.RateLimitService;

/**
 * Consumes one point of the route's policy, keyed by client IP. Answers 429
 * with {@code Retry-After} once the bucket is exhausted or blocked.
 */
@ApplicationScoped
public class RateLimitStage implements SecurityStage {

    public static final String NAME = "rate-limit";

    private static final Map<String, String> MESSAGES = Map.of(
            RateLimitPolicy.LOGIN_NAME, "Too many login attempts. Please try again later.",
            RateLimitPolicy.API_NAME, "API rate limit exceeded. Please slow down.",
            RateLimitPolicy.STRICT_NAME, "Strict rate limit exceeded. Please wait before retrying.");

    private static final String DEFAULT_MESSAGE = "Too many requests. Please try again later.";

    private final RateLimitService rateLimitService;

    @Inject
    public RateLimitStage(RateLimitService rateLimitService) {
        this.rateLimitService = rateLimitService;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<StageResult> apply(SecurityRequest request) {
        final var policy = request.routeProfile() != null
                ? request.routeProfile().ratePolicy()
                : RateLimitPolicy.API_NAME;
        final var context =
                new RateLimitContext(request.origin(), request.method(), request.path(), request.correlationId());

        return rateLimitService
                .consume(policy, request.clientIp(), context)
                .map(decision -> decision.allowed() ? StageResult.proceed() : reject(decision));
    }

    private StageResult reject(RateLimitDecision decision) {
        final var retryAfter = decision.retryAfterSeconds();
        final var body = new LinkedHashMap<String, Object>();
        body.put("error", MESSAGES.getOrDefault(decision.policy(), DEFAULT_MESSAGE));
        body.put("retryAfter", retryAfter);

        final var headers = Map.of(
                "Retry-After", Long.toString(retryAfter),
                "X-RateLimit-Limit", Long.toString(decision.limit()),
                "X-RateLimit-Remaining", "0");
        return StageResult.reject(NAME, new Rejection(429, headers, body));
    }
}
