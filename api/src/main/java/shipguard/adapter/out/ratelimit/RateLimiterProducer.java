package shipguard.adapter.out.ratelimit;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import shipguard.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import shipguard.core.config.RateLimitingConfig;
import shipguard.core.port.out.RateLimiter;
import shipguard.core.service.ratelimit.RateLimitPolicyRegistry;

/**
 * CDI producer for the rate limiter.
 *
 * <p>Buckets live in process memory. When rate limiting is disabled the limiter
 * still exists but allows every consumption.
 */
@ApplicationScoped
public class RateLimiterProducer {

    private static final Logger LOG = Logger.getLogger(RateLimiterProducer.class);

    private final RateLimitingConfig config;
    private final RateLimitPolicyRegistry policies;
    private final Clock clock;

    @Inject
    public RateLimiterProducer(RateLimitingConfig config, RateLimitPolicyRegistry policies, Clock clock) {
        this.config = config;
        this.policies = policies;
        this.clock = clock;
    }

    /**
     * Produces the rate limiter instance for CDI injection.
     *
     * @return the configured rate limiter
     */
    @Produces
    @ApplicationScoped
    public RateLimiter produceRateLimiter() {
        if (!config.enabled()) {
            LOG.info("Rate limiting is disabled, all consumptions are allowed");
            return new InMemoryRateLimiter(clock, false);
        }

        policies.all().forEach(p -> LOG.infov(
                "Rate limit policy {0}: {1} points per {2}s, block {3}s",
                p.name(), p.points(), p.window().toSeconds(), p.block().toSeconds()));
        return new InMemoryRateLimiter(clock, true);
    }
}
