package shipguard.core.port.out;

import java.util.function.Function;

import io.smallrye.mutiny.Uni;

import shipguard.core.model.ratelimit.RateLimitDecision;
import shipguard.core.model.ratelimit.RateLimitKey;
import shipguard.core.model.ratelimit.RateLimitPolicy;

/**
 * Port interface for token-bucket state storage and decisions.
 *
 * <p>Consumption on one key is atomic: concurrent callers never observe or
 * lose each other's decrements.
 */
public interface RateLimiter {

    /**
     * Take one point from the bucket identified by {@code key}.
     *
     * @param key the (policy, client) key
     * @param policy the policy to apply
     * @return the decision
     */
    Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, RateLimitPolicy policy);

    /**
     * Describe the bucket without consuming.
     *
     * @param key the key
     * @param policy the policy to apply
     * @return the current status
     */
    Uni<RateLimitDecision> getStatus(RateLimitKey key, RateLimitPolicy policy);

    /**
     * Drop the bucket for a key, lifting any block.
     *
     * @param key the key
     * @return completion signal
     */
    Uni<Void> reset(RateLimitKey key);

    /**
     * Remove buckets idle for longer than their policy's window plus block.
     *
     * @param policies resolves a policy by name
     * @return number of buckets removed
     */
    int evictIdle(Function<String, RateLimitPolicy> policies);

    boolean isEnabled();
}
