package shipguard.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;

import shipguard.core.model.ratelimit.BucketState;
import shipguard.core.model.ratelimit.FixedWindowBucketAlgorithm;
import shipguard.core.model.ratelimit.RateLimitDecision;
import shipguard.core.model.ratelimit.RateLimitKey;
import shipguard.core.model.ratelimit.RateLimitPolicy;
import shipguard.core.port.out.RateLimiter;

/**
 * In-memory rate limiter implementation.
 *
 * <p>
 * Stores bucket state in a concurrent hash map keyed by (policy, client).
 * Each consumption runs inside {@link ConcurrentMap#compute}, so the
 * check-then-decrement sequence for one key is serialized while different keys
 * proceed in parallel.
 *
 * <p>
 * State is not shared across instances and is lost on restart. Idle buckets are
 * dropped by {@link #evictIdle(Function)}.
 */
public final class InMemoryRateLimiter implements RateLimiter {

    private final ConcurrentMap<RateLimitKey, BucketState> states;
    private final FixedWindowBucketAlgorithm algorithm;
    private final Clock clock;
    private final boolean enabled;

    /**
     * Creates a new in-memory rate limiter.
     *
     * @param clock   time source
     * @param enabled whether rate limiting is enabled
     */
    public InMemoryRateLimiter(Clock clock, boolean enabled) {
        this.states = new ConcurrentHashMap<>();
        this.algorithm = FixedWindowBucketAlgorithm.getInstance();
        this.clock = clock;
        this.enabled = enabled;
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, RateLimitPolicy policy) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.unlimited(policy.name()));
        }

        final var nowMillis = clock.millis();
        final var result = new RateLimitDecision[1];

        states.compute(key, (k, currentState) -> {
            final var decision = algorithm.checkAndConsume(currentState, policy, nowMillis);
            result[0] = decision;
            return decision.newState();
        });

        return Uni.createFrom().item(result[0]);
    }

    @Override
    public Uni<RateLimitDecision> getStatus(RateLimitKey key, RateLimitPolicy policy) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.unlimited(policy.name()));
        }
        final var status = algorithm.status(states.get(key), policy, clock.millis());
        return Uni.createFrom().item(status);
    }

    @Override
    public Uni<Void> reset(RateLimitKey key) {
        states.remove(key);
        return Uni.createFrom().voidItem();
    }

    @Override
    public int evictIdle(Function<String, RateLimitPolicy> policies) {
        final var nowMillis = clock.millis();
        final var evicted = new AtomicInteger();

        for (var key : states.keySet()) {
            final var policy = policies.apply(key.policy());
            // Recheck inside compute so a concurrent consumption is not lost
            states.computeIfPresent(key, (k, state) -> {
                if (policy == null || algorithm.isEvictable(state, policy, nowMillis)) {
                    evicted.incrementAndGet();
                    return null;
                }
                return state;
            });
        }
        return evicted.get();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Returns the current number of tracked buckets.
     *
     * @return the number of active buckets
     */
    public int getBucketCount() {
        return states.size();
    }

    /**
     * Clears all rate limit state.
     */
    public void clear() {
        states.clear();
    }
}
