package shipguard.core.model.ratelimit;

/**
 * Fixed-window token bucket with blocking.
 *
 * <p>Each (policy, key) bucket starts with the policy's points. Every consumption
 * takes one point. When a window elapses the bucket refills. A consumption that
 * finds the bucket empty blocks the key for the policy's block duration; while
 * blocked every attempt is rejected, even across window boundaries. When the
 * block ends the key starts a fresh window with full points.
 */
public final class FixedWindowBucketAlgorithm {

    private static final FixedWindowBucketAlgorithm INSTANCE = new FixedWindowBucketAlgorithm();

    private FixedWindowBucketAlgorithm() {}

    public static FixedWindowBucketAlgorithm getInstance() {
        return INSTANCE;
    }

    /**
     * Attempt to take one point from the bucket.
     *
     * @param currentState the stored state, or null for a new key
     * @param policy the policy
     * @param nowMillis current time (epoch millis)
     * @return the decision carrying the state to store
     */
    public RateLimitDecision checkAndConsume(BucketState currentState, RateLimitPolicy policy, long nowMillis) {
        var state = currentState != null ? currentState : BucketState.initial(policy.points(), nowMillis);

        if (state.isBlockedAt(nowMillis)) {
            final var retryAfter = secondsUntil(state.blockedUntilMillis(), nowMillis);
            return RateLimitDecision.rejected(policy.name(), policy.points(), retryAfter, state.touch(nowMillis));
        }

        if (state.blockedUntilMillis() > 0 || windowElapsed(state, policy, nowMillis)) {
            state = BucketState.initial(policy.points(), nowMillis);
        }

        if (state.remainingPoints() > 0) {
            final var consumed = state.consume(nowMillis);
            return RateLimitDecision.allowed(policy.name(), consumed.remainingPoints(), policy.points(), consumed);
        }

        final var blockMillis = policy.block().toMillis();
        if (blockMillis <= 0) {
            // No block configured: the key waits for the window to end
            final var windowEnd = state.windowStartMillis() + policy.window().toMillis();
            return RateLimitDecision.rejected(
                    policy.name(), policy.points(), secondsUntil(windowEnd, nowMillis), state.touch(nowMillis));
        }
        final var blocked = state.blockUntil(nowMillis + blockMillis, nowMillis);
        return RateLimitDecision.rejected(policy.name(), policy.points(), policy.block().toSeconds(), blocked);
    }

    /**
     * Describe the bucket without consuming.
     *
     * @param currentState the stored state, or null for a new key
     * @param policy the policy
     * @param nowMillis current time (epoch millis)
     * @return the status; rejected when the key is blocked
     */
    public RateLimitDecision status(BucketState currentState, RateLimitPolicy policy, long nowMillis) {
        if (currentState == null) {
            return RateLimitDecision.allowed(policy.name(), policy.points(), policy.points(), null);
        }
        if (currentState.isBlockedAt(nowMillis)) {
            final var retryAfter = secondsUntil(currentState.blockedUntilMillis(), nowMillis);
            return RateLimitDecision.rejected(policy.name(), policy.points(), retryAfter, currentState);
        }
        if (currentState.blockedUntilMillis() > 0 || windowElapsed(currentState, policy, nowMillis)) {
            return RateLimitDecision.allowed(policy.name(), policy.points(), policy.points(), currentState);
        }
        return RateLimitDecision.allowed(
                policy.name(), currentState.remainingPoints(), policy.points(), currentState);
    }

    /**
     * Whether a bucket has been idle long enough to be dropped.
     *
     * @param state the stored state
     * @param policy the policy
     * @param nowMillis current time (epoch millis)
     * @return true if evictable
     */
    public boolean isEvictable(BucketState state, RateLimitPolicy policy, long nowMillis) {
        if (state.isBlockedAt(nowMillis)) {
            return false;
        }
        return nowMillis - state.lastSeenMillis() >= policy.idleTimeout().toMillis();
    }

    private boolean windowElapsed(BucketState state, RateLimitPolicy policy, long nowMillis) {
        return nowMillis - state.windowStartMillis() >= policy.window().toMillis();
    }

    private long secondsUntil(long targetMillis, long nowMillis) {
        final var millis = targetMillis - nowMillis;
        return Math.max(1, (millis + 999) / 1000);
    }
}
