package shipguard.core.model.ratelimit;

/**
 * Result of a consumption attempt.
 *
 * @param allowed whether the consumption succeeded
 * @param policy the policy name
 * @param remaining points left in the window (0 when rejected)
 * @param limit points per window
 * @param retryAfterSeconds seconds until the key may retry (only meaningful when rejected)
 * @param newState state to store for the bucket, null when no state is kept
 */
public record RateLimitDecision(
        boolean allowed, String policy, long remaining, long limit, long retryAfterSeconds, BucketState newState) {

    /**
     * Allowed decision used when rate limiting is disabled.
     *
     * @param policy the policy name
     * @return an allowed decision
     */
    public static RateLimitDecision unlimited(String policy) {
        return new RateLimitDecision(true, policy, Long.MAX_VALUE, Long.MAX_VALUE, 0, null);
    }

    public static RateLimitDecision allowed(String policy, long remaining, long limit, BucketState newState) {
        return new RateLimitDecision(true, policy, remaining, limit, 0, newState);
    }

    public static RateLimitDecision rejected(
            String policy, long limit, long retryAfterSeconds, BucketState newState) {
        return new RateLimitDecision(false, policy, 0, limit, retryAfterSeconds, newState);
    }
}
