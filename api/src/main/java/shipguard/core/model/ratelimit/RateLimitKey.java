package shipguard.core.model.ratelimit;

import java.util.Objects;

/**
 * Identifies one bucket: the same client is tracked independently per policy.
 *
 * @param policy the policy name
 * @param clientKey the partitioning identity, usually the client IP
 */
public record RateLimitKey(String policy, String clientKey) {

    public RateLimitKey {
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(clientKey, "clientKey must not be null");
    }

    public String toCacheKey() {
        return "shipguard:ratelimit:" + policy + ":" + clientKey;
    }
}
