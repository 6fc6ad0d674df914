package shipguard.core.model.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Named quota applied to a class of routes.
 *
 * @param name policy name, e.g. {@code login}
 * @param points consumptions allowed per window
 * @param window accounting window
 * @param block how long a key stays blocked once it exceeds its points
 */
public record RateLimitPolicy(String name, int points, Duration window, Duration block) {

    public static final String LOGIN_NAME = "login";
    public static final String API_NAME = "api";
    public static final String STRICT_NAME = "strict";

    public static final RateLimitPolicy LOGIN =
            new RateLimitPolicy(LOGIN_NAME, 5, Duration.ofMinutes(15), Duration.ofMinutes(30));
    public static final RateLimitPolicy API =
            new RateLimitPolicy(API_NAME, 100, Duration.ofSeconds(60), Duration.ofSeconds(60));
    public static final RateLimitPolicy STRICT =
            new RateLimitPolicy(STRICT_NAME, 10, Duration.ofSeconds(60), Duration.ofMinutes(5));

    public RateLimitPolicy {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(block, "block must not be null");
        if (points <= 0) {
            throw new IllegalArgumentException("points must be positive");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (block.isNegative()) {
            throw new IllegalArgumentException("block must not be negative");
        }
    }

    /**
     * Inactivity after which a bucket under this policy may be evicted.
     *
     * @return window plus block duration
     */
    public Duration idleTimeout() {
        return window.plus(block);
    }
}
