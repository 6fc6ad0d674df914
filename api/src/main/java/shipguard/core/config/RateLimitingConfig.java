package shipguard.core.config;

import java.time.Duration;
import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for token-bucket rate limiting.
 *
 * <p>Policies are declared per name. Names that are not configured fall back to
 * the built-in login, api and strict policies.
 *
 * <p>Example configuration:
 * <pre>{@code
 * shipguard.rate-limiting.policies.login.points=5
 * shipguard.rate-limiting.policies.login.window=PT15M
 * shipguard.rate-limiting.policies.login.block=PT30M
 * }</pre>
 */
@ConfigMapping(prefix = "shipguard.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Master toggle. When disabled every consumption is allowed.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * How often idle buckets are evicted. Read by the scheduler as
     * {@code shipguard.rate-limiting.eviction-interval}.
     */
    @WithName("eviction-interval")
    @WithDefault("5m")
    String evictionInterval();

    /**
     * Policies keyed by name.
     */
    Map<String, PolicyConfig> policies();

    /**
     * Parameters of one named policy.
     */
    interface PolicyConfig {

        /**
         * Consumptions allowed per window.
         */
        int points();

        /**
         * Accounting window.
         */
        Duration window();

        /**
         * Block duration applied once the points are exhausted.
         */
        @WithDefault("PT0S")
        Duration block();
    }
}
