package shipguard.core.service.ratelimit;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import shipguard.core.config.RateLimitingConfig;
import shipguard.core.model.ratelimit.RateLimitPolicy;

/**
 * Resolves rate-limit policies by name.
 *
 * <p>Configured policies override the built-in {@code login}, {@code api} and
 * {@code strict} policies of the same name.
 */
@ApplicationScoped
public class RateLimitPolicyRegistry {

    private static final Logger LOG = Logger.getLogger(RateLimitPolicyRegistry.class);

    private final Map<String, RateLimitPolicy> policies;

    @Inject
    public RateLimitPolicyRegistry(RateLimitingConfig config) {
        this(fromConfig(config));
    }

    public RateLimitPolicyRegistry(Map<String, RateLimitPolicy> overrides) {
        final var merged = new LinkedHashMap<String, RateLimitPolicy>();
        merged.put(RateLimitPolicy.LOGIN_NAME, RateLimitPolicy.LOGIN);
        merged.put(RateLimitPolicy.API_NAME, RateLimitPolicy.API);
        merged.put(RateLimitPolicy.STRICT_NAME, RateLimitPolicy.STRICT);
        merged.putAll(overrides);
        this.policies = Collections.unmodifiableMap(merged);

        policies.values().forEach(p -> LOG.debugf(
                "Rate limit policy %s: %d points per %s, block %s", p.name(), p.points(), p.window(), p.block()));
    }

    public static RateLimitPolicyRegistry defaults() {
        return new RateLimitPolicyRegistry(Map.of());
    }

    private static Map<String, RateLimitPolicy> fromConfig(RateLimitingConfig config) {
        final var result = new LinkedHashMap<String, RateLimitPolicy>();
        config.policies().forEach((name, policy) ->
                result.put(name, new RateLimitPolicy(name, policy.points(), policy.window(), policy.block())));
        return result;
    }

    public Optional<RateLimitPolicy> find(String name) {
        return Optional.ofNullable(policies.get(name));
    }

    /**
     * Resolve a policy by name.
     *
     * @param name the policy name
     * @return the policy
     * @throws IllegalArgumentException if no such policy exists
     */
    public RateLimitPolicy resolve(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown rate limit policy: " + name));
    }

    public Collection<RateLimitPolicy> all() {
        return policies.values();
    }
}
