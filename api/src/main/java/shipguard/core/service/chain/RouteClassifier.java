package shipguard.core.service.chain;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import shipguard.core.config.SecurityChainConfig;
import shipguard.core.model.chain.RouteClass;
import shipguard.core.model.chain.RouteProfile;
import shipguard.core.model.ratelimit.RateLimitPolicy;

/**
 * Maps request paths to route classes by prefix.
 *
 * <p>Classes are tried in the order excluded, login, admin, public. A path
 * that matches none of them is protected. A prefix matches the path itself and
 * anything below it, so {@code /admin} covers {@code /admin/audit} but not
 * {@code /administrator}.
 */
@ApplicationScoped
public class RouteClassifier {

    private final List<String> excludedPaths;
    private final List<String> loginPaths;
    private final List<String> adminPaths;
    private final List<String> publicPaths;
    private final Set<String> adminRoles;
    private final Map<String, Set<String>> routeRoles;

    @Inject
    public RouteClassifier(SecurityChainConfig config) {
        this(
                config.excludedPaths(),
                config.loginPaths(),
                config.adminPaths(),
                config.publicPaths(),
                Set.copyOf(config.adminRoles()),
                parseRoles(config.routeRoles()));
    }

    public RouteClassifier(
            List<String> excludedPaths,
            List<String> loginPaths,
            List<String> adminPaths,
            List<String> publicPaths,
            Set<String> adminRoles,
            Map<String, Set<String>> routeRoles) {
        this.excludedPaths = List.copyOf(excludedPaths);
        this.loginPaths = List.copyOf(loginPaths);
        this.adminPaths = List.copyOf(adminPaths);
        this.publicPaths = List.copyOf(publicPaths);
        this.adminRoles = Set.copyOf(adminRoles);
        this.routeRoles = Map.copyOf(routeRoles);
    }

    /**
     * Resolve the route profile of a path.
     *
     * @param rawPath the request path
     * @return the profile
     */
    public RouteProfile classify(String rawPath) {
        final var path = normalize(rawPath);

        if (matchesAny(path, excludedPaths)) {
            return new RouteProfile(RouteClass.EXCLUDED, RateLimitPolicy.API_NAME, Set.of());
        }
        if (matchesAny(path, loginPaths)) {
            return new RouteProfile(RouteClass.LOGIN, RateLimitPolicy.LOGIN_NAME, Set.of());
        }
        if (matchesAny(path, adminPaths)) {
            return new RouteProfile(RouteClass.ADMIN, RateLimitPolicy.STRICT_NAME, adminRoles);
        }
        if (matchesAny(path, publicPaths)) {
            return new RouteProfile(RouteClass.PUBLIC, RateLimitPolicy.API_NAME, Set.of());
        }
        return new RouteProfile(RouteClass.PROTECTED, RateLimitPolicy.API_NAME, rolesFor(path));
    }

    private Set<String> rolesFor(String path) {
        String bestPrefix = null;
        for (var prefix : routeRoles.keySet()) {
            if (matches(path, normalize(prefix)) && (bestPrefix == null || prefix.length() > bestPrefix.length())) {
                bestPrefix = prefix;
            }
        }
        return bestPrefix == null ? Set.of() : routeRoles.get(bestPrefix);
    }

    private static boolean matchesAny(String path, List<String> prefixes) {
        for (var prefix : prefixes) {
            if (matches(path, normalize(prefix))) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(String path, String prefix) {
        if ("/".equals(prefix)) {
            return true;
        }
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }

    private static String normalize(String path) {
        if (path == null || path.isBlank()) {
            return "/";
        }
        var normalized = path.trim();
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    static Map<String, Set<String>> parseRoles(Map<String, String> raw) {
        return raw.entrySet().stream()
                .collect(Collectors.toMap(
                        e -> e.getKey().startsWith("/") ? e.getKey() : "/" + e.getKey(),
                        e -> Arrays.stream(e.getValue().split(","))
                                .map(String::trim)
                                .filter(role -> !role.isEmpty())
                                .collect(Collectors.toCollection(LinkedHashSet::new))));
    }
}
