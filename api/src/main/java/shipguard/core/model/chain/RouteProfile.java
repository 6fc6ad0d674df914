package shipguard.core.model.chain;

import java.util.Objects;
import java.util.Set;

/**
 * Resolved security requirements for one request path.
 *
 * @param routeClass the route class
 * @param ratePolicy name of the rate-limit policy
 * @param allowedRoles roles allowed on the route, empty when any authenticated role is accepted
 */
public record RouteProfile(RouteClass routeClass, String ratePolicy, Set<String> allowedRoles) {

    public RouteProfile {
        Objects.requireNonNull(routeClass, "routeClass must not be null");
        Objects.requireNonNull(ratePolicy, "ratePolicy must not be null");
        allowedRoles = allowedRoles == null ? Set.of() : Set.copyOf(allowedRoles);
    }

    public boolean requiresAuthentication() {
        return routeClass == RouteClass.PROTECTED || routeClass == RouteClass.ADMIN;
    }
}
