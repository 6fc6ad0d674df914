package shipguard.core.model.auth;

import java.util.Objects;

import shipguard.core.model.audit.UserIdentity;

/**
 * Verified identity claims for the current request.
 *
 * @param userId subject of the credential
 * @param email email claim, may be null
 * @param role role claim
 * @param tokenType credential type claim, e.g. {@code access}
 */
public record AuthenticatedPrincipal(String userId, String email, String role, String tokenType) {

    public AuthenticatedPrincipal {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(role, "role must not be null");
    }

    public UserIdentity toIdentity() {
        return new UserIdentity(userId, email, role);
    }
}
