package shipguard.core.port.out;

import shipguard.core.model.auth.AuthenticatedPrincipal;
import shipguard.core.model.auth.InvalidTokenException;

/**
 * Verifies bearer credentials issued by the identity provider.
 */
public interface TokenVerifier {

    /**
     * Verify a bearer token and extract its identity claims.
     *
     * @param token the raw token, without the {@code Bearer } prefix
     * @return the verified principal
     * @throws InvalidTokenException if the token is malformed, has a bad signature or has expired
     */
    AuthenticatedPrincipal verify(String token) throws InvalidTokenException;
}
