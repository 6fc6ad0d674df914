package shipguard.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for bearer token verification.
 *
 * <p>Tokens are HMAC-signed JWTs issued by the identity provider. The secret is
 * shared with the issuer and must be at least 32 bytes.
 */
@ConfigMapping(prefix = "shipguard.auth.jwt")
public interface JwtConfig {

    /**
     * Shared HMAC secret.
     */
    String secret();

    /**
     * Expected issuer claim. Not checked when absent.
     */
    Optional<String> issuer();

    /**
     * Allowed clock skew when validating expiry.
     */
    @WithName("clock-skew")
    @WithDefault("PT30S")
    Duration clockSkew();
}
