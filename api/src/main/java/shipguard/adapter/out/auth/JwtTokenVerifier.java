package shipguard.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;

import shipguard.core.config.JwtConfig;
import shipguard.core.model.auth.AuthenticatedPrincipal;
import shipguard.core.model.auth.InvalidTokenException;
import shipguard.core.port.out.TokenVerifier;

/**
 * Verifies HS256-signed bearer tokens with a shared secret.
 *
 * <p>Expected claims: {@code sub} (or {@code id}) for the user id,
 * {@code role}, and optionally {@code email} and {@code type}. An expiration
 * time is required.
 */
@ApplicationScoped
public class JwtTokenVerifier implements TokenVerifier {

    private static final Logger LOG = Logger.getLogger(JwtTokenVerifier.class);

    static final int MIN_SECRET_BYTES = 32;
    private static final String DEFAULT_TOKEN_TYPE = "access";

    private final HmacKey key;
    private final String issuer;
    private final Duration clockSkew;
    private final Clock clock;

    @Inject
    public JwtTokenVerifier(JwtConfig config, Clock clock) {
        this(config.secret(), config.issuer().orElse(null), config.clockSkew(), clock);
    }

    public JwtTokenVerifier(String secret, String issuer, Duration clockSkew, Clock clock) {
        final var secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = new HmacKey(secretBytes);
        this.issuer = issuer;
        this.clockSkew = clockSkew;
        this.clock = clock;
    }

    @Override
    public AuthenticatedPrincipal verify(String token) throws InvalidTokenException {
        final var builder = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds((int) clockSkew.toSeconds())
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .setSkipDefaultAudienceValidation()
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
                .setVerificationKey(key);
        if (issuer != null) {
            builder.setExpectedIssuer(issuer);
        }

        final JwtClaims claims;
        try {
            claims = builder.build().processToClaims(token);
        } catch (InvalidJwtException e) {
            LOG.debugv("JWT validation failed: {0}", e.getMessage());
            throw new InvalidTokenException(summarize(e), e);
        }
        return toPrincipal(claims);
    }

    private AuthenticatedPrincipal toPrincipal(JwtClaims claims) throws InvalidTokenException {
        try {
            var userId = claims.getSubject();
            if (userId == null) {
                userId = claims.getClaimValueAsString("id");
            }
            final var role = claims.getStringClaimValue("role");
            if (userId == null || role == null) {
                throw new InvalidTokenException("Token is missing identity claims");
            }
            final var type = claims.getStringClaimValue("type");
            return new AuthenticatedPrincipal(
                    userId, claims.getStringClaimValue("email"), role, type != null ? type : DEFAULT_TOKEN_TYPE);
        } catch (MalformedClaimException e) {
            throw new InvalidTokenException("Malformed claims: " + e.getMessage(), e);
        }
    }

    private static String summarize(InvalidJwtException e) {
        if (e.hasExpired()) {
            return "Token has expired";
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID) || e.hasErrorCode(ErrorCodes.ISSUER_MISSING)) {
            return "Invalid token issuer";
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return "Invalid token signature";
        }
        return "Token validation failed";
    }
}
