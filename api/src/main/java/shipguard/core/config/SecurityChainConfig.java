package shipguard.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the request security chain: route classification, role
 * allow-lists, the admin IP allow-list and the security response headers.
 *
 * <p>Paths are matched by prefix. The first matching class wins in the order
 * excluded, login, admin, public; anything else is protected.
 */
@ConfigMapping(prefix = "shipguard.security")
public interface SecurityChainConfig {

    /**
     * Master toggle. When disabled requests bypass the chain.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Path prefixes that bypass the chain.
     */
    @WithName("excluded-paths")
    @WithDefault("/q/health,/q/metrics")
    List<String> excludedPaths();

    /**
     * Login path prefixes, limited by the login policy.
     */
    @WithName("login-paths")
    @WithDefault("/auth/login")
    List<String> loginPaths();

    /**
     * Administrative path prefixes, limited by the strict policy and restricted to admin roles.
     */
    @WithName("admin-paths")
    @WithDefault("/admin")
    List<String> adminPaths();

    /**
     * Path prefixes served without authentication.
     */
    @WithName("public-paths")
    @WithDefault("/public,/auth/events")
    List<String> publicPaths();

    /**
     * Roles allowed on administrative paths.
     */
    @WithName("admin-roles")
    @WithDefault("admin")
    List<String> adminRoles();

    /**
     * Client IPs allowed on administrative paths. When absent every IP is allowed.
     */
    @WithName("admin-allowed-ips")
    Optional<List<String>> adminAllowedIps();

    /**
     * Role allow-lists for protected path prefixes, as comma separated role names.
     * The longest matching prefix applies.
     */
    @WithName("route-roles")
    Map<String, String> routeRoles();

    /**
     * Upper bound on the time spent in the chain for one request.
     */
    @WithName("chain-timeout")
    @WithDefault("PT5S")
    Duration chainTimeout();

    /**
     * Session id checks on authenticated requests.
     */
    @WithName("session-validation")
    SessionValidationConfig sessionValidation();

    /**
     * Security response headers.
     */
    HeadersConfig headers();

    interface SessionValidationConfig {

        @WithDefault("false")
        boolean enabled();

        /**
         * Request header carrying the session id.
         */
        @WithDefault("X-Session-ID")
        String header();
    }

    interface HeadersConfig {

        @WithName("content-type-options")
        @WithDefault("nosniff")
        String contentTypeOptions();

        @WithName("frame-options")
        @WithDefault("DENY")
        String frameOptions();

        @WithName("xss-protection")
        @WithDefault("1; mode=block")
        String xssProtection();

        @WithName("referrer-policy")
        @WithDefault("strict-origin-when-cross-origin")
        String referrerPolicy();

        @WithName("permissions-policy")
        @WithDefault("geolocation=(), microphone=(), camera=()")
        String permissionsPolicy();

        @WithName("strict-transport-security")
        @WithDefault("max-age=31536000; includeSubDomains; preload")
        String strictTransportSecurity();

        /**
         * Content-Security-Policy value.
         */
        @WithName("content-security-policy")
        @WithDefault("default-src 'self'; script-src 'self' 'unsafe-eval' 'unsafe-inline'; "
                + "style-src 'self' 'unsafe-inline' https://fonts.googleapis.com; "
                + "font-src 'self' https://fonts.gstatic.com; img-src 'self' data: blob:; connect-src 'self'; "
                + "frame-ancestors 'none'; base-uri 'self'; form-action 'self'")
        String contentSecurityPolicy();
    }
}
