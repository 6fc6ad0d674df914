package shipguard.core.model.chain;

/**
 * Category of a request path. Selects the chain composition and the rate-limit policy.
 */
public enum RouteClass {
    /** Bypasses the chain entirely (health and metrics endpoints). */
    EXCLUDED,
    /** Headers, sanitization, injection detection and the api policy. */
    PUBLIC,
    /** Public stages with the login policy plus credential-shape validation. */
    LOGIN,
    /** Public stages plus authentication and optional role allow-lists. */
    PROTECTED,
    /** Strict policy, optional IP allow-list, authentication and the admin role. */
    ADMIN
}
