package shipguard.core.model.ratelimit;

import shipguard.core.model.audit.NetworkOrigin;

/**
 * Request context attached to the audit event written on a rejection.
 *
 * @param origin network origin, may be null
 * @param method HTTP method, may be null
 * @param path request path, may be null
 * @param correlationId request correlation id, may be null
 */
public record RateLimitContext(NetworkOrigin origin, String method, String path, String correlationId) {

    public static RateLimitContext none() {
        return new RateLimitContext(null, null, null, null);
    }
}
