package shipguard.core.model.audit;

/**
 * Network origin of the request that produced an audit event.
 *
 * @param ipAddress the resolved client IP
 * @param userAgent the User-Agent header value
 */
public record NetworkOrigin(String ipAddress, String userAgent) {

    public static NetworkOrigin ofIp(String ipAddress) {
        return new NetworkOrigin(ipAddress, null);
    }
}
