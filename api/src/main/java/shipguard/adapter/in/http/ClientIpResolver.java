package shipguard.adapter.in.http;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Resolves the client IP from proxy headers.
 *
 * <p>Priority: RFC 7239 {@code Forwarded}, then the first {@code X-Forwarded-For}
 * entry, then {@code X-Real-IP}. Requests carrying none of them resolve to
 * {@code unknown}.
 */
public final class ClientIpResolver {

    public static final String UNKNOWN = "unknown";

    private ClientIpResolver() {}

    /**
     * Resolve the client IP.
     *
     * @param headers header lookup, returning null for absent headers
     * @return the client IP, or {@link #UNKNOWN}
     */
    public static String resolve(UnaryOperator<String> headers) {
        final var forwarded = headers.apply("Forwarded");
        if (forwarded != null) {
            final var ip = parseForwardedFor(forwarded);
            if (ip != null && !ip.isBlank()) {
                return ip;
            }
        }

        final var xForwardedFor = headers.apply("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }

        final var realIp = headers.apply("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return UNKNOWN;
    }

    /**
     * Parse the client IP from an RFC 7239 Forwarded header.
     *
     * @param forwarded the header value
     * @return the client IP, or null if no {@code for} parameter is present
     */
    static String parseForwardedFor(String forwarded) {
        // First entry is the one closest to the client
        final var firstEntry = forwarded.split(",")[0].trim();

        for (final var part : firstEntry.split(";")) {
            final var trimmed = part.trim();
            if (!trimmed.toLowerCase(Locale.ROOT).startsWith("for=")) {
                continue;
            }
            var value = trimmed.substring(4);
            if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                value = value.substring(1, value.length() - 1);
            }
            // IPv6 in brackets, optional port after the bracket
            if (value.startsWith("[")) {
                final var bracketEnd = value.indexOf(']');
                if (bracketEnd > 0) {
                    return value.substring(1, bracketEnd);
                }
            }
            // IPv4 with port
            final var colonCount = value.length() - value.replace(":", "").length();
            if (colonCount == 1) {
                value = value.substring(0, value.indexOf(':'));
            }
            return value;
        }
        return null;
    }
}
