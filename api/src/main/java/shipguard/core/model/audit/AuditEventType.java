package shipguard.core.model.audit;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Catalogue of security-relevant occurrences recognized by the audit log.
 *
 * <p>Events are stored with their type as a string so that producers can record
 * occurrences outside this catalogue. Such events are kept, with the default
 * risk score.
 */
public enum AuditEventType {
    LOGIN_SUCCESS,
    LOGIN_FAILED,
    LOGOUT,
    TOKEN_REFRESH,
    MFA_CHALLENGE,
    MFA_FAILED,
    PASSWORD_CHANGE,
    PASSWORD_RESET,
    ACCOUNT_LOCKED,
    PERMISSION_GRANTED,
    ACCESS_DENIED,
    SESSION_INVALIDATED,
    DATA_ACCESS,
    DATA_MODIFICATION,
    DATA_EXPORT,
    DATA_DELETION,
    CONFIGURATION_CHANGE,
    RATE_LIMIT_EXCEEDED,
    SUSPICIOUS_ACTIVITY,
    SECURITY_VIOLATION;

    private static final Map<String, AuditEventType> BY_WIRE_NAME =
            Arrays.stream(values())
                    .collect(Collectors.toUnmodifiableMap(AuditEventType::wireName, Function.identity()));

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Look up a catalogue entry by its wire name.
     *
     * @param wireName the event type string, e.g. {@code login_failed}
     * @return the matching type, or empty when the string is not catalogued
     */
    public static Optional<AuditEventType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Canonical form of an event type string: the catalogue wire name when the
     * string resolves to a catalogued type, otherwise the string unchanged.
     *
     * @param eventType the event type string
     * @return the canonical event type string
     */
    public static String canonical(String eventType) {
        return fromWireName(eventType).map(AuditEventType::wireName).orElse(eventType);
    }
}
