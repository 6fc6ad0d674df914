package shipguard.core.model.audit;

import java.util.EnumMap;
import java.util.Map;

/**
 * Static event type to risk score table.
 *
 * <p>This table is the only place risk scores are defined. The audit log stamps
 * every event from it and the anomaly rules compare against the same values.
 * Scores range from 1 (routine) to 10 (critical).
 */
public final class RiskScores {

    public static final int DEFAULT_SCORE = 1;
    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 10;

    private static final Map<AuditEventType, Integer> SCORES = new EnumMap<>(AuditEventType.class);

    static {
        SCORES.put(AuditEventType.LOGIN_SUCCESS, 1);
        SCORES.put(AuditEventType.LOGIN_FAILED, 4);
        SCORES.put(AuditEventType.LOGOUT, 1);
        SCORES.put(AuditEventType.TOKEN_REFRESH, 1);
        SCORES.put(AuditEventType.MFA_CHALLENGE, 2);
        SCORES.put(AuditEventType.MFA_FAILED, 5);
        SCORES.put(AuditEventType.PASSWORD_CHANGE, 3);
        SCORES.put(AuditEventType.PASSWORD_RESET, 4);
        SCORES.put(AuditEventType.ACCOUNT_LOCKED, 7);
        SCORES.put(AuditEventType.PERMISSION_GRANTED, 1);
        SCORES.put(AuditEventType.ACCESS_DENIED, 5);
        SCORES.put(AuditEventType.SESSION_INVALIDATED, 2);
        SCORES.put(AuditEventType.DATA_ACCESS, 2);
        SCORES.put(AuditEventType.DATA_MODIFICATION, 3);
        SCORES.put(AuditEventType.DATA_EXPORT, 6);
        SCORES.put(AuditEventType.DATA_DELETION, 6);
        SCORES.put(AuditEventType.CONFIGURATION_CHANGE, 5);
        SCORES.put(AuditEventType.RATE_LIMIT_EXCEEDED, 6);
        SCORES.put(AuditEventType.SUSPICIOUS_ACTIVITY, 8);
        SCORES.put(AuditEventType.SECURITY_VIOLATION, 9);
    }

    private RiskScores() {}

    public static int scoreOf(AuditEventType type) {
        return SCORES.getOrDefault(type, DEFAULT_SCORE);
    }

    /**
     * Score an event type string. Uncatalogued types score {@link #DEFAULT_SCORE}.
     *
     * @param eventType the event type string
     * @return the risk score
     */
    public static int scoreOf(String eventType) {
        return AuditEventType.fromWireName(eventType).map(RiskScores::scoreOf).orElse(DEFAULT_SCORE);
    }
}
