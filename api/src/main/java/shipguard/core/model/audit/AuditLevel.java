package shipguard.core.model.audit;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity tier of an audit event, ordered from least to most severe.
 */
public enum AuditLevel {
    INFO,
    WARN,
    ERROR,
    CRITICAL;

    /**
     * Lower-case name used in JSON, CSV and log output.
     *
     * @return the wire name
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAtLeast(AuditLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parse a level from its wire or enum name.
     *
     * @param value the level name, case-insensitive
     * @return the level
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AuditLevel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Audit level must not be blank");
        }
        final var normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return WARN;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown audit level: " + value);
        }
    }
}
