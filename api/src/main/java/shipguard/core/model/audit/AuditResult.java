package shipguard.core.model.audit;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of the operation an audit event describes.
 */
public enum AuditResult {
    SUCCESS,
    FAILURE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
