package shipguard.core.service.chain.stage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;

import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditResult;
import shipguard.core.model.chain.Rejection;
import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;
import shipguard.core.service.audit.AuditEventLog;
import shipguard.core.service.chain.SecurityStage;

/**
 * Checks the shape of login credentials before they reach the identity provider.
 *
 * <p>Applies to requests that carry a body (POST, PUT, PATCH): email and
 * password are required, the email must look like an address and the password
 * must have at least eight characters.
 */
@ApplicationScoped
public class InputValidationStage implements SecurityStage {

    public static final String NAME = "input-validation";

    static final int MIN_PASSWORD_LENGTH = 8;

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    private final AuditEventLog auditLog;

    @Inject
    public InputValidationStage(AuditEventLog auditLog) {
        this.auditLog = auditLog;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<StageResult> apply(SecurityRequest request) {
        if (!BODY_METHODS.contains(request.method())) {
            return Uni.createFrom().item(StageResult.proceed());
        }

        final var errors = validate(request.body().orElse(null));
        if (errors.isEmpty()) {
            return Uni.createFrom().item(StageResult.proceed());
        }

        auditLog.record(RequestAudit.draft(
                        AuditEventType.SECURITY_VIOLATION,
                        AuditLevel.WARN,
                        AuditResult.FAILURE,
                        request,
                        "Input validation failed")
                .detail("errors", errors));

        final var body = new LinkedHashMap<String, Object>();
        body.put("error", "Validation failed");
        body.put("details", errors);
        return Uni.createFrom().item(StageResult.reject(NAME, new Rejection(400, null, body)));
    }

    List<String> validate(JsonNode body) {
        final var errors = new ArrayList<String>();
        final var email = text(body, "email");
        final var password = text(body, "password");

        if (email == null || email.isBlank()) {
            errors.add("email is required");
        } else if (!EMAIL.matcher(email).matches()) {
            errors.add("email must be a valid email address");
        }

        if (password == null || password.isEmpty()) {
            errors.add("password is required");
        } else if (password.length() < MIN_PASSWORD_LENGTH) {
            errors.add("password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        return errors;
    }

    private static String text(JsonNode body, String field) {
        if (body == null || !body.isObject()) {
            return null;
        }
        final var value = body.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }
}
