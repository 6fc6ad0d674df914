package shipguard.core.service.chain.stage;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditResult;
import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;
import shipguard.core.service.audit.AuditEventLog;
import shipguard.core.service.chain.SecurityStage;

/**
 * Strips script tags, {@code javascript:} URLs and inline event handlers from
 * every string in the JSON body, in place, and trims the result. A body that is
 * a bare JSON string is replaced. Always continues.
 *
 * <p>This is a best-effort blocklist, not a substitute for output encoding.
 * When markup is actually removed a {@code suspicious_activity} event is recorded.
 */
@ApplicationScoped
public class InputSanitizationStage implements SecurityStage {

    public static final String NAME = "input-sanitization";

    private static final Logger LOG = Logger.getLogger(InputSanitizationStage.class);

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("<script\\b[^<]*(?:(?!</script>)<[^<]*)*</script>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("on\\w+\\s*=", Pattern.CASE_INSENSITIVE));

    private final AuditEventLog auditLog;

    @Inject
    public InputSanitizationStage(AuditEventLog auditLog) {
        this.auditLog = auditLog;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<StageResult> apply(SecurityRequest request) {
        request.body().ifPresent(body -> {
            final var stripped = new ArrayList<String>();
            if (body.isTextual()) {
                final var sanitized = sanitizeText(body.textValue(), "/", stripped);
                if (sanitized != null) {
                    request.replaceBody(TextNode.valueOf(sanitized));
                }
            } else if (sanitizeNode(body, "", stripped)) {
                request.markBodyModified();
            }
            if (!stripped.isEmpty()) {
                LOG.debugf("Removed markup from %s in %s %s", stripped, request.method(), request.path());
                auditLog.record(RequestAudit.draft(
                                AuditEventType.SUSPICIOUS_ACTIVITY,
                                AuditLevel.WARN,
                                AuditResult.FAILURE,
                                request,
                                "Potentially malicious markup removed from request body")
                        .detail("fields", List.copyOf(stripped)));
            }
        });
        return Uni.createFrom().item(StageResult.proceed());
    }

    /**
     * Remove blocklisted markup and surrounding whitespace.
     *
     * @param value the input
     * @return the sanitized value
     */
    public static String sanitize(String value) {
        var result = value;
        for (var pattern : PATTERNS) {
            result = pattern.matcher(result).replaceAll("");
        }
        return result.trim();
    }

    private boolean sanitizeNode(JsonNode node, String pointer, List<String> stripped) {
        var changed = false;
        if (node instanceof ObjectNode object) {
            final var names = new ArrayList<String>();
            object.fieldNames().forEachRemaining(names::add);
            for (var name : names) {
                final var child = object.get(name);
                final var childPointer = pointer + "/" + name;
                if (child.isTextual()) {
                    final var sanitized = sanitizeText(child.textValue(), childPointer, stripped);
                    if (sanitized != null) {
                        object.put(name, sanitized);
                        changed = true;
                    }
                } else {
                    changed |= sanitizeNode(child, childPointer, stripped);
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (var i = 0; i < array.size(); i++) {
                final var child = array.get(i);
                final var childPointer = pointer + "/" + i;
                if (child.isTextual()) {
                    final var sanitized = sanitizeText(child.textValue(), childPointer, stripped);
                    if (sanitized != null) {
                        array.set(i, TextNode.valueOf(sanitized));
                        changed = true;
                    }
                } else {
                    changed |= sanitizeNode(child, childPointer, stripped);
                }
            }
        }
        return changed;
    }

    // Returns the replacement text, or null when the value is unchanged
    private String sanitizeText(String value, String pointer, List<String> stripped) {
        final var sanitized = sanitize(value);
        if (sanitized.equals(value)) {
            return null;
        }
        if (!sanitized.equals(value.trim())) {
            stripped.add(pointer);
        }
        return sanitized;
    }
}
