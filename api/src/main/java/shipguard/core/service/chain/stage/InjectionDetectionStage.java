package shipguard.core.service.chain.stage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditResult;
import shipguard.core.model.chain.Rejection;
import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;
import shipguard.core.service.audit.AuditEventLog;
import shipguard.core.service.chain.SecurityStage;

/**
 * Rejects requests whose query parameters or JSON body strings match SQL
 * keyword or operator patterns.
 *
 * <p>The patterns are a coarse heuristic: they also match harmless text such as
 * apostrophes or the word "and". They complement parameterized queries at the
 * data layer and do not replace them.
 */
@ApplicationScoped
public class InjectionDetectionStage implements SecurityStage {

    public static final String NAME = "injection-detection";

    static final String QUERY_ERROR = "Invalid request parameters";
    static final String BODY_ERROR = "Invalid request data";

    private static final Logger LOG = Logger.getLogger(InjectionDetectionStage.class);

    private static final int MAX_PAYLOAD_LENGTH = 200;

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile(
                    "\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|EXEC|UNION|SCRIPT)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("('|\"|;|--|\\*|\\||&)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bOR\\b|\\bAND\\b", Pattern.CASE_INSENSITIVE));

    private final AuditEventLog auditLog;

    @Inject
    public InjectionDetectionStage(AuditEventLog auditLog) {
        this.auditLog = auditLog;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<StageResult> apply(SecurityRequest request) {
        final var queryMatch = scanQuery(request.queryParams());
        if (queryMatch.isPresent()) {
            return Uni.createFrom().item(reject(request, "query", queryMatch.get(), QUERY_ERROR));
        }

        final var bodyMatch = request.body().flatMap(body -> scanBody(body, ""));
        if (bodyMatch.isPresent()) {
            return Uni.createFrom().item(reject(request, "body", bodyMatch.get(), BODY_ERROR));
        }

        return Uni.createFrom().item(StageResult.proceed());
    }

    /**
     * Check a single value against the patterns.
     *
     * @param value the value
     * @return the first matching pattern
     */
    public static Optional<Pattern> firstMatch(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        return PATTERNS.stream().filter(p -> p.matcher(value).find()).findFirst();
    }

    private Optional<Match> scanQuery(Map<String, List<String>> params) {
        for (var entry : params.entrySet()) {
            for (var value : entry.getValue()) {
                final var pattern = firstMatch(value);
                if (pattern.isPresent()) {
                    return Optional.of(new Match(entry.getKey(), value, pattern.get()));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Match> scanBody(JsonNode node, String pointer) {
        if (node.isTextual()) {
            final var field = pointer.isEmpty() ? "/" : pointer;
            return firstMatch(node.textValue()).map(p -> new Match(field, node.textValue(), p));
        }
        if (node.isObject()) {
            final var names = new ArrayList<String>();
            node.fieldNames().forEachRemaining(names::add);
            for (var name : names) {
                final var match = scanBody(node.get(name), pointer + "/" + name);
                if (match.isPresent()) {
                    return match;
                }
            }
        } else if (node.isArray()) {
            for (var i = 0; i < node.size(); i++) {
                final var match = scanBody(node.get(i), pointer + "/" + i);
                if (match.isPresent()) {
                    return match;
                }
            }
        }
        return Optional.empty();
    }

    private StageResult reject(SecurityRequest request, String location, Match match, String error) {
        LOG.warnf(
                "Injection pattern in %s field %s of %s %s from %s",
                location, match.field(), request.method(), request.path(), request.clientIp());

        auditLog.record(RequestAudit.draft(
                        AuditEventType.SECURITY_VIOLATION,
                        AuditLevel.ERROR,
                        AuditResult.FAILURE,
                        request,
                        "Potential SQL injection attempt detected")
                .detail("location", location)
                .detail("field", match.field())
                .detail("payload", RequestAudit.truncate(match.value(), MAX_PAYLOAD_LENGTH))
                .detail("pattern", match.pattern().pattern()));

        return StageResult.reject(NAME, Rejection.of(400, error));
    }

    private record Match(String field, String value, Pattern pattern) {}
}
