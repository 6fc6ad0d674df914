package shipguard.core.service.chain.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;
import shipguard.core.port.out.SecurityMetrics;
import shipguard.core.service.audit.AuditEventLog;
import shipguard.support.MutableClock;

@DisplayName("InjectionDetectionStage")
class InjectionDetectionStageTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AuditEventLog auditLog;
    private InjectionDetectionStage stage;

    @BeforeEach
    void setUp() {
        auditLog = new AuditEventLog(
                100, event -> {}, SecurityMetrics.NOOP, MutableClock.startingAt("2024-03-01T10:00:00Z"));
        stage = new InjectionDetectionStage(auditLog);
    }

    @Nested
    @DisplayName("firstMatch()")
    class PatternTests {

        @ParameterizedTest
        @ValueSource(strings = {"1 UNION SELECT password", "drop table users", "x' or '1'='1", "a; b", "id--", "a|b"})
        @DisplayName("should flag keyword and operator payloads")
        void shouldFlagPayloads(String value) {
            assertTrue(InjectionDetectionStage.firstMatch(value).isPresent());
        }

        @ParameterizedTest
        @ValueSource(strings = {"Rotterdam", "SHP-2024-0042", "ordered pallets", "selection", "Andover"})
        @DisplayName("should pass plain values and keywords inside words")
        void shouldPassPlainValues(String value) {
            assertFalse(InjectionDetectionStage.firstMatch(value).isPresent());
        }

        @Test
        @DisplayName("should flag standalone conjunctions")
        void shouldFlagConjunctions() {
            assertTrue(InjectionDetectionStage.firstMatch("pallets and crates").isPresent());
        }
    }

    @Test
    @DisplayName("should reject a matching query parameter with 400 and record a violation")
    void shouldRejectQuery() {
        var request = SecurityRequest.builder("GET", "/api/shipments")
                .queryParam("status", "1 UNION SELECT 1")
                .clientIp("10.0.0.66")
                .correlationId("corr-9")
                .build();

        var result = stage.apply(request).await().atMost(TIMEOUT);

        var shortCircuit = assertInstanceOf(StageResult.ShortCircuit.class, result);
        assertEquals(InjectionDetectionStage.NAME, shortCircuit.stage());
        assertEquals(400, shortCircuit.rejection().status());
        assertEquals("Invalid request parameters", shortCircuit.rejection().error());

        var event = auditLog.recent(1).get(0);
        assertEquals("security_violation", event.eventType());
        assertEquals(AuditLevel.ERROR, event.level());
        assertEquals("GET", event.details().get("method"));
        assertEquals("/api/shipments", event.details().get("path"));
        assertEquals("query", event.details().get("location"));
        assertEquals("status", event.details().get("field"));
        assertEquals("corr-9", event.correlationId());
    }

    @Test
    @DisplayName("should reject a matching nested body string")
    void shouldRejectBody() throws Exception {
        var request = SecurityRequest.builder("POST", "/api/shipments")
                .body(objectMapper.readTree("{\"stops\":[{\"city\":\"Oslo\"},{\"city\":\"DROP TABLE stops\"}]}"))
                .build();

        var result = stage.apply(request).await().atMost(TIMEOUT);

        var shortCircuit = assertInstanceOf(StageResult.ShortCircuit.class, result);
        assertEquals("Invalid request data", shortCircuit.rejection().error());
        assertEquals("/stops/1/city", auditLog.recent(1).get(0).details().get("field"));
    }

    @Test
    @DisplayName("should truncate long payloads in the audit entry")
    void shouldTruncatePayload() {
        var request = SecurityRequest.builder("GET", "/api/shipments")
                .queryParam("q", "x;" + "a".repeat(300))
                .build();

        stage.apply(request).await().atMost(TIMEOUT);

        var payload = (String) auditLog.recent(1).get(0).details().get("payload");
        assertEquals(203, payload.length());
        assertTrue(payload.endsWith("..."));
    }

    @Test
    @DisplayName("should pass clean requests without recording")
    void shouldPassCleanRequest() throws Exception {
        var request = SecurityRequest.builder("POST", "/api/shipments")
                .queryParam("page", "2")
                .body(objectMapper.readTree("{\"city\":\"Oslo\",\"weight\":120,\"fragile\":true}"))
                .build();

        assertTrue(stage.apply(request).await().atMost(TIMEOUT).isContinue());
        assertEquals(0, auditLog.size());
    }
}
