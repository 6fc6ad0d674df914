package shipguard.core.service.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import shipguard.core.model.audit.AuditEventDraft;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditQuery;
import shipguard.core.model.audit.AuditResult;
import shipguard.core.model.audit.NetworkOrigin;
import shipguard.core.model.audit.ResourceRef;
import shipguard.core.model.audit.UserIdentity;
import shipguard.core.port.out.SecurityMetrics;
import shipguard.support.MutableClock;

@DisplayName("AuditExportService")
class AuditExportServiceTest {

    private static final String HEADER = "\"timestamp\",\"level\",\"eventType\",\"userId\",\"userEmail\",\"userRole\","
            + "\"ipAddress\",\"resourceType\",\"resourceId\",\"action\",\"result\",\"riskScore\",\"details\"";

    private MutableClock clock;
    private AuditEventLog auditLog;
    private AuditExportService exportService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T08:00:00Z");
        auditLog = new AuditEventLog(100, event -> {}, SecurityMetrics.NOOP, clock);
        var objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        exportService = new AuditExportService(auditLog, objectMapper);
    }

    private static List<String> lines(String csv) {
        return List.of(csv.split("\n"));
    }

    @Nested
    @DisplayName("CSV layout")
    class LayoutTests {

        @Test
        @DisplayName("should emit only the quoted header when nothing matches")
        void shouldEmitHeaderOnly() {
            var csv = exportService.export(
                    Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-01T23:59:59Z"), null);

            assertEquals(HEADER + "\n", csv);
        }

        @Test
        @DisplayName("should quote every field and serialize details as JSON")
        void shouldQuoteEveryField() {
            auditLog.record(AuditEventDraft.of(AuditEventType.DATA_MODIFICATION)
                    .level(AuditLevel.INFO)
                    .identity(new UserIdentity("u-7", "ops@example.com", "dispatcher"))
                    .network(NetworkOrigin.ofIp("10.1.2.3"))
                    .resource(new ResourceRef("shipment", "S-100"))
                    .action("Updated shipment")
                    .result(AuditResult.SUCCESS)
                    .detail("field", "status"));

            var rows = lines(exportService.export(
                    Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-01T23:59:59Z"), null));

            assertEquals(2, rows.size());
            assertEquals(HEADER, rows.get(0));
            assertEquals(
                    "\"2024-03-01T08:00:00Z\",\"info\",\"data_modification\",\"u-7\",\"ops@example.com\","
                            + "\"dispatcher\",\"10.1.2.3\",\"shipment\",\"S-100\",\"Updated shipment\",\"success\","
                            + "\"3\",\"{\"\"field\"\":\"\"status\"\"}\"",
                    rows.get(1));
        }

        @Test
        @DisplayName("should write empty quoted fields for missing identity and network")
        void shouldWriteEmptyFields() {
            auditLog.record(AuditEventDraft.of(AuditEventType.LOGOUT));

            var rows = lines(exportService.export(
                    Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-01T23:59:59Z"), null));

            assertEquals(
                    "\"2024-03-01T08:00:00Z\",\"info\",\"logout\",\"\",\"\",\"\",\"\",\"\",\"\",\"\",\"success\",\"1\",\"{}\"",
                    rows.get(1));
        }

        @Test
        @DisplayName("should double embedded quotes in free text")
        void shouldEscapeQuotes() {
            auditLog.record(AuditEventDraft.of(AuditEventType.DATA_ACCESS).action("Viewed \"priority\" loads"));

            var csv = exportService.export(
                    Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-01T23:59:59Z"), null);

            assertTrue(csv.contains("\"Viewed \"\"priority\"\" loads\""));
        }
    }

    @Nested
    @DisplayName("Selection")
    class SelectionTests {

        @BeforeEach
        void populate() {
            auditLog.record(AuditEventDraft.of(AuditEventType.LOGIN_SUCCESS));
            clock.advance(Duration.ofHours(1));
            auditLog.record(AuditEventDraft.of(AuditEventType.LOGIN_FAILED));
            clock.advance(Duration.ofHours(1));
            auditLog.record(AuditEventDraft.of(AuditEventType.LOGOUT));
        }

        @Test
        @DisplayName("should include both range boundaries and list rows oldest first")
        void shouldIncludeBoundariesInOrder() {
            var rows = lines(exportService.export(
                    Instant.parse("2024-03-01T08:00:00Z"), Instant.parse("2024-03-01T09:00:00Z"), null));

            assertEquals(3, rows.size());
            assertTrue(rows.get(1).contains("\"login_success\""));
            assertTrue(rows.get(2).contains("\"login_failed\""));
        }

        @Test
        @DisplayName("should restrict rows to the requested event types")
        void shouldFilterTypes() {
            var rows = lines(exportService.export(
                    Instant.parse("2024-03-01T00:00:00Z"),
                    Instant.parse("2024-03-01T23:59:59Z"),
                    List.of("logout")));

            assertEquals(2, rows.size());
            assertTrue(rows.get(1).contains("\"logout\""));
        }

        @Test
        @DisplayName("should reject a missing range bound")
        void shouldRejectMissingBound() {
            assertThrows(
                    NullPointerException.class,
                    () -> exportService.export(null, Instant.parse("2024-03-01T23:59:59Z"), null));
        }
    }

    @Test
    @DisplayName("should record the export with its row count")
    void shouldAuditExport() {
        auditLog.record(AuditEventDraft.of(AuditEventType.LOGIN_SUCCESS));
        auditLog.record(AuditEventDraft.of(AuditEventType.LOGOUT));
        clock.advance(Duration.ofMinutes(5));

        exportService.exportAudited(
                Instant.parse("2024-03-01T00:00:00Z"),
                Instant.parse("2024-03-01T08:00:00Z"),
                null,
                new UserIdentity("admin-1", "admin@example.com", "admin"),
                NetworkOrigin.ofIp("10.9.9.9"));

        var exports = auditLog.query(AuditQuery.builder().eventTypes(AuditEventType.DATA_EXPORT).build());
        assertEquals(1, exports.size());
        var exportEvent = exports.get(0);
        assertEquals(2, exportEvent.details().get("rowCount"));
        assertEquals("admin-1", exportEvent.userId().orElseThrow());
        assertEquals("audit_log", exportEvent.resource().resourceType());
        assertEquals(6, exportEvent.riskScore());
    }
}
