package shipguard.core.service.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import shipguard.core.model.audit.AuditEvent;
import shipguard.core.model.audit.AuditEventDraft;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditQuery;
import shipguard.core.model.audit.NetworkOrigin;
import shipguard.core.model.audit.UserIdentity;
import shipguard.core.port.out.AuditEventForwarder;
import shipguard.core.port.out.SecurityMetrics;
import shipguard.support.MutableClock;

@DisplayName("AuditEventLog")
class AuditEventLogTest {

    private MutableClock clock;
    private List<AuditEvent> forwarded;
    private SecurityMetrics metrics;
    private AuditEventLog log;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        forwarded = new ArrayList<>();
        metrics = mock(SecurityMetrics.class);
        log = new AuditEventLog(5, forwarded::add, metrics, clock);
    }

    private AuditEvent record(AuditEventDraft draft) {
        return log.record(draft).orElseThrow();
    }

    @Nested
    @DisplayName("Recording")
    class RecordingTests {

        @Test
        @DisplayName("should stamp timestamp, sequence and risk score")
        void shouldStampEvent() {
            var event = record(AuditEventDraft.of(AuditEventType.LOGIN_FAILED)
                    .level(AuditLevel.WARN)
                    .identity(UserIdentity.ofEmail("user@example.com"))
                    .network(NetworkOrigin.ofIp("10.0.0.1")));

            assertEquals(1, event.sequence());
            assertEquals(Instant.parse("2024-03-01T10:00:00Z"), event.timestamp());
            assertEquals(4, event.riskScore());
            assertEquals(1, log.size());
        }

        @Test
        @DisplayName("should forward every event and count it")
        void shouldForwardEvents() {
            var event = record(AuditEventDraft.of(AuditEventType.LOGOUT));

            assertEquals(List.of(event), forwarded);
            verify(metrics).recordAuditEvent(event);
        }

        @Test
        @DisplayName("should record uncatalogued event types with the default score")
        void shouldAcceptUnknownTypes() {
            var event = record(AuditEventDraft.of("shipment_rerouted"));

            assertEquals("shipment_rerouted", event.eventType());
            assertEquals(1, event.riskScore());
            assertTrue(event.knownType().isEmpty());
        }

        @Test
        @DisplayName("should store catalogued types under their wire name whatever the input case")
        void shouldCanonicaliseCataloguedTypes() {
            var event = record(AuditEventDraft.of(" LOGIN_FAILED "));

            assertEquals("login_failed", event.eventType());
            assertEquals(4, event.riskScore());
            assertEquals(AuditEventType.LOGIN_FAILED, event.knownType().orElseThrow());
            assertEquals(1, log.query(AuditQuery.builder()
                            .eventTypes(List.of("Login_Failed"))
                            .build())
                    .size());
        }

        @Test
        @DisplayName("should keep timestamps non-decreasing when the clock goes backwards")
        void shouldKeepTimestampsMonotonic() {
            var first = record(AuditEventDraft.of(AuditEventType.LOGOUT));
            clock.advance(Duration.ofSeconds(-30));
            var second = record(AuditEventDraft.of(AuditEventType.LOGOUT));

            assertFalse(second.timestamp().isBefore(first.timestamp()));
            assertTrue(second.sequence() > first.sequence());
        }

        @Test
        @DisplayName("should keep recorded events unchanged when the draft is reused")
        void shouldFreezeDetails() {
            var draft = AuditEventDraft.of(AuditEventType.DATA_ACCESS).detail("shipment", "S-1");
            var event = record(draft);

            draft.detail("shipment", "S-2");

            assertEquals("S-1", event.details().get("shipment"));
            assertThrows(UnsupportedOperationException.class, () -> event.details().put("x", "y"));
        }
    }

    @Nested
    @DisplayName("Capacity")
    class CapacityTests {

        @Test
        @DisplayName("should evict the oldest events once full")
        void shouldEvictOldest() {
            for (int i = 0; i < 8; i++) {
                record(AuditEventDraft.of(AuditEventType.DATA_ACCESS).detail("i", i));
                clock.advance(Duration.ofSeconds(1));
            }

            var events = log.query(AuditQuery.all());
            assertEquals(5, events.size());
            assertEquals(8, events.get(0).sequence());
            assertEquals(4, events.get(4).sequence());
            assertEquals(5, log.capacity());
        }

        @Test
        @DisplayName("should reject a non-positive capacity")
        void shouldRejectBadCapacity() {
            assertThrows(
                    IllegalArgumentException.class, () -> new AuditEventLog(0, event -> {}, metrics, clock));
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class FailureIsolationTests {

        @Test
        @DisplayName("should keep the event when forwarding fails")
        void shouldSurviveForwarderFailure() {
            AuditEventForwarder failing = event -> {
                throw new IllegalStateException("queue closed");
            };
            var failingLog = new AuditEventLog(5, failing, metrics, clock);

            var event = failingLog.record(AuditEventDraft.of(AuditEventType.LOGOUT));

            assertTrue(event.isPresent());
            assertEquals(1, failingLog.size());
        }

        @Test
        @DisplayName("should notify remaining listeners when one throws")
        void shouldIsolateListeners() {
            var seen = new ArrayList<AuditEvent>();
            log.addListener(event -> {
                throw new IllegalStateException("boom");
            });
            log.addListener(seen::add);

            var event = record(AuditEventDraft.of(AuditEventType.LOGOUT));

            assertEquals(List.of(event), seen);
        }

        @Test
        @DisplayName("should keep recording when metrics fail")
        void shouldSurviveMetricsFailure() {
            doThrow(new IllegalStateException("registry closed")).when(metrics).recordAuditEvent(any());

            assertTrue(log.record(AuditEventDraft.of(AuditEventType.LOGOUT)).isPresent());
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @BeforeEach
        void populate() {
            record(AuditEventDraft.of(AuditEventType.LOGIN_FAILED)
                    .level(AuditLevel.WARN)
                    .identity(UserIdentity.ofEmail("User@Example.com"))
                    .network(NetworkOrigin.ofIp("10.0.0.1"))
                    .correlationId("c-1"));
            clock.advance(Duration.ofMinutes(1));
            record(AuditEventDraft.of(AuditEventType.PERMISSION_GRANTED)
                    .identity(new UserIdentity("u-2", "ops@example.com", "dispatcher"))
                    .network(NetworkOrigin.ofIp("10.0.0.2")));
            clock.advance(Duration.ofMinutes(1));
            record(AuditEventDraft.of(AuditEventType.SECURITY_VIOLATION)
                    .level(AuditLevel.ERROR)
                    .network(NetworkOrigin.ofIp("10.0.0.1"))
                    .correlationId("c-1"));
        }

        @Test
        @DisplayName("should return newest first")
        void shouldReturnNewestFirst() {
            var events = log.query(AuditQuery.all());

            assertEquals(List.of(3L, 2L, 1L), events.stream().map(AuditEvent::sequence).toList());
            assertEquals(
                    List.of(1L, 2L, 3L),
                    log.queryChronological(AuditQuery.all()).stream()
                            .map(AuditEvent::sequence)
                            .toList());
        }

        @Test
        @DisplayName("should filter by an inclusive time range")
        void shouldFilterByRange() {
            var query = AuditQuery.builder()
                    .from(Instant.parse("2024-03-01T10:01:00Z"))
                    .to(Instant.parse("2024-03-01T10:02:00Z"))
                    .build();

            assertEquals(2, log.count(query));
        }

        @Test
        @DisplayName("should match email case-insensitively")
        void shouldMatchEmailIgnoringCase() {
            var events = log.query(AuditQuery.builder().userEmail("user@example.com").build());

            assertEquals(1, events.size());
            assertEquals("login_failed", events.get(0).eventType());
        }

        @Test
        @DisplayName("should combine criteria")
        void shouldCombineCriteria() {
            var query = AuditQuery.builder()
                    .ipAddress("10.0.0.1")
                    .minLevel(AuditLevel.ERROR)
                    .correlationId("c-1")
                    .build();

            var events = log.query(query);

            assertEquals(1, events.size());
            assertEquals(3, events.get(0).sequence());
        }

        @Test
        @DisplayName("should filter by user id, type and risk")
        void shouldFilterByUserTypeAndRisk() {
            assertEquals(1, log.count(AuditQuery.builder().userId("u-2").build()));
            assertEquals(
                    2,
                    log.count(AuditQuery.builder()
                            .eventTypes(AuditEventType.LOGIN_FAILED, AuditEventType.SECURITY_VIOLATION)
                            .build()));
            assertEquals(1, log.count(AuditQuery.builder().minRiskScore(6).build()));
        }

        @Test
        @DisplayName("should honour the limit")
        void shouldHonourLimit() {
            assertEquals(2, log.query(AuditQuery.builder().limit(2).build()).size());
            assertEquals(1, log.recent(1).size());
        }

        @Test
        @DisplayName("should reject an inverted range")
        void shouldRejectInvertedRange() {
            assertThrows(IllegalArgumentException.class, () -> AuditQuery.builder()
                    .from(Instant.parse("2024-03-02T00:00:00Z"))
                    .to(Instant.parse("2024-03-01T00:00:00Z"))
                    .build());
        }

        @Test
        @DisplayName("should summarize the buffer")
        void shouldSummarize() {
            var stats = log.statistics();

            assertEquals(3, stats.totalEvents());
            assertEquals(5, stats.capacity());
            assertEquals(1L, stats.byType().get("security_violation"));
            assertEquals(1L, stats.byLevel().get("error"));
            assertEquals(1, stats.highRiskEvents());
            assertEquals(Instant.parse("2024-03-01T10:00:00Z"), stats.oldest());
            assertEquals(Instant.parse("2024-03-01T10:02:00Z"), stats.newest());
        }
    }

    @Test
    @DisplayName("should summarize an empty buffer")
    void shouldSummarizeEmptyBuffer() {
        var stats = log.statistics();

        assertEquals(0, stats.totalEvents());
        assertNull(stats.oldest());
        assertNull(stats.newest());
    }
}
