package shipguard.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shipguard.core.model.audit.AuditEventDraft;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;

@DisplayName("MicrometerSecurityMetrics")
class MicrometerSecurityMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerSecurityMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerSecurityMetrics(registry);
    }

    @Test
    @DisplayName("should count audit events by type and level")
    void shouldCountAuditEvents() {
        var event = AuditEventDraft.of(AuditEventType.LOGIN_FAILED)
                .level(AuditLevel.WARN)
                .toEvent(1, Instant.parse("2024-03-01T10:00:00Z"));

        metrics.recordAuditEvent(event);
        metrics.recordAuditEvent(event);

        assertEquals(
                2.0,
                registry.get("shipguard.audit.events")
                        .tag("event_type", "login_failed")
                        .tag("level", "warn")
                        .counter()
                        .count());
    }

    @Test
    @DisplayName("should tag rejections, anomalies and short-circuits")
    void shouldTagCounters() {
        metrics.recordRateLimitRejected("login");
        metrics.recordAnomaly("risk-cluster");
        metrics.recordShortCircuit("rate-limit", 429);
        metrics.recordSinkFailure("file");
        metrics.recordSinkDrop();

        assertEquals(1.0, registry.get("shipguard.ratelimit.rejected").tag("policy", "login").counter().count());
        assertEquals(1.0, registry.get("shipguard.anomaly.detections").tag("rule", "risk-cluster").counter().count());
        assertEquals(
                1.0,
                registry.get("shipguard.chain.short_circuits")
                        .tag("stage", "rate-limit")
                        .tag("status", "429")
                        .counter()
                        .count());
        assertEquals(1.0, registry.get("shipguard.audit.sink.failures").tag("sink", "file").counter().count());
        assertEquals(1.0, registry.get("shipguard.audit.sink.dropped").counter().count());
    }
}
