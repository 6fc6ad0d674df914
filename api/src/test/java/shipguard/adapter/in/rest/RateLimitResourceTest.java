package shipguard.adapter.in.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shipguard.adapter.in.http.CurrentSecurityRequest;
import shipguard.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.NetworkOrigin;
import shipguard.core.model.audit.UserIdentity;
import shipguard.core.port.out.SecurityMetrics;
import shipguard.core.service.audit.AuditEventLog;
import shipguard.core.service.ratelimit.RateLimitPolicyRegistry;
import shipguard.core.service.ratelimit.RateLimitService;
import shipguard.support.MutableClock;

@DisplayName("RateLimitResource")
class RateLimitResourceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private AuditEventLog auditLog;
    private RateLimitService service;
    private RateLimitResource resource;

    @BeforeEach
    void setUp() {
        var clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        auditLog = new AuditEventLog(100, event -> {}, SecurityMetrics.NOOP, clock);
        service = new RateLimitService(
                new InMemoryRateLimiter(clock, true),
                RateLimitPolicyRegistry.defaults(),
                auditLog,
                SecurityMetrics.NOOP);
        var currentRequest = mock(CurrentSecurityRequest.class);
        when(currentRequest.identity())
                .thenReturn(Optional.of(new UserIdentity("u-1", "admin@example.com", "admin")));
        when(currentRequest.origin()).thenReturn(NetworkOrigin.ofIp("10.0.0.5"));
        when(currentRequest.correlationId()).thenReturn("corr-9");
        resource = new RateLimitResource(service, auditLog, currentRequest);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> statusBody(String policy, String key) {
        var response = resource.status(policy, key).await().atMost(TIMEOUT);
        assertEquals(200, response.getStatus());
        return (Map<String, Object>) response.getEntity();
    }

    @Test
    @DisplayName("should report a fresh bucket with full points")
    void shouldReportFreshBucket() {
        var body = statusBody("login", "10.0.0.9");

        assertEquals("login", body.get("policy"));
        assertEquals("10.0.0.9", body.get("key"));
        assertEquals(5L, body.get("limit"));
        assertEquals(5L, body.get("remaining"));
        assertEquals(false, body.get("blocked"));
    }

    @Test
    @DisplayName("should report a blocked bucket")
    void shouldReportBlockedBucket() {
        for (int i = 0; i < 6; i++) {
            service.consume("login", "10.0.0.9").await().atMost(TIMEOUT);
        }

        var body = statusBody("login", "10.0.0.9");

        assertEquals(true, body.get("blocked"));
        assertEquals(1800L, body.get("retryAfter"));
    }

    @Test
    @DisplayName("should unlock a bucket and record the change")
    void shouldResetAndAudit() {
        for (int i = 0; i < 6; i++) {
            service.consume("login", "10.0.0.9").await().atMost(TIMEOUT);
        }

        var response = resource.reset("login", "10.0.0.9").await().atMost(TIMEOUT);

        assertEquals(204, response.getStatus());
        assertEquals(false, statusBody("login", "10.0.0.9").get("blocked"));
        var event = auditLog.recent(1).get(0);
        assertEquals(AuditEventType.CONFIGURATION_CHANGE.wireName(), event.eventType());
        assertEquals("u-1", event.userId().orElseThrow());
        assertEquals("login", event.details().get("policy"));
        assertEquals("10.0.0.9", event.details().get("key"));
    }

    @Test
    @DisplayName("should reject unknown policies")
    void shouldRejectUnknownPolicy() {
        assertThrows(IllegalArgumentException.class, () -> resource.status("bogus", "10.0.0.9"));
    }
}
