package shipguard.adapter.out.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shipguard.core.model.audit.AuditEvent;
import shipguard.core.model.audit.AuditEventDraft;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.port.out.SecurityMetrics;
import shipguard.spi.AuditSink;
import shipguard.spi.AuditSinkException;

@DisplayName("AuditSinkDispatcher")
class AuditSinkDispatcherTest {

    private SecurityMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = mock(SecurityMetrics.class);
    }

    private static AuditEvent event(long sequence) {
        return AuditEventDraft.of(AuditEventType.LOGOUT).toEvent(sequence, Instant.parse("2024-03-01T10:00:00Z"));
    }

    private static AuditSink collecting(String name, List<AuditEvent> received) {
        return new AuditSink() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void append(AuditEvent event) {
                received.add(event);
            }
        };
    }

    private static AuditSink failing(String name) {
        return new AuditSink() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void append(AuditEvent event) throws AuditSinkException {
                throw new AuditSinkException("disk full");
            }
        };
    }

    @Test
    @DisplayName("should deliver to every sink even when one fails")
    void shouldIsolateSinkFailures() {
        var received = new CopyOnWriteArrayList<AuditEvent>();
        var dispatcher = new AuditSinkDispatcher(
                List.of(failing("broken"), collecting("memory", received)), 10, metrics);

        dispatcher.forward(event(1));
        dispatcher.forward(event(2));
        dispatcher.shutdown();

        assertEquals(List.of(1L, 2L), received.stream().map(AuditEvent::sequence).toList());
        verify(metrics, times(2)).recordSinkFailure("broken");
    }

    @Test
    @DisplayName("should drop and count events when the queue is full")
    void shouldDropWhenQueueFull() throws Exception {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var received = new CopyOnWriteArrayList<AuditEvent>();
        var blocking = new AuditSink() {
            @Override
            public String name() {
                return "slow";
            }

            @Override
            public void append(AuditEvent event) {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                received.add(event);
            }
        };
        var dispatcher = new AuditSinkDispatcher(List.of(blocking), 1, metrics);

        dispatcher.forward(event(1));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        dispatcher.forward(event(2));
        dispatcher.forward(event(3));

        verify(metrics).recordSinkDrop();
        release.countDown();
        dispatcher.shutdown();
        assertEquals(List.of(1L, 2L), received.stream().map(AuditEvent::sequence).toList());
    }

    @Test
    @DisplayName("should skip unavailable sinks and ignore events without sinks")
    void shouldSkipUnavailableSinks() {
        var unavailable = new AuditSink() {
            @Override
            public String name() {
                return "offline";
            }

            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public void append(AuditEvent event) {
                throw new IllegalStateException("should not be called");
            }
        };
        var dispatcher = new AuditSinkDispatcher(List.of(unavailable), 10, metrics);

        dispatcher.forward(event(1));
        dispatcher.shutdown();

        assertTrue(dispatcher.getSinks().isEmpty());
        verify(metrics, never()).recordSinkDrop();
    }
}
