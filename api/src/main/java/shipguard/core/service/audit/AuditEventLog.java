package shipguard.core.service.audit;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import shipguard.core.config.AuditConfig;
import shipguard.core.model.audit.AuditEvent;
import shipguard.core.model.audit.AuditEventDraft;
import shipguard.core.model.audit.AuditQuery;
import shipguard.core.model.audit.AuditStatistics;
import shipguard.core.port.out.AuditEventForwarder;
import shipguard.core.port.out.SecurityMetrics;

/**
 * Append-only, bounded in-memory log of security events.
 *
 * <p>Events are kept newest first in a fixed-capacity buffer; once full, the
 * oldest event is dropped for each new one. Recording never throws and never
 * waits on durable storage: each event is handed to the
 * {@link AuditEventForwarder} and then to the registered listeners.
 *
 * <p>Timestamps and sequence numbers are assigned under the write lock, so
 * buffer order and timestamp order always agree.
 */
@ApplicationScoped
public class AuditEventLog {

    private static final Logger LOG = Logger.getLogger(AuditEventLog.class);

    private final int capacity;
    private final AuditEventForwarder forwarder;
    private final SecurityMetrics metrics;
    private final Clock clock;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Deque<AuditEvent> events;
    private final List<AuditEventListener> listeners = new CopyOnWriteArrayList<>();

    private long nextSequence = 1;
    private Instant lastTimestamp = Instant.EPOCH;

    @Inject
    public AuditEventLog(AuditConfig config, AuditEventForwarder forwarder, SecurityMetrics metrics, Clock clock) {
        this(config.bufferCapacity(), forwarder, metrics, clock);
    }

    public AuditEventLog(int capacity, AuditEventForwarder forwarder, SecurityMetrics metrics, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Audit buffer capacity must be positive");
        }
        this.capacity = capacity;
        this.forwarder = forwarder;
        this.metrics = metrics;
        this.clock = clock;
        this.events = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Register a callback for every recorded event.
     *
     * @param listener the listener
     */
    public void addListener(AuditEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(AuditEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Record an event.
     *
     * <p>Stamps the timestamp and risk score, stores the event, queues it for
     * the durable sinks and notifies listeners. Failures are logged, never thrown.
     *
     * @param draft the event description
     * @return the recorded event, or empty if recording failed
     */
    public Optional<AuditEvent> record(AuditEventDraft draft) {
        final AuditEvent event;
        try {
            event = append(draft);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to record audit event %s", draft != null ? draft.eventType() : "null");
            return Optional.empty();
        }

        try {
            forwarder.forward(event);
        } catch (RuntimeException e) {
            LOG.warnf("Failed to queue audit event %d for durable storage: %s", event.sequence(), e.getMessage());
        }

        try {
            metrics.recordAuditEvent(event);
        } catch (RuntimeException e) {
            LOG.debugf("Failed to record audit metric: %s", e.getMessage());
        }

        for (var listener : listeners) {
            try {
                listener.onRecorded(event);
            } catch (RuntimeException e) {
                LOG.warnf("Audit listener failed for event %d: %s", event.sequence(), e.getMessage());
            }
        }
        return Optional.of(event);
    }

    private AuditEvent append(AuditEventDraft draft) {
        lock.writeLock().lock();
        try {
            var timestamp = clock.instant();
            if (timestamp.isBefore(lastTimestamp)) {
                timestamp = lastTimestamp;
            }
            final var event = draft.toEvent(nextSequence, timestamp);
            nextSequence++;
            lastTimestamp = timestamp;

            events.addFirst(event);
            while (events.size() > capacity) {
                events.pollLast();
            }
            return event;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Query the buffer.
     *
     * @param query the filter
     * @return matching events, newest first
     */
    public List<AuditEvent> query(AuditQuery query) {
        lock.readLock().lock();
        try {
            final var result = new ArrayList<AuditEvent>();
            for (var event : events) {
                if (query.matches(event)) {
                    result.add(event);
                    if (query.limit() > 0 && result.size() >= query.limit()) {
                        break;
                    }
                }
            }
            return Collections.unmodifiableList(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Query the buffer in recording order.
     *
     * @param query the filter
     * @return matching events, oldest first
     */
    public List<AuditEvent> queryChronological(AuditQuery query) {
        final var newestFirst = new ArrayList<>(query(query));
        Collections.reverse(newestFirst);
        return Collections.unmodifiableList(newestFirst);
    }

    /**
     * Count matching events without copying them.
     *
     * @param query the filter (its limit is ignored)
     * @return number of matching events
     */
    public int count(AuditQuery query) {
        lock.readLock().lock();
        try {
            var count = 0;
            for (var event : events) {
                if (query.matches(event)) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<AuditEvent> recent(int limit) {
        return query(AuditQuery.builder().limit(limit).build());
    }

    public int size() {
        lock.readLock().lock();
        try {
            return events.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Summarize the buffer.
     *
     * @return counts per type and level, high-risk count and the retained time span
     */
    public AuditStatistics statistics() {
        final List<AuditEvent> snapshot;
        lock.readLock().lock();
        try {
            snapshot = List.copyOf(events);
        } finally {
            lock.readLock().unlock();
        }

        final Map<String, Long> byType = snapshot.stream()
                .collect(Collectors.groupingBy(AuditEvent::eventType, TreeMap::new, Collectors.counting()));
        final Map<String, Long> byLevel = snapshot.stream()
                .collect(Collectors.groupingBy(e -> e.level().wireName(), TreeMap::new, Collectors.counting()));
        final var highRisk = snapshot.stream()
                .filter(e -> e.riskScore() >= AuditStatistics.HIGH_RISK_THRESHOLD)
                .count();

        final var newest = snapshot.isEmpty() ? null : snapshot.get(0).timestamp();
        final var oldest = snapshot.isEmpty() ? null : snapshot.get(snapshot.size() - 1).timestamp();

        return new AuditStatistics(snapshot.size(), capacity, byType, byLevel, highRisk, oldest, newest);
    }
}
