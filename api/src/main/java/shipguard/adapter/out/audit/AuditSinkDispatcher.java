package shipguard.adapter.out.audit;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import shipguard.core.config.AuditConfig;
import shipguard.core.model.audit.AuditEvent;
import shipguard.core.port.out.AuditEventForwarder;
import shipguard.core.port.out.SecurityMetrics;
import shipguard.spi.AuditSink;

/**
 * Forwards recorded audit events to the durable sinks on a background worker.
 *
 * <p>Built-in sinks come from configuration; additional sinks are discovered via
 * {@link ServiceLoader}. Events wait in a bounded queue. When the queue is full
 * the event is dropped for the sinks and counted; it stays in the in-memory
 * buffer. A failing sink is logged and counted and does not stop delivery to
 * the others.
 */
@ApplicationScoped
public class AuditSinkDispatcher implements AuditEventForwarder {

    private static final Logger LOG = Logger.getLogger(AuditSinkDispatcher.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final AuditConfig config;
    private final ObjectMapper objectMapper;
    private final SecurityMetrics metrics;

    private List<AuditSink> sinks = List.of();
    private ThreadPoolExecutor executor;

    @Inject
    public AuditSinkDispatcher(AuditConfig config, ObjectMapper objectMapper, SecurityMetrics metrics) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    AuditSinkDispatcher(List<AuditSink> sinks, int queueCapacity, SecurityMetrics metrics) {
        this.config = null;
        this.objectMapper = null;
        this.metrics = metrics;
        start(sinks, queueCapacity);
    }

    @PostConstruct
    void init() {
        final var loaded = new ArrayList<AuditSink>();
        if (config.loggingSink().enabled()) {
            loaded.add(new LoggingAuditSink(objectMapper));
        }
        if (config.fileSink().enabled()) {
            loaded.add(new FileAuditSink(Path.of(config.fileSink().path()), objectMapper));
        }
        ServiceLoader.load(AuditSink.class).stream()
                .map(ServiceLoader.Provider::get)
                .forEach(loaded::add);

        start(loaded, config.sinkQueueCapacity());
    }

    private void start(List<AuditSink> candidates, int queueCapacity) {
        sinks = candidates.stream().filter(AuditSink::isAvailable).toList();
        if (sinks.isEmpty()) {
            LOG.warn("No audit sinks available - events are kept in memory only");
            return;
        }
        LOG.infof(
                "Loaded %d audit sink(s): %s",
                sinks.size(), sinks.stream().map(AuditSink::name).toList());

        executor = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                r -> {
                    final var thread = new Thread(r, "audit-sink-worker");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    LOG.warnf("Audit sink worker did not drain within %ds", SHUTDOWN_TIMEOUT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        sinks.forEach(sink -> {
            try {
                sink.close();
            } catch (Exception e) {
                LOG.warnf("Error closing audit sink %s: %s", sink.name(), e.getMessage());
            }
        });
    }

    @Override
    public void forward(AuditEvent event) {
        if (executor == null) {
            return;
        }
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            LOG.warnf("Audit sink queue full, event %d not forwarded", event.sequence());
            metrics.recordSinkDrop();
        }
    }

    private void deliver(AuditEvent event) {
        for (var sink : sinks) {
            try {
                sink.append(event);
            } catch (Exception e) {
                LOG.warnf("Audit sink %s failed on event %d: %s", sink.name(), event.sequence(), e.getMessage());
                metrics.recordSinkFailure(sink.name());
            }
        }
    }

    public List<AuditSink> getSinks() {
        return sinks;
    }
}
