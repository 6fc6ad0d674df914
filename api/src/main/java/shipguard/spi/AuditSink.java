package shipguard.spi;

import shipguard.core.model.audit.AuditEvent;

/**
 * SPI for durable audit storage beyond the in-memory buffer.
 *
 * <p>Sinks are called from a single background worker, never from the request
 * path. A sink that throws only loses that event for itself; the failure is
 * logged and counted and other sinks still receive the event.
 *
 * <p>Built-in sinks:
 * <ul>
 *   <li>{@code logging} - one JSON line per event on the {@code shipguard.audit} category</li>
 *   <li>{@code file} - JSON lines appended to a local file</li>
 * </ul>
 *
 * <p>Additional sinks are discovered via {@link java.util.ServiceLoader}; register
 * them in {@code META-INF/services/shipguard.spi.AuditSink}.
 */
public interface AuditSink {

    /**
     * Returns the unique name of this sink.
     *
     * @return sink name (e.g., "logging", "file", "elasticsearch")
     */
    String name();

    /**
     * Returns whether this sink is configured and should receive events.
     *
     * @return true if available
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Persist one event.
     *
     * @param event the recorded event
     * @throws AuditSinkException if the event could not be persisted
     */
    void append(AuditEvent event) throws AuditSinkException;

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
