package shipguard.core.port.out;

import shipguard.core.model.audit.AuditEvent;

/**
 * Hands recorded events to durable storage without blocking the caller.
 */
public interface AuditEventForwarder {

    /**
     * Queue an event for the durable sinks. Must return immediately and must not throw.
     *
     * @param event the recorded event
     */
    void forward(AuditEvent event);
}
