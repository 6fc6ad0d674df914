package shipguard.core.service.audit;

import shipguard.core.model.audit.AuditEvent;

/**
 * Callback invoked synchronously after each event is recorded.
 */
@FunctionalInterface
public interface AuditEventListener {

    void onRecorded(AuditEvent event);
}
