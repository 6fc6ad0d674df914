package shipguard.adapter.out.alert;

import org.jboss.logging.Logger;

import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.SecurityAlert;
import shipguard.spi.AlertChannel;

/**
 * Alert channel that logs alerts on the {@code shipguard.security} category.
 * Critical alerts log at ERROR, the rest at WARN.
 */
public class LoggingAlertChannel implements AlertChannel {

    public static final String NAME = "logging";

    private static final Logger LOG = Logger.getLogger("shipguard.security");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(SecurityAlert alert) {
        final var event = alert.event();
        final var message = String.format(
                "SECURITY ALERT: %s level=%s user=%s ip=%s correlationId=%s",
                alert.summary(),
                event.level().wireName(),
                event.userEmail().or(event::userId).orElse("-"),
                event.ipAddress().orElse("-"),
                event.correlationId() != null ? event.correlationId() : "-");

        if (event.level().isAtLeast(AuditLevel.CRITICAL)) {
            LOG.error(message);
        } else {
            LOG.warn(message);
        }
    }
}
