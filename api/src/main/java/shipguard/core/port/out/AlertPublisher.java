package shipguard.core.port.out;

import shipguard.core.model.audit.SecurityAlert;

/**
 * Delivers security alerts to the configured alert channels, fire-and-forget.
 */
public interface AlertPublisher {

    void publish(SecurityAlert alert);
}
