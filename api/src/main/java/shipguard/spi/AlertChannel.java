package shipguard.spi;

import shipguard.core.model.audit.SecurityAlert;

/**
 * SPI for delivering security alerts raised by the anomaly detector.
 *
 * <p>Channels are invoked asynchronously, in priority order, for every alert at
 * or above the configured severity cutoff. Exceptions are caught and logged by
 * the dispatcher.
 *
 * <p>Built-in channels:
 * <ul>
 *   <li>{@code logging} - logs the alert on the {@code shipguard.security} category (priority 0)</li>
 *   <li>{@code webhook} - POSTs the alert as JSON when a URL is configured (priority 10)</li>
 * </ul>
 */
public interface AlertChannel {

    String name();

    /**
     * Higher priority channels are invoked first.
     *
     * @return priority value
     */
    default int priority() {
        return 0;
    }

    default boolean isAvailable() {
        return true;
    }

    /**
     * Deliver an alert.
     *
     * @param alert the alert
     */
    void send(SecurityAlert alert);

    default void close() {}
}
