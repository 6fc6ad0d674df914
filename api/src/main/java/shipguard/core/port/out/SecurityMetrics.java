package shipguard.core.port.out;

import shipguard.core.model.audit.AuditEvent;

/**
 * Port for recording security observability metrics.
 */
public interface SecurityMetrics {

    void recordAuditEvent(AuditEvent event);

    void recordSinkFailure(String sinkName);

    /**
     * Record an event that could not be queued for the durable sinks.
     */
    void recordSinkDrop();

    void recordRateLimitRejected(String policy);

    void recordAnomaly(String rule);

    /**
     * Record a request stopped by a chain stage.
     *
     * @param stage the stage name
     * @param status the response status
     */
    void recordShortCircuit(String stage, int status);

    /**
     * Metrics implementation that records nothing.
     */
    SecurityMetrics NOOP = new SecurityMetrics() {
        @Override
        public void recordAuditEvent(AuditEvent event) {}

        @Override
        public void recordSinkFailure(String sinkName) {}

        @Override
        public void recordSinkDrop() {}

        @Override
        public void recordRateLimitRejected(String policy) {}

        @Override
        public void recordAnomaly(String rule) {}

        @Override
        public void recordShortCircuit(String stage, int status) {}
    };
}
