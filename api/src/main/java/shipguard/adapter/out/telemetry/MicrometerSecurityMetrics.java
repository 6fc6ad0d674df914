package shipguard.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import shipguard.core.model.audit.AuditEvent;
import shipguard.core.port.out.SecurityMetrics;

/**
 * Micrometer-backed security metrics.
 *
 * <p>Metrics:
 * <ul>
 *   <li>{@code shipguard.audit.events} - recorded audit events by type and level</li>
 *   <li>{@code shipguard.audit.sink.failures} - failed sink writes by sink</li>
 *   <li>{@code shipguard.audit.sink.dropped} - events not queued for the sinks</li>
 *   <li>{@code shipguard.ratelimit.rejected} - rejected consumptions by policy</li>
 *   <li>{@code shipguard.anomaly.detections} - anomaly findings by rule</li>
 *   <li>{@code shipguard.chain.short_circuits} - requests stopped by a chain stage</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerSecurityMetrics implements SecurityMetrics {

    private final MeterRegistry registry;

    @Inject
    public MicrometerSecurityMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordAuditEvent(AuditEvent event) {
        Counter.builder("shipguard.audit.events")
                .description("Recorded audit events")
                .tag("event_type", event.eventType())
                .tag("level", event.level().wireName())
                .register(registry)
                .increment();
    }

    @Override
    public void recordSinkFailure(String sinkName) {
        Counter.builder("shipguard.audit.sink.failures")
                .description("Audit events a sink failed to persist")
                .tag("sink", sinkName)
                .register(registry)
                .increment();
    }

    @Override
    public void recordSinkDrop() {
        Counter.builder("shipguard.audit.sink.dropped")
                .description("Audit events dropped because the sink queue was full")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRateLimitRejected(String policy) {
        Counter.builder("shipguard.ratelimit.rejected")
                .description("Rejected rate-limit consumptions")
                .tag("policy", policy)
                .register(registry)
                .increment();
    }

    @Override
    public void recordAnomaly(String rule) {
        Counter.builder("shipguard.anomaly.detections")
                .description("Anomaly rule findings")
                .tag("rule", rule)
                .register(registry)
                .increment();
    }

    @Override
    public void recordShortCircuit(String stage, int status) {
        Counter.builder("shipguard.chain.short_circuits")
                .description("Requests stopped by a security chain stage")
                .tag("stage", stage)
                .tag("status", String.valueOf(status))
                .register(registry)
                .increment();
    }
}
