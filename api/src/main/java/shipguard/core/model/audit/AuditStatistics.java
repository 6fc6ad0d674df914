package shipguard.core.model.audit;

import java.time.Instant;
import java.util.Map;

/**
 * Summary of the in-memory audit buffer for dashboards.
 *
 * @param totalEvents events currently retained
 * @param capacity buffer capacity
 * @param byType counts per event type
 * @param byLevel counts per level wire name
 * @param highRiskEvents events with a risk score of 6 or more
 * @param oldest timestamp of the oldest retained event, or null
 * @param newest timestamp of the newest retained event, or null
 */
public record AuditStatistics(
        int totalEvents,
        int capacity,
        Map<String, Long> byType,
        Map<String, Long> byLevel,
        long highRiskEvents,
        Instant oldest,
        Instant newest) {

    public static final int HIGH_RISK_THRESHOLD = 6;

    public AuditStatistics {
        byType = Map.copyOf(byType);
        byLevel = Map.copyOf(byLevel);
    }
}
