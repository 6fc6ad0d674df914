package shipguard.core.model.audit;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Filter over the in-memory audit buffer. Every criterion is optional; an empty
 * query matches all events.
 *
 * @param from inclusive lower time bound, or null
 * @param to inclusive upper time bound, or null
 * @param eventTypes event types to keep, empty for all
 * @param userId exact user id, or null
 * @param userEmail exact user email (case-insensitive), or null
 * @param ipAddress exact client IP, or null
 * @param minLevel minimum severity, or null
 * @param correlationId exact correlation id, or null
 * @param minRiskScore minimum risk score, 0 for all
 * @param limit maximum number of results, 0 for unlimited
 */
public record AuditQuery(
        Instant from,
        Instant to,
        Set<String> eventTypes,
        String userId,
        String userEmail,
        String ipAddress,
        AuditLevel minLevel,
        String correlationId,
        int minRiskScore,
        int limit) {

    public AuditQuery {
        eventTypes = eventTypes == null
                ? Set.of()
                : eventTypes.stream().map(AuditEventType::canonical).collect(Collectors.toUnmodifiableSet());
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Query start must not be after its end");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
    }

    public static AuditQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Check whether an event satisfies every criterion of this query.
     *
     * @param event the event
     * @return true if the event matches
     */
    public boolean matches(AuditEvent event) {
        if (from != null && event.timestamp().isBefore(from)) {
            return false;
        }
        if (to != null && event.timestamp().isAfter(to)) {
            return false;
        }
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.eventType())) {
            return false;
        }
        if (userId != null && !userId.equals(event.userId().orElse(null))) {
            return false;
        }
        if (userEmail != null
                && !event.userEmail().map(userEmail::equalsIgnoreCase).orElse(false)) {
            return false;
        }
        if (ipAddress != null && !ipAddress.equals(event.ipAddress().orElse(null))) {
            return false;
        }
        if (minLevel != null && !event.level().isAtLeast(minLevel)) {
            return false;
        }
        if (correlationId != null && !correlationId.equals(event.correlationId())) {
            return false;
        }
        return event.riskScore() >= minRiskScore;
    }

    public static final class Builder {
        private Instant from;
        private Instant to;
        private Set<String> eventTypes = Set.of();
        private String userId;
        private String userEmail;
        private String ipAddress;
        private AuditLevel minLevel;
        private String correlationId;
        private int minRiskScore;
        private int limit;

        private Builder() {}

        public Builder from(Instant from) {
            this.from = from;
            return this;
        }

        public Builder to(Instant to) {
            this.to = to;
            return this;
        }

        public Builder eventTypes(Collection<String> eventTypes) {
            this.eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
            return this;
        }

        public Builder eventTypes(AuditEventType... types) {
            this.eventTypes = Arrays.stream(types).map(AuditEventType::wireName).collect(Collectors.toSet());
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder userEmail(String userEmail) {
            this.userEmail = userEmail;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder minLevel(AuditLevel minLevel) {
            this.minLevel = minLevel;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder minRiskScore(int minRiskScore) {
            this.minRiskScore = minRiskScore;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public AuditQuery build() {
            return new AuditQuery(
                    from, to, eventTypes, userId, userEmail, ipAddress, minLevel, correlationId, minRiskScore, limit);
        }
    }
}
