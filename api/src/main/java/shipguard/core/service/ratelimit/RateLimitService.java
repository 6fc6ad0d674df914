package shipguard.core.service.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shipguard.core.model.audit.AuditEventDraft;
import shipguard.core.model.audit.AuditEventType;
import shipguard.core.model.audit.AuditLevel;
import shipguard.core.model.audit.AuditResult;
import shipguard.core.model.ratelimit.RateLimitContext;
import shipguard.core.model.ratelimit.RateLimitDecision;
import shipguard.core.model.ratelimit.RateLimitKey;
import shipguard.core.port.out.RateLimiter;
import shipguard.core.port.out.SecurityMetrics;
import shipguard.core.service.audit.AuditEventLog;

/**
 * Applies named rate-limit policies and audits every rejection.
 */
@ApplicationScoped
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    private final RateLimiter rateLimiter;
    private final RateLimitPolicyRegistry policies;
    private final AuditEventLog auditLog;
    private final SecurityMetrics metrics;

    @Inject
    public RateLimitService(
            RateLimiter rateLimiter,
            RateLimitPolicyRegistry policies,
            AuditEventLog auditLog,
            SecurityMetrics metrics) {
        this.rateLimiter = rateLimiter;
        this.policies = policies;
        this.auditLog = auditLog;
        this.metrics = metrics;
    }

    /**
     * Consume one point for {@code clientKey} under the named policy.
     *
     * <p>A rejection records a {@code rate_limit_exceeded} event before the
     * decision is returned.
     *
     * @param policyName the policy name
     * @param clientKey the partitioning identity, usually the client IP
     * @param context request context for the audit event
     * @return the decision
     */
    public Uni<RateLimitDecision> consume(String policyName, String clientKey, RateLimitContext context) {
        final var policy = policies.resolve(policyName);
        final var key = new RateLimitKey(policy.name(), clientKey);

        return rateLimiter.checkAndConsume(key, policy).invoke(decision -> {
            if (!decision.allowed()) {
                onRejected(key, decision, context);
            }
        });
    }

    public Uni<RateLimitDecision> consume(String policyName, String clientKey) {
        return consume(policyName, clientKey, RateLimitContext.none());
    }

    public Uni<RateLimitDecision> status(String policyName, String clientKey) {
        final var policy = policies.resolve(policyName);
        return rateLimiter.getStatus(new RateLimitKey(policy.name(), clientKey), policy);
    }

    /**
     * Lift any block and restore full points for a key.
     *
     * @param policyName the policy name
     * @param clientKey the client key
     * @return completion signal
     */
    public Uni<Void> reset(String policyName, String clientKey) {
        final var policy = policies.resolve(policyName);
        LOG.infof("Resetting rate limit bucket %s for %s", policy.name(), clientKey);
        return rateLimiter.reset(new RateLimitKey(policy.name(), clientKey));
    }

    /**
     * Drop buckets idle for longer than their policy's window plus block.
     *
     * @return number of buckets removed
     */
    public int evictIdleBuckets() {
        final var evicted = rateLimiter.evictIdle(name -> policies.find(name).orElse(null));
        if (evicted > 0) {
            LOG.debugf("Evicted %d idle rate limit buckets", evicted);
        }
        return evicted;
    }

    @Scheduled(
            every = "${shipguard.rate-limiting.eviction-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledEviction() {
        evictIdleBuckets();
    }

    private void onRejected(RateLimitKey key, RateLimitDecision decision, RateLimitContext context) {
        LOG.debugf(
                "Rate limit %s exceeded for %s, retry after %ds",
                key.policy(), key.clientKey(), decision.retryAfterSeconds());
        metrics.recordRateLimitRejected(key.policy());

        final var draft = AuditEventDraft.of(AuditEventType.RATE_LIMIT_EXCEEDED)
                .level(AuditLevel.WARN)
                .result(AuditResult.ERROR)
                .network(context.origin())
                .correlationId(context.correlationId())
                .action("Rate limit exceeded for policy " + key.policy())
                .detail("key", key.clientKey())
                .detail("policy", key.policy())
                .detail("retryAfter", decision.retryAfterSeconds())
                .detail("remainingPoints", decision.remaining());
        if (context.method() != null) {
            draft.detail("method", context.method());
        }
        if (context.path() != null) {
            draft.detail("path", context.path());
        }
        auditLog.record(draft);
    }
}
