package shipguard.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for anomaly detection rules and alert delivery.
 *
 * <p>Each rule has a threshold, a window and a cool-down. The cool-down
 * suppresses repeated violations for the same (rule, subject) while the
 * condition persists; it defaults to the rule window.
 */
@ConfigMapping(prefix = "shipguard.anomaly")
public interface AnomalyConfig {

    /**
     * Master toggle for anomaly detection.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Lowest violation level forwarded to alert channels (info, warn, error, critical).
     */
    @WithName("alert-threshold")
    @WithDefault("error")
    String alertThreshold();

    /**
     * Repeated failed logins for the same account.
     */
    @WithName("repeated-login-failure")
    RuleConfig repeatedLoginFailure();

    /**
     * Event volume from one client IP.
     */
    @WithName("source-volume")
    RuleConfig sourceVolume();

    /**
     * Log-wide cluster of high-risk events.
     */
    @WithName("risk-cluster")
    RiskClusterConfig riskCluster();

    /**
     * Webhook alert channel.
     */
    WebhookConfig webhook();

    interface RuleConfig {
        @WithDefault("true")
        boolean enabled();

        /**
         * Event count at which the rule fires.
         */
        int threshold();

        /**
         * Sliding window the events are counted in.
         */
        Duration window();

        /**
         * Suppression period after the rule fires for a subject. Defaults to the window.
         */
        Optional<Duration> cooldown();
    }

    interface RiskClusterConfig extends RuleConfig {

        /**
         * Minimum risk score for an event to count towards the cluster.
         */
        @WithName("min-risk-score")
        @WithDefault("6")
        int minRiskScore();
    }

    interface WebhookConfig {

        /**
         * Target URL. The webhook channel is inactive when absent.
         */
        Optional<String> url();

        @WithDefault("PT5S")
        Duration timeout();
    }
}
