package shipguard.core.service.anomaly;

import java.time.Duration;
import java.util.Objects;

import shipguard.core.config.AnomalyConfig;

/**
 * Threshold, window and cool-down of one rule.
 *
 * @param enabled whether the rule runs
 * @param threshold event count at which the rule fires
 * @param window counting window
 * @param cooldown suppression period after firing
 */
public record RuleSettings(boolean enabled, int threshold, Duration window, Duration cooldown) {

    public RuleSettings {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(cooldown, "cooldown must not be null");
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
    }

    public static RuleSettings of(int threshold, Duration window) {
        return new RuleSettings(true, threshold, window, window);
    }

    public static RuleSettings from(AnomalyConfig.RuleConfig config) {
        return new RuleSettings(
                config.enabled(),
                config.threshold(),
                config.window(),
                config.cooldown().orElse(config.window()));
    }
}
