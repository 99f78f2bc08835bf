package fr.lapetina.avatar.delivery.infrastructure.health;

import fr.lapetina.avatar.delivery.infrastructure.config.AvatarClientConfig;

import java.time.Duration;

/**
 * Thresholds of the provider health state machine.
 *
 * @param degradedThreshold  consecutive failures that demote HEALTHY to DEGRADED
 * @param unhealthyThreshold further consecutive failures that demote DEGRADED to UNHEALTHY
 * @param recoveryThreshold  consecutive successes that promote DEGRADED to HEALTHY
 * @param cooldownBase       first cooldown; doubled on every flap
 * @param cooldownMax        cooldown cap
 * @param canaryLease        time after which an unresolved canary claim lapses
 */
public record HealthPolicy(
        int degradedThreshold,
        int unhealthyThreshold,
        int recoveryThreshold,
        Duration cooldownBase,
        Duration cooldownMax,
        Duration canaryLease
) {
    public HealthPolicy {
        if (degradedThreshold < 1 || unhealthyThreshold < 1 || recoveryThreshold < 1) {
            throw new IllegalArgumentException("Thresholds must be at least 1");
        }
        if (cooldownBase.isNegative() || cooldownBase.isZero() || cooldownMax.compareTo(cooldownBase) < 0) {
            throw new IllegalArgumentException("Cooldown must satisfy 0 < base <= max");
        }
    }

    public static HealthPolicy defaults() {
        return new HealthPolicy(3, 2, 2, Duration.ofSeconds(5), Duration.ofMinutes(5), Duration.ofSeconds(30));
    }

    public static HealthPolicy fromConfig(AvatarClientConfig.HealthConfig config) {
        return new HealthPolicy(
                config.getDegradedThreshold(),
                config.getUnhealthyThreshold(),
                config.getRecoveryThreshold(),
                Duration.ofMillis(config.getCooldownBaseMs()),
                Duration.ofMillis(config.getCooldownMaxMs()),
                Duration.ofMillis(config.getCanaryLeaseMs())
        );
    }

    /**
     * Cooldown for the n-th entry into UNHEALTHY: {@code min(base * 2^(n-1), max)}.
     */
    public Duration cooldownFor(int flapCount) {
        int exponent = Math.max(0, Math.min(flapCount - 1, 30));
        long millis = cooldownBase.toMillis();
        long cap = cooldownMax.toMillis();
        long scaled = millis > (cap >> exponent) ? cap : millis << exponent;
        return Duration.ofMillis(Math.min(scaled, cap));
    }
}
