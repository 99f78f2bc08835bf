package fr.lapetina.avatar.delivery.domain.model;

/**
 * Health status of an avatar provider.
 *
 * HEALTHY: in full rotation
 * DEGRADED: recent consecutive failures, still selectable behind healthy providers
 * UNHEALTHY: excluded from rotation until its cooldown elapses and a canary succeeds
 */
public enum HealthState {
    HEALTHY(0, 2),
    DEGRADED(1, 1),
    UNHEALTHY(2, 0);

    private final int selectionTier;
    private final int gaugeValue;

    HealthState(int selectionTier, int gaugeValue) {
        this.selectionTier = selectionTier;
        this.gaugeValue = gaugeValue;
    }

    /**
     * Lower tiers are offered first.
     */
    public int selectionTier() {
        return selectionTier;
    }

    public int gaugeValue() {
        return gaugeValue;
    }
}
