package com.contextfusion.common.boost;

/**
 * Tunables for {@link SessionPriorityBoost}.
 *
 * @param enabled           master switch
 * @param multiplier        factor applied to the session signal's weight (1–10)
 * @param dampeningFactor   factor applied to every other signal's weight, in (0, 1]
 * @param weakThreshold     foreground voting power below this counts as weak, in [0, 1]
 */
public record BoostSettings(
    boolean enabled,
    double multiplier,
    double dampeningFactor,
    double weakThreshold
) {

    public static final double DEFAULT_MULTIPLIER       = 2.0;
    public static final double DEFAULT_DAMPENING_FACTOR = 0.5;
    public static final double DEFAULT_WEAK_THRESHOLD   = 0.3;

    public static BoostSettings defaults() {
        return new BoostSettings(true, DEFAULT_MULTIPLIER, DEFAULT_DAMPENING_FACTOR, DEFAULT_WEAK_THRESHOLD);
    }

    public BoostSettings withEnabled(boolean value) {
        return new BoostSettings(value, multiplier, dampeningFactor, weakThreshold);
    }

    public BoostSettings withMultiplier(double value) {
        return new BoostSettings(enabled, value, dampeningFactor, weakThreshold);
    }

    public BoostSettings withDampeningFactor(double value) {
        return new BoostSettings(enabled, multiplier, value, weakThreshold);
    }

    public BoostSettings withWeakThreshold(double value) {
        return new BoostSettings(enabled, multiplier, dampeningFactor, value);
    }
}
