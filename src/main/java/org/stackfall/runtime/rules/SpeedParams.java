package org.stackfall.runtime.rules;

/**
 * Automatic drop timing. The interval shrinks linearly per level and is clamped at
 * {@code minIntervalMs}.
 *
 * @param baseIntervalMs        Interval at level 1.
 * @param minIntervalMs         Lower bound of the interval.
 * @param decreasePerLevelMs    Reduction per level above 1.
 */
public record SpeedParams(long baseIntervalMs, long minIntervalMs, long decreasePerLevelMs) {

    public static final SpeedParams DEFAULT = new SpeedParams(1000, 100, 50);

    public SpeedParams {
        if (minIntervalMs <= 0) {
            throw new IllegalArgumentException("minIntervalMs must be positive, got " + minIntervalMs);
        }
        if (baseIntervalMs < minIntervalMs) {
            throw new IllegalArgumentException("baseIntervalMs (" + baseIntervalMs
                    + ") must not be below minIntervalMs (" + minIntervalMs + ")");
        }
        if (decreasePerLevelMs < 0) {
            throw new IllegalArgumentException("decreasePerLevelMs must not be negative, got " + decreasePerLevelMs);
        }
    }
}
