package org.stackfall.runtime.rules;

/**
 * Level progression: the level rises by one for every {@code linesPerLevel} lines.
 *
 * @param linesPerLevel Lines needed per level, must be positive.
 * @param startLevel    The level of a fresh game, must be positive.
 */
public record LevelParams(int linesPerLevel, int startLevel) {

    public static final LevelParams DEFAULT = new LevelParams(10, 1);

    public LevelParams {
        if (linesPerLevel <= 0) {
            throw new IllegalArgumentException("linesPerLevel must be positive, got " + linesPerLevel);
        }
        if (startLevel <= 0) {
            throw new IllegalArgumentException("startLevel must be positive, got " + startLevel);
        }
    }
}
