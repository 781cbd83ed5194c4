package org.stackfall.runtime.rules;

/**
 * All tunable parameters the state machine consumes. Built from configuration by
 * {@link org.stackfall.config.GameConfiguration}; tests construct it directly.
 *
 * @param boardWidth  Number of columns.
 * @param boardHeight Number of rows.
 * @param scoreTable  Line clear base scores.
 * @param levels      Level progression.
 * @param speed       Drop interval parameters.
 */
public record GameRules(
        int boardWidth,
        int boardHeight,
        ScoreTable scoreTable,
        LevelParams levels,
        SpeedParams speed
) {

    public static final GameRules STANDARD = new GameRules(10, 20, ScoreTable.CLASSIC, LevelParams.DEFAULT, SpeedParams.DEFAULT);

    public GameRules {
        if (boardWidth <= 0 || boardHeight <= 0) {
            throw new IllegalArgumentException("Board dimensions must be positive, got " + boardWidth + "x" + boardHeight);
        }
        if (scoreTable == null || levels == null || speed == null) {
            throw new IllegalArgumentException("scoreTable, levels and speed are required");
        }
    }

    /**
     * Returns these rules with a different board size.
     */
    public GameRules withBoard(int width, int height) {
        if (width == boardWidth && height == boardHeight) {
            return this;
        }
        return new GameRules(width, height, scoreTable, levels, speed);
    }
}
