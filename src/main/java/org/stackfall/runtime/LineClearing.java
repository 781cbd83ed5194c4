package org.stackfall.runtime;

import org.stackfall.runtime.model.Board;
import org.stackfall.runtime.rules.LevelParams;
import org.stackfall.runtime.rules.ScoreTable;
import org.stackfall.runtime.rules.SpeedParams;

import java.util.List;

/**
 * Row clearing and the score, level and speed formulas.
 */
public final class LineClearing {

    /**
     * @param board        The board after clearing.
     * @param linesCleared Number of rows removed.
     * @param scoreGained  Score awarded for the clear.
     */
    public record ClearResult(Board board, int linesCleared, int scoreGained) {
    }

    private LineClearing() {
        // Utility class
    }

    /**
     * Clears every completed row. When no row is complete the input board is returned
     * as-is with zero gain.
     */
    public static ClearResult clearLines(Board board, int level, ScoreTable scoreTable) {
        List<Integer> completed = board.completedRows();
        if (completed.isEmpty()) {
            return new ClearResult(board, 0, 0);
        }
        int lines = completed.size();
        return new ClearResult(board.clearRows(completed), lines, calculateScore(lines, level, scoreTable));
    }

    public static int calculateScore(int linesCleared, int level, ScoreTable scoreTable) {
        return scoreTable.baseFor(linesCleared) * level;
    }

    /**
     * The level rises exactly at each multiple of {@code linesPerLevel}.
     */
    public static int calculateLevel(int totalLinesCleared, LevelParams levels) {
        return levels.startLevel() + totalLinesCleared / levels.linesPerLevel();
    }

    /**
     * Linear decrease per level above 1, clamped at the minimum interval.
     */
    public static long dropInterval(int level, SpeedParams speed) {
        long decrease = (long) (level - 1) * speed.decreasePerLevelMs();
        return Math.max(speed.minIntervalMs(), speed.baseIntervalMs() - decrease);
    }
}
