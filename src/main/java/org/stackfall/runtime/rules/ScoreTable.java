package org.stackfall.runtime.rules;

/**
 * Base scores for clearing one to four lines with a single lock. The awarded score is
 * the base value multiplied by the level at the time of the clear.
 *
 * @param single Base score for one line.
 * @param dbl    Base score for two lines.
 * @param triple Base score for three lines.
 * @param tetris Base score for four lines.
 */
public record ScoreTable(int single, int dbl, int triple, int tetris) {

    public static final ScoreTable CLASSIC = new ScoreTable(100, 300, 500, 800);

    public ScoreTable {
        if (single < 0 || dbl < 0 || triple < 0 || tetris < 0) {
            throw new IllegalArgumentException("Base scores must not be negative");
        }
    }

    /**
     * @param lines The number of lines cleared at once.
     * @return The base score, or 0 for any count other than 1 to 4.
     */
    public int baseFor(int lines) {
        return switch (lines) {
            case 1 -> single;
            case 2 -> dbl;
            case 3 -> triple;
            case 4 -> tetris;
            default -> 0;
        };
    }
}
