package org.stackfall.runtime.model;

/**
 * A board-relative coordinate. The x axis grows to the right, the y axis grows downwards,
 * so row 0 is the top of the board.
 *
 * @param x The column.
 * @param y The row.
 */
public record Position(int x, int y) {

    public static final Position ORIGIN = new Position(0, 0);

    public Position plus(Position other) {
        return new Position(x + other.x, y + other.y);
    }

    public Position minus(Position other) {
        return new Position(x - other.x, y - other.y);
    }
}
