package org.stackfall.runtime.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * An immutable rectangular grid of {@link Cell}s.
 * <p>
 * Every mutating operation returns a new board and leaves this instance untouched, so
 * earlier game states stay valid for rendering and replay comparison. Row arrays are
 * never written after construction, which lets a new board share the rows it did not
 * change with its predecessor.
 * <p>
 * Row 0 is the top of the board.
 */
public final class Board {

    private final Cell[][] rows;
    private final int width;
    private final int height;

    private Board(Cell[][] rows, int width, int height) {
        this.rows = rows;
        this.width = width;
        this.height = height;
    }

    /**
     * Creates a board where every cell is empty.
     *
     * @param width  The number of columns, must be positive.
     * @param height The number of rows, must be positive.
     * @return The empty board.
     * @throws IllegalArgumentException if a dimension is not positive.
     */
    public static Board empty(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Board dimensions must be positive, got " + width + "x" + height);
        }
        Cell[][] rows = new Cell[height][];
        Cell[] emptyRow = emptyRow(width);
        for (int y = 0; y < height; y++) {
            rows[y] = emptyRow;
        }
        return new Board(rows, width, height);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean isInBounds(Position pos) {
        return pos.x() >= 0 && pos.x() < width && pos.y() >= 0 && pos.y() < height;
    }

    /**
     * @param pos The position to look up.
     * @return The cell, or empty if the position lies outside the board.
     */
    public Optional<Cell> get(Position pos) {
        if (!isInBounds(pos)) {
            return Optional.empty();
        }
        return Optional.of(rows[pos.y()][pos.x()]);
    }

    /**
     * @return true only if the position is on the board and holds an empty cell.
     */
    public boolean isEmpty(Position pos) {
        return isInBounds(pos) && rows[pos.y()][pos.x()].isEmpty();
    }

    /**
     * Returns a board with the given cell written at {@code pos}. Out-of-bounds positions
     * are ignored and this board is returned unchanged.
     */
    public Board place(Position pos, Cell cell) {
        if (!isInBounds(pos)) {
            return this;
        }
        Cell[][] newRows = rows.clone();
        Cell[] newRow = rows[pos.y()].clone();
        newRow[pos.x()] = cell;
        newRows[pos.y()] = newRow;
        return new Board(newRows, width, height);
    }

    /**
     * Stamps all blocks of the piece onto the board as filled cells of the piece's shape.
     * Blocks outside the board are dropped.
     */
    public Board placePiece(ActivePiece piece) {
        Cell cell = Cell.filled(piece.shape());
        Cell[][] newRows = rows.clone();
        boolean changed = false;
        for (Position pos : piece.blocks()) {
            if (!isInBounds(pos)) {
                continue;
            }
            if (newRows[pos.y()] == rows[pos.y()]) {
                newRows[pos.y()] = rows[pos.y()].clone();
            }
            newRows[pos.y()][pos.x()] = cell;
            changed = true;
        }
        return changed ? new Board(newRows, width, height) : this;
    }

    /**
     * @return The indices of all rows in which no cell is empty, in ascending order.
     */
    public List<Integer> completedRows() {
        List<Integer> completed = new ArrayList<>();
        for (int y = 0; y < height; y++) {
            if (isRowComplete(rows[y])) {
                completed.add(y);
            }
        }
        return completed;
    }

    /**
     * Removes the given rows, shifts every row above them down and fills the top with as
     * many empty rows as were removed. The order of the indices does not matter;
     * duplicates and indices outside the board are ignored.
     */
    public Board clearRows(Collection<Integer> indices) {
        Set<Integer> toRemove = new TreeSet<>();
        for (Integer index : indices) {
            if (index != null && index >= 0 && index < height) {
                toRemove.add(index);
            }
        }
        if (toRemove.isEmpty()) {
            return this;
        }

        Cell[][] newRows = new Cell[height][];
        int target = height - 1;
        for (int y = height - 1; y >= 0; y--) {
            if (!toRemove.contains(y)) {
                newRows[target--] = rows[y];
            }
        }
        Cell[] emptyRow = emptyRow(width);
        while (target >= 0) {
            newRows[target--] = emptyRow;
        }
        return new Board(newRows, width, height);
    }

    /**
     * @param y The row index.
     * @return An unmodifiable copy of the row.
     * @throws IndexOutOfBoundsException if the row does not exist.
     */
    public List<Cell> row(int y) {
        if (y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Row " + y + " outside board of height " + height);
        }
        return Collections.unmodifiableList(Arrays.asList(rows[y].clone()));
    }

    public int filledCellCount() {
        int count = 0;
        for (Cell[] row : rows) {
            for (Cell cell : row) {
                if (!cell.isEmpty()) {
                    count++;
                }
            }
        }
        return count;
    }

    private static boolean isRowComplete(Cell[] row) {
        for (Cell cell : row) {
            if (cell.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static Cell[] emptyRow(int width) {
        Cell[] row = new Cell[width];
        Arrays.fill(row, Cell.EMPTY);
        return row;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board other)) return false;
        return width == other.width && height == other.height && Arrays.deepEquals(rows, other.rows);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.deepHashCode(rows);
    }

    @Override
    public String toString() {
        return "Board{" + width + "x" + height + ", filled=" + filledCellCount() + "}";
    }
}
