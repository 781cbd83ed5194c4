package org.stackfall.runtime;

import org.stackfall.runtime.model.ActivePiece;
import org.stackfall.runtime.model.Board;
import org.stackfall.runtime.model.Position;
import org.stackfall.runtime.model.Shape;

import java.util.List;
import java.util.Optional;

/**
 * Validity checks for pieces against a board, and the wall-kick rotation search.
 * <p>
 * A piece is valid when all four blocks lie inside the board and on empty cells. Blocks
 * above the top edge (negative y) count as invalid.
 */
public final class CollisionResolver {

    /**
     * What a piece collides with, checked in declaration order.
     */
    public enum CollisionType {
        NONE,
        WALL,
        FLOOR,
        CEILING,
        BLOCK
    }

    private static final List<Position> I_KICKS = List.of(
            new Position(0, 0),
            new Position(-2, 0),
            new Position(2, 0),
            new Position(-2, 1),
            new Position(2, -1));

    private static final List<Position> O_KICKS = List.of(new Position(0, 0));

    private static final List<Position> DEFAULT_KICKS = List.of(
            new Position(0, 0),
            new Position(-1, 0),
            new Position(1, 0),
            new Position(0, -1),
            new Position(-1, -1),
            new Position(1, -1));

    private CollisionResolver() {
        // Utility class
    }

    public static boolean isValidPosition(ActivePiece piece, Board board) {
        for (Position pos : piece.blocks()) {
            if (!board.isEmpty(pos)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Classifies why a piece is invalid. Used for diagnostics only; the game rules rely on
     * {@link #isValidPosition(ActivePiece, Board)}.
     */
    public static CollisionType detectCollision(ActivePiece piece, Board board) {
        List<Position> blocks = piece.blocks();
        if (blocks.stream().anyMatch(p -> p.x() < 0 || p.x() >= board.width())) {
            return CollisionType.WALL;
        }
        if (blocks.stream().anyMatch(p -> p.y() >= board.height())) {
            return CollisionType.FLOOR;
        }
        if (blocks.stream().anyMatch(p -> p.y() < 0)) {
            return CollisionType.CEILING;
        }
        if (blocks.stream().anyMatch(p -> !board.isEmpty(p))) {
            return CollisionType.BLOCK;
        }
        return CollisionType.NONE;
    }

    /**
     * @return true if the piece is valid where it is but would be invalid one row lower.
     */
    public static boolean hasLanded(ActivePiece piece, Board board) {
        return isValidPosition(piece, board) && !isValidPosition(piece.moveDown(), board);
    }

    /**
     * Moves the piece down while the next row is still valid.
     *
     * @return The lowest reachable position, or the piece itself if it cannot move.
     */
    public static ActivePiece hardDropPosition(ActivePiece piece, Board board) {
        ActivePiece current = piece;
        for (int steps = 0; steps <= board.height(); steps++) {
            ActivePiece next = current.moveDown();
            if (!isValidPosition(next, board)) {
                return current;
            }
            current = next;
        }
        return current;
    }

    /**
     * Rotates the piece and tries the shape's kick offsets in priority order; the first
     * offset that yields a valid position wins.
     *
     * @return The rotated (and possibly shifted) piece, or empty if every offset fails.
     */
    public static Optional<ActivePiece> tryRotate(ActivePiece piece, Board board, boolean clockwise) {
        ActivePiece rotated = clockwise ? piece.rotateClockwise() : piece.rotateCounterClockwise();
        for (Position offset : kickOffsets(piece.shape())) {
            ActivePiece candidate = rotated.movedBy(offset);
            if (isValidPosition(candidate, board)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The kick offsets tried for the shape, in priority order.
     */
    public static List<Position> kickOffsets(Shape shape) {
        return switch (shape) {
            case I -> I_KICKS;
            case O -> O_KICKS;
            default -> DEFAULT_KICKS;
        };
    }

    /**
     * @return true if a freshly spawned piece does not fit.
     */
    public static boolean isGameOver(ActivePiece spawned, Board board) {
        return !isValidPosition(spawned, board);
    }
}
