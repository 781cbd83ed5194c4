package org.stackfall.runtime.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The falling piece: a shape placed at a pivot position in one of four rotations.
 * Movement methods return new instances; validity against a board is checked by
 * {@link org.stackfall.runtime.CollisionResolver}.
 *
 * @param shape    The tetromino kind.
 * @param position The pivot position on the board.
 * @param rotation The current orientation.
 */
public record ActivePiece(Shape shape, Position position, Rotation rotation) {

    private static final Position LEFT = new Position(-1, 0);
    private static final Position RIGHT = new Position(1, 0);
    private static final Position DOWN = new Position(0, 1);

    /**
     * Places a freshly spawned piece: pivot at {@code (boardWidth / 2, 1)}, rotation 0.
     *
     * @param shape      The shape to spawn.
     * @param boardWidth The width of the board the piece spawns on.
     * @return The spawned piece.
     */
    public static ActivePiece spawn(Shape shape, int boardWidth) {
        return new ActivePiece(shape, new Position(boardWidth / 2, 1), Rotation.R0);
    }

    /**
     * Computes the absolute board positions of the four blocks. Recomputed on every call.
     *
     * @return The block positions in the order of {@link Shape#baseOffsets()}.
     */
    public List<Position> blocks() {
        List<Position> result = new ArrayList<>(4);
        for (Position offset : shape.baseOffsets()) {
            result.add(rotation.apply(offset).plus(position));
        }
        return result;
    }

    public ActivePiece moveLeft() {
        return movedBy(LEFT);
    }

    public ActivePiece moveRight() {
        return movedBy(RIGHT);
    }

    public ActivePiece moveDown() {
        return movedBy(DOWN);
    }

    public ActivePiece movedBy(Position offset) {
        return new ActivePiece(shape, position.plus(offset), rotation);
    }

    public ActivePiece rotateClockwise() {
        return new ActivePiece(shape, position, rotation.clockwise());
    }

    public ActivePiece rotateCounterClockwise() {
        return new ActivePiece(shape, position, rotation.counterClockwise());
    }
}
