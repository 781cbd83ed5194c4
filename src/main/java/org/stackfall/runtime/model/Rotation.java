package org.stackfall.runtime.model;

/**
 * The four discrete orientations of a piece. Clockwise and counter-clockwise successors
 * form a 4-cycle.
 */
public enum Rotation {
    R0,
    R90,
    R180,
    R270;

    public Rotation clockwise() {
        return switch (this) {
            case R0 -> R90;
            case R90 -> R180;
            case R180 -> R270;
            case R270 -> R0;
        };
    }

    public Rotation counterClockwise() {
        return switch (this) {
            case R0 -> R270;
            case R90 -> R0;
            case R180 -> R90;
            case R270 -> R180;
        };
    }

    /**
     * Rotates a rotation-0 offset around the pivot into this orientation.
     *
     * @param offset The offset relative to the pivot at rotation 0.
     * @return The offset relative to the pivot in this orientation.
     */
    public Position apply(Position offset) {
        return switch (this) {
            case R0 -> offset;
            case R90 -> new Position(-offset.y(), offset.x());
            case R180 -> new Position(-offset.x(), -offset.y());
            case R270 -> new Position(offset.y(), -offset.x());
        };
    }
}
