package org.stackfall.runtime.model;

import java.util.List;

/**
 * The seven tetromino kinds with their block offsets at rotation 0, relative to the pivot.
 */
public enum Shape {
    I(List.of(new Position(-1, 0), new Position(0, 0), new Position(1, 0), new Position(2, 0))),
    O(List.of(new Position(0, 0), new Position(1, 0), new Position(0, 1), new Position(1, 1))),
    T(List.of(new Position(-1, 0), new Position(0, 0), new Position(1, 0), new Position(0, -1))),
    S(List.of(new Position(-1, 0), new Position(0, 0), new Position(0, -1), new Position(1, -1))),
    Z(List.of(new Position(-1, -1), new Position(0, -1), new Position(0, 0), new Position(1, 0))),
    J(List.of(new Position(-1, -1), new Position(-1, 0), new Position(0, 0), new Position(1, 0))),
    L(List.of(new Position(-1, 0), new Position(0, 0), new Position(1, 0), new Position(1, -1)));

    private final List<Position> baseOffsets;

    Shape(List<Position> baseOffsets) {
        this.baseOffsets = baseOffsets;
    }

    /**
     * @return The four block offsets at rotation 0. The list is immutable.
     */
    public List<Position> baseOffsets() {
        return baseOffsets;
    }
}
