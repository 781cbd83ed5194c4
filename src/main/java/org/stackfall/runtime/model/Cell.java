package org.stackfall.runtime.model;

/**
 * The content of a single board cell: either empty or filled by a block of a given shape.
 */
public sealed interface Cell permits Cell.Empty, Cell.Filled {

    /**
     * The shared empty cell.
     */
    Cell EMPTY = new Empty();

    /**
     * Creates a filled cell for the given shape.
     *
     * @param shape The shape whose block occupies the cell.
     * @return A filled cell.
     */
    static Cell filled(Shape shape) {
        return new Filled(shape);
    }

    default boolean isEmpty() {
        return this instanceof Empty;
    }

    record Empty() implements Cell {
    }

    record Filled(Shape shape) implements Cell {
        public Filled {
            if (shape == null) {
                throw new IllegalArgumentException("A filled cell requires a shape");
            }
        }
    }
}
