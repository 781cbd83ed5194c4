package org.stackfall.runtime.internal.services;

import org.stackfall.runtime.model.Shape;
import org.stackfall.runtime.spi.IShapeSupplier;

import java.util.List;

/**
 * Cycles through a fixed list of shapes. Used for scripted sessions and tests.
 */
public final class SequenceShapeSupplier implements IShapeSupplier {

    private final List<Shape> shapes;
    private int index = 0;

    public SequenceShapeSupplier(List<Shape> shapes) {
        if (shapes == null || shapes.isEmpty()) {
            throw new IllegalArgumentException("At least one shape is required");
        }
        this.shapes = List.copyOf(shapes);
    }

    public static SequenceShapeSupplier of(Shape... shapes) {
        return new SequenceShapeSupplier(List.of(shapes));
    }

    @Override
    public Shape nextShape() {
        Shape shape = shapes.get(index);
        index = (index + 1) % shapes.size();
        return shape;
    }

    /**
     * @return The index of the shape the next call returns.
     */
    public int position() {
        return index;
    }
}
