package org.stackfall.runtime.internal.services;

import org.apache.commons.math3.random.Well19937c;
import org.stackfall.runtime.model.Shape;
import org.stackfall.runtime.spi.IShapeSupplier;

/**
 * Draws each shape uniformly and independently from a seeded {@link Well19937c}.
 * The same seed always yields the same sequence.
 * <p>
 * Not thread-safe; the engine calls it from the consumer thread only.
 */
public final class RandomShapeSupplier implements IShapeSupplier {

    private static final Shape[] SHAPES = Shape.values();

    private final long seed;
    private final Well19937c rng;

    /**
     * @param seed The initial seed for the random number generator.
     */
    public RandomShapeSupplier(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    @Override
    public Shape nextShape() {
        return SHAPES[rng.nextInt(SHAPES.length)];
    }

    public long getSeed() {
        return seed;
    }
}
