package org.stackfall.runtime.internal.services;

import org.apache.commons.math3.random.RandomAdaptor;
import org.apache.commons.math3.random.Well19937c;
import org.stackfall.runtime.model.Shape;
import org.stackfall.runtime.spi.IShapeSupplier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * Deals shapes from shuffled bags that each contain all seven shapes once, so every
 * shape appears exactly once per seven draws. Deterministic for a given seed.
 * <p>
 * Not thread-safe; the engine calls it from the consumer thread only.
 */
public final class SevenBagShapeSupplier implements IShapeSupplier {

    private final long seed;
    private final Random random;
    private final Deque<Shape> bag = new ArrayDeque<>(Shape.values().length);

    public SevenBagShapeSupplier(long seed) {
        this.seed = seed;
        // Collections.shuffle needs a java.util.Random view of the generator
        this.random = new RandomAdaptor(new Well19937c(seed));
    }

    @Override
    public Shape nextShape() {
        if (bag.isEmpty()) {
            refill();
        }
        return bag.poll();
    }

    /**
     * @return The number of shapes left in the current bag.
     */
    public int remainingInBag() {
        return bag.size();
    }

    public long getSeed() {
        return seed;
    }

    private void refill() {
        List<Shape> shapes = new ArrayList<>(Arrays.asList(Shape.values()));
        Collections.shuffle(shapes, random);
        bag.addAll(shapes);
    }
}
