package org.stackfall.runtime.spi;

import org.stackfall.runtime.model.Shape;

/**
 * Supplies the shape of the next previewed piece.
 * <p>
 * This is the only source of nondeterminism the state machine sees. Live play injects a
 * seeded random implementation, tests inject fixed sequences, and replay playback injects
 * the shapes recorded in the event log, so all three share the same state machine code.
 * <p>
 * The state machine calls {@link #nextShape()} exactly once per piece lock.
 */
@FunctionalInterface
public interface IShapeSupplier {

    /**
     * @return The shape to put into the preview slot.
     */
    Shape nextShape();
}
