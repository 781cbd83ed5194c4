package org.stackfall.replay;

import org.stackfall.runtime.Input;
import org.stackfall.runtime.model.Shape;

/**
 * One entry of a replay log. Events are ordered by non-decreasing frame number.
 */
public sealed interface ReplayEvent permits ReplayEvent.PlayerInput, ReplayEvent.PieceSpawn {

    long frameNumber();

    /**
     * An input applied to the state machine in the given frame.
     */
    record PlayerInput(Input input, long frameNumber) implements ReplayEvent {
        public PlayerInput {
            if (input == null) {
                throw new IllegalArgumentException("input is required");
            }
            if (frameNumber < 0) {
                throw new IllegalArgumentException("frameNumber must not be negative");
            }
        }
    }

    /**
     * The shape drawn from the supplier when a piece locked in the given frame.
     */
    record PieceSpawn(Shape shape, long frameNumber) implements ReplayEvent {
        public PieceSpawn {
            if (shape == null) {
                throw new IllegalArgumentException("shape is required");
            }
            if (frameNumber < 0) {
                throw new IllegalArgumentException("frameNumber must not be negative");
            }
        }
    }
}
