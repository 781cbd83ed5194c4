package org.stackfall.replay;

import org.stackfall.runtime.model.GameState;
import org.stackfall.runtime.model.Shape;

import java.util.List;

/**
 * Immutable playback position of a replay.
 *
 * @param gameState      The reconstructed game state after all applied frames.
 * @param events         The full event log being played.
 * @param nextEventIndex Index of the first event not yet applied.
 * @param currentFrame   The frame the next {@link ReplayPlayer#advanceFrame} call applies.
 * @param pendingShapes  Shapes announced by spawn events and not yet consumed by a lock, oldest first.
 * @param finished       Whether playback has ended.
 */
public record ReplayPlayerState(
        GameState gameState,
        List<ReplayEvent> events,
        int nextEventIndex,
        long currentFrame,
        List<Shape> pendingShapes,
        boolean finished
) {

    public ReplayPlayerState {
        events = List.copyOf(events);
        pendingShapes = List.copyOf(pendingShapes);
    }

    /**
     * @return Fraction of events applied, in {@code [0, 1]}. An empty log counts as complete.
     */
    public double progress() {
        if (events.isEmpty()) {
            return 1.0;
        }
        return (double) nextEventIndex / events.size();
    }

    public int remainingEvents() {
        return events.size() - nextEventIndex;
    }
}
