package org.stackfall.engine;

import org.stackfall.replay.ReplayData;
import org.stackfall.runtime.model.GameState;

import java.util.Optional;

/**
 * Outcome of a live session.
 *
 * @param finalState The last fully applied state.
 * @param replay     The recording, present if the session was recorded.
 */
public record SessionResult(GameState finalState, Optional<ReplayData> replay) {
}
