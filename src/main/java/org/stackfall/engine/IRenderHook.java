package org.stackfall.engine;

import org.stackfall.runtime.model.GameState;

/**
 * Receives every state the consumer loop produces, including the initial one.
 * Called on the consumer thread; implementations should return quickly.
 */
@FunctionalInterface
public interface IRenderHook {

    void onStateChanged(GameState state);

    IRenderHook NONE = state -> { };
}
