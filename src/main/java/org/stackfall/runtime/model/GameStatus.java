package org.stackfall.runtime.model;

/**
 * The top-level lifecycle of a game. {@link #GAME_OVER} is terminal.
 */
public enum GameStatus {
    PLAYING,
    PAUSED,
    GAME_OVER
}
