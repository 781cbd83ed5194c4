package org.stackfall.runtime;

/**
 * The alphabet of the game state machine.
 */
public enum Input {
    MOVE_LEFT,
    MOVE_RIGHT,
    MOVE_DOWN,
    ROTATE_CLOCKWISE,
    ROTATE_COUNTER_CLOCKWISE,
    HARD_DROP,
    PAUSE,
    QUIT,
    TICK
}
