package org.stackfall.engine;

import org.stackfall.runtime.Input;

/**
 * Commands carried from the producers to the consumer loop.
 */
public enum GameCommand {
    MOVE_LEFT(Input.MOVE_LEFT),
    MOVE_RIGHT(Input.MOVE_RIGHT),
    SOFT_DROP(Input.MOVE_DOWN),
    ROTATE_CW(Input.ROTATE_CLOCKWISE),
    ROTATE_CCW(Input.ROTATE_COUNTER_CLOCKWISE),
    HARD_DROP(Input.HARD_DROP),
    TOGGLE_PAUSE(Input.PAUSE),
    TICK(Input.TICK),
    QUIT(Input.QUIT);

    private final Input input;

    GameCommand(Input input) {
        this.input = input;
    }

    public Input toInput() {
        return input;
    }

    public static GameCommand fromInput(Input input) {
        for (GameCommand command : values()) {
            if (command.input == input) {
                return command;
            }
        }
        throw new IllegalArgumentException("No command for input " + input);
    }
}
