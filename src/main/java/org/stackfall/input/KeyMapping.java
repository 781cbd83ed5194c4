package org.stackfall.input;

import org.stackfall.runtime.Input;

import java.util.Map;
import java.util.Optional;

/**
 * Keyboard layout.
 * <ul>
 *   <li>Arrows: up rotates clockwise, down/left/right move.</li>
 *   <li>{@code h}/{@code l}/{@code j} move left/right/down, {@code k} rotates clockwise,
 *       {@code z} rotates counter-clockwise (either case).</li>
 *   <li>Space hard-drops, {@code p} toggles pause, {@code q} quits.</li>
 * </ul>
 */
public final class KeyMapping {

    public static final int ESCAPE_KEY_CODE = 27;

    private static final Map<Character, Input> ARROW_KEYS = Map.of(
            'A', Input.ROTATE_CLOCKWISE,
            'B', Input.MOVE_DOWN,
            'C', Input.MOVE_RIGHT,
            'D', Input.MOVE_LEFT);

    private static final Map<Character, Input> REGULAR_KEYS = Map.ofEntries(
            Map.entry('h', Input.MOVE_LEFT),
            Map.entry('H', Input.MOVE_LEFT),
            Map.entry('l', Input.MOVE_RIGHT),
            Map.entry('L', Input.MOVE_RIGHT),
            Map.entry('j', Input.MOVE_DOWN),
            Map.entry('J', Input.MOVE_DOWN),
            Map.entry('k', Input.ROTATE_CLOCKWISE),
            Map.entry('K', Input.ROTATE_CLOCKWISE),
            Map.entry('z', Input.ROTATE_COUNTER_CLOCKWISE),
            Map.entry('Z', Input.ROTATE_COUNTER_CLOCKWISE),
            Map.entry(' ', Input.HARD_DROP),
            Map.entry('p', Input.PAUSE),
            Map.entry('P', Input.PAUSE));

    private KeyMapping() {
        // Utility class
    }

    public static Optional<Input> keyToInput(int key) {
        if (key < 0 || key > Character.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.ofNullable(REGULAR_KEYS.get((char) key));
    }

    /**
     * Maps the final byte of an {@code ESC [ x} sequence.
     */
    public static Optional<Input> arrowToInput(int key) {
        if (key < 0 || key > Character.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.ofNullable(ARROW_KEYS.get((char) key));
    }

    public static boolean isQuitKey(int key) {
        return key == 'q' || key == 'Q';
    }

    /**
     * The game input a parsed key stands for. Quit keys, timeouts and unknown sequences map to nothing.
     */
    public static Optional<Input> toInput(ParseResult result) {
        if (result instanceof ParseResult.Arrow arrow) {
            return Optional.of(arrow.input());
        }
        if (result instanceof ParseResult.Regular regular) {
            return keyToInput(regular.key());
        }
        return Optional.empty();
    }
}
