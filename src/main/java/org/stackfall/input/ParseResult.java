package org.stackfall.input;

import org.stackfall.runtime.Input;

/**
 * Outcome of reading one key from an {@link IKeySource}.
 */
public sealed interface ParseResult
        permits ParseResult.Arrow, ParseResult.Regular, ParseResult.Timeout, ParseResult.Unknown {

    /**
     * A complete {@code ESC [ A..D} sequence.
     */
    record Arrow(Input input) implements ParseResult {
    }

    /**
     * A single non-escape byte.
     */
    record Regular(int key) implements ParseResult {
    }

    /**
     * No byte was available.
     */
    record Timeout() implements ParseResult {
    }

    /**
     * An escape sequence that was incomplete or not recognized.
     */
    record Unknown() implements ParseResult {
    }

    ParseResult TIMEOUT = new Timeout();
    ParseResult UNKNOWN = new Unknown();
}
