package org.stackfall.input;

import org.stackfall.runtime.Input;

import java.io.IOException;
import java.util.Optional;

/**
 * Reads keys from an {@link IKeySource}, folding {@code ESC [ A..D} sequences into arrow keys.
 * <p>
 * After an ESC byte the parser waits {@code escapeWaitMs} for the rest of the sequence and
 * {@code secondWaitMs} before the final byte. A lone ESC, or ESC followed by anything other
 * than {@code '['}, yields {@link ParseResult.Unknown}.
 */
public class EscapeSequenceParser {

    private final IKeySource source;
    private final long escapeWaitMs;
    private final long secondWaitMs;

    public EscapeSequenceParser(IKeySource source, long escapeWaitMs, long secondWaitMs) {
        if (escapeWaitMs < 0 || secondWaitMs < 0) {
            throw new IllegalArgumentException("Escape sequence waits must not be negative");
        }
        this.source = source;
        this.escapeWaitMs = escapeWaitMs;
        this.secondWaitMs = secondWaitMs;
    }

    /**
     * Reads the next key without blocking on an idle source.
     *
     * @return {@link ParseResult.Timeout} if no byte is available.
     * @throws IOException if the source fails or reaches end of input.
     */
    public ParseResult readKey() throws IOException, InterruptedException {
        if (!source.available()) {
            return ParseResult.TIMEOUT;
        }
        int key = readByte();
        if (key != KeyMapping.ESCAPE_KEY_CODE) {
            return new ParseResult.Regular(key);
        }
        return parseEscapeSequence()
                .<ParseResult>map(ParseResult.Arrow::new)
                .orElse(ParseResult.UNKNOWN);
    }

    /**
     * Parses the bytes following an ESC that was already consumed.
     */
    Optional<Input> parseEscapeSequence() throws IOException, InterruptedException {
        source.sleep(escapeWaitMs);
        if (!source.available()) {
            return Optional.empty();
        }
        if (readByte() != '[') {
            return Optional.empty();
        }
        source.sleep(secondWaitMs);
        if (!source.available()) {
            return Optional.empty();
        }
        return KeyMapping.arrowToInput(readByte());
    }

    private int readByte() throws IOException {
        int value = source.read();
        if (value < 0) {
            throw new IOException("Key source reached end of input");
        }
        return value;
    }
}
