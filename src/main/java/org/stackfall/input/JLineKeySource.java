package org.stackfall.input;

import org.jline.terminal.Terminal;
import org.jline.utils.NonBlockingReader;

import java.io.IOException;

/**
 * {@link IKeySource} over a JLine terminal. The terminal must already be in raw mode.
 */
public class JLineKeySource implements IKeySource {

    private static final long PEEK_TIMEOUT_MS = 1;

    private final NonBlockingReader reader;

    public JLineKeySource(Terminal terminal) {
        this.reader = terminal.reader();
    }

    /**
     * End of input counts as available so the following {@link #read()} reports it.
     */
    @Override
    public boolean available() throws IOException {
        return reader.peek(PEEK_TIMEOUT_MS) != NonBlockingReader.READ_EXPIRED;
    }

    @Override
    public int read() throws IOException {
        return reader.read();
    }
}
