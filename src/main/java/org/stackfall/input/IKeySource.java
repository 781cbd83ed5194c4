package org.stackfall.input;

import java.io.IOException;

/**
 * Raw byte source for keyboard input.
 */
public interface IKeySource {

    /**
     * @return Whether a byte can be read without blocking.
     */
    boolean available() throws IOException;

    /**
     * Reads one byte.
     *
     * @return The byte value, or -1 at end of input.
     */
    int read() throws IOException;

    /**
     * Waits before the next availability check. Lets tests run escape-sequence timing without real sleeps.
     */
    default void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }
}
