package org.stackfall.engine;

import org.stackfall.input.EscapeSequenceParser;
import org.stackfall.input.KeyMapping;
import org.stackfall.input.ParseResult;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Optional;

/**
 * Decodes keystrokes into commands.
 * <p>
 * Polls the parser; when no key is available it sleeps for the poll interval. A quit key
 * enqueues {@link GameCommand#QUIT} and ends the producer. Unmapped keys are dropped.
 * An I/O failure of the key source is logged and ends the producer. An interrupt that the
 * key source reports as {@link InterruptedIOException} is treated as a stop request.
 */
public class KeyboardInputProducer extends AbstractProducer {

    private final EscapeSequenceParser parser;
    private final long pollIntervalMs;

    public KeyboardInputProducer(CommandQueue queue, EscapeSequenceParser parser, long pollIntervalMs) {
        super(queue);
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive, got " + pollIntervalMs);
        }
        this.parser = parser;
        this.pollIntervalMs = pollIntervalMs;
    }

    @Override
    protected void produce() throws InterruptedException {
        while (!Thread.currentThread().isInterrupted()) {
            ParseResult result;
            try {
                result = parser.readKey();
            } catch (InterruptedIOException e) {
                log.debug("Key source interrupted, shutting down");
                Thread.currentThread().interrupt();
                return;
            } catch (IOException e) {
                log.warn("Keyboard input failed, no further keys will be read: {}", e.getMessage());
                return;
            }

            if (result instanceof ParseResult.Timeout) {
                Thread.sleep(pollIntervalMs);
                continue;
            }
            if (result instanceof ParseResult.Regular regular && KeyMapping.isQuitKey(regular.key())) {
                log.debug("Quit key pressed");
                queue.put(GameCommand.QUIT);
                return;
            }
            Optional<GameCommand> command = KeyMapping.toInput(result).map(GameCommand::fromInput);
            if (command.isPresent()) {
                queue.put(command.get());
            } else {
                log.trace("Ignoring unmapped key {}", result);
            }
        }
    }
}
