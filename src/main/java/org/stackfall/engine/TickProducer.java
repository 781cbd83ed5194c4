package org.stackfall.engine;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Emits {@link GameCommand#TICK} at the current drop interval.
 * <p>
 * The interval is re-read from the shared cell before every sleep, so a level change written
 * by the consumer takes effect from the next tick on.
 */
public class TickProducer extends AbstractProducer {

    private final AtomicLong intervalMs;

    public TickProducer(CommandQueue queue, AtomicLong intervalMs) {
        super(queue);
        this.intervalMs = intervalMs;
    }

    @Override
    protected void produce() throws InterruptedException {
        while (!Thread.currentThread().isInterrupted()) {
            Thread.sleep(Math.max(1, intervalMs.get()));
            queue.put(GameCommand.TICK);
        }
    }
}
