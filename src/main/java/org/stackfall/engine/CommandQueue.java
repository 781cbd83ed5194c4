package org.stackfall.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO between the producers and the consumer loop, backed by {@link ArrayBlockingQueue}.
 * <p>
 * {@link #put(GameCommand)} blocks while the queue is full, so a slow consumer throttles
 * the producers instead of losing input.
 */
public class CommandQueue {

    public static final int DEFAULT_CAPACITY = 100;

    private final ArrayBlockingQueue<GameCommand> queue;
    private final int capacity;

    public CommandQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Creates a queue from an options block with an optional {@code capacity} key.
     *
     * @throws IllegalArgumentException if the capacity is not a positive integer.
     */
    public CommandQueue(Config options) {
        this(readCapacity(options));
    }

    private static int readCapacity(Config options) {
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of("capacity", DEFAULT_CAPACITY)));
        try {
            return finalConfig.getInt("capacity");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for CommandQueue", e);
        }
    }

    /**
     * Appends a command, waiting for space if necessary.
     */
    public void put(GameCommand command) throws InterruptedException {
        if (command == null) {
            throw new NullPointerException("command cannot be null");
        }
        queue.put(command);
    }

    /**
     * Appends a command if space is available right now.
     *
     * @return {@code false} if the queue is full.
     */
    public boolean offer(GameCommand command) {
        if (command == null) {
            throw new NullPointerException("command cannot be null");
        }
        return queue.offer(command);
    }

    /**
     * Removes the oldest command, waiting until one is available.
     */
    public GameCommand take() throws InterruptedException {
        return queue.take();
    }

    /**
     * @return The oldest command, or {@code null} if none arrived within the timeout.
     */
    public GameCommand poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int size() {
        return queue.size();
    }

    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        queue.clear();
    }
}
