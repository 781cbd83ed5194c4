package org.stackfall.engine;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.stackfall.junit.extensions.logging.LogWatchExtension;

import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CommandQueueTest {

    @Test
    void take_shouldReturnCommandsInFifoOrder() throws InterruptedException {
        CommandQueue queue = new CommandQueue(4);
        queue.put(GameCommand.MOVE_LEFT);
        queue.put(GameCommand.TICK);
        queue.put(GameCommand.HARD_DROP);

        assertEquals(GameCommand.MOVE_LEFT, queue.take());
        assertEquals(GameCommand.TICK, queue.take());
        assertEquals(GameCommand.HARD_DROP, queue.take());
        assertEquals(0, queue.size());
    }

    @Test
    void offer_shouldFailWhenFull() {
        CommandQueue queue = new CommandQueue(2);

        assertTrue(queue.offer(GameCommand.TICK));
        assertTrue(queue.offer(GameCommand.TICK));
        assertFalse(queue.offer(GameCommand.QUIT));
        assertEquals(0, queue.remainingCapacity());
        assertEquals(2, queue.capacity());
    }

    @Test
    @Tag("integration")
    void put_shouldBlockUntilConsumerMakesRoom() throws InterruptedException {
        CommandQueue queue = new CommandQueue(1);
        queue.put(GameCommand.TICK);
        AtomicBoolean delivered = new AtomicBoolean(false);

        Thread producer = new Thread(() -> {
            try {
                queue.put(GameCommand.QUIT);
                delivered.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        await().during(100, TimeUnit.MILLISECONDS).atMost(1, TimeUnit.SECONDS).until(() -> !delivered.get());
        assertEquals(GameCommand.TICK, queue.take());
        await().atMost(2, TimeUnit.SECONDS).untilTrue(delivered);
        assertEquals(GameCommand.QUIT, queue.take());
        producer.join(1000);
    }

    @Test
    void poll_shouldTimeOutOnEmptyQueue() throws InterruptedException {
        assertNull(new CommandQueue(1).poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void clear_shouldDropPendingCommands() {
        CommandQueue queue = new CommandQueue(3);
        queue.offer(GameCommand.TICK);
        queue.offer(GameCommand.MOVE_RIGHT);

        queue.clear();

        assertEquals(0, queue.size());
        assertEquals(3, queue.remainingCapacity());
    }

    @Test
    void constructor_shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new CommandQueue(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CommandQueue(ConfigFactory.parseMap(Map.of("capacity", "lots"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void configConstructor_shouldDefaultCapacity() {
        assertEquals(CommandQueue.DEFAULT_CAPACITY, new CommandQueue(ConfigFactory.empty()).capacity());
        assertEquals(7, new CommandQueue(ConfigFactory.parseMap(Map.of("capacity", 7))).capacity());
    }

    @Test
    void put_shouldRejectNull() {
        CommandQueue queue = new CommandQueue(1);

        assertThatThrownBy(() -> queue.put(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> queue.offer(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void gameCommand_shouldMapToAndFromInputs() {
        for (GameCommand command : GameCommand.values()) {
            assertEquals(command, GameCommand.fromInput(command.toInput()));
        }
        assertEquals(GameCommand.SOFT_DROP, GameCommand.fromInput(org.stackfall.runtime.Input.MOVE_DOWN));
    }
}
