package org.stackfall.engine;

import org.stackfall.replay.ReplayData;
import org.stackfall.replay.ReplayRecorder;
import org.stackfall.runtime.GameLogic;
import org.stackfall.runtime.LineClearing;
import org.stackfall.runtime.model.GameState;
import org.stackfall.runtime.model.Shape;
import org.stackfall.runtime.rules.GameRules;
import org.stackfall.runtime.spi.IShapeSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The single consumer of the {@link CommandQueue}.
 * <p>
 * {@link #run} takes one command at a time and applies it through {@link GameLogic#step}, so
 * state transitions are strictly serialized in queue order. After each command it updates the
 * drop interval cell when the level changed, records the command (and any shape the lock drew)
 * if recording, and notifies the render hook when the state changed. The loop ends on
 * {@link GameCommand#QUIT}, on game over, or when the calling thread is interrupted while
 * waiting for a command. Registered producers are started when the loop starts and stopped
 * when it ends.
 */
public class GameEngine {

    private static final Logger LOG = LoggerFactory.getLogger(GameEngine.class);

    private final GameRules rules;
    private final IShapeSupplier shapeSupplier;
    private final CommandQueue queue;
    private final IRenderHook renderHook;
    private final Clock clock;
    private final AtomicLong dropIntervalMs;
    private final List<AbstractProducer> producers = new ArrayList<>();

    public GameEngine(GameRules rules, IShapeSupplier shapeSupplier, CommandQueue queue, IRenderHook renderHook) {
        this(rules, shapeSupplier, queue, renderHook, Clock.systemUTC());
    }

    public GameEngine(GameRules rules, IShapeSupplier shapeSupplier, CommandQueue queue, IRenderHook renderHook, Clock clock) {
        this.rules = rules;
        this.shapeSupplier = shapeSupplier;
        this.queue = queue;
        this.renderHook = renderHook;
        this.clock = clock;
        this.dropIntervalMs = new AtomicLong(LineClearing.dropInterval(rules.levels().startLevel(), rules.speed()));
    }

    /**
     * The drop interval shared with the {@link TickProducer}. Written by the consumer only.
     */
    public AtomicLong dropIntervalCell() {
        return dropIntervalMs;
    }

    public CommandQueue queue() {
        return queue;
    }

    /**
     * Registers a producer to be started and stopped together with the consumer loop.
     */
    public void addProducer(AbstractProducer producer) {
        producers.add(producer);
    }

    /**
     * Draws the first two shapes from the supplier and plays a new game.
     */
    public SessionResult run(boolean record) {
        Shape first = shapeSupplier.nextShape();
        Shape second = shapeSupplier.nextShape();
        return run(GameLogic.restart(first, second, rules), record);
    }

    /**
     * Plays from the given state until quit, game over or interruption. Blocks the calling thread.
     *
     * @param initialState The state to start from.
     * @param record       Whether to record a replay.
     * @return The last fully applied state and, if recording, the replay.
     */
    public SessionResult run(GameState initialState, boolean record) {
        long startTimestamp = clock.millis();
        ReplayRecorder recorder = record ? ReplayRecorder.forInitialState(initialState, startTimestamp) : null;
        GameState state = initialState;
        dropIntervalMs.set(LineClearing.dropInterval(state.level(), rules.speed()));
        renderHook.onStateChanged(state);

        LOG.info("Game engine started (board {}x{}, level {}, recording {})",
                state.board().width(), state.board().height(), state.level(), record ? "on" : "off");
        producers.forEach(AbstractProducer::start);
        boolean interrupted = false;
        try {
            while (true) {
                GameCommand command;
                try {
                    command = queue.take();
                } catch (InterruptedException e) {
                    interrupted = true;
                    LOG.info("Game engine interrupted, ending session");
                    break;
                }

                if (command == GameCommand.QUIT) {
                    LOG.info("Player quit: score={}, level={}, lines={}", state.score(), state.level(), state.linesCleared());
                    break;
                }

                CapturingShapeSupplier capturing = new CapturingShapeSupplier(shapeSupplier);
                GameLogic.StepOutcome outcome = GameLogic.step(state, command.toInput(), capturing, rules);
                GameState next = outcome.state();

                if (recorder != null) {
                    Shape drawn = capturing.drawn();
                    if (drawn != null) {
                        recorder.recordPieceSpawn(drawn);
                    }
                    recorder.recordInput(command.toInput());
                    recorder.advanceFrame();
                }
                if (next.level() != state.level()) {
                    outcome.nextIntervalMs().ifPresent(dropIntervalMs::set);
                    LOG.debug("Drop interval now {} ms at level {}", dropIntervalMs.get(), next.level());
                }
                if (next != state) {
                    state = next;
                    renderHook.onStateChanged(state);
                }

                if (!outcome.shouldContinue()) {
                    LOG.info("Game over: score={}, level={}, lines={}", state.score(), state.level(), state.linesCleared());
                    break;
                }
            }
        } finally {
            producers.forEach(AbstractProducer::stop);
            // restored only now so the producer joins above are not cut short
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        Optional<ReplayData> replay = recorder == null
                ? Optional.empty()
                : Optional.of(recorder.build(state, clock.millis()));
        replay.ifPresent(data -> LOG.debug("Recorded {} events over {} frames", data.eventCount(), recorder.currentFrame()));
        return new SessionResult(state, replay);
    }

    /**
     * Remembers the shape a lock drew so it can be logged as a spawn event.
     */
    private static final class CapturingShapeSupplier implements IShapeSupplier {

        private final IShapeSupplier delegate;
        private Shape drawn;

        CapturingShapeSupplier(IShapeSupplier delegate) {
            this.delegate = delegate;
        }

        @Override
        public Shape nextShape() {
            drawn = delegate.nextShape();
            return drawn;
        }

        Shape drawn() {
            return drawn;
        }
    }
}
