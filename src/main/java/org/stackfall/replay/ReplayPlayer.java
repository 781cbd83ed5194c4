package org.stackfall.replay;

import org.stackfall.runtime.GameLogic;
import org.stackfall.runtime.model.GameState;
import org.stackfall.runtime.model.Shape;
import org.stackfall.runtime.rules.GameRules;
import org.stackfall.runtime.spi.IShapeSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Reconstructs a session from its event log.
 * <p>
 * Each {@link #advanceFrame} call applies every event of the current frame in log order.
 * {@link ReplayEvent.PieceSpawn} events queue a shape; when an applied input locks a piece,
 * the state machine draws the oldest queued shape, or the current preview if none is queued.
 * Playback finishes once the log is exhausted or the game is over.
 * <p>
 * A log must therefore list each {@link ReplayEvent.PieceSpawn} before the locking input that
 * drew the shape, in the same frame, as {@link ReplayRecorder} writes it.
 */
public final class ReplayPlayer {

    private static final Logger LOG = LoggerFactory.getLogger(ReplayPlayer.class);

    private ReplayPlayer() {
        // Utility class
    }

    /**
     * Positions playback before the first frame, starting at level 1.
     */
    public static ReplayPlayerState initialize(ReplayData data) {
        return initialize(data, GameRules.STANDARD);
    }

    /**
     * Positions playback before the first frame. The board size always comes from the
     * replay metadata; the start level from the given rules.
     */
    public static ReplayPlayerState initialize(ReplayData data, GameRules rules) {
        ReplayMetadata metadata = data.metadata();
        GameState initial = GameState.initial(
                metadata.firstShape(),
                metadata.secondShape(),
                metadata.boardWidth(),
                metadata.boardHeight(),
                rules.levels().startLevel());
        return new ReplayPlayerState(initial, data.events(), 0, 0, List.of(), data.events().isEmpty());
    }

    /**
     * Applies all events of the current frame.
     *
     * @param state The playback position.
     * @param rules Scoring and leveling parameters; the board size is taken from the replay.
     * @return The new position; the given one if playback already finished.
     */
    public static ReplayPlayerState advanceFrame(ReplayPlayerState state, GameRules rules) {
        if (state.finished()) {
            return state;
        }
        GameState game = state.gameState();
        GameRules boardRules = rules.withBoard(game.board().width(), game.board().height());
        List<ReplayEvent> events = state.events();
        Deque<Shape> pending = new ArrayDeque<>(state.pendingShapes());
        int index = state.nextEventIndex();

        while (index < events.size() && events.get(index).frameNumber() <= state.currentFrame()) {
            ReplayEvent event = events.get(index++);
            if (event instanceof ReplayEvent.PieceSpawn spawn) {
                pending.addLast(spawn.shape());
            } else if (event instanceof ReplayEvent.PlayerInput playerInput) {
                GameState current = game;
                IShapeSupplier supplier = () -> pending.isEmpty() ? current.nextShape() : pending.pollFirst();
                game = GameLogic.update(game, playerInput.input(), supplier, boardRules);
                if (game.isGameOver()) {
                    break;
                }
            }
        }

        boolean finished = index >= events.size() || game.isGameOver();
        if (finished) {
            LOG.debug("Replay finished at frame {}: score={}, level={}, lines={}",
                    state.currentFrame(), game.score(), game.level(), game.linesCleared());
        }
        return new ReplayPlayerState(game, events, index, state.currentFrame() + 1, List.copyOf(pending), finished);
    }

    /**
     * Plays a replay to its end without pacing.
     *
     * @return The final reconstructed game state.
     */
    public static GameState playToEnd(ReplayData data, GameRules rules) {
        ReplayPlayerState state = initialize(data, rules);
        while (!state.finished()) {
            state = advanceFrame(state, rules);
        }
        return state.gameState();
    }

    /**
     * Whether a reconstructed final state agrees with the score, level and lines recorded in the metadata.
     */
    public static boolean matchesMetadata(GameState finalState, ReplayMetadata metadata) {
        return finalState.score() == metadata.finalScore()
                && finalState.level() == metadata.finalLevel()
                && finalState.linesCleared() == metadata.finalLines();
    }
}
