package org.stackfall.runtime;

import org.stackfall.runtime.model.ActivePiece;
import org.stackfall.runtime.model.Board;
import org.stackfall.runtime.model.GameState;
import org.stackfall.runtime.model.GameStatus;
import org.stackfall.runtime.model.Shape;
import org.stackfall.runtime.rules.GameRules;
import org.stackfall.runtime.spi.IShapeSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.UnaryOperator;

/**
 * The game state machine.
 * <p>
 * {@link #update(GameState, Input, IShapeSupplier, GameRules)} is a pure transition over its
 * explicit arguments: it never reads the clock and never draws randomness of its own. The
 * shape supplier is the only nondeterministic input and is invoked once per piece lock.
 * <p>
 * Transitions:
 * <ul>
 *   <li>While not playing, only {@link Input#PAUSE} in {@link GameStatus#PAUSED} is accepted
 *       (resumes play). Game over is terminal.</li>
 *   <li>Lateral moves and rotations that end in an invalid position are ignored.</li>
 *   <li>A failed descent ({@link Input#MOVE_DOWN}, {@link Input#TICK}) locks the piece.</li>
 *   <li>{@link Input#HARD_DROP} awards two points per row dropped, then locks.</li>
 *   <li>{@link Input#QUIT} is handled by the surrounding loop and is a no-op here.</li>
 * </ul>
 */
public final class GameLogic {

    private static final Logger LOG = LoggerFactory.getLogger(GameLogic.class);

    /**
     * Points awarded per row travelled by a hard drop.
     */
    public static final int HARD_DROP_POINTS_PER_ROW = 2;

    /**
     * Result of a single step.
     *
     * @param state          The state after the input.
     * @param pieceLocked    Whether the input locked the active piece (and consumed one shape from the supplier).
     * @param nextIntervalMs The drop interval for the resulting level, empty once the game is over.
     */
    public record StepOutcome(GameState state, boolean pieceLocked, OptionalLong nextIntervalMs) {

        public boolean shouldContinue() {
            return !state.isGameOver();
        }
    }

    private record Transition(GameState state, boolean locked) {

        static Transition unchanged(GameState state) {
            return new Transition(state, false);
        }
    }

    private GameLogic() {
        // Utility class
    }

    /**
     * Applies one input to a state.
     *
     * @param state         The current state.
     * @param input         The input to apply.
     * @param shapeSupplier Provides the next preview shape when a piece locks.
     * @param rules         Scoring, leveling and board parameters.
     * @return The resulting state; the input state itself if the input was rejected.
     */
    public static GameState update(GameState state, Input input, IShapeSupplier shapeSupplier, GameRules rules) {
        return transition(state, input, shapeSupplier, rules).state();
    }

    /**
     * Applies one input and reports whether a lock happened and which drop interval
     * the resulting level calls for.
     */
    public static StepOutcome step(GameState state, Input input, IShapeSupplier shapeSupplier, GameRules rules) {
        Transition transition = transition(state, input, shapeSupplier, rules);
        GameState newState = transition.state();
        OptionalLong interval = newState.isGameOver()
                ? OptionalLong.empty()
                : OptionalLong.of(LineClearing.dropInterval(newState.level(), rules.speed()));
        return new StepOutcome(newState, transition.locked(), interval);
    }

    /**
     * Creates a fresh game with the given first and previewed shapes.
     */
    public static GameState restart(Shape firstShape, Shape nextShape, GameRules rules) {
        return GameState.initial(firstShape, nextShape, rules.boardWidth(), rules.boardHeight(), rules.levels().startLevel());
    }

    private static Transition transition(GameState state, Input input, IShapeSupplier shapeSupplier, GameRules rules) {
        if (!state.isPlaying()) {
            if (input == Input.PAUSE && state.status() == GameStatus.PAUSED) {
                return Transition.unchanged(state.withStatus(GameStatus.PLAYING));
            }
            return Transition.unchanged(state);
        }

        return switch (input) {
            case MOVE_LEFT -> handleMove(state, ActivePiece::moveLeft);
            case MOVE_RIGHT -> handleMove(state, ActivePiece::moveRight);
            case MOVE_DOWN, TICK -> handleMoveDown(state, shapeSupplier, rules);
            case ROTATE_CLOCKWISE -> handleRotation(state, true);
            case ROTATE_COUNTER_CLOCKWISE -> handleRotation(state, false);
            case HARD_DROP -> handleHardDrop(state, shapeSupplier, rules);
            case PAUSE -> Transition.unchanged(state.withStatus(GameStatus.PAUSED));
            case QUIT -> Transition.unchanged(state);
        };
    }

    private static Transition handleMove(GameState state, UnaryOperator<ActivePiece> move) {
        ActivePiece moved = move.apply(state.activePiece());
        if (CollisionResolver.isValidPosition(moved, state.board())) {
            return Transition.unchanged(state.withActivePiece(moved));
        }
        if (LOG.isTraceEnabled()) {
            LOG.trace("Move rejected: {} collision at {}", CollisionResolver.detectCollision(moved, state.board()), moved.position());
        }
        return Transition.unchanged(state);
    }

    private static Transition handleMoveDown(GameState state, IShapeSupplier shapeSupplier, GameRules rules) {
        ActivePiece moved = state.activePiece().moveDown();
        if (CollisionResolver.isValidPosition(moved, state.board())) {
            return Transition.unchanged(state.withActivePiece(moved));
        }
        return lock(state, shapeSupplier, rules);
    }

    private static Transition handleRotation(GameState state, boolean clockwise) {
        Optional<ActivePiece> rotated = CollisionResolver.tryRotate(state.activePiece(), state.board(), clockwise);
        if (rotated.isEmpty()) {
            LOG.trace("Rotation rejected for {} at {}", state.activePiece().shape(), state.activePiece().position());
            return Transition.unchanged(state);
        }
        return Transition.unchanged(state.withActivePiece(rotated.get()));
    }

    private static Transition handleHardDrop(GameState state, IShapeSupplier shapeSupplier, GameRules rules) {
        ActivePiece dropped = CollisionResolver.hardDropPosition(state.activePiece(), state.board());
        int distance = dropped.position().y() - state.activePiece().position().y();
        GameState droppedState = state
                .withActivePiece(dropped)
                .withScore(state.score() + distance * HARD_DROP_POINTS_PER_ROW);
        return lock(droppedState, shapeSupplier, rules);
    }

    /**
     * Stamps the piece, clears lines, updates totals, then spawns the previewed shape.
     * If the spawned piece does not fit, the game ends with the lock's score and lines
     * still applied.
     */
    private static Transition lock(GameState state, IShapeSupplier shapeSupplier, GameRules rules) {
        Board stamped = state.board().placePiece(state.activePiece());
        LineClearing.ClearResult cleared = LineClearing.clearLines(stamped, state.level(), rules.scoreTable());
        int totalLines = state.linesCleared() + cleared.linesCleared();
        int newLevel = LineClearing.calculateLevel(totalLines, rules.levels());
        int newScore = state.score() + cleared.scoreGained();
        ActivePiece spawned = ActivePiece.spawn(state.nextShape(), cleared.board().width());
        Shape upcoming = shapeSupplier.nextShape();

        if (cleared.linesCleared() > 0) {
            LOG.debug("Cleared {} line(s) for {} points, total lines {}", cleared.linesCleared(), cleared.scoreGained(), totalLines);
        }
        if (newLevel != state.level()) {
            LOG.debug("Level up: {} -> {}", state.level(), newLevel);
        }

        if (CollisionResolver.isGameOver(spawned, cleared.board())) {
            return new Transition(new GameState(
                    cleared.board(),
                    state.activePiece(),
                    state.nextShape(),
                    newScore,
                    newLevel,
                    totalLines,
                    GameStatus.GAME_OVER), true);
        }
        return new Transition(new GameState(
                cleared.board(),
                spawned,
                upcoming,
                newScore,
                newLevel,
                totalLines,
                GameStatus.PLAYING), true);
    }
}
