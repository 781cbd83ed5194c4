package org.stackfall.runtime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.stackfall.junit.extensions.logging.LogWatchExtension;
import org.stackfall.runtime.internal.services.SequenceShapeSupplier;
import org.stackfall.runtime.model.ActivePiece;
import org.stackfall.runtime.model.Board;
import org.stackfall.runtime.model.Cell;
import org.stackfall.runtime.model.GameState;
import org.stackfall.runtime.model.GameStatus;
import org.stackfall.runtime.model.Position;
import org.stackfall.runtime.model.Rotation;
import org.stackfall.runtime.model.Shape;
import org.stackfall.runtime.rules.GameRules;
import org.stackfall.runtime.rules.LevelParams;
import org.stackfall.runtime.spi.IShapeSupplier;
import org.stackfall.testutils.BoardFixtures;

import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class GameLogicTest {

    private final GameRules rules = GameRules.STANDARD;
    private IShapeSupplier supplier;

    @BeforeEach
    void setUp() {
        supplier = SequenceShapeSupplier.of(Shape.I);
    }

    @Test
    void restart_shouldSpawnFirstShapeOnEmptyBoard() {
        GameRules custom = new GameRules(12, 22, rules.scoreTable(), new LevelParams(10, 3), rules.speed());

        GameState state = GameLogic.restart(Shape.T, Shape.O, custom);

        assertEquals(Board.empty(12, 22), state.board());
        assertEquals(ActivePiece.spawn(Shape.T, 12), state.activePiece());
        assertEquals(new Position(6, 1), state.activePiece().position());
        assertEquals(Shape.O, state.nextShape());
        assertEquals(0, state.score());
        assertEquals(3, state.level());
        assertEquals(0, state.linesCleared());
        assertEquals(GameStatus.PLAYING, state.status());
    }

    @Test
    @DisplayName("An O dropped by ticks locks after 18 ticks and the preview piece spawns")
    void tick_shouldDropPieceUntilItLocks() {
        GameState state = GameLogic.restart(Shape.O, Shape.T, rules);

        for (int i = 0; i < 17; i++) {
            GameLogic.StepOutcome outcome = GameLogic.step(state, Input.TICK, supplier, rules);
            assertFalse(outcome.pieceLocked());
            state = outcome.state();
        }
        assertEquals(new Position(5, 18), state.activePiece().position());
        assertTrue(CollisionResolver.hasLanded(state.activePiece(), state.board()));

        GameLogic.StepOutcome locked = GameLogic.step(state, Input.TICK, supplier, rules);

        assertTrue(locked.pieceLocked());
        GameState after = locked.state();
        assertEquals(ActivePiece.spawn(Shape.T, 10), after.activePiece());
        assertEquals(Shape.I, after.nextShape());
        assertEquals(4, after.board().filledCellCount());
        assertThat(after.board().get(new Position(5, 19))).contains(Cell.filled(Shape.O));
        assertEquals(0, after.score());
        assertEquals(0, after.linesCleared());
        assertEquals(GameStatus.PLAYING, after.status());
        assertEquals(OptionalLong.of(1000), locked.nextIntervalMs());
    }

    @Test
    @DisplayName("Rotating an I into the single gap and hard dropping clears the row for 132 points")
    void hardDrop_intoGap_shouldClearLineAndAwardDropBonus() {
        GameState start = GameLogic.restart(Shape.I, Shape.O, rules);
        GameState state = BoardFixtures.withBoard(start, BoardFixtures.fillRowExcept(start.board(), 19, 5));

        state = GameLogic.update(state, Input.ROTATE_CLOCKWISE, supplier, rules);
        assertEquals(new ActivePiece(Shape.I, new Position(5, 1), Rotation.R90), state.activePiece());

        GameLogic.StepOutcome outcome = GameLogic.step(state, Input.HARD_DROP, supplier, rules);

        GameState after = outcome.state();
        assertTrue(outcome.pieceLocked());
        assertEquals(16 * GameLogic.HARD_DROP_POINTS_PER_ROW + 100, after.score());
        assertEquals(1, after.linesCleared());
        assertEquals(1, after.level());
        assertEquals(3, after.board().filledCellCount());
        assertThat(after.board().completedRows()).isEmpty();
        for (int y = 17; y <= 19; y++) {
            assertFalse(after.board().isEmpty(new Position(5, y)), "column 5 row " + y);
        }
        assertEquals(ActivePiece.spawn(Shape.O, 10), after.activePiece());
    }

    @Test
    void hardDrop_onEmptyBoard_shouldAwardTwoPointsPerRow() {
        GameState state = GameLogic.restart(Shape.O, Shape.T, rules);

        GameState after = GameLogic.update(state, Input.HARD_DROP, supplier, rules);

        assertEquals(17 * 2, after.score());
        assertEquals(4, after.board().filledCellCount());
    }

    @Test
    void lineClear_reachingThreshold_shouldLevelUpAndShortenInterval() {
        GameState start = GameLogic.restart(Shape.I, Shape.O, rules);
        GameState state = new GameState(
                BoardFixtures.fillRowExcept(start.board(), 19, 5),
                new ActivePiece(Shape.I, new Position(5, 1), Rotation.R90),
                Shape.O, 0, 1, 9, GameStatus.PLAYING);

        GameLogic.StepOutcome outcome = GameLogic.step(state, Input.HARD_DROP, supplier, rules);

        assertEquals(10, outcome.state().linesCleared());
        assertEquals(2, outcome.state().level());
        // cleared at level 1, so the base score is not doubled
        assertEquals(132, outcome.state().score());
        assertEquals(OptionalLong.of(950), outcome.nextIntervalMs());
    }

    @Test
    void move_intoWall_shouldReturnSameState() {
        GameState state = GameLogic.restart(Shape.O, Shape.T, rules);
        for (int i = 0; i < 5; i++) {
            state = GameLogic.update(state, Input.MOVE_LEFT, supplier, rules);
        }
        assertEquals(0, state.activePiece().position().x());

        assertSame(state, GameLogic.update(state, Input.MOVE_LEFT, supplier, rules));
    }

    @ParameterizedTest
    @EnumSource(Shape.class)
    void rotate_fourTimesInOpenSpace_shouldRestoreOrientationAndPosition(Shape shape) {
        ActivePiece interior = new ActivePiece(shape, new Position(5, 10), Rotation.R0);
        GameState start = GameLogic.restart(shape, Shape.O, rules).withActivePiece(interior);

        for (Input rotation : new Input[] {Input.ROTATE_CLOCKWISE, Input.ROTATE_COUNTER_CLOCKWISE}) {
            GameState state = start;
            for (int i = 0; i < 4; i++) {
                state = GameLogic.update(state, rotation, supplier, rules);
            }
            assertEquals(interior, state.activePiece(), shape + " after four " + rotation);
        }
    }

    @Test
    @DisplayName("An I at its spawn row is kicked on the way through R270 and ends two columns left, one row down")
    void rotate_fourTimesAtSpawn_shouldKickIPiece() {
        GameState start = GameLogic.restart(Shape.I, Shape.O, rules);

        for (Input rotation : new Input[] {Input.ROTATE_CLOCKWISE, Input.ROTATE_COUNTER_CLOCKWISE}) {
            GameState state = start;
            for (int i = 0; i < 4; i++) {
                state = GameLogic.update(state, rotation, supplier, rules);
            }
            assertEquals(new ActivePiece(Shape.I, new Position(3, 2), Rotation.R0), state.activePiece(), "after four " + rotation);
        }
    }

    @Test
    void move_andRotate_shouldNotConsumeShapes() {
        IShapeSupplier mockSupplier = mock(IShapeSupplier.class);
        when(mockSupplier.nextShape()).thenReturn(Shape.S);
        GameState state = GameLogic.restart(Shape.T, Shape.L, rules);

        state = GameLogic.update(state, Input.MOVE_RIGHT, mockSupplier, rules);
        state = GameLogic.update(state, Input.ROTATE_COUNTER_CLOCKWISE, mockSupplier, rules);
        state = GameLogic.update(state, Input.MOVE_DOWN, mockSupplier, rules);
        verify(mockSupplier, never()).nextShape();

        state = GameLogic.update(state, Input.HARD_DROP, mockSupplier, rules);
        verify(mockSupplier, times(1)).nextShape();
        assertEquals(Shape.L, state.activePiece().shape());
        assertEquals(Shape.S, state.nextShape());
    }

    @Test
    @DisplayName("Pause, tick, pause leaves the piece where it was and resumes play")
    void pause_shouldFreezeUntilResumed() {
        GameState playing = GameLogic.restart(Shape.T, Shape.O, rules);

        GameState paused = GameLogic.update(playing, Input.PAUSE, supplier, rules);
        assertEquals(GameStatus.PAUSED, paused.status());

        assertSame(paused, GameLogic.update(paused, Input.TICK, supplier, rules));
        assertSame(paused, GameLogic.update(paused, Input.MOVE_LEFT, supplier, rules));
        assertSame(paused, GameLogic.update(paused, Input.HARD_DROP, supplier, rules));

        GameState resumed = GameLogic.update(paused, Input.PAUSE, supplier, rules);
        assertEquals(GameStatus.PLAYING, resumed.status());
        assertEquals(playing.activePiece(), resumed.activePiece());
        assertEquals(playing.board(), resumed.board());
    }

    @Test
    void quit_shouldBeNoOp() {
        GameState state = GameLogic.restart(Shape.T, Shape.O, rules);

        assertSame(state, GameLogic.update(state, Input.QUIT, supplier, rules));
    }

    @Test
    @DisplayName("A lock whose preview piece cannot spawn ends the game")
    void lock_withBlockedSpawn_shouldEndGame() {
        Board board = Board.empty(10, 20).place(new Position(5, 1), Cell.filled(Shape.Z));
        ActivePiece resting = new ActivePiece(Shape.O, new Position(0, 18), Rotation.R0);
        GameState state = new GameState(board, resting, Shape.T, 40, 1, 3, GameStatus.PLAYING);

        GameLogic.StepOutcome outcome = GameLogic.step(state, Input.TICK, supplier, rules);

        GameState over = outcome.state();
        assertEquals(GameStatus.GAME_OVER, over.status());
        assertTrue(outcome.pieceLocked());
        assertFalse(outcome.shouldContinue());
        assertEquals(OptionalLong.empty(), outcome.nextIntervalMs());
        assertEquals(40, over.score());
        assertEquals(3, over.linesCleared());
        assertEquals(5, over.board().filledCellCount());
    }

    @ParameterizedTest
    @EnumSource(Input.class)
    void gameOver_shouldBeTerminal(Input input) {
        GameState over = GameLogic.restart(Shape.T, Shape.O, rules).withStatus(GameStatus.GAME_OVER);

        assertSame(over, GameLogic.update(over, input, supplier, rules));
    }
}
