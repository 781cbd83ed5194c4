package org.stackfall.runtime.model;

/**
 * A complete, immutable snapshot of a game. Every accepted command produces a new
 * instance; earlier snapshots remain valid.
 *
 * @param board        The locked cells.
 * @param activePiece  The falling piece.
 * @param nextShape    The previewed shape that spawns after the next lock.
 * @param score        Accumulated score.
 * @param level        Current level.
 * @param linesCleared Total lines cleared in this game.
 * @param status       Lifecycle status.
 */
public record GameState(
        Board board,
        ActivePiece activePiece,
        Shape nextShape,
        int score,
        int level,
        int linesCleared,
        GameStatus status
) {

    /**
     * Creates the state at session start: empty board, first shape spawned, level 1.
     */
    public static GameState initial(Shape firstShape, Shape nextShape, int boardWidth, int boardHeight) {
        return initial(firstShape, nextShape, boardWidth, boardHeight, 1);
    }

    public static GameState initial(Shape firstShape, Shape nextShape, int boardWidth, int boardHeight, int startLevel) {
        return new GameState(
                Board.empty(boardWidth, boardHeight),
                ActivePiece.spawn(firstShape, boardWidth),
                nextShape,
                0,
                startLevel,
                0,
                GameStatus.PLAYING);
    }

    public boolean isPlaying() {
        return status == GameStatus.PLAYING;
    }

    public boolean isPaused() {
        return status == GameStatus.PAUSED;
    }

    public boolean isGameOver() {
        return status == GameStatus.GAME_OVER;
    }

    public GameState withActivePiece(ActivePiece piece) {
        return new GameState(board, piece, nextShape, score, level, linesCleared, status);
    }

    public GameState withScore(int newScore) {
        return new GameState(board, activePiece, nextShape, newScore, level, linesCleared, status);
    }

    public GameState withStatus(GameStatus newStatus) {
        return new GameState(board, activePiece, nextShape, score, level, linesCleared, newStatus);
    }
}
