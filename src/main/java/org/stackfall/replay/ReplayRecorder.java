package org.stackfall.replay;

import org.stackfall.runtime.Input;
import org.stackfall.runtime.model.GameState;
import org.stackfall.runtime.model.Shape;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates replay events during a live session and builds the immutable
 * {@link ReplayData} once the session ends.
 * <p>
 * The frame counter is advanced by the caller, once per consumed command. The recorder is
 * confined to the engine's consumer thread and is not thread-safe.
 */
public final class ReplayRecorder {

    private final long startTimestamp;
    private final int boardWidth;
    private final int boardHeight;
    private final Shape firstShape;
    private final Shape secondShape;
    private final List<ReplayEvent> events = new ArrayList<>();
    private long currentFrame = 0;

    private ReplayRecorder(long startTimestamp, int boardWidth, int boardHeight, Shape firstShape, Shape secondShape) {
        this.startTimestamp = startTimestamp;
        this.boardWidth = boardWidth;
        this.boardHeight = boardHeight;
        this.firstShape = firstShape;
        this.secondShape = secondShape;
    }

    public static ReplayRecorder create(long startTimestamp, int boardWidth, int boardHeight, Shape firstShape, Shape secondShape) {
        return new ReplayRecorder(startTimestamp, boardWidth, boardHeight, firstShape, secondShape);
    }

    /**
     * Starts a recording for a session beginning in the given state.
     */
    public static ReplayRecorder forInitialState(GameState initial, long startTimestamp) {
        return new ReplayRecorder(
                startTimestamp,
                initial.board().width(),
                initial.board().height(),
                initial.activePiece().shape(),
                initial.nextShape());
    }

    public void recordInput(Input input) {
        events.add(new ReplayEvent.PlayerInput(input, currentFrame));
    }

    public void recordPieceSpawn(Shape shape) {
        events.add(new ReplayEvent.PieceSpawn(shape, currentFrame));
    }

    public void advanceFrame() {
        currentFrame++;
    }

    public long currentFrame() {
        return currentFrame;
    }

    public int eventCount() {
        return events.size();
    }

    /**
     * Finalizes the recording.
     *
     * @param finalState   The state the session ended in.
     * @param endTimestamp Wall-clock end in epoch milliseconds.
     * @return The immutable replay.
     */
    public ReplayData build(GameState finalState, long endTimestamp) {
        ReplayMetadata metadata = new ReplayMetadata(
                ReplayMetadata.CURRENT_VERSION,
                startTimestamp,
                boardWidth,
                boardHeight,
                firstShape,
                secondShape,
                finalState.score(),
                finalState.level(),
                finalState.linesCleared(),
                endTimestamp - startTimestamp);
        return new ReplayData(metadata, events);
    }
}
