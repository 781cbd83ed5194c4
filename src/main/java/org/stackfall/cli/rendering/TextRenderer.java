package org.stackfall.cli.rendering;

import org.stackfall.runtime.model.Board;
import org.stackfall.runtime.model.GameState;
import org.stackfall.runtime.model.Position;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts a {@link GameState} into plain text lines. Filled cells and the falling piece
 * render as {@code []}, empty cells as {@code " ."}; a side panel shows score, level,
 * lines, the next shape and the status.
 * <pre>
 * +--------------------+
 * | . . . .[][][] . . .|  Score: 120
 * | . . . . .[] . . . .|  Level: 1
 * ...
 * +--------------------+
 * </pre>
 */
public class TextRenderer {

    static final String FILLED = "[]";
    static final String EMPTY = " .";
    private static final String PANEL_GAP = "  ";

    /**
     * @return The board with border and side panel, one string per terminal line.
     */
    public List<String> render(GameState state) {
        Board board = state.board();
        Set<Position> pieceBlocks = new HashSet<>();
        if (!state.isGameOver()) {
            pieceBlocks.addAll(state.activePiece().blocks());
        }
        List<String> panel = sidePanel(state);

        List<String> lines = new ArrayList<>(board.height() + 2);
        String border = "+" + "--".repeat(board.width()) + "+";
        lines.add(border);
        for (int y = 0; y < board.height(); y++) {
            StringBuilder line = new StringBuilder(board.width() * 2 + 24);
            line.append('|');
            for (int x = 0; x < board.width(); x++) {
                Position position = new Position(x, y);
                boolean filled = pieceBlocks.contains(position) || !board.isEmpty(position);
                line.append(filled ? FILLED : EMPTY);
            }
            line.append('|');
            if (y < panel.size() && !panel.get(y).isEmpty()) {
                line.append(PANEL_GAP).append(panel.get(y));
            }
            lines.add(line.toString());
        }
        lines.add(border);
        return lines;
    }

    /**
     * A short summary shown after the session ends.
     */
    public List<String> renderGameOver(GameState state) {
        return List.of(
                "GAME OVER",
                "Score: " + state.score(),
                "Level: " + state.level(),
                "Lines: " + state.linesCleared());
    }

    private List<String> sidePanel(GameState state) {
        List<String> panel = new ArrayList<>();
        panel.add("Score: " + state.score());
        panel.add("Level: " + state.level());
        panel.add("Lines: " + state.linesCleared());
        panel.add("");
        panel.add("Next:  " + state.nextShape());
        panel.add("");
        switch (state.status()) {
            case PAUSED -> panel.add("PAUSED");
            case GAME_OVER -> panel.add("GAME OVER");
            case PLAYING -> panel.add("");
        }
        return panel;
    }
}
