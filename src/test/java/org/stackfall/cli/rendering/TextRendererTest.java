package org.stackfall.cli.rendering;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.stackfall.junit.extensions.logging.LogWatchExtension;
import org.stackfall.runtime.GameLogic;
import org.stackfall.runtime.model.GameState;
import org.stackfall.runtime.model.GameStatus;
import org.stackfall.runtime.model.Shape;
import org.stackfall.runtime.rules.GameRules;
import org.stackfall.testutils.BoardFixtures;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TextRendererTest {

    private final TextRenderer renderer = new TextRenderer();

    @Test
    void render_shouldDrawBorderedBoardWithActivePiece() {
        GameState state = GameLogic.restart(Shape.T, Shape.O, GameRules.STANDARD.withBoard(4, 3))
                .withScore(120);

        List<String> lines = renderer.render(state);

        assertThat(lines).containsExactly(
                "+--------+",
                "| . .[] .|  Score: 120",
                "| .[][][]|  Level: 1",
                "| . . . .|  Lines: 0",
                "+--------+");
    }

    @Test
    void render_shouldShowLockedCellsAndPanel() {
        GameState base = GameLogic.restart(Shape.O, Shape.Z, GameRules.STANDARD.withBoard(6, 8));
        GameState state = BoardFixtures.withBoard(base, BoardFixtures.fillRowExcept(base.board(), 7, 0));

        List<String> lines = renderer.render(state);

        assertEquals(10, lines.size());
        assertEquals("| .[][][][][]|", lines.get(8));
        assertEquals("| . . . . . .|  Next:  Z", lines.get(5));
        assertEquals("| . . . . . .|", lines.get(6));
    }

    @Test
    void render_shouldShowPauseAndGameOverStatus() {
        GameState base = GameLogic.restart(Shape.I, Shape.T, GameRules.STANDARD);

        assertThat(renderer.render(base.withStatus(GameStatus.PAUSED))).contains("| . . . . . . . . . .|  PAUSED");
        List<String> over = renderer.render(base.withStatus(GameStatus.GAME_OVER));
        assertThat(over).contains("| . . . . . . . . . .|  GAME OVER");
        assertThat(String.join("\n", over)).doesNotContain(TextRenderer.FILLED);
    }

    @Test
    void renderGameOver_shouldSummarizeTotals() {
        GameState state = new GameState(
                BoardFixtures.parse("...."), GameLogic.restart(Shape.I, Shape.I, GameRules.STANDARD).activePiece(),
                Shape.J, 4200, 5, 42, GameStatus.GAME_OVER);

        assertEquals(List.of("GAME OVER", "Score: 4200", "Level: 5", "Lines: 42"), renderer.renderGameOver(state));
    }
}
