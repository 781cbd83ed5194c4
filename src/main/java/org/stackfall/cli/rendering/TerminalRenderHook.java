package org.stackfall.cli.rendering;

import org.jline.terminal.Terminal;
import org.jline.utils.InfoCmp;
import org.stackfall.engine.IRenderHook;
import org.stackfall.runtime.model.GameState;

import java.io.PrintWriter;
import java.util.List;

/**
 * Writes each state to a JLine terminal, redrawing the screen from the top-left corner.
 * In raw mode line endings are written as CR LF.
 */
public class TerminalRenderHook implements IRenderHook {

    private final Terminal terminal;
    private final TextRenderer renderer;
    private final List<String> footer;

    public TerminalRenderHook(Terminal terminal, TextRenderer renderer) {
        this(terminal, renderer, List.of());
    }

    /**
     * @param footer Lines printed under the board, e.g. key help.
     */
    public TerminalRenderHook(Terminal terminal, TextRenderer renderer, List<String> footer) {
        this.terminal = terminal;
        this.renderer = renderer;
        this.footer = List.copyOf(footer);
    }

    @Override
    public void onStateChanged(GameState state) {
        List<String> lines = renderer.render(state);
        terminal.puts(InfoCmp.Capability.clear_screen);
        PrintWriter writer = terminal.writer();
        for (String line : lines) {
            writer.print(line);
            writer.print("\r\n");
        }
        for (String line : footer) {
            writer.print(line);
            writer.print("\r\n");
        }
        writer.flush();
    }

    /**
     * Prints lines below the current screen without clearing it.
     */
    public void printLines(List<String> lines) {
        PrintWriter writer = terminal.writer();
        for (String line : lines) {
            writer.print(line);
            writer.print("\r\n");
        }
        writer.flush();
    }
}
