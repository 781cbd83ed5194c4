package org.stackfall.cli.commands;

import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.stackfall.cli.CommandLineInterface;
import org.stackfall.cli.rendering.TerminalRenderHook;
import org.stackfall.cli.rendering.TextRenderer;
import org.stackfall.config.GameConfiguration;
import org.stackfall.replay.ReplayData;
import org.stackfall.replay.ReplayPlayer;
import org.stackfall.replay.ReplayPlayerState;
import org.stackfall.runtime.model.GameState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "replay",
    description = "Play back a recorded game"
)
public class ReplayCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ReplayCommand.class);

    static final double MIN_SPEED = 0.25;
    static final double MAX_SPEED = 4.0;

    @Parameters(index = "0", paramLabel = "NAME", description = "Name of the stored replay")
    private String name;

    @Option(
        names = {"-x", "--speed"},
        description = "Playback speed multiplier between 0.25 and 4.0 (default: replay.default-speed)"
    )
    private Double speed;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        GameConfiguration configuration = parent.getGameConfiguration();
        double playbackSpeed = validateSpeed(speed != null ? speed : configuration.replay().defaultSpeed());
        long frameIntervalMs = configuration.replay().frameIntervalMs(playbackSpeed);

        ReplayData data = parent.createReplayRepository().load(name);
        LOG.info("Playing replay '{}' ({} events) at {}x", name, data.eventCount(), playbackSpeed);

        TextRenderer renderer = new TextRenderer();
        ReplayPlayerState state = ReplayPlayer.initialize(data, configuration.rules());
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            TerminalRenderHook renderHook = new TerminalRenderHook(terminal, renderer,
                    List.of("", String.format("Replay '%s' at %.2fx", name, playbackSpeed)));
            renderHook.onStateChanged(state.gameState());
            while (!state.finished()) {
                Thread.sleep(frameIntervalMs);
                GameState before = state.gameState();
                state = ReplayPlayer.advanceFrame(state, configuration.rules());
                if (state.gameState() != before) {
                    renderHook.onStateChanged(state.gameState());
                }
            }
            renderHook.printLines(renderer.renderGameOver(state.gameState()));
        }

        boolean matches = ReplayPlayer.matchesMetadata(state.gameState(), data.metadata());
        PrintWriter out = spec.commandLine().getOut();
        out.println(matches
                ? "Replay reproduced the recorded result."
                : "Replay diverged from the recorded result.");
        out.flush();
        if (!matches) {
            LOG.warn("Replay '{}' diverged: recorded score={}, level={}, lines={}; replayed score={}, level={}, lines={}",
                    name, data.metadata().finalScore(), data.metadata().finalLevel(), data.metadata().finalLines(),
                    state.gameState().score(), state.gameState().level(), state.gameState().linesCleared());
        }
        return 0;
    }

    static double validateSpeed(double value) {
        if (Double.isNaN(value) || value < MIN_SPEED || value > MAX_SPEED) {
            throw new IllegalArgumentException("Speed must be between " + MIN_SPEED + " and " + MAX_SPEED + ", got " + value);
        }
        return value;
    }
}
