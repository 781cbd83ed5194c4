package org.stackfall.cli.commands;

import org.jline.terminal.Attributes;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.stackfall.cli.CommandLineInterface;
import org.stackfall.cli.rendering.TerminalRenderHook;
import org.stackfall.cli.rendering.TextRenderer;
import org.stackfall.config.GameConfiguration;
import org.stackfall.engine.CommandQueue;
import org.stackfall.engine.GameEngine;
import org.stackfall.engine.KeyboardInputProducer;
import org.stackfall.engine.SessionResult;
import org.stackfall.engine.TickProducer;
import org.stackfall.input.EscapeSequenceParser;
import org.stackfall.input.JLineKeySource;
import org.stackfall.replay.ReplayData;
import org.stackfall.replay.storage.IReplayRepository;
import org.stackfall.runtime.model.GameState;
import org.stackfall.runtime.spi.IShapeSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "play",
    description = "Play a game in the terminal"
)
public class PlayCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(PlayCommand.class);

    static final List<String> KEY_HELP = List.of(
            "",
            "Arrows / h j l: move   Up / k: rotate   z: rotate back",
            "Space: drop   p: pause   q: quit");

    @Option(
        names = {"-r", "--record"},
        paramLabel = "NAME",
        description = "Save a replay of this game under the given name"
    )
    private String recordName;

    @Option(
        names = {"-s", "--seed"},
        description = "Seed for the piece sequence (default: random)"
    )
    private Long seed;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        GameConfiguration configuration = parent.getGameConfiguration();
        IReplayRepository repository = null;
        if (recordName != null) {
            repository = parent.createReplayRepository();
            if (repository.exists(recordName)) {
                LOG.warn("Replay '{}' already exists and will be overwritten", recordName);
            }
        }

        long actualSeed = seed != null ? seed : System.nanoTime();
        IShapeSupplier supplier = configuration.engine().pieceSupplier().create(actualSeed);
        LOG.info("Starting game with {} piece supplier, seed {}", configuration.engine().pieceSupplier().configName(), actualSeed);

        TextRenderer renderer = new TextRenderer();
        SessionResult result;
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            Attributes saved = terminal.enterRawMode();
            try {
                CommandQueue queue = new CommandQueue(configuration.engine().queueCapacity());
                TerminalRenderHook renderHook = new TerminalRenderHook(terminal, renderer, KEY_HELP);
                GameEngine engine = new GameEngine(configuration.rules(), supplier, queue, renderHook);
                GameConfiguration.TerminalConfig terminalConfig = configuration.terminal();
                EscapeSequenceParser parser = new EscapeSequenceParser(
                        new JLineKeySource(terminal),
                        terminalConfig.escapeSequenceWaitMs(),
                        terminalConfig.escapeSequenceSecondWaitMs());
                engine.addProducer(new TickProducer(queue, engine.dropIntervalCell()));
                engine.addProducer(new KeyboardInputProducer(queue, parser, terminalConfig.inputPollIntervalMs()));

                result = engine.run(recordName != null);
                renderHook.printLines(renderer.renderGameOver(result.finalState()));
            } finally {
                terminal.setAttributes(saved);
            }
        }

        GameState finalState = result.finalState();
        LOG.info("Session ended: score={}, level={}, lines={}", finalState.score(), finalState.level(), finalState.linesCleared());
        PrintWriter out = spec.commandLine().getOut();
        out.printf("Final score %d (level %d, %d lines)%n", finalState.score(), finalState.level(), finalState.linesCleared());

        if (repository != null && result.replay().isPresent()) {
            ReplayData replay = result.replay().get();
            repository.save(recordName, replay);
            out.printf("Replay saved as '%s' (%d events)%n", recordName, replay.eventCount());
        }
        out.flush();
        return 0;
    }
}
