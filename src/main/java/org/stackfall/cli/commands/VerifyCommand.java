package org.stackfall.cli.commands;

import org.stackfall.cli.CommandLineInterface;
import org.stackfall.replay.ReplayData;
import org.stackfall.replay.ReplayMetadata;
import org.stackfall.replay.ReplayPlayer;
import org.stackfall.runtime.model.GameState;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Re-simulates a stored replay without rendering. Exits with 0 if the result matches the
 * recorded metadata, 1 otherwise.
 */
@Command(
    name = "verify",
    description = "Check that a stored replay reproduces its recorded result"
)
public class VerifyCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "NAME", description = "Name of the stored replay")
    private String name;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        ReplayData data = parent.createReplayRepository().load(name);
        GameState replayed = ReplayPlayer.playToEnd(data, parent.getGameConfiguration().rules());
        ReplayMetadata recorded = data.metadata();

        PrintWriter out = spec.commandLine().getOut();
        out.printf("recorded: score=%d level=%d lines=%d%n", recorded.finalScore(), recorded.finalLevel(), recorded.finalLines());
        out.printf("replayed: score=%d level=%d lines=%d%n", replayed.score(), replayed.level(), replayed.linesCleared());
        boolean matches = ReplayPlayer.matchesMetadata(replayed, recorded);
        out.println(matches ? "OK" : "MISMATCH");
        out.flush();
        return matches ? 0 : 1;
    }
}
