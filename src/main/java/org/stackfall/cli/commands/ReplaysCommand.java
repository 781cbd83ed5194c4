package org.stackfall.cli.commands;

import org.stackfall.cli.CommandLineInterface;
import org.stackfall.replay.ReplayData;
import org.stackfall.replay.ReplayMetadata;
import org.stackfall.replay.storage.IReplayRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "replays",
    description = "List stored replays"
)
public class ReplaysCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ReplaysCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        IReplayRepository repository = parent.createReplayRepository();
        List<String> names = repository.list();
        PrintWriter out = spec.commandLine().getOut();
        if (names.isEmpty()) {
            out.println("No replays stored.");
            out.flush();
            return 0;
        }

        for (String name : names) {
            try {
                ReplayData data = repository.load(name);
                out.println(summarize(name, data));
            } catch (IOException e) {
                LOG.warn("Skipping unreadable replay '{}': {}", name, e.getMessage());
                out.printf("%-20s (unreadable)%n", name);
            }
        }
        out.flush();
        return 0;
    }

    static String summarize(String name, ReplayData data) {
        ReplayMetadata metadata = data.metadata();
        return String.format("%-20s score=%-7d level=%-3d lines=%-4d events=%-6d %s (%ds)",
                name,
                metadata.finalScore(),
                metadata.finalLevel(),
                metadata.finalLines(),
                data.eventCount(),
                Instant.ofEpochMilli(metadata.startTimestamp()),
                Duration.ofMillis(metadata.durationMs()).toSeconds());
    }
}
