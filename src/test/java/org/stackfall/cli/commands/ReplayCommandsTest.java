package org.stackfall.cli.commands;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.stackfall.cli.CommandLineInterface;
import org.stackfall.config.LoggingConfigurator;
import org.stackfall.engine.SessionResult;
import org.stackfall.junit.extensions.logging.ExpectLog;
import org.stackfall.junit.extensions.logging.LogLevel;
import org.stackfall.junit.extensions.logging.LogWatchExtension;
import org.stackfall.replay.ReplayData;
import org.stackfall.replay.ReplayMetadata;
import org.stackfall.replay.codec.JsonReplayCodec;
import org.stackfall.replay.storage.FileReplayRepository;
import org.stackfall.runtime.internal.services.SevenBagShapeSupplier;
import org.stackfall.runtime.model.Shape;
import org.stackfall.runtime.rules.GameRules;
import org.stackfall.testutils.ScriptedSessions;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class ReplayCommandsTest {

    @TempDir
    Path tempDir;

    private Path configFile;
    private Path replayDir;
    private FileReplayRepository repository;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        LoggingConfigurator.reset();
        replayDir = tempDir.resolve("replays");
        configFile = tempDir.resolve("stackfall.conf");
        Files.writeString(configFile, """
                stackfall.replay.directory = "%s"
                logging.default-level = "INFO"
                """.formatted(replayDir.toString().replace("\\", "/")));
        repository = new FileReplayRepository(replayDir, new JsonReplayCodec());
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("stackfall.logging.format");
        LoggingConfigurator.reset();
    }

    @Test
    void verify_matchingReplay_shouldPrintOk() throws IOException {
        repository.save("good", record(11L));

        int exitCode = execute("verify", "good");

        assertEquals(0, exitCode);
        assertThat(out.toString()).contains("recorded: score=").contains("replayed: score=").containsPattern("(?m)^OK$");
    }

    @Test
    void verify_tamperedReplay_shouldReportMismatch() throws IOException {
        ReplayData data = record(12L);
        ReplayMetadata m = data.metadata();
        ReplayData tampered = new ReplayData(new ReplayMetadata(m.version(), m.startTimestamp(), m.boardWidth(),
                m.boardHeight(), m.firstShape(), m.secondShape(), m.finalScore() + 1, m.finalLevel(), m.finalLines(),
                m.durationMs()), data.events());
        repository.save("tampered", tampered);

        int exitCode = execute("verify", "tampered");

        assertEquals(1, exitCode);
        assertThat(out.toString()).contains("MISMATCH");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*CommandLineInterface", messagePattern = "verify failed: .*missing.*")
    void verify_missingReplay_shouldFailWithError() {
        int exitCode = execute("verify", "missing");

        assertEquals(1, exitCode);
        assertThat(err.toString()).startsWith("Error: ");
    }

    @Test
    void replays_emptyStore_shouldSayNothingStored() {
        assertEquals(0, execute("replays"));
        assertThat(out.toString()).contains("No replays stored.");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ReplaysCommand", messagePattern = "Skipping unreadable replay 'broken'.*")
    void replays_shouldListSummariesAndFlagUnreadableFiles() throws IOException {
        repository.save("alpha", record(1L));
        repository.save("beta", record(2L));
        Files.writeString(replayDir.resolve("broken" + FileReplayRepository.FILE_SUFFIX), "[]");

        assertEquals(0, execute("replays"));

        String[] lines = out.toString().trim().split("\\R");
        assertEquals(3, lines.length);
        assertThat(lines[0]).startsWith("alpha").contains("score=").contains("events=");
        assertThat(lines[1]).startsWith("beta");
        assertThat(lines[2]).startsWith("broken").contains("(unreadable)");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*CommandLineInterface", messagePattern = "verify failed: Configuration file.*")
    void missingConfigFile_shouldFail() {
        StringWriter errors = new StringWriter();
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(new StringWriter()));
        commandLine.setErr(new PrintWriter(errors));

        int exitCode = commandLine.execute("-c", tempDir.resolve("nope.conf").toString(), "verify", "x");

        assertEquals(1, exitCode);
        assertThat(errors.toString()).contains("not found");
    }

    @Test
    void summarize_shouldIncludeTotalsAndDuration() {
        ReplayData data = new ReplayData(new ReplayMetadata("1.0", 0L, 10, 20,
                Shape.T, Shape.O, 900, 2, 12, 61_000L),
                List.of());

        String line = ReplaysCommand.summarize("run-1", data);

        assertThat(line).startsWith("run-1").contains("score=900").contains("level=2").contains("lines=12")
                .contains("events=0").contains("1970-01-01T00:00:00Z").endsWith("(61s)");
    }

    @Test
    void validateSpeed_shouldEnforceBounds() {
        assertEquals(0.25, ReplayCommand.validateSpeed(0.25));
        assertEquals(4.0, ReplayCommand.validateSpeed(4.0));
        assertThatThrownBy(() -> ReplayCommand.validateSpeed(0.2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReplayCommand.validateSpeed(4.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReplayCommand.validateSpeed(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    private int execute(String... args) {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        String[] full = new String[args.length + 2];
        full[0] = "--config";
        full[1] = configFile.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return commandLine.execute(full);
    }

    private static ReplayData record(long seed) {
        SessionResult session = ScriptedSessions.play(ScriptedSessions.randomScript(seed, 150),
                new SevenBagShapeSupplier(seed), GameRules.STANDARD);
        return session.replay().orElseThrow();
    }
}
