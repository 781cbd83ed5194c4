package org.stackfall.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.stackfall.cli.commands.PlayCommand;
import org.stackfall.cli.commands.ReplayCommand;
import org.stackfall.cli.commands.ReplaysCommand;
import org.stackfall.cli.commands.VerifyCommand;
import org.stackfall.config.ConfigLoader;
import org.stackfall.config.GameConfiguration;
import org.stackfall.config.LoggingConfigurator;
import org.stackfall.replay.storage.FileReplayRepository;
import org.stackfall.replay.storage.IReplayRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "stackfall",
    mixinStandardHelpOptions = true,
    version = "Stackfall 1.0",
    description = "Stackfall - falling-block puzzle with deterministic replays",
    subcommands = {
        PlayCommand.class,
        ReplayCommand.class,
        ReplaysCommand.class,
        VerifyCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;
    private GameConfiguration gameConfiguration;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Builds the command line with an exception handler that logs failures and exits with code 1.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("stackfall");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            LOG.error("{} failed: {}", cmd.getCommandName(), ex.getMessage());
            LOG.debug("Exception details:", ex);
            cmd.getErr().println("Error: " + ex.getMessage());
            return 1;
        });
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @throws IllegalArgumentException if the configuration file given with {@code --config} is missing or invalid.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file specified via --config was not found: "
                        + configFile.getAbsolutePath());
            }
            try {
                config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            } catch (ConfigException e) {
                throw new IllegalArgumentException("Failed to load or parse configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    public GameConfiguration getGameConfiguration() {
        if (gameConfiguration == null) {
            gameConfiguration = GameConfiguration.fromConfig(getConfig());
        }
        return gameConfiguration;
    }

    public IReplayRepository createReplayRepository() {
        return new FileReplayRepository(getGameConfiguration().replay().directory());
    }
}
