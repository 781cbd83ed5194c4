package org.stackfall.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.stackfall.runtime.internal.services.RandomShapeSupplier;
import org.stackfall.runtime.internal.services.SevenBagShapeSupplier;
import org.stackfall.runtime.rules.GameRules;
import org.stackfall.runtime.rules.LevelParams;
import org.stackfall.runtime.rules.ScoreTable;
import org.stackfall.runtime.rules.SpeedParams;
import org.stackfall.runtime.spi.IShapeSupplier;
import org.stackfall.utils.PathExpansion;

import java.util.Locale;

/**
 * Typed view of the {@code stackfall} configuration block.
 *
 * @param rules    Board, scoring, leveling and speed parameters.
 * @param engine   Queue and piece supply settings.
 * @param terminal Keyboard timing.
 * @param replay   Replay storage and playback settings.
 */
public record GameConfiguration(
        GameRules rules,
        EngineConfig engine,
        TerminalConfig terminal,
        ReplayConfig replay
) {

    public static final String ROOT_PATH = "stackfall";

    /**
     * Piece supply strategies selectable by {@code stackfall.engine.piece-supplier}.
     */
    public enum PieceSupplierKind {
        RANDOM("random"),
        SEVEN_BAG("seven-bag");

        private final String configName;

        PieceSupplierKind(String configName) {
            this.configName = configName;
        }

        public String configName() {
            return configName;
        }

        public IShapeSupplier create(long seed) {
            return switch (this) {
                case RANDOM -> new RandomShapeSupplier(seed);
                case SEVEN_BAG -> new SevenBagShapeSupplier(seed);
            };
        }

        static PieceSupplierKind fromConfigName(String name) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (PieceSupplierKind kind : values()) {
                if (kind.configName.equals(normalized)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown piece supplier '" + name + "', expected 'random' or 'seven-bag'");
        }
    }

    public record EngineConfig(int queueCapacity, PieceSupplierKind pieceSupplier) {
        public EngineConfig {
            if (queueCapacity <= 0) {
                throw new IllegalArgumentException("queue-capacity must be positive, got " + queueCapacity);
            }
        }
    }

    public record TerminalConfig(long escapeSequenceWaitMs, long escapeSequenceSecondWaitMs, long inputPollIntervalMs) {
        public TerminalConfig {
            if (escapeSequenceWaitMs < 0 || escapeSequenceSecondWaitMs < 0) {
                throw new IllegalArgumentException("Escape sequence waits must not be negative");
            }
            if (inputPollIntervalMs <= 0) {
                throw new IllegalArgumentException("input-poll-interval-ms must be positive, got " + inputPollIntervalMs);
            }
        }
    }

    /**
     * @param directory           Storage directory with variables already expanded.
     * @param baseFrameIntervalMs Playback delay per frame at speed 1.0.
     * @param defaultSpeed        Playback speed multiplier used when none is given.
     */
    public record ReplayConfig(String directory, long baseFrameIntervalMs, double defaultSpeed) {
        public ReplayConfig {
            if (baseFrameIntervalMs <= 0) {
                throw new IllegalArgumentException("base-frame-interval-ms must be positive, got " + baseFrameIntervalMs);
            }
            if (defaultSpeed <= 0) {
                throw new IllegalArgumentException("default-speed must be positive, got " + defaultSpeed);
            }
        }

        /**
         * @return The delay between frames at the given speed multiplier, at least 1 ms.
         */
        public long frameIntervalMs(double speed) {
            return Math.max(1, Math.round(baseFrameIntervalMs / speed));
        }
    }

    /**
     * Builds the typed configuration from a loaded config tree.
     *
     * @param config The root configuration, containing a {@code stackfall} block.
     * @throws IllegalArgumentException if a value is missing, has the wrong type or is out of range.
     */
    public static GameConfiguration fromConfig(Config config) {
        try {
            Config root = config.getConfig(ROOT_PATH);

            Config board = root.getConfig("board");
            Config score = root.getConfig("score");
            Config level = root.getConfig("level");
            Config speed = root.getConfig("speed");
            GameRules rules = new GameRules(
                    board.getInt("width"),
                    board.getInt("height"),
                    new ScoreTable(score.getInt("single"), score.getInt("double"), score.getInt("triple"), score.getInt("tetris")),
                    new LevelParams(level.getInt("lines-per-level"), level.getInt("start-level")),
                    new SpeedParams(speed.getLong("base-interval-ms"), speed.getLong("min-interval-ms"), speed.getLong("decrease-per-level-ms")));

            Config engine = root.getConfig("engine");
            EngineConfig engineConfig = new EngineConfig(
                    engine.getInt("queue-capacity"),
                    PieceSupplierKind.fromConfigName(engine.getString("piece-supplier")));

            Config terminal = root.getConfig("terminal");
            TerminalConfig terminalConfig = new TerminalConfig(
                    terminal.getLong("escape-sequence-wait-ms"),
                    terminal.getLong("escape-sequence-second-wait-ms"),
                    terminal.getLong("input-poll-interval-ms"));

            Config replay = root.getConfig("replay");
            ReplayConfig replayConfig = new ReplayConfig(
                    PathExpansion.expandPath(replay.getString("directory")),
                    replay.getLong("base-frame-interval-ms"),
                    replay.getDouble("default-speed"));

            return new GameConfiguration(rules, engineConfig, terminalConfig, replayConfig);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
        }
    }
}
