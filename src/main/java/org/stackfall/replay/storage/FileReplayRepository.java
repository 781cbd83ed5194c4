package org.stackfall.replay.storage;

import org.stackfall.replay.ReplayData;
import org.stackfall.replay.codec.IReplayCodec;
import org.stackfall.replay.codec.JsonReplayCodec;
import org.stackfall.replay.codec.ReplayCodecException;
import org.stackfall.utils.PathExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores each replay as {@code <name>.replay.json} in one directory.
 * <p>
 * Writes go to a {@code .UUID.tmp} sibling first and are moved into place atomically, so
 * readers never observe a partially written replay. Temp files are ignored by {@link #list()}.
 */
public class FileReplayRepository implements IReplayRepository {

    private static final Logger log = LoggerFactory.getLogger(FileReplayRepository.class);

    public static final String FILE_SUFFIX = ".replay.json";
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_.-]+");

    private final Path directory;
    private final IReplayCodec codec;

    /**
     * @param directory The storage directory; {@code ${VAR}} references are expanded. Created on first save.
     */
    public FileReplayRepository(String directory) {
        this(Paths.get(PathExpansion.expandPath(directory)), new JsonReplayCodec());
    }

    public FileReplayRepository(Path directory, IReplayCodec codec) {
        this.directory = directory.toAbsolutePath().normalize();
        this.codec = codec;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void save(String name, ReplayData data) throws IOException {
        Path target = resolve(name);
        byte[] bytes;
        try {
            bytes = codec.encode(data);
        } catch (ReplayCodecException e) {
            throw new IOException("Failed to encode replay '" + name + "'", e);
        }

        Files.createDirectories(directory);
        Path tempFile = directory.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.write(tempFile, bytes);
        try {
            Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile, cleanupEx);
            }
            throw e;
        }
        log.info("Saved replay '{}' ({} events) to {}", name, data.eventCount(), target);
    }

    @Override
    public ReplayData load(String name) throws IOException {
        Path file = resolve(name);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "Replay '" + name + "' does not exist");
        }
        byte[] bytes = Files.readAllBytes(file);
        try {
            ReplayData data = codec.decode(bytes);
            log.debug("Loaded replay '{}' with {} events", name, data.eventCount());
            return data;
        } catch (ReplayCodecException e) {
            throw new IOException("Replay '" + name + "' is corrupt: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> list() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(directory)) {
            return stream
                    .filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(fileName -> fileName.endsWith(FILE_SUFFIX))
                    .map(fileName -> fileName.substring(0, fileName.length() - FILE_SUFFIX.length()))
                    .filter(replayName -> VALID_NAME.matcher(replayName).matches())
                    .sorted()
                    .toList();
        }
    }

    @Override
    public boolean exists(String name) {
        return Files.isRegularFile(resolve(name));
    }

    @Override
    public boolean delete(String name) throws IOException {
        boolean deleted = Files.deleteIfExists(resolve(name));
        if (deleted) {
            log.info("Deleted replay '{}'", name);
        }
        return deleted;
    }

    private Path resolve(String name) {
        validateName(name);
        return directory.resolve(name + FILE_SUFFIX);
    }

    static void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Replay name must not be empty");
        }
        if (!VALID_NAME.matcher(name).matches() || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Invalid replay name '" + name
                    + "': use letters, digits, '-', '_' or '.' only");
        }
    }
}
